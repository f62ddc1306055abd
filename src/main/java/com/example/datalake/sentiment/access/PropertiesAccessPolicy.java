package com.example.datalake.sentiment.access;

import com.example.datalake.sentiment.config.EngineProperties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/** Role lists from {@code sentiment.engine.access}; the pause flag lives in memory. */
@Component
public class PropertiesAccessPolicy implements AccessPolicy {

    private final Set<String> trainers;
    private final Set<String> admins;
    private final AtomicBoolean paused;

    public PropertiesAccessPolicy(EngineProperties properties) {
        this.admins = Set.copyOf(properties.getAccess().getAdmins());
        this.trainers = Set.copyOf(properties.getAccess().getTrainers());
        this.paused = new AtomicBoolean(properties.isStartPaused());
    }

    @Override
    public boolean isTrainer(String caller) {
        // admins may train as well
        return caller != null && (trainers.contains(caller) || admins.contains(caller));
    }

    @Override
    public boolean isAdmin(String caller) {
        return caller != null && admins.contains(caller);
    }

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    @Override
    public void setPaused(boolean value) {
        paused.set(value);
    }
}
