package com.example.datalake.sentiment.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "sentiment.engine")
@Validated
public class EngineProperties {

    /** How recent a caller's last call must be for its input token to influence the next one. */
    @NotNull
    private Duration recencyWindow = Duration.ofHours(1);
    private boolean startPaused = false;
    private final Access access = new Access();

    public Duration getRecencyWindow() {
        return recencyWindow;
    }

    public void setRecencyWindow(Duration recencyWindow) {
        this.recencyWindow = recencyWindow;
    }

    public boolean isStartPaused() {
        return startPaused;
    }

    public void setStartPaused(boolean startPaused) {
        this.startPaused = startPaused;
    }

    public Access getAccess() {
        return access;
    }

    public static final class Access {
        private final List<String> trainers = new ArrayList<>(List.of("trainer"));
        private final List<String> admins = new ArrayList<>(List.of("admin"));

        public List<String> getTrainers() {
            return trainers;
        }

        public void setTrainers(List<String> trainers) {
            this.trainers.clear();
            if (trainers != null) {
                this.trainers.addAll(trainers);
            }
        }

        public List<String> getAdmins() {
            return admins;
        }

        public void setAdmins(List<String> admins) {
            this.admins.clear();
            if (admins != null) {
                this.admins.addAll(admins);
            }
        }
    }
}
