package com.example.datalake.sentiment.store;

import com.example.datalake.sentiment.model.UserContext;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Per-caller adaptive contexts. Entries are created lazily and never removed. */
public class UserContextStore {

    private final Map<String, UserContext> contexts = new TreeMap<>();

    public Optional<UserContext> find(String caller) {
        return Optional.ofNullable(contexts.get(caller));
    }

    public UserContext getOrCreate(String caller) {
        return contexts.computeIfAbsent(caller, key -> new UserContext());
    }

    public int size() {
        return contexts.size();
    }

    public Map<String, UserContext> entries() {
        return Collections.unmodifiableMap(contexts);
    }

    public void restore(String caller, UserContext context) {
        contexts.put(caller, context.copy());
    }

    public UserContextStore copy() {
        UserContextStore copy = new UserContextStore();
        contexts.forEach((caller, context) -> copy.contexts.put(caller, context.copy()));
        return copy;
    }
}
