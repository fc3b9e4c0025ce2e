package com.trendloop.orchestrator.stage;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Shared artifact bag passed by reference through every stage of one run.
 *
 * Keys are stage-defined strings ("selected_keyword", "article_path", "image_path", ...);
 * values are opaque to the orchestrator. The context is owned by the orchestrator for
 * the duration of a run and discarded afterwards.
 *
 * <p>Append-only from a stage's point of view: there is no remove, and a key written by
 * one stage cannot be replaced by a later one. A stage may overwrite its own keys.
 *
 * Methods are synchronized because a stage may fan out internally and write from
 * several threads.
 */
public class RunContext {

    private final UUID runId;
    private final Map<String, Object> values  = new LinkedHashMap<>();
    private final Map<String, String> writers = new HashMap<>();

    // Name of the stage currently executing; null between stages.
    private String currentStage;

    public RunContext(UUID runId) {
        this.runId = runId;
    }

    public UUID runId() { return runId; }

    /**
     * Mark the start of a stage so writes can be attributed to it.
     * Called by the orchestrator only.
     */
    public synchronized void enterStage(String stageName) {
        this.currentStage = stageName;
    }

    /** Called by the orchestrator once the stage's outcome is recorded. */
    public synchronized void leaveStage() {
        this.currentStage = null;
    }

    /**
     * Add an artifact.
     *
     * @throws IllegalStateException if the key was written by an earlier stage
     */
    public synchronized void put(String key, Object value) {
        checkWritable(key);
        values.put(key, value);
        writers.put(key, currentStage);
    }

    /**
     * Add several artifacts at once. Every key is checked before any is written, so a
     * rejected batch leaves the context unchanged.
     *
     * @throws IllegalStateException if any key was written by an earlier stage
     */
    public synchronized void putAll(Map<String, ?> artifacts) {
        artifacts.keySet().forEach(this::checkWritable);
        artifacts.forEach((key, value) -> {
            values.put(key, value);
            writers.put(key, currentStage);
        });
    }

    private void checkWritable(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Context key must not be blank");
        }
        String owner = writers.get(key);
        if (owner != null && !owner.equals(currentStage)) {
            throw new IllegalStateException("Context key '" + key + "' was written by stage '"
                    + owner + "' and cannot be replaced by '" + currentStage + "'");
        }
    }

    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Typed lookup for a key an upstream stage must have produced.
     *
     * @throws IllegalStateException if the key is missing or has a different type
     */
    public synchronized <T> T require(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            throw new IllegalStateException("Missing context key '" + key + "'");
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Context key '" + key + "' is a "
                    + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public synchronized boolean contains(String key) {
        return values.containsKey(key);
    }

    public synchronized Set<String> keys() {
        return Collections.unmodifiableSet(new LinkedHashMap<>(values).keySet());
    }

    /** Stage that wrote the key, if any. */
    public synchronized Optional<String> writerOf(String key) {
        return Optional.ofNullable(writers.get(key));
    }

    /** Read-only copy, in insertion order. */
    public synchronized Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
