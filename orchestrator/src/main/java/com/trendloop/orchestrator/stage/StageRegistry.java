package com.trendloop.orchestrator.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, named list of pipeline stages.
 *
 * Stages are registered during process initialization. The first call to
 * {@link #orderedStages()} (or an explicit {@link #seal()}) validates the declared
 * data dependencies and freezes the registry; from then on it can be iterated any
 * number of times, once per run, but never changed.
 *
 * <p>All validation failures are {@link ConfigurationException}s: duplicate names,
 * duplicate ordinals, a required input that no earlier stage produces, or a
 * registration after sealing.
 */
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    private final List<Stage> stages = new ArrayList<>();
    private List<Stage> ordered;

    public StageRegistry() {}

    public StageRegistry(List<? extends Stage> initial) {
        initial.forEach(this::register);
    }

    public synchronized void register(Stage stage) {
        if (ordered != null) {
            throw new ConfigurationException(
                    "Stage registry is sealed; cannot register '" + stage.name() + "' at run time");
        }
        if (stage.name() == null || stage.name().isBlank()) {
            throw new ConfigurationException("Stage name must not be blank (ordinal " + stage.ordinal() + ")");
        }
        for (Stage existing : stages) {
            if (existing.name().equals(stage.name())) {
                throw new ConfigurationException("Duplicate stage name '" + stage.name() + "'");
            }
            if (existing.ordinal() == stage.ordinal()) {
                throw new ConfigurationException("Duplicate stage ordinal " + stage.ordinal()
                        + " ('" + existing.name() + "' and '" + stage.name() + "')");
            }
        }
        stages.add(stage);
        log.info("Registered stage #{} '{}' (inputs={}, outputs={})",
                stage.ordinal(), stage.name(), stage.requiredInputs(), stage.producedOutputs());
    }

    /**
     * Validate data dependencies and freeze the registry. Idempotent.
     *
     * @throws ConfigurationException if a stage requires an input that no stage with a
     *                                lower ordinal declares as output
     */
    public synchronized void seal() {
        if (ordered != null) return;

        List<Stage> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(Stage::ordinal));

        Set<String> available = new HashSet<>();
        for (Stage stage : sorted) {
            for (String input : stage.requiredInputs()) {
                if (!available.contains(input)) {
                    throw new ConfigurationException("Stage '" + stage.name() + "' requires '"
                            + input + "' but no earlier stage produces it");
                }
            }
            available.addAll(stage.producedOutputs());
        }
        ordered = List.copyOf(sorted);
        log.info("Stage registry sealed with {} stages", ordered.size());
    }

    /** Stages by ascending ordinal. Seals the registry on first call. */
    public synchronized List<Stage> orderedStages() {
        seal();
        return ordered;
    }

    public synchronized Optional<Stage> find(String name) {
        return stages.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public synchronized int size() {
        return stages.size();
    }
}
