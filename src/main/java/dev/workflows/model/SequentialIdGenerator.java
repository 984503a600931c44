package dev.workflows.model;

import java.util.Objects;

/**
 * Deterministic ids {@code <prefix>_1}, {@code <prefix>_2}, ... Not thread-safe;
 * one editor session drives one generator.
 */
public final class SequentialIdGenerator implements IdGenerator {

    private final String prefix;
    private long counter;

    public SequentialIdGenerator(String prefix) {
        this(prefix, 0);
    }

    public SequentialIdGenerator(String prefix, long lastIssued) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.counter = lastIssued;
    }

    @Override
    public String nextId() {
        counter++;
        return prefix + "_" + counter;
    }
}
