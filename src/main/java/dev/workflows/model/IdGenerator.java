package dev.workflows.model;

/**
 * Source of fresh step ids. Implementations must never repeat an id within a
 * definition; the tree operations rely on it instead of re-checking.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();
}
