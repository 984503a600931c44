package dev.workflows.model;

/**
 * Where a step goes relative to a target step. {@code BEFORE} and {@code AFTER}
 * splice into the target's own sequence; {@code THEN} and {@code ELSE} append
 * to a branch of a condition target.
 */
public enum InsertMode {
    BEFORE,
    AFTER,
    THEN,
    ELSE
}
