package dev.workflows.model;

import java.util.List;

/**
 * Outcome of an insert. {@code inserted == false} means the target was not
 * found (or could not take the step) and {@code steps} is the input unchanged.
 */
public record InsertResult(List<Step> steps, boolean inserted) {}
