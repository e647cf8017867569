package com.infragraph.core.diagnostic;

/**
 * Thrown when an internal graph or cluster invariant does not hold.
 *
 * <p>This signals a bug in the pipeline rather than bad input; it is never caught
 * inside the core.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
