package com.numbersgame.puzzleserver;

/**
 * No acceptable puzzle was found within the attempt budget, or generation was cancelled.
 */
public class GenerationExhaustedException extends RuntimeException {

    private final int attempts;
    private final boolean cancelled;

    public GenerationExhaustedException(String message, int attempts, boolean cancelled) {
        super(message);
        this.attempts = attempts;
        this.cancelled = cancelled;
    }

    public int getAttempts() { return attempts; }
    public boolean isCancelled() { return cancelled; }
}
