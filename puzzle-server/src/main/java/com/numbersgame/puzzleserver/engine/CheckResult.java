package com.numbersgame.puzzleserver.engine;

/**
 * Outcome of checking a player's expression.
 *
 * @param correct   whether the value matched the target; always {@code false} without a target
 * @param reason    classification of the outcome
 * @param evaluated whole number when the result is an integer, otherwise a {@code Double};
 *                  {@code null} when the expression could not be evaluated
 * @param message   human readable detail for invalid expressions
 */
public record CheckResult(boolean correct, CheckReason reason, Number evaluated, String message) {

    static CheckResult invalid(Number evaluated, String message) {
        return new CheckResult(false, CheckReason.INVALID_EXPRESSION, evaluated, message);
    }
}
