package com.numbersgame.puzzleserver.engine;

public class SolverTimeoutException extends RuntimeException {

    public SolverTimeoutException(String message) {
        super(message);
    }
}
