package com.numbersgame.puzzleserver;

public class RoundNotFoundException extends RuntimeException {

    public RoundNotFoundException(String roundId) {
        super("Round not found: " + roundId);
    }
}
