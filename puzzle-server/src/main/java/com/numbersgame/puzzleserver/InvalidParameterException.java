package com.numbersgame.puzzleserver;

/**
 * The request itself is malformed (as opposed to a player's expression being malformed).
 */
public class InvalidParameterException extends RuntimeException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
