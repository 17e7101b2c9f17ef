package com.numbersgame.puzzleserver;

public class MissingRequestFieldException extends InvalidParameterException {

    public MissingRequestFieldException(String message) {
        super(message);
    }
}
