package com.numbersgame.puzzleserver.engine;

public class DivisionByZeroException extends ArithmeticException {

    public DivisionByZeroException(String message) {
        super(message);
    }
}
