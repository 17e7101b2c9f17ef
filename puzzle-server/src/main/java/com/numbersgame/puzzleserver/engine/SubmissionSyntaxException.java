package com.numbersgame.puzzleserver.engine;

public class SubmissionSyntaxException extends RuntimeException {

    public SubmissionSyntaxException(String message) {
        super(message);
    }
}
