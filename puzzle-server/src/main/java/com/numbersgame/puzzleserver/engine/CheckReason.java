package com.numbersgame.puzzleserver.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckReason {
    CORRECT("correct"),
    WRONG_VALUE("wrong_value"),
    INVALID_EXPRESSION("invalid_expression"),
    VALID_EXPRESSION("valid_expression");

    private final String wireName;

    CheckReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
