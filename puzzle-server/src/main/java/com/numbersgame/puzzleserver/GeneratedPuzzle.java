package com.numbersgame.puzzleserver;

public class GeneratedPuzzle {
    private final String roundId;
    private final PuzzleRound round;

    public GeneratedPuzzle(String roundId, PuzzleRound round) {
        this.roundId = roundId;
        this.round = round;
    }

    public String getRoundId() { return roundId; }
    public PuzzleRound getRound() { return round; }
}
