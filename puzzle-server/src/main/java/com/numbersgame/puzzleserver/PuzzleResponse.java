package com.numbersgame.puzzleserver;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code GET /api/puzzle/new}.
 */
public class PuzzleResponse {
    private final String roundId;
    private final long target;
    private final List<Integer> numbers;
    private final String solutionExpr;
    private final List<Integer> usedNumbers;
    private final int maxOperandCount;
    private final List<String> templateTokens;
    private final int numPlaceholders;

    public PuzzleResponse(GeneratedPuzzle puzzle, boolean showSolution) {
        PuzzleRound round = puzzle.getRound();
        this.roundId = puzzle.getRoundId();
        this.target = round.getTarget();
        this.numbers = round.getNumbers();
        this.solutionExpr = showSolution ? round.getSolution() : null;
        this.usedNumbers = round.getUsedNumbers();
        this.maxOperandCount = round.getUsedNumbers().size();
        this.templateTokens = round.getTemplateTokens();
        this.numPlaceholders = round.getNumPlaceholders();
    }

    @JsonProperty("round_id")
    public String getRoundId() { return roundId; }

    @JsonProperty("target")
    public long getTarget() { return target; }

    @JsonProperty("numbers")
    public List<Integer> getNumbers() { return numbers; }

    @JsonProperty("solution_expr")
    public String getSolutionExpr() { return solutionExpr; }

    @JsonProperty("used_numbers")
    public List<Integer> getUsedNumbers() { return usedNumbers; }

    @JsonProperty("max_operand_count")
    public int getMaxOperandCount() { return maxOperandCount; }

    @JsonProperty("template_tokens")
    public List<String> getTemplateTokens() { return templateTokens; }

    @JsonProperty("num_placeholders")
    public int getNumPlaceholders() { return numPlaceholders; }
}
