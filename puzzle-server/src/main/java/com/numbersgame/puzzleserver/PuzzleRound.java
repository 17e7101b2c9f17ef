package com.numbersgame.puzzleserver;

import java.util.List;

public class PuzzleRound {
    private final String solution;
    private final List<Integer> numbers;
    private final List<Integer> usedNumbers;
    private final long target;
    private final List<String> templateTokens;
    private final int numPlaceholders;

    public PuzzleRound(String solution, List<Integer> numbers, List<Integer> usedNumbers, long target,
                       List<String> templateTokens, int numPlaceholders) {
        this.solution = solution;
        this.numbers = List.copyOf(numbers);
        this.usedNumbers = List.copyOf(usedNumbers);
        this.target = target;
        this.templateTokens = List.copyOf(templateTokens);
        this.numPlaceholders = numPlaceholders;
    }

    public String getSolution() { return solution; }
    public List<Integer> getNumbers() { return numbers; }
    public List<Integer> getUsedNumbers() { return usedNumbers; }
    public long getTarget() { return target; }
    public List<String> getTemplateTokens() { return templateTokens; }
    public int getNumPlaceholders() { return numPlaceholders; }

    @Override
    public String toString() {
        return "PuzzleRound{" +
                "target=" + target +
                ", numbers=" + numbers +
                ", placeholders=" + numPlaceholders +
                '}';
    }
}
