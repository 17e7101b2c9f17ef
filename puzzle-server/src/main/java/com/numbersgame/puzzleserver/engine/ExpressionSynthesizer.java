package com.numbersgame.puzzleserver.engine;

import java.util.Random;

/**
 * Builds random expression trees by recursive splitting.
 * <p>
 * The split point is uniform over {@code [1, n-1]}, which does not give a uniform distribution
 * over tree shapes. Leaves are independent, so duplicates are possible here.
 */
public class ExpressionSynthesizer {

    private static final Operator[] OPERATORS = Operator.values();

    private final Random random;

    public ExpressionSynthesizer(Random random) {
        this.random = random;
    }

    public Expr synthesize(int leafCount) {
        if (leafCount < 1) {
            throw new IllegalArgumentException("leafCount must be >= 1, got " + leafCount);
        }
        if (leafCount == 1) {
            return Expr.leaf(Expr.MIN_LEAF + random.nextInt(Expr.MAX_LEAF - Expr.MIN_LEAF + 1));
        }
        int leftCount = 1 + random.nextInt(leafCount - 1);
        Expr left = synthesize(leftCount);
        Expr right = synthesize(leafCount - leftCount);
        Operator op = OPERATORS[random.nextInt(OPERATORS.length)];
        return Expr.of(left, op, right);
    }
}
