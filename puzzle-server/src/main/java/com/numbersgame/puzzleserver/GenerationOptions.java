package com.numbersgame.puzzleserver;

import com.numbersgame.puzzleserver.engine.Expr;

public class GenerationOptions {
    private final int numOperands;
    private final int decoys;
    private final long targetMin;
    private final long targetMax;
    private final double requireParensProb;

    public GenerationOptions(int numOperands, int decoys, long targetMin, long targetMax, double requireParensProb) {
        this.numOperands = numOperands;
        this.decoys = decoys;
        this.targetMin = targetMin;
        this.targetMax = targetMax;
        this.requireParensProb = requireParensProb;
    }

    public int getNumOperands() { return numOperands; }
    public int getDecoys() { return decoys; }
    public long getTargetMin() { return targetMin; }
    public long getTargetMax() { return targetMax; }
    public double getRequireParensProb() { return requireParensProb; }

    public void validate() {
        if (numOperands < 2) {
            throw new InvalidParameterException("num_operands must be >= 2");
        }
        if (decoys < 0) {
            throw new InvalidParameterException("decoys must be >= 0");
        }
        int distinctValues = Expr.MAX_LEAF - Expr.MIN_LEAF + 1;
        if (numOperands + decoys > distinctValues) {
            throw new InvalidParameterException("num_operands + decoys must be <= " + distinctValues);
        }
        if (targetMin > targetMax) {
            throw new InvalidParameterException("target_min must be <= target_max");
        }
        if (Double.isNaN(requireParensProb) || requireParensProb < 0.0 || requireParensProb > 1.0) {
            throw new InvalidParameterException("require_parens_prob must be between 0 and 1");
        }
    }

    @Override
    public String toString() {
        return "GenerationOptions{" +
                "numOperands=" + numOperands +
                ", decoys=" + decoys +
                ", target=[" + targetMin + "," + targetMax + "]" +
                ", requireParensProb=" + requireParensProb +
                '}';
    }
}
