package com.numbersgame.puzzleserver.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fully parenthesized arithmetic expression over small integer leaves.
 */
public sealed interface Expr permits Expr.Leaf, Expr.BinaryOp {

    int MIN_LEAF = 1;
    int MAX_LEAF = 19;

    int leafCount();

    // left to right
    default List<Integer> leaves() {
        List<Integer> out = new ArrayList<>(leafCount());
        collectLeaves(this, out);
        return out;
    }

    private static void collectLeaves(Expr expr, List<Integer> out) {
        if (expr instanceof Leaf leaf) {
            out.add(leaf.value());
        } else if (expr instanceof BinaryOp op) {
            collectLeaves(op.left(), out);
            collectLeaves(op.right(), out);
        }
    }

    record Leaf(int value) implements Expr {
        public Leaf {
            if (value < MIN_LEAF || value > MAX_LEAF) {
                throw new IllegalArgumentException("Leaf value out of range [" + MIN_LEAF + "," + MAX_LEAF + "]: " + value);
            }
        }

        @Override
        public int leafCount() { return 1; }
    }

    record BinaryOp(Expr left, Operator op, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public int leafCount() { return left.leafCount() + right.leafCount(); }
    }

    static Expr leaf(int value) {
        return new Leaf(value);
    }

    static Expr of(Expr left, Operator op, Expr right) {
        return new BinaryOp(left, op, right);
    }
}
