package com.numbersgame.puzzleserver.engine;

public final class ExpressionEvaluator {

    private ExpressionEvaluator() {}

    public static Rational evaluate(Expr expr) {
        if (expr instanceof Expr.Leaf leaf) {
            return Rational.of(leaf.value());
        }
        Expr.BinaryOp node = (Expr.BinaryOp) expr;
        Rational a = evaluate(node.left());
        Rational b = evaluate(node.right());
        return node.op().apply(a, b);
    }
}
