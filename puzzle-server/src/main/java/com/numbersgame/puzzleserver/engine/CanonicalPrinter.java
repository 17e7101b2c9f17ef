package com.numbersgame.puzzleserver.engine;

/**
 * Renders expression trees with the fewest parentheses that still reparse to the same tree under
 * the usual precedence and left-associativity.
 * <p>
 * A subtree is wrapped when its operator binds looser than its parent's, or when it is the right
 * operand of {@code -} or {@code /} and has the same precedence as the parent.
 */
public final class CanonicalPrinter {

    private CanonicalPrinter() {}

    /** Result of a placeholder rendering: the text and the next unused leaf index. */
    public record PlaceholderRendering(String text, int nextIndex) {}

    public static String render(Expr expr) {
        StringBuilder sb = new StringBuilder();
        appendValues(sb, expr, null, false);
        return sb.toString();
    }

    public static PlaceholderRendering renderPlaceholders(Expr expr) {
        return renderPlaceholders(expr, 0);
    }

    public static PlaceholderRendering renderPlaceholders(Expr expr, int startIndex) {
        StringBuilder sb = new StringBuilder();
        int next = appendPlaceholders(sb, expr, startIndex, null, false);
        return new PlaceholderRendering(sb.toString(), next);
    }

    public static String placeholder(int index) {
        return "{" + index + "}";
    }

    static boolean needsParens(Operator op, Operator parentOp, boolean isRight) {
        if (parentOp == null) {
            return false;
        }
        if (op.precedence() < parentOp.precedence()) {
            return true;
        }
        return isRight
                && (parentOp == Operator.SUB || parentOp == Operator.DIV)
                && op.precedence() == parentOp.precedence();
    }

    private static void appendValues(StringBuilder sb, Expr expr, Operator parentOp, boolean isRight) {
        if (expr instanceof Expr.Leaf leaf) {
            sb.append(leaf.value());
            return;
        }
        Expr.BinaryOp node = (Expr.BinaryOp) expr;
        boolean parens = needsParens(node.op(), parentOp, isRight);
        if (parens) sb.append('(');
        appendValues(sb, node.left(), node.op(), false);
        sb.append(node.op().symbol());
        appendValues(sb, node.right(), node.op(), true);
        if (parens) sb.append(')');
    }

    private static int appendPlaceholders(StringBuilder sb, Expr expr, int index, Operator parentOp, boolean isRight) {
        if (expr instanceof Expr.Leaf) {
            sb.append(placeholder(index));
            return index + 1;
        }
        Expr.BinaryOp node = (Expr.BinaryOp) expr;
        boolean parens = needsParens(node.op(), parentOp, isRight);
        if (parens) sb.append('(');
        int next = appendPlaceholders(sb, node.left(), index, node.op(), false);
        sb.append(node.op().symbol());
        next = appendPlaceholders(sb, node.right(), next, node.op(), true);
        if (parens) sb.append(')');
        return next;
    }
}
