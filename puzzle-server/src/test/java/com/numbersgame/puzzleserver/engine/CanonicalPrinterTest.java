package com.numbersgame.puzzleserver.engine;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.numbersgame.puzzleserver.engine.Expr.leaf;
import static org.assertj.core.api.Assertions.assertThat;

class CanonicalPrinterTest {

    private static Expr op(Expr l, Operator op, Expr r) {
        return Expr.of(l, op, r);
    }

    @Test
    void leafHasNoParentheses() {
        assertThat(CanonicalPrinter.render(leaf(5))).isEqualTo("5");
    }

    @Test
    void lowerPrecedenceChildIsWrapped() {
        assertThat(CanonicalPrinter.render(op(op(leaf(1), Operator.ADD, leaf(2)), Operator.MUL, leaf(3))))
                .isEqualTo("(1+2)*3");
        assertThat(CanonicalPrinter.render(op(leaf(3), Operator.MUL, op(leaf(1), Operator.SUB, leaf(2)))))
                .isEqualTo("3*(1-2)");
    }

    @Test
    void higherPrecedenceChildIsNotWrapped() {
        assertThat(CanonicalPrinter.render(op(op(leaf(1), Operator.MUL, leaf(2)), Operator.ADD, leaf(3))))
                .isEqualTo("1*2+3");
        assertThat(CanonicalPrinter.render(op(leaf(1), Operator.SUB, op(leaf(2), Operator.DIV, leaf(3)))))
                .isEqualTo("1-2/3");
    }

    @Test
    void leftAssociativeChainsStayFlat() {
        assertThat(CanonicalPrinter.render(op(op(leaf(9), Operator.SUB, leaf(2)), Operator.SUB, leaf(3))))
                .isEqualTo("9-2-3");
        assertThat(CanonicalPrinter.render(op(op(leaf(8), Operator.DIV, leaf(4)), Operator.DIV, leaf(2))))
                .isEqualTo("8/4/2");
    }

    @Test
    void rightOperandOfSubtractionOrDivisionKeepsParentheses() {
        assertThat(CanonicalPrinter.render(op(leaf(9), Operator.SUB, op(leaf(2), Operator.SUB, leaf(3)))))
                .isEqualTo("9-(2-3)");
        assertThat(CanonicalPrinter.render(op(leaf(9), Operator.SUB, op(leaf(2), Operator.ADD, leaf(3)))))
                .isEqualTo("9-(2+3)");
        assertThat(CanonicalPrinter.render(op(leaf(8), Operator.DIV, op(leaf(4), Operator.DIV, leaf(2)))))
                .isEqualTo("8/(4/2)");
        assertThat(CanonicalPrinter.render(op(leaf(8), Operator.DIV, op(leaf(4), Operator.MUL, leaf(2)))))
                .isEqualTo("8/(4*2)");
    }

    @Test
    void rightOperandOfAdditionOrMultiplicationIsFlattened() {
        assertThat(CanonicalPrinter.render(op(leaf(9), Operator.ADD, op(leaf(2), Operator.SUB, leaf(3)))))
                .isEqualTo("9+2-3");
        assertThat(CanonicalPrinter.render(op(leaf(2), Operator.MUL, op(leaf(3), Operator.DIV, leaf(4)))))
                .isEqualTo("2*3/4");
    }

    @Test
    void placeholdersNumberLeavesLeftToRight() {
        Expr expr = op(op(leaf(4), Operator.ADD, leaf(7)), Operator.MUL, op(leaf(9), Operator.SUB, leaf(2)));
        CanonicalPrinter.PlaceholderRendering rendering = CanonicalPrinter.renderPlaceholders(expr);
        assertThat(rendering.text()).isEqualTo("({0}+{1})*({2}-{3})");
        assertThat(rendering.nextIndex()).isEqualTo(4);
    }

    @Test
    void placeholderNumberingContinuesFromStartIndex() {
        CanonicalPrinter.PlaceholderRendering rendering =
                CanonicalPrinter.renderPlaceholders(op(leaf(1), Operator.DIV, leaf(2)), 3);
        assertThat(rendering.text()).isEqualTo("{3}/{4}");
        assertThat(rendering.nextIndex()).isEqualTo(5);
    }

    @Test
    void renderingsAreStructurallyIsomorphic() {
        ExpressionSynthesizer synthesizer = new ExpressionSynthesizer(new Random(2024));
        for (int i = 0; i < 200; i++) {
            Expr expr = synthesizer.synthesize(1 + i % 7);
            String template = CanonicalPrinter.renderPlaceholders(expr).text();
            List<Integer> leaves = expr.leaves();
            for (int k = 0; k < leaves.size(); k++) {
                template = template.replace(CanonicalPrinter.placeholder(k), String.valueOf(leaves.get(k)));
            }
            assertThat(template).isEqualTo(CanonicalPrinter.render(expr));
        }
    }

    @Test
    void renderedStringEvaluatesToTreeValue() {
        ExpressionSynthesizer synthesizer = new ExpressionSynthesizer(new Random(5));
        int checked = 0;
        for (int i = 0; i < 300; i++) {
            Expr expr = synthesizer.synthesize(5);
            Rational expected;
            try {
                expected = ExpressionEvaluator.evaluate(expr);
            } catch (DivisionByZeroException e) {
                continue;
            }
            assertThat(SubmissionParser.parse(CanonicalPrinter.render(expr)).evaluate())
                    .as(CanonicalPrinter.render(expr))
                    .isEqualTo(expected);
            checked++;
        }
        assertThat(checked).isPositive();
    }
}
