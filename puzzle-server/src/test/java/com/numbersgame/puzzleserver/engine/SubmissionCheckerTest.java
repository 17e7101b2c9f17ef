package com.numbersgame.puzzleserver.engine;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionCheckerTest {

    @Test
    void validExpressionWithoutTarget() {
        CheckResult result = SubmissionChecker.check(List.of(2, 2), "2+2");
        assertThat(result.reason()).isEqualTo(CheckReason.VALID_EXPRESSION);
        assertThat(result.correct()).isFalse();
        assertThat(result.evaluated()).isEqualTo(4L);
        assertThat(result.message()).isNull();
    }

    @Test
    void correctWhenTargetMatches() {
        CheckResult result = SubmissionChecker.check(List.of(2, 2), "2+2", 4L);
        assertThat(result.correct()).isTrue();
        assertThat(result.reason()).isEqualTo(CheckReason.CORRECT);
        assertThat(result.evaluated()).isEqualTo(4L);
    }

    @Test
    void wrongValue() {
        CheckResult result = SubmissionChecker.check(List.of(2, 2), "2+2", 5L);
        assertThat(result.correct()).isFalse();
        assertThat(result.reason()).isEqualTo(CheckReason.WRONG_VALUE);
        assertThat(result.evaluated()).isEqualTo(4L);
    }

    @Test
    void divisionByZeroIsAnInvalidExpression() {
        CheckResult result = SubmissionChecker.check(List.of(1, 0), "1/0");
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.evaluated()).isNull();
        assertThat(result.message()).isEqualTo("Division by zero");
    }

    @Test
    void numberUsedMoreOftenThanAvailable() {
        CheckResult result = SubmissionChecker.check(List.of(2), "2+2");
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.evaluated()).isNull();
        assertThat(result.message()).contains("Number 2 not available");
    }

    @Test
    void numberNotInBank() {
        CheckResult result = SubmissionChecker.check(List.of(3, 4), "3+5", 8L);
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.correct()).isFalse();
        assertThat(result.message()).contains("Number 5");
    }

    @Test
    void rejectsForbiddenCharacters() {
        CheckResult result = SubmissionChecker.check(List.of(2), "2+x");
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.message()).contains("invalid characters");

        assertThat(SubmissionChecker.check(List.of(2), "").reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
    }

    @Test
    void rejectsBadSyntax() {
        CheckResult result = SubmissionChecker.check(List.of(2, 3), "(2+3");
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.message()).startsWith("Invalid expression");
    }

    @Test
    void fractionalResultIsReportedAsDouble() {
        CheckResult result = SubmissionChecker.check(List.of(7, 2), "7/2", 3L);
        assertThat(result.reason()).isEqualTo(CheckReason.WRONG_VALUE);
        assertThat(result.evaluated()).isEqualTo(3.5);
    }

    @Test
    void exactComparisonThroughFractions() {
        CheckResult result = SubmissionChecker.check(List.of(6, 1, 5, 7), "6/(1-5/7)", 21L);
        assertThat(result.reason()).isEqualTo(CheckReason.CORRECT);
        assertThat(result.evaluated()).isEqualTo(21L);
    }

    @Test
    void unusedBankNumbersAreFine() {
        CheckResult result = SubmissionChecker.check(List.of(3, 4, 9, 11), "(3+4)*9", 63L);
        assertThat(result.correct()).isTrue();
    }

    @Test
    void unreadableTargetStillReportsValue() {
        CheckResult result = SubmissionChecker.checkWithUnreadableTarget(List.of(2, 2), "2*2");
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.evaluated()).isEqualTo(4L);
        assertThat(result.message()).isEqualTo("Invalid target value");
    }

    @Test
    void deeplyNestedExpressionIsAnInvalidExpression() {
        String parens = "(".repeat(100_000) + "1" + ")".repeat(100_000);
        CheckResult result = SubmissionChecker.check(List.of(1), parens, 1L);
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.correct()).isFalse();
        assertThat(result.message()).contains("nested too deeply");

        String negated = "-(".repeat(100_000) + "1" + ")".repeat(100_000);
        CheckResult negatedResult = SubmissionChecker.check(List.of(1), negated, 1L);
        assertThat(negatedResult.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(negatedResult.message()).contains("nested too deeply");
    }

    @Test
    void hugeSumOverHugeBankIsAnInvalidExpression() {
        List<Integer> bank = Collections.nCopies(100_000, 1);
        String sum = "1" + "+1".repeat(99_999);
        CheckResult result = SubmissionChecker.check(bank, sum);
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.message()).contains("too many numbers");
    }

    @Test
    void leadingZeroLiteralIsAnInvalidExpression() {
        CheckResult result = SubmissionChecker.check(List.of(7), "007", 7L);
        assertThat(result.reason()).isEqualTo(CheckReason.INVALID_EXPRESSION);
        assertThat(result.correct()).isFalse();
    }
}
