package com.numbersgame.puzzleserver.engine;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates and evaluates a player's expression against the number bank.
 * <p>
 * Malformed input, unavailable numbers and division by zero are reported through
 * {@link CheckReason#INVALID_EXPRESSION}; nothing here throws for bad player input.
 */
public final class SubmissionChecker {

    private static final Pattern ALLOWED = Pattern.compile("[0-9+\\-*/()\\s]+");
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private SubmissionChecker() {}

    public static CheckResult check(List<Integer> bank, String expression) {
        return check(bank, expression, null);
    }

    // null target: validate and evaluate only
    public static CheckResult check(List<Integer> bank, String expression, Long target) {
        if (!ALLOWED.matcher(expression).matches()) {
            return CheckResult.invalid(null, "Invalid expression: expression contains invalid characters");
        }

        SubmissionParser.ParsedSubmission parsed;
        try {
            parsed = SubmissionParser.parse(expression);
        } catch (SubmissionSyntaxException e) {
            return CheckResult.invalid(null, "Invalid expression: " + e.getMessage());
        }

        String usageProblem = findUnavailableNumber(bank, parsed.literals());
        if (usageProblem != null) {
            return CheckResult.invalid(null, usageProblem);
        }

        Rational value;
        try {
            value = parsed.evaluate();
        } catch (DivisionByZeroException e) {
            return CheckResult.invalid(null, "Division by zero");
        }

        Number evaluated = toNumber(value);
        if (target == null) {
            return new CheckResult(false, CheckReason.VALID_EXPRESSION, evaluated, null);
        }
        boolean correct = value.equals(Rational.of(target));
        return new CheckResult(correct, correct ? CheckReason.CORRECT : CheckReason.WRONG_VALUE, evaluated, null);
    }

    /**
     * Checks an expression whose accompanying target could not be read as an integer. The
     * expression is still validated and evaluated so the caller can show its value.
     */
    public static CheckResult checkWithUnreadableTarget(List<Integer> bank, String expression) {
        CheckResult result = check(bank, expression, null);
        if (result.reason() != CheckReason.VALID_EXPRESSION) {
            return result;
        }
        return CheckResult.invalid(result.evaluated(), "Invalid target value");
    }

    private static String findUnavailableNumber(List<Integer> bank, List<BigInteger> used) {
        Map<BigInteger, Integer> available = new HashMap<>();
        for (Integer n : bank) {
            available.merge(BigInteger.valueOf(n), 1, Integer::sum);
        }
        for (BigInteger u : used) {
            int count = available.getOrDefault(u, 0);
            if (count <= 0) {
                return "Number " + u + " not available or used too many times";
            }
            available.put(u, count - 1);
        }
        return null;
    }

    static Number toNumber(Rational value) {
        if (!value.isInteger()) {
            return value.doubleValue();
        }
        BigInteger n = value.getNumerator();
        if (n.compareTo(LONG_MIN) >= 0 && n.compareTo(LONG_MAX) <= 0) {
            return n.longValue();
        }
        return n;
    }
}
