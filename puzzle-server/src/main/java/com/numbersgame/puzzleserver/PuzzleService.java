package com.numbersgame.puzzleserver;

import com.fasterxml.jackson.databind.JsonNode;
import com.numbersgame.puzzleserver.engine.CheckResult;
import com.numbersgame.puzzleserver.engine.SubmissionChecker;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations shared by the REST controller and the WebSocket handler.
 */
@Service
public class PuzzleService {

    private final PuzzleGenerator generator;
    private final RoundStore roundStore;

    public PuzzleService(PuzzleGenerator generator, RoundStore roundStore) {
        this.generator = generator;
        this.roundStore = roundStore;
    }

    public PuzzleResponse newPuzzle(GenerationOptions options, boolean showSolution) {
        return new PuzzleResponse(generator.generate(options), showSolution);
    }

    /**
     * Checks a {@code {numbers, expression, target?}} payload.
     *
     * @throws MissingRequestFieldException if {@code numbers} or {@code expression} is absent
     * @throws InvalidParameterException    if {@code numbers} is not a list of integers
     */
    public CheckResult check(JsonNode payload) {
        JsonNode numbersNode = payload == null ? null : payload.get("numbers");
        JsonNode expressionNode = payload == null ? null : payload.get("expression");
        if (numbersNode == null || numbersNode.isNull() || expressionNode == null || expressionNode.isNull()) {
            throw new MissingRequestFieldException("Missing numbers or expression");
        }
        if (!numbersNode.isArray()) {
            throw new InvalidParameterException("numbers must be a list of integers");
        }
        if (!expressionNode.isTextual()) {
            throw new InvalidParameterException("expression must be a string");
        }

        List<Integer> bank = new ArrayList<>(numbersNode.size());
        for (JsonNode n : numbersNode) {
            if (!n.isInt()) {
                throw new InvalidParameterException("numbers must be a list of integers");
            }
            bank.add(n.intValue());
        }
        String expression = expressionNode.asText();

        JsonNode targetNode = payload.get("target");
        if (targetNode == null || targetNode.isNull()) {
            return SubmissionChecker.check(bank, expression);
        }
        Long target = readTarget(targetNode);
        if (target == null) {
            return SubmissionChecker.checkWithUnreadableTarget(bank, expression);
        }
        return SubmissionChecker.check(bank, expression, target);
    }

    public String reveal(String roundId) {
        return roundStore.require(roundId).getSolution();
    }

    private static Long readTarget(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        // 4.0 is accepted as 4, 4.5 is not
        if (node.isNumber()) {
            try {
                return node.decimalValue().stripTrailingZeros().longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
