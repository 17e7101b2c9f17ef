package com.numbersgame.puzzleserver;

import com.numbersgame.puzzleserver.engine.CanonicalPrinter;
import com.numbersgame.puzzleserver.engine.DivisionByZeroException;
import com.numbersgame.puzzleserver.engine.Expr;
import com.numbersgame.puzzleserver.engine.ExpressionEvaluator;
import com.numbersgame.puzzleserver.engine.ExpressionSynthesizer;
import com.numbersgame.puzzleserver.engine.Rational;
import com.numbersgame.puzzleserver.engine.ReachabilitySolver;
import com.numbersgame.puzzleserver.engine.SolverTimeoutException;
import com.numbersgame.puzzleserver.engine.TemplateTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Retry loop that turns random expression trees into accepted, verified puzzles.
 * <p>
 * A candidate is accepted only if it evaluates to an integer inside the target range, its leaves
 * are pairwise distinct, and the solver confirms the full bank (leaves plus decoys) reaches the
 * target.
 */
@Component
public class PuzzleGenerator {

    private static final Logger log = LoggerFactory.getLogger(PuzzleGenerator.class);

    private final Random random;
    private final ExpressionSynthesizer synthesizer;
    private final ReachabilitySolver solver;
    private final RoundStore roundStore;
    private final int attemptBudget;

    public PuzzleGenerator(Random random,
                           ReachabilitySolver solver,
                           RoundStore roundStore,
                           @Value("${puzzle.generation.attempts:2000}") int attemptBudget) {
        if (attemptBudget < 1) {
            throw new IllegalArgumentException("attempt budget must be >= 1");
        }
        this.random = random;
        this.synthesizer = new ExpressionSynthesizer(random);
        this.solver = solver;
        this.roundStore = roundStore;
        this.attemptBudget = attemptBudget;
    }

    /**
     * @throws InvalidParameterException    if the options are out of range
     * @throws GenerationExhaustedException if no candidate was accepted within the budget or the
     *                                      calling thread was interrupted
     */
    public GeneratedPuzzle generate(GenerationOptions options) {
        options.validate();
        for (int attempt = 1; attempt <= attemptBudget; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new GenerationExhaustedException("Puzzle generation cancelled", attempt - 1, true);
            }
            Optional<PuzzleRound> accepted = tryCandidate(options);
            if (accepted.isPresent()) {
                PuzzleRound round = accepted.get();
                String roundId = roundStore.put(round);
                log.info("Generated round {} after {} attempt(s): target={} numbers={}",
                        roundId, attempt, round.getTarget(), round.getNumbers());
                return new GeneratedPuzzle(roundId, round);
            }
        }
        log.warn("No puzzle accepted within {} attempts for {}", attemptBudget, options);
        throw new GenerationExhaustedException(
                "Failed to generate puzzle; try adjusting parameters", attemptBudget, false);
    }

    private Optional<PuzzleRound> tryCandidate(GenerationOptions options) {
        int numOperands = options.getNumOperands();
        Expr expr = synthesizer.synthesize(numOperands);

        Rational value;
        try {
            value = ExpressionEvaluator.evaluate(expr);
        } catch (DivisionByZeroException e) {
            return Optional.empty();
        }
        if (!value.isInteger()) {
            return Optional.empty();
        }
        if (value.compareTo(Rational.of(options.getTargetMin())) < 0
                || value.compareTo(Rational.of(options.getTargetMax())) > 0) {
            return Optional.empty();
        }
        long target = value.getNumerator().longValueExact();

        List<Integer> used = expr.leaves();
        if (new HashSet<>(used).size() != numOperands) {
            return Optional.empty();
        }

        List<Integer> numbers = buildBank(used, options.getDecoys());

        Optional<String> witness;
        try {
            witness = solver.solve(numbers, target);
        } catch (SolverTimeoutException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new GenerationExhaustedException("Puzzle generation cancelled", 0, true);
            }
            log.warn("Verifier gave up on bank {} for target {}: {}", numbers, target, e.getMessage());
            return Optional.empty();
        }
        if (witness.isEmpty()) {
            return Optional.empty();
        }

        String solution = CanonicalPrinter.render(expr);
        CanonicalPrinter.PlaceholderRendering template = CanonicalPrinter.renderPlaceholders(expr);
        List<String> tokens = TemplateTokenizer.tokenize(template.text());
        if (template.nextIndex() != numOperands) {
            return Optional.empty();
        }

        if (random.nextDouble() < options.getRequireParensProb() && !tokens.contains("(")) {
            return Optional.empty();
        }

        log.debug("Accepted {} = {} (verifier witness {})", solution, target, witness.get());
        return Optional.of(new PuzzleRound(solution, numbers, used, target, tokens, template.nextIndex()));
    }

    private List<Integer> buildBank(List<Integer> leaves, int decoys) {
        Set<Integer> taken = new HashSet<>(leaves);
        List<Integer> pool = new ArrayList<>();
        for (int n = Expr.MIN_LEAF; n <= Expr.MAX_LEAF; n++) {
            if (!taken.contains(n)) {
                pool.add(n);
            }
        }
        Collections.shuffle(pool, random);
        List<Integer> numbers = new ArrayList<>(leaves);
        numbers.addAll(pool.subList(0, decoys));
        Collections.shuffle(numbers, random);
        return numbers;
    }
}
