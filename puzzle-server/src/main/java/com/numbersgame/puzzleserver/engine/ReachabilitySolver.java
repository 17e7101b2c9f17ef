package com.numbersgame.puzzleserver.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Exhaustive search over pairwise reductions of a number bank.
 * <p>
 * A bank is solvable when repeatedly replacing two entries {@code a, b} by one of
 * {@code a+b, a-b, a*b, a/b} (the last only for {@code b != 0}) can leave a single value equal to
 * the target. Every bank number is used exactly once.
 * <p>
 * Reachability is memoized on the sorted multiset of values only. The witness string is rebuilt
 * afterwards by walking down states the memo already marked reachable, so text never enters the
 * memo key. Instances are immutable; each call gets its own memo.
 */
public class ReachabilitySolver {

    private final Duration timeout;

    public ReachabilitySolver() {
        this(null);
    }

    // null timeout means no limit
    public ReachabilitySolver(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @return a fully parenthesized expression over the whole bank that equals {@code target}
     * @throws SolverTimeoutException if the budget runs out or the thread is interrupted
     */
    public Optional<String> solve(List<Integer> bank, long target) {
        if (bank.isEmpty()) {
            return Optional.empty();
        }
        Search search = new Search(Rational.of(target), timeout == null ? null : System.nanoTime() + timeout.toNanos());
        List<Item> items = new ArrayList<>(bank.size());
        for (Integer n : bank) {
            items.add(new Item(Rational.of(n), String.valueOf(n)));
        }
        if (!search.reachable(valuesOf(items))) {
            return Optional.empty();
        }
        return Optional.of(search.witness(items));
    }

    public boolean isSolvable(List<Integer> bank, long target) {
        return solve(bank, target).isPresent();
    }

    private record Item(Rational value, String text) {}

    private static List<Rational> valuesOf(List<Item> items) {
        List<Rational> values = new ArrayList<>(items.size());
        for (Item item : items) {
            values.add(item.value());
        }
        Collections.sort(values);
        return values;
    }

    private static List<Rational> combine(Rational a, Rational b) {
        List<Rational> results = new ArrayList<>(4);
        results.add(a.add(b));
        results.add(a.subtract(b));
        results.add(a.multiply(b));
        if (!b.isZero()) {
            results.add(a.divide(b));
        }
        return results;
    }

    private static final class Search {
        private final Rational target;
        private final Long deadline;
        private final Map<List<Rational>, Boolean> memo = new HashMap<>();

        Search(Rational target, Long deadline) {
            this.target = target;
            this.deadline = deadline;
        }

        // values must be sorted
        boolean reachable(List<Rational> values) {
            if (values.size() == 1) {
                return values.get(0).equals(target);
            }
            Boolean known = memo.get(values);
            if (known != null) {
                return known;
            }
            checkBudget();
            boolean found = false;
            Set<List<Rational>> tried = new HashSet<>();
            int n = values.size();
            outer:
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (i == j) {
                        continue;
                    }
                    for (Rational combined : combine(values.get(i), values.get(j))) {
                        List<Rational> next = reduce(values, i, j, combined);
                        if (tried.add(next) && reachable(next)) {
                            found = true;
                            break outer;
                        }
                    }
                }
            }
            memo.put(values, found);
            return found;
        }

        String witness(List<Item> items) {
            if (items.size() == 1) {
                return items.get(0).text();
            }
            int n = items.size();
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (i == j) {
                        continue;
                    }
                    Item a = items.get(i);
                    Item b = items.get(j);
                    for (Item combined : combineItems(a, b)) {
                        List<Item> rest = new ArrayList<>(n - 1);
                        for (int k = 0; k < n; k++) {
                            if (k != i && k != j) {
                                rest.add(items.get(k));
                            }
                        }
                        rest.add(combined);
                        if (reachable(valuesOf(rest))) {
                            return witness(rest);
                        }
                    }
                }
            }
            throw new IllegalStateException("No witness for a state marked reachable");
        }

        private List<Item> combineItems(Item a, Item b) {
            List<Item> results = new ArrayList<>(4);
            results.add(new Item(a.value().add(b.value()), "(" + a.text() + "+" + b.text() + ")"));
            results.add(new Item(a.value().subtract(b.value()), "(" + a.text() + "-" + b.text() + ")"));
            results.add(new Item(a.value().multiply(b.value()), "(" + a.text() + "*" + b.text() + ")"));
            if (!b.value().isZero()) {
                results.add(new Item(a.value().divide(b.value()), "(" + a.text() + "/" + b.text() + ")"));
            }
            return results;
        }

        private List<Rational> reduce(List<Rational> values, int i, int j, Rational combined) {
            List<Rational> next = new ArrayList<>(values.size() - 1);
            for (int k = 0; k < values.size(); k++) {
                if (k != i && k != j) {
                    next.add(values.get(k));
                }
            }
            int at = Collections.binarySearch(next, combined);
            next.add(at < 0 ? -at - 1 : at, combined);
            return next;
        }

        private void checkBudget() {
            if (Thread.currentThread().isInterrupted()) {
                throw new SolverTimeoutException("Search interrupted");
            }
            if (deadline != null && System.nanoTime() - deadline > 0) {
                throw new SolverTimeoutException("Search exceeded its time budget");
            }
        }
    }
}
