package net.littleredcomputer.dpll;

import com.google.common.primitives.Ints;
import gnu.trove.map.TIntIntMap;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * The Davis-Putnam-Logemann-Loveland procedure in its plain form: unit propagation over
 * explicitly simplified clause lists, and a two-way branch on the literal with the most
 * occurrences. There is no clause learning and no watched literal indexing.
 * <p>
 * The search is driven by an explicit stack of branches rather than by recursion, so
 * the depth of the search is not bounded by the depth of the call stack.
 */
public class DPLLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final Comparator<Integer> byMagnitude = Comparator.comparingInt(Math::abs);
    private long decisions;
    private long propagations;
    private int[] model;

    public DPLLSolver() {
        super("DPLL");
    }

    /** A subproblem awaiting propagation: the clauses of its parent and the assignment to extend. */
    private static class Branch {
        final List<int[]> clauses;
        final TIntSet assignment;
        final int depth;

        Branch(List<int[]> clauses, TIntSet assignment, int depth) {
            this.clauses = clauses;
            this.assignment = assignment;
            this.depth = depth;
        }
    }

    /** Result of unit propagation: either a conflict, or the clauses left once every unit is committed. */
    static class Propagation {
        private static final Propagation conflict = new Propagation(false, Collections.emptyList());
        final boolean consistent;
        final List<int[]> clauses;

        private Propagation(boolean consistent, List<int[]> clauses) {
            this.consistent = consistent;
            this.clauses = clauses;
        }

        static Propagation conflict() { return conflict; }
        static Propagation of(List<int[]> clauses) { return new Propagation(true, clauses); }
    }

    @Override
    public boolean solve(SATProblem problem) {
        decisions = 0;
        propagations = 0;
        model = null;
        start();
        List<int[]> clauses = new ArrayList<>(problem.nClauses());
        for (List<Integer> c : problem.clauses()) clauses.add(Ints.toArray(c));

        Deque<Branch> stack = new ArrayDeque<>();
        stack.push(new Branch(clauses, new TIntHashSet(), 0));
        try {
            while (!stack.isEmpty()) {
                final Branch b = stack.pop();
                ++stepCount;
                if (stepCount % logCheckSteps == 0) {
                    maybeReportProgress(() -> String.format("depth %d, %d clauses, %d decisions", b.depth, b.clauses.size(), decisions));
                }
                Propagation p = propagate(b.clauses, b.assignment);
                if (!p.consistent) {
                    log.trace("conflict at depth %d", b.depth);
                    continue;
                }
                if (p.clauses.isEmpty()) {
                    model = sortByMagnitude(b.assignment);
                    log.debug("model found after %d decisions, %d propagations", decisions, propagations);
                    return true;
                }
                int l = chooseLiteral(p.clauses);
                ++decisions;
                log.trace("decide %d at depth %d", l, b.depth);
                // The positive branch is pushed last so that it is explored first.
                stack.push(new Branch(p.clauses, extend(b.assignment, -l), b.depth + 1));
                stack.push(new Branch(p.clauses, extend(b.assignment, l), b.depth + 1));
            }
            log.debug("unsatisfiable after %d decisions, %d propagations", decisions, propagations);
            return false;
        } finally {
            stop();
        }
    }

    @Override
    public Optional<int[]> model() {
        return model == null ? Optional.empty() : Optional.of(model.clone());
    }

    public long decisions() { return decisions; }

    public long propagations() { return propagations; }

    private static TIntSet extend(TIntSet assignment, int literal) {
        TIntSet s = new TIntHashSet(assignment);
        s.add(literal);
        return s;
    }

    private static int[] sortByMagnitude(TIntSet assignment) {
        Integer[] ls = new Integer[assignment.size()];
        int i = 0;
        for (int l : assignment.toArray()) ls[i++] = l;
        Arrays.sort(ls, byMagnitude);
        return Ints.toArray(Arrays.asList(ls));
    }

    /**
     * Simplify the clauses under an assignment: a clause containing an assigned literal is
     * dropped, and literals whose complements are assigned are removed from the rest.
     */
    static List<int[]> eliminate(List<int[]> clauses, TIntSet assignment) {
        List<int[]> reduced = new ArrayList<>(clauses.size());
        CLAUSE:
        for (int[] clause : clauses) {
            int[] kept = new int[clause.length];
            int n = 0;
            for (int l : clause) {
                if (assignment.contains(l)) continue CLAUSE;
                if (!assignment.contains(-l)) kept[n++] = l;
            }
            reduced.add(n == clause.length ? clause : Arrays.copyOf(kept, n));
        }
        return reduced;
    }

    /**
     * Commit unit literals until none remain, adding each to the assignment and simplifying the
     * clauses after every one. Stops at the first clause that becomes empty.
     */
    @CheckReturnValue
    Propagation propagate(List<int[]> clauses, TIntSet assignment) {
        List<int[]> reduced = eliminate(clauses, assignment);
        TIntSet queued = new TIntHashSet();
        TIntStack units = new TIntArrayStack();
        for (int[] c : reduced) {
            if (c.length == 0) return Propagation.conflict();
            if (c.length == 1 && queued.add(c[0])) units.push(c[0]);
        }
        while (units.size() > 0 && !reduced.isEmpty()) {
            ++propagations;
            final int l = units.pop();
            assignment.add(l);
            List<int[]> next = new ArrayList<>(reduced.size());
            for (int[] c : reduced) {
                if (Ints.contains(c, l)) continue;
                int[] stripped = without(c, -l);
                if (stripped.length == 0) return Propagation.conflict();
                if (stripped.length == 1 && queued.add(stripped[0])) units.push(stripped[0]);
                next.add(stripped);
            }
            reduced = next;
        }
        return Propagation.of(reduced);
    }

    private static int[] without(int[] clause, int literal) {
        if (!Ints.contains(clause, literal)) return clause;
        int[] out = new int[clause.length];
        int n = 0;
        for (int l : clause) if (l != literal) out[n++] = l;
        return Arrays.copyOf(out, n);
    }

    /**
     * Choose the decision literal: the signed literal occurring in the most clauses. Among
     * variables with equal counts the smaller one wins; when the best positive and the best
     * negative literal tie, the one with the larger variable wins, the positive literal if
     * the variables are equal.
     * @param clauses nonempty list of nonempty clauses
     */
    static int chooseLiteral(List<int[]> clauses) {
        TIntIntMap positive = new TIntIntHashMap();
        TIntIntMap negative = new TIntIntHashMap();
        for (int[] clause : clauses) {
            TIntSet seen = new TIntHashSet(clause.length);
            for (int l : clause) {
                if (!seen.add(l)) continue;
                if (l > 0) positive.adjustOrPutValue(l, 1, 1);
                else negative.adjustOrPutValue(-l, 1, 1);
            }
        }
        checkState(!positive.isEmpty() || !negative.isEmpty(), "no literal to choose among %s clauses", clauses.size());
        final int maxPos = mostFrequent(positive);
        final int maxNeg = mostFrequent(negative);
        if (maxNeg == 0) return maxPos;
        if (maxPos == 0) return -maxNeg;
        final int p = positive.get(maxPos), n = negative.get(maxNeg);
        if (p > n) return maxPos;
        if (p < n) return -maxNeg;
        return maxPos >= maxNeg ? maxPos : -maxNeg;
    }

    // The variable with the highest count, the smallest such on ties; 0 if there are none.
    private static int mostFrequent(TIntIntMap counts) {
        int best = 0;
        int bestCount = 0;
        for (int v : counts.keys()) {
            int c = counts.get(v);
            if (c > bestCount || (c == bestCount && v < best)) {
                best = v;
                bestCount = c;
            }
        }
        return best;
    }
}
