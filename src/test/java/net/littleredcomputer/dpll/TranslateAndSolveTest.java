package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.dpll.tseitin.FormulaTranslator;
import net.littleredcomputer.dpll.tseitin.Translation;
import net.littleredcomputer.dpll.tseitin.TseitinEncoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import java.util.List;
import java.util.Random;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

/**
 * Checks the whole pipeline, text to CNF to model, against truth tables of random formulas.
 */
public class TranslateAndSolveTest {
    private static final Logger log = LogManager.getFormatterLogger();

    /** A formula tree evaluated directly, independently of the translator. */
    private static abstract class Expr {
        abstract boolean eval(boolean[] values);
    }

    private static class Var extends Expr {
        final int index;
        final String name;
        Var(int index, String name) { this.index = index; this.name = name; }
        @Override boolean eval(boolean[] values) { return values[index]; }
        @Override public String toString() { return name; }
    }

    private static class Not extends Expr {
        final Expr e;
        Not(Expr e) { this.e = e; }
        @Override boolean eval(boolean[] values) { return !e.eval(values); }
        @Override public String toString() { return "(not " + e + ")"; }
    }

    private static class Binary extends Expr {
        final boolean and;
        final Expr l, r;
        Binary(boolean and, Expr l, Expr r) { this.and = and; this.l = l; this.r = r; }
        @Override boolean eval(boolean[] values) { return and ? l.eval(values) && r.eval(values) : l.eval(values) || r.eval(values); }
        @Override public String toString() { return "(" + (and ? "and" : "or") + " " + l + " " + r + ")"; }
    }

    private static class Generator {
        final Random random;
        final List<Var> vars;
        final boolean nnf;

        Generator(long seed, int nVars, boolean nnf) {
            random = new Random(seed);
            ImmutableList.Builder<Var> b = ImmutableList.builder();
            // Some atoms are spelled as integers to make sure names and ids stay apart.
            for (int i = 0; i < nVars; ++i) b.add(new Var(i, i % 3 == 2 ? Integer.toString(nVars - i) : "x" + i));
            vars = b.build();
            this.nnf = nnf;
        }

        Expr generate(int depth) {
            if (depth == 0 || random.nextInt(4) == 0) {
                Var v = vars.get(random.nextInt(vars.size()));
                return random.nextBoolean() ? new Not(v) : v;
            }
            Expr e = new Binary(random.nextBoolean(), generate(depth - 1), generate(depth - 1));
            return !nnf && random.nextInt(3) == 0 ? new Not(e) : e;
        }
    }

    private static boolean bruteForce(Expr e, int nVars) {
        boolean[] values = new boolean[nVars];
        for (int bits = 0; bits < 1 << nVars; ++bits) {
            for (int i = 0; i < nVars; ++i) values[i] = (bits >> i & 1) != 0;
            if (e.eval(values)) return true;
        }
        return false;
    }

    // Read the values of the original variables off a model; unassigned ones are taken false.
    private static boolean[] valuesOf(int[] model, Translation t, List<Var> vars) {
        boolean[] values = new boolean[vars.size()];
        for (int l : model) {
            for (Var v : vars) {
                if (t.context().variableId(v.name).orElse(0) == l) values[v.index] = true;
            }
        }
        return values;
    }

    private void checkAgainstTruthTable(long seed, int nVars, int depth, boolean nnf) {
        Generator g = new Generator(seed, nVars, nnf);
        int sat = 0;
        for (int trial = 0; trial < 60; ++trial) {
            Expr e = g.generate(depth);
            String formula = e.toString();
            boolean expected = bruteForce(e, nVars);
            int eqClauses = -1;
            for (TseitinEncoder.Mode mode : TseitinEncoder.Mode.values()) {
                Translation t = new FormulaTranslator(mode).translate(formula);
                SATProblem p = t.problem();
                DPLLSolver s = new DPLLSolver();
                boolean outcome = s.solve(p);
                assertThat(formula + " " + mode, outcome, is(expected));
                if (outcome) {
                    int[] model = s.model().get();
                    assertTrue(formula, p.evaluate(model));
                    assertTrue(formula + " " + mode, e.eval(valuesOf(model, t, g.vars)));
                }
                if (mode == TseitinEncoder.Mode.EQUIVALENCE) eqClauses = p.nClauses();
                else assertThat(p.nClauses(), lessThanOrEqualTo(eqClauses));
            }
            if (expected) ++sat;
        }
        log.info("seed %d: %d of 60 formulas over %d variables satisfiable", seed, sat, nVars);
    }

    @Test public void nnfFewVariables() { checkAgainstTruthTable(1, 3, 4, true); }
    @Test public void nnfMoreVariables() { checkAgainstTruthTable(2, 8, 6, true); }
    @Test public void negatedSubformulas() { checkAgainstTruthTable(3, 4, 5, false); }
    @Test public void negatedSubformulasMoreVariables() { checkAgainstTruthTable(4, 10, 6, false); }

    @Test
    public void conjunctionIsSatisfiable() {
        Translation t = new FormulaTranslator(TseitinEncoder.Mode.EQUIVALENCE).translate("(and x1 x2)");
        DPLLSolver s = new DPLLSolver();
        assertTrue(s.solve(t.problem()));
        int[] model = s.model().get();
        assertThat(model[0], is(1));
        assertThat(model[1], is(2));
    }

    @Test
    public void contradictionIsUnsatisfiable() {
        for (TseitinEncoder.Mode mode : TseitinEncoder.Mode.values()) {
            assertFalse(new DPLLSolver().solve(new FormulaTranslator(mode).translate("(and x1 (not x1))").problem()));
        }
    }

    @Test
    public void tautologyIsSatisfiable() {
        for (TseitinEncoder.Mode mode : TseitinEncoder.Mode.values()) {
            assertTrue(new DPLLSolver().solve(new FormulaTranslator(mode).translate("(or x1 (not x1))").problem()));
        }
    }

    @Test
    public void solverAndTranslatorCanBeReused() {
        FormulaTranslator translator = new FormulaTranslator(TseitinEncoder.Mode.LEFT_TO_RIGHT);
        DPLLSolver s = new DPLLSolver();
        assertFalse(s.solve(translator.translate("(and (or a b) (and (not a) (not b)))").problem()));
        assertTrue(s.solve(translator.translate("(and (or a b) (not a))").problem()));
        DPLLSolver fresh = new DPLLSolver();
        assertTrue(fresh.solve(new FormulaTranslator(TseitinEncoder.Mode.LEFT_TO_RIGHT).translate("(and (or a b) (not a))").problem()));
        assertThat(s.model().get(), is(fresh.model().get()));
    }
}
