package net.littleredcomputer.dpll;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A formula in conjunctive normal form: a list of clauses over signed integer literals,
 * together with the comment lines that accompany it in DIMACS form.
 */
public class SATProblem {
    private static final Logger log = LogManager.getFormatterLogger();
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();
    private final static Joiner spaceJoiner = Joiner.on(' ');
    private final int nVariables;
    private final ImmutableList<ImmutableList<Integer>> clauses;
    private final ImmutableList<String> comments;

    private SATProblem(int nVariables, ImmutableList<ImmutableList<Integer>> clauses, ImmutableList<String> comments) {
        this.nVariables = nVariables;
        this.clauses = clauses;
        this.comments = comments;
    }

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private final ImmutableList.Builder<ImmutableList<Integer>> clauses = ImmutableList.builder();
        private final ImmutableList.Builder<String> comments = ImmutableList.builder();
        private int nVariables = -1;
        private int maxVariable = 0;

        private Builder() {}

        public Builder comment(String text) {
            comments.add(text);
            return this;
        }

        public Builder addClause(Iterable<Integer> literals) {
            ImmutableList<Integer> clause = ImmutableList.copyOf(literals);
            for (int l : clause) {
                if (l == 0) throw new IllegalArgumentException("0 is not a literal");
                maxVariable = Math.max(maxVariable, Math.abs(l));
            }
            clauses.add(clause);
            return this;
        }

        /** Declares the variable count; without a declaration the largest variable seen is used. */
        public Builder nVariables(int n) {
            if (n < 0) throw new IllegalArgumentException("negative variable count " + n);
            nVariables = n;
            return this;
        }

        public SATProblem build() {
            return new SATProblem(nVariables >= 0 ? nVariables : maxVariable, clauses.build(), comments.build());
        }
    }

    public int nVariables() { return nVariables; }

    public int nClauses() { return clauses.size(); }

    public List<Integer> getClause(int i) { return clauses.get(i); }

    public List<List<Integer>> clauses() { return Collections.unmodifiableList(clauses); }

    public List<String> comments() { return comments; }

    /**
     * Evaluate the problem's clauses under a (possibly partial) assignment
     * @param model signed literals taken to be true
     * @return true iff every clause contains a literal of the model
     */
    public boolean evaluate(int[] model) {
        TIntSet trueLiterals = new TIntHashSet(model);
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (trueLiterals.contains(literal)) continue CLAUSE;
            }
            return false;
        }
        return true;
    }

    public static SATProblem parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Reads DIMACS CNF. Comment lines are skipped, the counts on the p line are taken as a
     * declaration but not checked against the content, and each 0 ends a clause. A p line
     * that is not of the form {@code p cnf <vars> <clauses>} is ignored.
     */
    public static SATProblem parseFrom(Reader r) {
        Builder b = builder();
        List<Integer> literals = new ArrayList<>();
        boolean pending = false;
        int lineNumber = 0;
        try (BufferedReader br = new BufferedReader(r)) {
            String line;
            while ((line = br.readLine()) != null) {
                ++lineNumber;
                if (line.trim().isEmpty()) continue;
                if (line.startsWith("c")) {
                    b.comment(line.substring(1).trim());
                    continue;
                }
                if (line.startsWith("p")) {
                    // A p line that does not parse is skipped like a comment.
                    Matcher m = pLineRe.matcher(line);
                    if (m.matches()) b.nVariables(Integer.parseInt(m.group(1)));
                    else log.debug("ignoring p line %s", line);
                    continue;
                }
                for (String token : splitter.split(line)) {
                    int l;
                    try {
                        l = Integer.parseInt(token);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("line " + lineNumber + ": not a literal: " + token, e);
                    }
                    if (l == 0) {
                        b.addClause(literals);
                        literals.clear();
                        pending = false;
                    } else {
                        literals.add(l);
                        pending = true;
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (pending) throw new IllegalArgumentException("Unterminated final clause");
        return b.build();
    }

    /** @return the problem in DIMACS CNF form, comments first */
    public String toDimacs() {
        StringBuilder sb = new StringBuilder();
        for (String c : comments) sb.append(c.isEmpty() ? "c" : "c " + c).append('\n');
        sb.append("p cnf ").append(nVariables).append(' ').append(clauses.size()).append('\n');
        for (List<Integer> clause : clauses) spaceJoiner.appendTo(sb, clause).append(clause.isEmpty() ? "0\n" : " 0\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "SATProblem{" + nVariables + " variables, " + clauses.size() + " clauses}";
    }
}
