package net.littleredcomputer.dpll.tseitin;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Emits the clauses defining each subformula id reachable from the root, after first
 * emitting the unit clause that forces the root true.
 */
public class TseitinEncoder {
    private static final Logger log = LogManager.getFormatterLogger();

    public enum Mode {
        /** P ⇔ (L op R): three clauses per node */
        EQUIVALENCE("eq"),
        /**
         * P ⇒ (L op R) only. Sound because the root is forced true; the result is
         * equisatisfiable with, but not equivalent to, the input.
         */
        LEFT_TO_RIGHT("left_to_right");

        private final String optionName;

        Mode(String optionName) { this.optionName = optionName; }

        public String optionName() { return optionName; }

        public static Mode fromOptionName(String name) {
            for (Mode m : values()) if (m.optionName.equals(name)) return m;
            throw new IllegalArgumentException("unknown encoding mode: " + name);
        }
    }

    private final Mode mode;

    public TseitinEncoder(Mode mode) { this.mode = mode; }

    public Mode mode() { return mode; }

    public void encode(Operand root, EncodingContext context) {
        context.addClause(root.literal());
        // Pre-order walk: a node's clauses, then those of its left subtree, then its right.
        // A pending operand is negated when the node it refers to occurs under an odd number of negations.
        Deque<Operand> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Operand o = pending.pop();
            switch (o.kind()) {
                case VARIABLE:
                    break;
                case SUBFORMULA: {
                    Subformula f = context.subformula(o.id());
                    define(o.id(), f, !o.isNegated(), context);
                    pending.push(o.isNegated() ? f.right().negate() : f.right());
                    pending.push(o.isNegated() ? f.left().negate() : f.left());
                    break;
                }
            }
        }
        log.debug("%s encoding: %d ids, %d clauses", mode, context.nIds(), context.clauses().size());
    }

    private void define(int p, Subformula f, boolean positive, EncodingContext context) {
        final int l = f.left().literal(), r = f.right().literal();
        switch (mode) {
            case EQUIVALENCE:
                switch (f.connective()) {
                    case AND:
                        context.addClause(-l, -r, p);
                        context.addClause(l, -p);
                        context.addClause(r, -p);
                        return;
                    case OR:
                        context.addClause(l, r, -p);
                        context.addClause(-l, p);
                        context.addClause(-r, p);
                        return;
                }
                break;
            case LEFT_TO_RIGHT:
                // Under a negation it is the converse implication that constrains the formula.
                if (!positive) {
                    switch (f.connective()) {
                        case AND:
                            context.addClause(-l, -r, p);
                            return;
                        case OR:
                            context.addClause(-l, p);
                            context.addClause(-r, p);
                            return;
                    }
                    break;
                }
                switch (f.connective()) {
                    case AND:
                        context.addClause(-p, l);
                        context.addClause(-p, r);
                        return;
                    case OR:
                        context.addClause(-p, l, r);
                        return;
                }
                break;
        }
        throw new IllegalStateException("not a connective: " + f.connective());
    }
}
