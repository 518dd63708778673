package net.littleredcomputer.dpll.tseitin;

import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Builds the formula tree from a token stream with a stack machine. Atoms are registered as
 * variables the first time they are seen; each {@code and}/{@code or} group is given a fresh
 * subformula id; a {@code not} group is replaced by its negated operand.
 */
public final class FormulaBuilder {
    private static final Logger log = LogManager.getFormatterLogger();
    static final String OPEN = "(";
    static final String CLOSE = ")";

    private FormulaBuilder() {}

    /**
     * An entry on the parse stack: an open parenthesis, an operator keyword, or a resolved operand.
     * Raw atom names never sit on the stack, so an atom spelled like an integer can't be
     * confused with an id.
     */
    private static final class Item {
        static final Item open = new Item(null, null);
        final Keyword keyword;
        final Operand operand;

        private Item(Keyword keyword, Operand operand) {
            this.keyword = keyword;
            this.operand = operand;
        }

        static Item of(Keyword k) { return new Item(k, null); }
        static Item of(Operand o) { return new Item(null, o); }
        boolean isOpen() { return this == open; }

        @Override
        public String toString() { return isOpen() ? OPEN : keyword != null ? keyword.toString() : operand.toString(); }
    }

    /**
     * @param tokens the output of {@link FormulaScanner#tokenize}
     * @param context receives the variables and subformulas of the formula
     * @return the root of the formula: a subformula, or a (possibly negated) variable for a
     * trivial formula
     */
    public static Operand build(List<String> tokens, EncodingContext context) {
        Deque<Item> stack = new ArrayDeque<>();
        for (String token : tokens) {
            if (token.equals(OPEN)) {
                stack.push(Item.open);
            } else if (token.equals(CLOSE)) {
                stack.push(Item.of(reduce(popGroup(stack), context)));
            } else {
                Optional<Keyword> k = Keyword.of(token);
                stack.push(k.isPresent() ? Item.of(k.get()) : Item.of(context.variable(token)));
            }
        }
        if (stack.size() != 1) throw new IllegalArgumentException("formula does not reduce to a single root: " + Lists.reverse(new ArrayList<>(stack)));
        Item root = stack.pop();
        if (root.operand == null) throw new IllegalArgumentException("formula has no operand: " + root);
        log.debug("root %s", root.operand);
        return root.operand;
    }

    // Pops back to the matching open parenthesis, returning the group in left-to-right order.
    private static List<Item> popGroup(Deque<Item> stack) {
        List<Item> group = new ArrayList<>();
        while (true) {
            if (stack.isEmpty()) throw new IllegalArgumentException("unbalanced " + CLOSE);
            Item i = stack.pop();
            if (i.isOpen()) break;
            group.add(i);
        }
        return Lists.reverse(group);
    }

    private static Operand reduce(List<Item> group, EncodingContext context) {
        if (group.isEmpty()) throw new IllegalArgumentException("empty group ()");
        Keyword op = group.get(0).keyword;
        if (op == null) throw new IllegalArgumentException("group must start with an operator: " + group);
        List<Operand> operands = new ArrayList<>();
        for (Item i : group.subList(1, group.size())) {
            if (i.operand == null) throw new IllegalArgumentException("misplaced operator " + i + " in " + group);
            operands.add(i.operand);
        }
        switch (op) {
            case NOT:
                if (operands.size() != 1) throw new IllegalArgumentException("not takes one operand: " + group);
                return operands.get(0).negate();
            case AND:
            case OR:
                if (operands.size() != 2) throw new IllegalArgumentException(op + " takes two operands: " + group);
                return context.allocate(new Subformula(op, operands.get(0), operands.get(1)));
            default:
                throw new IllegalArgumentException("unknown operator " + op);
        }
    }
}
