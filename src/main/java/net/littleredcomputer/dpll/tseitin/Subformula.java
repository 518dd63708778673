package net.littleredcomputer.dpll.tseitin;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * An internal {@code and}/{@code or} node of the formula tree. Each node receives its own id
 * from the encoding context, and is later defined by the clauses the Tseitin encoder emits.
 */
public final class Subformula {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private final Keyword connective;
    private final ImmutableList<Operand> operands;

    Subformula(Keyword connective, Operand left, Operand right) {
        if (connective == Keyword.NOT) throw new IllegalArgumentException("negation is not a subformula node");
        this.connective = connective;
        this.operands = ImmutableList.of(left, right);
    }

    public Keyword connective() { return connective; }
    public Operand left() { return operands.get(0); }
    public Operand right() { return operands.get(1); }
    public ImmutableList<Operand> operands() { return operands; }

    @Override
    public String toString() {
        return "(" + connective + ' ' + spaceJoiner.join(operands) + ")";
    }
}
