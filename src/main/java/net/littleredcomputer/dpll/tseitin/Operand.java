package net.littleredcomputer.dpll.tseitin;

/**
 * A reference from a subformula to one of its operands: an original variable or another
 * subformula, possibly negated. Negation never gets a node of its own; it is carried here
 * and folded into the sign of {@link #literal()}.
 */
public final class Operand {
    public enum Kind {
        VARIABLE,
        SUBFORMULA,
    }

    private final Kind kind;
    private final int id;  // positive, drawn from the shared id counter
    private final boolean negated;

    private Operand(Kind kind, int id, boolean negated) {
        if (id <= 0) throw new IllegalArgumentException("ids are positive: " + id);
        this.kind = kind;
        this.id = id;
        this.negated = negated;
    }

    static Operand variable(int id) { return new Operand(Kind.VARIABLE, id, false); }
    static Operand subformula(int id) { return new Operand(Kind.SUBFORMULA, id, false); }

    public Kind kind() { return kind; }
    public int id() { return id; }
    public boolean isNegated() { return negated; }

    public Operand negate() { return new Operand(kind, id, !negated); }

    /** @return the signed integer literal denoting this operand in the CNF output */
    public int literal() { return negated ? -id : id; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operand)) return false;
        Operand that = (Operand) o;
        return kind == that.kind && id == that.id && negated == that.negated;
    }

    @Override
    public int hashCode() { return 31 * (31 * kind.hashCode() + id) + (negated ? 1 : 0); }

    @Override
    public String toString() { return Integer.toString(literal()); }
}
