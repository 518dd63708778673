package net.littleredcomputer.dpll.tseitin;

import net.littleredcomputer.dpll.SATProblem;

/**
 * The outcome of translating one formula: its root and the context holding the substitution
 * table and the emitted clauses.
 */
public class Translation {
    private final EncodingContext context;
    private final Operand root;
    private final TseitinEncoder.Mode mode;

    Translation(EncodingContext context, Operand root, TseitinEncoder.Mode mode) {
        this.context = context;
        this.root = root;
        this.mode = mode;
    }

    public Operand root() { return root; }
    public EncodingContext context() { return context; }
    public TseitinEncoder.Mode mode() { return mode; }

    /**
     * @return the clauses as a CNF problem over every id of the context, annotated with the
     * substitution table and the root
     */
    public SATProblem problem() {
        SATProblem.Builder b = SATProblem.builder()
                .comment("")
                .comment("Substitutions:");
        for (String s : context.substitutions()) b.comment("    " + s);
        b.comment("")
                .comment("Root node is " + root.literal())
                .comment("");
        context.clauses().forEach(b::addClause);
        return b.nVariables(context.nIds()).build();
    }

    public String toDimacs() { return problem().toDimacs(); }
}
