package net.littleredcomputer.dpll.tseitin;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Translates a fully parenthesized prefix formula over {@code not}, {@code and} and
 * {@code or} into an equisatisfiable CNF.
 */
public class FormulaTranslator {
    private static final Logger log = LogManager.getFormatterLogger();
    private final TseitinEncoder encoder;

    public FormulaTranslator(TseitinEncoder.Mode mode) {
        this.encoder = new TseitinEncoder(mode);
    }

    public Translation translate(String formula) {
        EncodingContext context = new EncodingContext();
        Operand root = FormulaBuilder.build(FormulaScanner.tokenize(formula), context);
        encoder.encode(root, context);
        log.debug("translated %d variables, %d subformulas into %d clauses",
                context.nVariables(), context.nIds() - context.nVariables(), context.clauses().size());
        return new Translation(context, root, encoder.mode());
    }
}
