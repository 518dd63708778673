package net.littleredcomputer.dpll.tseitin;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a prefix formula into tokens. Bracket characters always come out as tokens of their own,
 * even when glued to an identifier; everything else is a maximal run of non-whitespace.
 */
public final class FormulaScanner {
    private static final Pattern bracketRe = Pattern.compile("([()\\[\\]{}])");
    private static final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private FormulaScanner() {}

    public static List<String> tokenize(String formula) {
        return splitter.splitToList(bracketRe.matcher(formula).replaceAll(" $1 "));
    }
}
