package net.littleredcomputer.dpll.tseitin;

import java.util.Optional;

/**
 * The operator keywords of the prefix formula language.
 */
public enum Keyword {
    NOT("not"),
    AND("and"),
    OR("or");

    private final String token;

    Keyword(String token) { this.token = token; }

    static Optional<Keyword> of(String token) {
        for (Keyword k : values()) if (k.token.equals(token)) return Optional.of(k);
        return Optional.empty();
    }

    @Override
    public String toString() { return token; }
}
