package com.barthel.biasadjust.domain.model;

import com.barthel.biasadjust.domain.exception.KindNotSupportedException;

import java.util.List;
import java.util.Locale;

/**
 * Whether corrections are applied as sums or as ratios.
 */
public enum Kind {
    ADDITIVE("+", List.of("+", "add", "additive")),
    MULTIPLICATIVE("*", List.of("*", "mult", "multiplicative"));

    private final String symbol;
    private final List<String> aliases;

    Kind(String symbol, List<String> aliases) {
        this.symbol = symbol;
        this.aliases = aliases;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolve a kind from one of its accepted spellings.
     *
     * @param alias e.g. {@code "+"}, {@code "add"}, {@code "*"} or {@code "mult"}
     * @return the matching kind
     * @throws KindNotSupportedException if the alias is not recognised
     */
    public static Kind fromAlias(String alias) {
        if (alias != null) {
            String normalized = alias.trim().toLowerCase(Locale.ROOT);
            for (Kind kind : values()) {
                if (kind.aliases.contains(normalized)) {
                    return kind;
                }
            }
        }
        throw new KindNotSupportedException(alias, List.of(values()));
    }
}
