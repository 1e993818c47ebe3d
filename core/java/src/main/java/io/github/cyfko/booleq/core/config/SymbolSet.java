package io.github.cyfko.booleq.core.config;

/**
 * Symbols used to render expressions in infix form.
 * <p>
 * {@link #UNICODE} uses the conventional logic glyphs, {@link #ASCII} sticks to characters that
 * survive any terminal.
 * </p>
 *
 * <pre>{@code
 * x.and(y.not())   // UNICODE: (x=1 ∧ ¬y=?)    ASCII: (x=1 & ~y=?)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum SymbolSet {

    UNICODE("⊤", "⊥", "¬", "∧", "∨", "⊕", "→", "↔"),

    ASCII("1", "0", "~", "&", "|", "^", "->", "<->");

    private final String trueSymbol;
    private final String falseSymbol;
    private final String not;
    private final String and;
    private final String or;
    private final String xor;
    private final String implies;
    private final String equivalent;

    SymbolSet(String trueSymbol, String falseSymbol, String not, String and, String or,
              String xor, String implies, String equivalent) {
        this.trueSymbol = trueSymbol;
        this.falseSymbol = falseSymbol;
        this.not = not;
        this.and = and;
        this.or = or;
        this.xor = xor;
        this.implies = implies;
        this.equivalent = equivalent;
    }

    /**
     * Returns the symbol of a boolean constant.
     *
     * @param value the constant value
     * @return the top symbol for {@code true}, the bottom symbol for {@code false}
     */
    public String constant(boolean value) {
        return value ? trueSymbol : falseSymbol;
    }

    public String not() {
        return not;
    }

    public String and() {
        return and;
    }

    public String or() {
        return or;
    }

    public String xor() {
        return xor;
    }

    public String implies() {
        return implies;
    }

    public String equivalent() {
        return equivalent;
    }
}
