package net.tablegen.api;

/**
 * An (immutable) grammar symbol as seen by table construction.
 * A Symbol is identified by its name and its Kind; two symbols are equal
 * if-and-only-if both of these are equal. Terminals are the tokens of the
 * lexical grammar, nonterminals are the named rules of the syntactic
 * grammar.
 */
public final class Symbol {

    /**
     * The namespace a Symbol lives in.
     */
    public enum Kind { TERMINAL, NONTERMINAL }

    /**
     * The built-in terminal matching the end of the input.
     * It is implicitly present in every grammar and need not be declared.
     */
    public static final Symbol END_OF_INPUT = terminal("$end");

    private final String name;
    private final Kind kind;

    public Symbol(String name, Kind kind) {
        if (name == null)
            throw new NullPointerException("Symbol name may not be null");
        if (kind == null)
            throw new NullPointerException("Symbol kind may not be null");
        this.name = name;
        this.kind = kind;
    }

    public String toString() {
        return ((kind == Kind.TERMINAL) ? "terminal " : "nonterminal ") +
            name;
    }

    public boolean equals(Object other) {
        if (! (other instanceof Symbol)) return false;
        Symbol so = (Symbol) other;
        return (getName().equals(so.getName()) && getKind() == so.getKind());
    }

    public int hashCode() {
        return name.hashCode() ^ kind.hashCode();
    }

    /**
     * The name this symbol is declared under.
     */
    public String getName() {
        return name;
    }

    /**
     * Whether this is a terminal or a nonterminal.
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Create a terminal Symbol with the given name.
     */
    public static Symbol terminal(String name) {
        return new Symbol(name, Kind.TERMINAL);
    }

    /**
     * Create a nonterminal Symbol with the given name.
     */
    public static Symbol nonterminal(String name) {
        return new Symbol(name, Kind.NONTERMINAL);
    }

}
