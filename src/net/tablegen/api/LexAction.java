package net.tablegen.api;

/**
 * An (immutable) entry of the lexical automaton's transition table.
 * LexAction-s come in exactly three varieties, distinguished by their
 * Type: an Error (no token matches), an Advance (scanning continues in
 * another automaton state), and an Accept (a token of some terminal has
 * been recognized). LexAction-s carry no precedence; competing Accept-s are
 * ordered by the declaration order of their terminals.
 */
public abstract class LexAction {

    /**
     * The variety of a LexAction.
     */
    public enum Type { ERROR, ADVANCE, ACCEPT }

    public static final class Error extends LexAction {

        private static final Error INSTANCE = new Error();

        private Error() {
            super(Type.ERROR);
        }

        public String toString() {
            return "error";
        }

        public boolean equals(Object other) {
            return (other instanceof Error);
        }

        public int hashCode() {
            return 0x2F1B;
        }

    }

    public static final class Advance extends LexAction {

        private final int state;

        private Advance(int state) {
            super(Type.ADVANCE);
            this.state = state;
        }

        public String toString() {
            return "advance " + state;
        }

        public boolean equals(Object other) {
            return ((other instanceof Advance) &&
                    state == ((Advance) other).getState());
        }

        public int hashCode() {
            return state * 31 + 1;
        }

        /**
         * The index of the automaton state scanning continues in.
         */
        public int getState() {
            return state;
        }

    }

    public static final class Accept extends LexAction {

        private final Symbol symbol;

        private Accept(Symbol symbol) {
            super(Type.ACCEPT);
            if (symbol == null)
                throw new NullPointerException(
                    "Accepted symbol may not be null");
            this.symbol = symbol;
        }

        public String toString() {
            return "accept " + symbol.getName();
        }

        public boolean equals(Object other) {
            return ((other instanceof Accept) &&
                    symbol.equals(((Accept) other).getSymbol()));
        }

        public int hashCode() {
            return symbol.hashCode() * 31 + 2;
        }

        /**
         * The terminal whose token has been recognized.
         */
        public Symbol getSymbol() {
            return symbol;
        }

    }

    private final Type type;

    private LexAction(Type type) {
        this.type = type;
    }

    /**
     * The variety of this action.
     */
    public Type getType() {
        return type;
    }

    /**
     * Return the (shared) Error action.
     */
    public static Error error() {
        return Error.INSTANCE;
    }

    /**
     * Create an action continuing the scan in the given state.
     */
    public static Advance advance(int state) {
        return new Advance(state);
    }

    /**
     * Create an action recognizing a token of the given terminal.
     */
    public static Accept accept(Symbol symbol) {
        return new Accept(symbol);
    }

}
