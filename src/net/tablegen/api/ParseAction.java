package net.tablegen.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An (immutable) entry of the LR parse table.
 * ParseAction-s come in exactly three varieties, distinguished by their
 * Type: an Error (no valid action), a Shift (the lookahead is consumed and
 * the parser moves to another state), and a Reduce (a recognized production
 * body is replaced by its left-hand nonterminal).
 * A Shift can be justified by several items of its state at once, each of
 * which contributes the precedence of its production; a Shift hence carries
 * a (nonempty) set of precedences, while a Reduce carries a single one.
 */
public abstract class ParseAction {

    /**
     * The variety of a ParseAction.
     */
    public enum Type { ERROR, SHIFT, REDUCE }

    public static final class Error extends ParseAction {

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
            return 0x3E71;
        }

    }

    public static final class Shift extends ParseAction {

        private final int state;
        private final Set<Integer> precedences;

        private Shift(int state, Collection<Integer> precedences) {
            super(Type.SHIFT);
            if (precedences == null)
                throw new NullPointerException(
                    "Shift precedences may not be null");
            if (precedences.isEmpty())
                throw new IllegalArgumentException(
                    "Shift must have at least one precedence");
            if (precedences.contains(null))
                throw new NullPointerException(
                    "Shift precedences may not contain null");
            this.state = state;
            this.precedences = Collections.unmodifiableSet(
                new LinkedHashSet<Integer>(precedences));
        }

        public String toString() {
            return "shift " + state + " " + precedences;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Shift)) return false;
            Shift so = (Shift) other;
            return (state == so.getState() &&
                    new ArrayList<Integer>(precedences).equals(
                        new ArrayList<Integer>(so.getPrecedences())));
        }

        public int hashCode() {
            return (state * 31 + 1) ^ precedences.hashCode();
        }

        /**
         * The index of the state the parser moves to.
         */
        public int getState() {
            return state;
        }

        /**
         * The precedences of the items justifying this shift, in the order
         * they were supplied.
         */
        public Set<Integer> getPrecedences() {
            return precedences;
        }

    }

    public static final class Reduce extends ParseAction {

        private final Symbol symbol;
        private final int length;
        private final int precedence;

        private Reduce(Symbol symbol, int length, int precedence) {
            super(Type.REDUCE);
            if (symbol == null)
                throw new NullPointerException(
                    "Reduced symbol may not be null");
            if (length < 0)
                throw new IllegalArgumentException(
                    "Production length may not be negative");
            this.symbol = symbol;
            this.length = length;
            this.precedence = precedence;
        }

        public String toString() {
            return "reduce " + symbol.getName() + " " + length + " " +
                precedence;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Reduce)) return false;
            Reduce ro = (Reduce) other;
            return (symbol.equals(ro.getSymbol()) &&
                    length == ro.getLength() &&
                    precedence == ro.getPrecedence());
        }

        public int hashCode() {
            return symbol.hashCode() ^ (length * 31 + precedence);
        }

        /**
         * The left-hand nonterminal of the production reduced by.
         */
        public Symbol getSymbol() {
            return symbol;
        }

        /**
         * The amount of symbols in the production's body.
         */
        public int getLength() {
            return length;
        }

        /**
         * The declared precedence of the production.
         */
        public int getPrecedence() {
            return precedence;
        }

    }

    private final Type type;

    private ParseAction(Type type) {
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
     * Create a shift action to the given state.
     */
    public static Shift shift(int state, Collection<Integer> precedences) {
        return new Shift(state, precedences);
    }
    public static Shift shift(int state, Integer... precedences) {
        return new Shift(state, Arrays.asList(precedences));
    }

    /**
     * Create a reduce action by a production with the given left-hand
     * symbol, body length, and precedence.
     */
    public static Reduce reduce(Symbol symbol, int length, int precedence) {
        return new Reduce(symbol, length, precedence);
    }

}
