package net.tablegen.api;

import java.util.List;

/**
 * Arbiter between competing actions during table construction.
 * Table construction discovers the actions of every table cell one at a
 * time; whenever a cell that already holds an action receives another
 * candidate, the appropriate resolve method is consulted and tells whether
 * the candidate should replace the current action.
 * Decisions do not depend on which action was discovered first; genuinely
 * ambiguous parse table cells are recorded and can be retrieved via
 * getConflicts() after construction has finished.
 * Implementations are not required to be thread-safe.
 */
public interface ConflictResolver {

    /**
     * Decide between two actions for the same lexical automaton transition.
     * Returns true if candidate should replace current.
     * Lexical ambiguities are resolved silently by declaration order.
     */
    boolean resolveLexAction(LexAction current, LexAction candidate);

    /**
     * Decide between two actions for the same parse table cell.
     * lookahead is the terminal the cell is indexed by; it is only used for
     * describing conflicts. Returns true if candidate should replace
     * current. Ambiguous situations are resolved by fixed defaults and
     * recorded as Conflict-s.
     */
    boolean resolveParseAction(Symbol lookahead, ParseAction current,
                               ParseAction candidate);

    /**
     * Return the conflicts recorded so far, in the order they were first
     * encountered.
     * The returned list is an unmodifiable snapshot.
     */
    List<Conflict> getConflicts();

}
