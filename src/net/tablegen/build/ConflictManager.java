package net.tablegen.build;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.tablegen.api.Conflict;
import net.tablegen.api.ConflictResolver;
import net.tablegen.api.InvalidGrammarException;
import net.tablegen.api.LexAction;
import net.tablegen.api.ParseAction;
import net.tablegen.api.Symbol;
import net.tablegen.grammar.GrammarSet;
import net.tablegen.grammar.LexicalGrammar;
import net.tablegen.grammar.PreparedGrammar;

public class ConflictManager implements ConflictResolver {

    private static final Logger LOGGER = Logger.getLogger("ConflictManager");

    private final SymbolCatalog catalog;
    private final ConflictLog log;

    public ConflictManager(SymbolCatalog catalog, ConflictLog log) {
        if (catalog == null)
            throw new NullPointerException(
                "ConflictManager catalog may not be null");
        if (log == null)
            throw new NullPointerException(
                "ConflictManager log may not be null");
        this.catalog = catalog;
        this.log = log;
    }
    public ConflictManager(PreparedGrammar syntax, LexicalGrammar lexical,
            Map<Symbol, String> names) throws InvalidGrammarException {
        this(new SymbolCatalog(syntax, lexical, names), new ConflictLog());
    }
    public ConflictManager(GrammarSet grammars)
            throws InvalidGrammarException {
        this(grammars.getSyntax(), grammars.getLexical(),
             grammars.getNames());
    }

    public SymbolCatalog getCatalog() {
        return catalog;
    }

    public ConflictLog getLog() {
        return log;
    }

    public List<Conflict> getConflicts() {
        return log.getEntries();
    }

    public boolean resolveLexAction(LexAction current, LexAction candidate) {
        checkNotNull(current, candidate);
        switch (current.getType()) {
            case ERROR:
                return (candidate.getType() != LexAction.Type.ERROR);
            case ADVANCE:
                return false;
            case ACCEPT:
                if (candidate.getType() != LexAction.Type.ACCEPT)
                    return false;
                return (catalog.compare(
                    ((LexAction.Accept) candidate).getSymbol(),
                    ((LexAction.Accept) current).getSymbol()) < 0);
            default:
                throw new IllegalArgumentException(
                    "Unrecognized lex action " + current);
        }
    }

    public boolean resolveParseAction(Symbol lookahead, ParseAction current,
                                      ParseAction candidate) {
        if (lookahead == null)
            throw new NullPointerException("Lookahead may not be null");
        checkNotNull(current, candidate);
        if (current.equals(candidate)) return false;
        switch (current.getType()) {
            case ERROR:
                return (candidate.getType() != ParseAction.Type.ERROR);
            case SHIFT:
                switch (candidate.getType()) {
                    case ERROR: case SHIFT:
                        return false;
                    case REDUCE:
                        return ! resolveShiftReduce(lookahead,
                            (ParseAction.Shift) current,
                            (ParseAction.Reduce) candidate);
                    default:
                        throw new IllegalArgumentException(
                            "Unrecognized parse action " + candidate);
                }
            case REDUCE:
                switch (candidate.getType()) {
                    case ERROR:
                        return false;
                    case SHIFT:
                        return resolveShiftReduce(lookahead,
                            (ParseAction.Shift) candidate,
                            (ParseAction.Reduce) current);
                    case REDUCE:
                        return resolveReduceReduce(lookahead,
                            (ParseAction.Reduce) current,
                            (ParseAction.Reduce) candidate);
                    default:
                        throw new IllegalArgumentException(
                            "Unrecognized parse action " + candidate);
                }
            default:
                throw new IllegalArgumentException(
                    "Unrecognized parse action " + current);
        }
    }

    /* Returns whether the shift wins. Ties and mixed precedences go to the
     * shift. */
    protected boolean resolveShiftReduce(Symbol lookahead,
            ParseAction.Shift shift, ParseAction.Reduce reduce) {
        int reducePrec = reduce.getPrecedence();
        boolean allGreater = true, allLess = true;
        for (int p : shift.getPrecedences()) {
            if (p <= reducePrec) allGreater = false;
            if (p >= reducePrec) allLess = false;
        }
        if (allGreater || allLess) {
            LOGGER.finer("Resolved " + shift + " / " + reduce + " on " +
                lookahead + " by precedence");
            return allGreater;
        }
        record(describeShiftReduce(lookahead, shift, reduce));
        return true;
    }

    /* Returns whether candidate wins. Ties go to the symbol declared
     * first. */
    protected boolean resolveReduceReduce(Symbol lookahead,
            ParseAction.Reduce current, ParseAction.Reduce candidate) {
        int currentPrec = current.getPrecedence();
        int candidatePrec = candidate.getPrecedence();
        if (currentPrec != candidatePrec) {
            LOGGER.finer("Resolved " + current + " / " + candidate +
                " on " + lookahead + " by precedence");
            return (candidatePrec > currentPrec);
        }
        record(describeReduceReduce(lookahead, current, candidate));
        return (catalog.compare(candidate.getSymbol(),
                                current.getSymbol()) < 0);
    }

    protected String describeShiftReduce(Symbol lookahead,
            ParseAction.Shift shift, ParseAction.Reduce reduce) {
        StringBuilder sb = new StringBuilder();
        sb.append(catalog.getName(lookahead)).append(": shift (precedence ");
        boolean first = true;
        for (int p : shift.getPrecedences()) {
            if (first) {
                first = false;
            } else {
                sb.append(", ");
            }
            sb.append(p);
        }
        sb.append(") / ").append(describeReduce(reduce));
        return sb.toString();
    }

    protected String describeReduceReduce(Symbol lookahead,
            ParseAction.Reduce current, ParseAction.Reduce candidate) {
        return catalog.getName(lookahead) + ": " +
            describeReduce(candidate) + " / " + describeReduce(current);
    }

    protected String describeReduce(ParseAction.Reduce reduce) {
        return "reduce " + catalog.getName(reduce.getSymbol()) +
            " (precedence " + reduce.getPrecedence() + ")";
    }

    private void record(String description) {
        if (log.append(description))
            LOGGER.fine("Recorded conflict " + description);
    }

    private static void checkNotNull(Object current, Object candidate) {
        if (current == null)
            throw new NullPointerException(
                "Current action may not be null");
        if (candidate == null)
            throw new NullPointerException(
                "Candidate action may not be null");
    }

}
