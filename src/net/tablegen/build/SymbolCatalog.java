package net.tablegen.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import net.tablegen.api.InvalidGrammarException;
import net.tablegen.api.Symbol;
import net.tablegen.grammar.LexicalGrammar;
import net.tablegen.grammar.NamedRule;
import net.tablegen.grammar.PreparedGrammar;

/* Declaration ranks and display names of all symbols of a grammar.
 * Ranks are only comparable between symbols of the same kind. Immutable
 * after construction. */
public class SymbolCatalog {

    public static final String END_OF_INPUT_NAME = "END_OF_INPUT";

    private static final Logger LOGGER = Logger.getLogger("SymbolCatalog");

    private final Map<Symbol, Integer> ranks;
    private final Map<Symbol, String> names;

    public SymbolCatalog(PreparedGrammar syntax, LexicalGrammar lexical,
            Map<Symbol, String> names) throws InvalidGrammarException {
        lexical.validate();
        Map<Symbol, Integer> ranks = new LinkedHashMap<Symbol, Integer>();
        int index = 0;
        for (NamedRule r : syntax.getRules()) {
            ranks.put(Symbol.nonterminal(r.getName()), index++);
        }
        index = 0;
        for (NamedRule r : lexical.getRules()) {
            ranks.put(Symbol.terminal(r.getName()), index++);
        }
        ranks.put(Symbol.END_OF_INPUT, index);

        Map<Symbol, String> resolvedNames =
            new LinkedHashMap<Symbol, String>();
        List<Symbol> required = new ArrayList<Symbol>(ranks.keySet());
        for (String ref : syntax.getReferencedNames()) {
            Symbol sym = lexical.resolveReference(ref);
            if (! required.contains(sym)) required.add(sym);
        }
        for (Symbol sym : required) {
            String name = names.get(sym);
            if (name == null && sym.equals(Symbol.END_OF_INPUT))
                name = END_OF_INPUT_NAME;
            if (name == null)
                throw new InvalidGrammarException("Missing display name " +
                    "for " + sym);
            resolvedNames.put(sym, name);
        }

        this.ranks = Collections.unmodifiableMap(ranks);
        this.names = Collections.unmodifiableMap(resolvedNames);
        LOGGER.config("Cataloged " + syntax.size() + " rules and " +
            lexical.size() + " tokens");
    }

    public Set<Symbol> getSymbols() {
        return names.keySet();
    }

    public boolean contains(Symbol sym) {
        return names.containsKey(sym);
    }

    public int getRank(Symbol sym) {
        Integer ret = ranks.get(sym);
        if (ret == null)
            throw new IllegalArgumentException("Unranked symbol " + sym);
        return ret;
    }

    public String getName(Symbol sym) {
        String ret = names.get(sym);
        if (ret == null)
            throw new IllegalArgumentException("Unknown symbol " + sym);
        return ret;
    }

    /* Negative if a was declared before b, positive if after, zero if they
     * are the same symbol. */
    public int compare(Symbol a, Symbol b) {
        if (a.getKind() != b.getKind())
            throw new IllegalArgumentException("Cannot compare ranks of " +
                a + " and " + b);
        return Integer.compare(getRank(a), getRank(b));
    }

}
