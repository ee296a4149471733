package net.tablegen.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import net.tablegen.api.Symbol;

/* The syntactic and lexical grammars of a language along with the display
 * names of their symbols. */
public class GrammarSet {

    private final PreparedGrammar syntax;
    private final LexicalGrammar lexical;
    private final Map<Symbol, String> names;

    public GrammarSet(PreparedGrammar syntax, LexicalGrammar lexical,
                      Map<Symbol, String> names) {
        if (syntax == null)
            throw new NullPointerException(
                "GrammarSet syntax may not be null");
        if (lexical == null)
            throw new NullPointerException(
                "GrammarSet lexical grammar may not be null");
        if (names == null)
            throw new NullPointerException(
                "GrammarSet names may not be null");
        this.syntax = syntax;
        this.lexical = lexical;
        this.names = Collections.unmodifiableMap(
            new LinkedHashMap<Symbol, String>(names));
    }

    public PreparedGrammar getSyntax() {
        return syntax;
    }

    public LexicalGrammar getLexical() {
        return lexical;
    }

    public Map<Symbol, String> getNames() {
        return names;
    }

}
