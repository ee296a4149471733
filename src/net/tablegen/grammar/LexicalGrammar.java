package net.tablegen.grammar;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.tablegen.api.InvalidGrammarException;
import net.tablegen.api.Symbol;

/* The token definitions of a grammar. Earlier tokens take priority over
 * later ones where both match. */
public class LexicalGrammar extends PreparedGrammar {

    public LexicalGrammar() {
        super();
    }
    public LexicalGrammar(List<NamedRule> tokens) {
        super(tokens);
    }
    public LexicalGrammar(NamedRule... tokens) {
        super(tokens);
    }

    /* A reference resolves to a token if there is one of that name, and to
     * a rule otherwise. */
    public Symbol resolveReference(String name) {
        if (hasRule(name)) return Symbol.terminal(name);
        return Symbol.nonterminal(name);
    }

    public void validate() throws InvalidGrammarException {
        for (NamedRule r : getRules()) {
            Set<String> refs = new LinkedHashSet<String>();
            r.getRule().collectReferences(refs);
            if (! refs.isEmpty())
                throw new InvalidGrammarException("Token " + r.getName() +
                    " definition may only contain patterns and strings, " +
                    "got references to " + refs + " instead");
        }
    }

}
