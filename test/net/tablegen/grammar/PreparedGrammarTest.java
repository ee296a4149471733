package net.tablegen.grammar;

import static net.tablegen.grammar.Rules.choice;
import static net.tablegen.grammar.Rules.pattern;
import static net.tablegen.grammar.Rules.rule;
import static net.tablegen.grammar.Rules.seq;
import static net.tablegen.grammar.Rules.str;
import static net.tablegen.grammar.Rules.sym;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import net.tablegen.api.Symbol;
import org.junit.Test;

public class PreparedGrammarTest {

    @Test
    public void collectsReferencesLeftToRight() {
        PreparedGrammar g = new PreparedGrammar(
            rule("a", seq(sym("b"), choice(sym("c"), sym("b")), sym("d"))),
            rule("b", sym("e")));
        assertEquals(new LinkedHashSet<String>(
                         Arrays.asList("b", "c", "d", "e")),
                     g.getReferencedNames());
    }

    @Test
    public void looksUpRules() {
        PreparedGrammar g = new PreparedGrammar(rule("a", sym("b")));
        assertTrue(g.hasRule("a"));
        assertFalse(g.hasRule("b"));
        assertEquals(sym("b"), g.getRule("a"));
        assertNull(g.getRule("b"));
        assertEquals(0, g.indexOf("a"));
        assertEquals(1, g.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsDuplicateNames() {
        new PreparedGrammar(rule("a", sym("b")), rule("a", sym("c")));
    }

    @Test
    public void rulesCompareByValue() {
        assertEquals(seq(sym("a"), str("x")), seq(sym("a"), str("x")));
        assertFalse(seq(sym("a")).equals(choice(sym("a"))));
        assertEquals(pattern("[a-c]"), pattern("[a-c]"));
        assertEquals(pattern("[a-c]").hashCode(),
                     pattern("[a-c]").hashCode());
        assertEquals("(a | (\"x\" /[0-9]/))",
            choice(sym("a"), seq(str("x"), pattern("[0-9]"))).toString());
    }

    @Test
    public void resolvesReferencesAgainstTokens() {
        LexicalGrammar lex = new LexicalGrammar(rule("num",
                                                     pattern("[0-9]+")));
        assertEquals(Symbol.terminal("num"), lex.resolveReference("num"));
        assertEquals(Symbol.nonterminal("expr"),
                     lex.resolveReference("expr"));
    }

    @Test
    public void listsRulesInOrder() {
        Set<String> names = new PreparedGrammar(rule("z", sym("a")),
            rule("a", sym("z"))).getRuleNames();
        assertEquals(Arrays.asList("z", "a"),
                     Arrays.asList(names.toArray()));
    }

}
