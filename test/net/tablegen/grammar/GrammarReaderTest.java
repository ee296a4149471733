package net.tablegen.grammar;

import static net.tablegen.grammar.Rules.choice;
import static net.tablegen.grammar.Rules.seq;
import static net.tablegen.grammar.Rules.str;
import static net.tablegen.grammar.Rules.sym;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.Arrays;
import net.tablegen.api.InvalidGrammarException;
import net.tablegen.api.LexAction;
import net.tablegen.api.ParseAction;
import net.tablegen.api.Symbol;
import net.tablegen.build.ConflictManager;
import org.junit.Before;
import org.junit.Test;

public class GrammarReaderTest {

    private GrammarSet grammars;

    @Before
    public void setUp() throws Exception {
        Reader input = new InputStreamReader(
            GrammarReaderTest.class.getResourceAsStream("arithmetic.json"),
            "UTF-8");
        try {
            grammars = GrammarReader.read(input);
        } finally {
            input.close();
        }
    }

    @Test
    public void preservesDeclarationOrder() {
        assertEquals(Arrays.asList("expression", "term"),
            Arrays.asList(grammars.getSyntax().getRuleNames().toArray()));
        assertEquals(2, grammars.getLexical().indexOf("identifier"));
        assertEquals(-1, grammars.getLexical().indexOf("expression"));
    }

    @Test
    public void readsRuleTrees() {
        assertEquals(choice(seq(sym("expression"), sym("plus"),
                                sym("expression")),
                            sym("term")),
                     grammars.getSyntax().getRule("expression"));
        assertEquals(str("let"), grammars.getLexical().getRule("keyword"));
    }

    @Test
    public void resolvesNames() {
        assertEquals("'+'", grammars.getNames().get(Symbol.terminal("plus")));
        assertEquals("number",
                     grammars.getNames().get(Symbol.terminal("number")));
        assertEquals("term",
                     grammars.getNames().get(Symbol.nonterminal("term")));
        assertEquals("end of input",
                     grammars.getNames().get(Symbol.END_OF_INPUT));
    }

    @Test
    public void buildsConflictManager() throws Exception {
        ConflictManager manager = new ConflictManager(grammars);
        assertTrue(manager.resolveLexAction(
            LexAction.accept(Symbol.terminal("identifier")),
            LexAction.accept(Symbol.terminal("keyword"))));
        Symbol expression = Symbol.nonterminal("expression");
        assertTrue(manager.resolveParseAction(Symbol.terminal("plus"),
            ParseAction.reduce(expression, 3, 1),
            ParseAction.shift(4, 1)));
        manager.resolveParseAction(Symbol.END_OF_INPUT,
            ParseAction.reduce(Symbol.nonterminal("term"), 1, 0),
            ParseAction.reduce(expression, 1, 0));
        assertEquals(Arrays.asList(
            "'+': shift (precedence 1) / reduce expression (precedence 1)",
            "end of input: reduce expression (precedence 0) / " +
                "reduce term (precedence 0)"),
            Arrays.asList(manager.getConflicts().get(0).getDescription(),
                          manager.getConflicts().get(1).getDescription()));
    }

    @Test(expected = InvalidGrammarException.class)
    public void rejectsMalformedJSON() throws Exception {
        GrammarReader.read(new StringReader("{\"rules\": ["));
    }

    @Test(expected = InvalidGrammarException.class)
    public void rejectsNonObjects() throws Exception {
        GrammarReader.read(new StringReader("[]"));
    }

    @Test(expected = InvalidGrammarException.class)
    public void rejectsUnknownRuleTypes() throws Exception {
        GrammarReader.read(new StringReader("{\"rules\": [{\"name\": " +
            "\"a\", \"rule\": {\"type\": \"REPEAT\"}}]}"));
    }

    @Test(expected = InvalidGrammarException.class)
    public void rejectsDuplicateRules() throws Exception {
        GrammarReader.read(new StringReader("{\"rules\": [" +
            "{\"name\": \"a\", \"rule\": {\"type\": \"SYMBOL\", " +
            "\"name\": \"b\"}}, {\"name\": \"a\", \"rule\": " +
            "{\"type\": \"SYMBOL\", \"name\": \"c\"}}]}"));
    }

    @Test(expected = InvalidGrammarException.class)
    public void rejectsReferencesInTokens() throws Exception {
        GrammarReader.read(new StringReader("{\"rules\": [], " +
            "\"tokens\": [{\"name\": \"t\", \"rule\": {\"type\": " +
            "\"SYMBOL\", \"name\": \"u\"}}]}"));
    }

    @Test(expected = InvalidGrammarException.class)
    public void rejectsNamesForUnknownSymbols() throws Exception {
        GrammarReader.read(new StringReader("{\"rules\": [], " +
            "\"names\": {\"ghost\": \"boo\"}}"));
    }

    @Test(expected = InvalidGrammarException.class)
    public void rejectsInvalidPatterns() throws Exception {
        GrammarReader.read(new StringReader("{\"rules\": [], " +
            "\"tokens\": [{\"name\": \"t\", \"rule\": {\"type\": " +
            "\"PATTERN\", \"value\": \"[a-\"}}]}"));
    }

}
