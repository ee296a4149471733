package net.tablegen.grammar;

import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;
import net.tablegen.api.InvalidGrammarException;
import net.tablegen.api.Symbol;
import net.tablegen.api.Utilities;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/* Reads grammars from JSON documents of the form
 *
 *   {"rules": [{"name": "expr", "rule": RULE}, ...],
 *    "tokens": [{"name": "number", "rule": RULE}, ...],
 *    "names": {"expr": "expression", ...}}
 *
 * where RULE is an object with a "type" of SEQ or CHOICE (with a "members"
 * array), SYMBOL (with a "name"), or PATTERN or STRING (with a "value").
 * Declaration order is the order of the arrays. "names" is optional; symbols
 * not mentioned there are displayed under their own names. */
public final class GrammarReader {

    /* Prevent (unintended) construction */
    private GrammarReader() {}

    public static GrammarSet read(Reader input)
            throws InvalidGrammarException {
        JSONObject doc;
        try {
            Object value = new JSONTokener(input).nextValue();
            if (! (value instanceof JSONObject))
                throw new InvalidGrammarException(
                    "Grammar document must be a JSON object");
            doc = (JSONObject) value;
        } catch (JSONException exc) {
            throw new InvalidGrammarException("Malformed grammar document",
                                              exc);
        }
        return read(doc);
    }

    public static GrammarSet read(JSONObject doc)
            throws InvalidGrammarException {
        try {
            PreparedGrammar syntax = new PreparedGrammar(
                readRules(doc.getJSONArray("rules"), "rule"));
            LexicalGrammar lexical = new LexicalGrammar(
                readRules(doc.optJSONArray("tokens"), "token"));
            lexical.validate();
            Map<Symbol, String> names = defaultNames(syntax, lexical);
            JSONObject overrides = doc.optJSONObject("names");
            if (overrides != null) {
                for (String key : overrides.keySet()) {
                    String display = overrides.getString(key);
                    if (! Utilities.nonempty(display))
                        throw new InvalidGrammarException(
                            "Empty display name for " + key);
                    Symbol sym = key.equals(Symbol.END_OF_INPUT.getName()) ?
                        Symbol.END_OF_INPUT : lexical.resolveReference(key);
                    if (! names.containsKey(sym) &&
                            ! sym.equals(Symbol.END_OF_INPUT))
                        throw new InvalidGrammarException("Display name " +
                            "given for unknown symbol " + key);
                    names.put(sym, display);
                }
            }
            return new GrammarSet(syntax, lexical, names);
        } catch (JSONException exc) {
            throw new InvalidGrammarException("Malformed grammar document",
                                              exc);
        }
    }

    /* Map every declared or referenced symbol to its own name. */
    public static Map<Symbol, String> defaultNames(PreparedGrammar syntax,
                                                   LexicalGrammar lexical) {
        Map<Symbol, String> ret = new LinkedHashMap<Symbol, String>();
        for (String name : syntax.getRuleNames()) {
            ret.put(Symbol.nonterminal(name), name);
        }
        for (String name : lexical.getRuleNames()) {
            ret.put(Symbol.terminal(name), name);
        }
        for (String name : syntax.getReferencedNames()) {
            Symbol sym = lexical.resolveReference(name);
            if (! ret.containsKey(sym)) ret.put(sym, name);
        }
        return ret;
    }

    private static List<NamedRule> readRules(JSONArray source, String what)
            throws InvalidGrammarException {
        List<NamedRule> ret = new ArrayList<NamedRule>();
        if (source == null) return ret;
        List<String> seen = new ArrayList<String>();
        for (int i = 0; i < source.length(); i++) {
            JSONObject entry = source.getJSONObject(i);
            String name = entry.getString("name");
            if (! Utilities.nonempty(name))
                throw new InvalidGrammarException("Empty " + what + " name");
            if (seen.contains(name))
                throw new InvalidGrammarException("Duplicate " + what +
                    " " + name);
            seen.add(name);
            ret.add(new NamedRule(name,
                readRule(entry.getJSONObject("rule"))));
        }
        return ret;
    }

    public static Rule readRule(JSONObject source)
            throws InvalidGrammarException {
        String type = source.getString("type");
        if (type.equals("SEQ") || type.equals("CHOICE")) {
            JSONArray src = source.getJSONArray("members");
            List<Rule> members = new ArrayList<Rule>();
            for (int i = 0; i < src.length(); i++) {
                members.add(readRule(src.getJSONObject(i)));
            }
            return type.equals("SEQ") ? new Sequence(members) :
                new Choice(members);
        } else if (type.equals("SYMBOL")) {
            return new SymbolReference(source.getString("name"));
        } else if (type.equals("PATTERN")) {
            try {
                return new PatternRule(source.getString("value"));
            } catch (PatternSyntaxException exc) {
                throw new InvalidGrammarException("Invalid pattern " +
                    source.getString("value"), exc);
            }
        } else if (type.equals("STRING")) {
            return new StringRule(source.getString("value"));
        } else {
            throw new InvalidGrammarException("Unrecognized rule type " +
                type);
        }
    }

}
