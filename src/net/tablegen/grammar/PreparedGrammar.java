package net.tablegen.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/* An ordered collection of uniquely named rules. The order of the rules is
 * their declaration order, which conflict resolution relies upon. */
public class PreparedGrammar {

    private final Map<String, NamedRule> rules;

    public PreparedGrammar() {
        rules = new LinkedHashMap<String, NamedRule>();
    }
    public PreparedGrammar(List<NamedRule> rules) {
        this();
        for (NamedRule r : rules) addRule(r);
    }
    public PreparedGrammar(NamedRule... rules) {
        this(Arrays.asList(rules));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getName());
        sb.append('@');
        sb.append(Integer.toHexString(hashCode()));
        sb.append('[');
        boolean first = true;
        for (NamedRule r : rules.values()) {
            if (first) {
                first = false;
            } else {
                sb.append(',');
            }
            sb.append(r.getName()).append('=').append(r.getRule());
        }
        sb.append(']');
        return sb.toString();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    public List<NamedRule> getRules() {
        return Collections.unmodifiableList(
            new ArrayList<NamedRule>(rules.values()));
    }

    public Set<String> getRuleNames() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public boolean hasRule(String name) {
        return rules.containsKey(name);
    }

    public Rule getRule(String name) {
        NamedRule ret = rules.get(name);
        return (ret == null) ? null : ret.getRule();
    }

    /* Return the declaration index of the given rule, or -1 if there is
     * none. */
    public int indexOf(String name) {
        int i = 0;
        for (String n : rules.keySet()) {
            if (n.equals(name)) return i;
            i++;
        }
        return -1;
    }

    public Set<String> getReferencedNames() {
        Set<String> ret = new LinkedHashSet<String>();
        for (NamedRule r : rules.values()) {
            r.getRule().collectReferences(ret);
        }
        return ret;
    }

    public void addRule(NamedRule rule) {
        if (rules.containsKey(rule.getName()))
            throw new IllegalArgumentException("Duplicate rule " +
                rule.getName());
        rules.put(rule.getName(), rule);
    }
    public void addRule(String name, Rule rule) {
        addRule(new NamedRule(name, rule));
    }

}
