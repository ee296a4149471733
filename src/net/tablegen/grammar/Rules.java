package net.tablegen.grammar;

import java.util.Arrays;

public final class Rules {

    /* Prevent (unintended) construction */
    private Rules() {}

    public static Sequence seq(Rule... members) {
        return new Sequence(Arrays.asList(members));
    }

    public static Choice choice(Rule... members) {
        return new Choice(Arrays.asList(members));
    }

    public static SymbolReference sym(String name) {
        return new SymbolReference(name);
    }

    public static PatternRule pattern(String regex) {
        return new PatternRule(regex);
    }

    public static StringRule str(String content) {
        return new StringRule(content);
    }

    public static NamedRule rule(String name, Rule rule) {
        return new NamedRule(name, rule);
    }

}
