package net.tablegen.grammar;

import java.util.regex.Pattern;

public class PatternRule extends Rule {

    private final Pattern pattern;

    public PatternRule(Pattern pattern) {
        if (pattern == null)
            throw new NullPointerException(
                "PatternRule pattern may not be null");
        this.pattern = pattern;
    }
    public PatternRule(String regex) {
        this(Pattern.compile(regex));
    }

    protected String toStringBase() {
        return "/" + pattern.pattern() + "/";
    }

    protected boolean matches(Rule other) {
        return ((other instanceof PatternRule) &&
                patternsEqual(pattern, ((PatternRule) other).getPattern()));
    }

    protected int hashCodeBase() {
        return pattern.pattern().hashCode() ^ pattern.flags();
    }

    public Pattern getPattern() {
        return pattern;
    }

    public static boolean patternsEqual(Pattern a, Pattern b) {
        // HACK: Assuming the Pattern API does not change in incompatible
        //       ways...
        if (a == null) return (b == null);
        if (b == null) return (a == null);
        return (a.pattern().equals(b.pattern()) &&
                a.flags() == b.flags());
    }

}
