package net.tablegen.grammar;

import java.util.Collection;

public abstract class Rule {

    public String toString() {
        return toStringBase();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Rule)) return false;
        Rule ro = (Rule) other;
        return (matches(ro) && ro.matches(this));
    }

    public int hashCode() {
        return hashCodeBase();
    }

    protected abstract String toStringBase();

    protected abstract boolean matches(Rule other);

    protected abstract int hashCodeBase();

    /* Add the names of all symbols referenced by this rule to drain, in
     * left-to-right order. */
    public void collectReferences(Collection<String> drain) {}

}
