package net.tablegen.grammar;

public class NamedRule {

    private final String name;
    private final Rule rule;

    public NamedRule(String name, Rule rule) {
        if (name == null)
            throw new NullPointerException(
                "NamedRule name may not be null");
        if (rule == null)
            throw new NullPointerException(
                "NamedRule rule may not be null");
        this.name = name;
        this.rule = rule;
    }

    public String toString() {
        return String.format("%s@%h[name=%s,rule=%s]",
            getClass().getName(), this, getName(), getRule());
    }

    public boolean equals(Object other) {
        if (! (other instanceof NamedRule)) return false;
        NamedRule no = (NamedRule) other;
        return (getName().equals(no.getName()) &&
                getRule().equals(no.getRule()));
    }

    public int hashCode() {
        return getName().hashCode() ^ getRule().hashCode();
    }

    public String getName() {
        return name;
    }

    public Rule getRule() {
        return rule;
    }

}
