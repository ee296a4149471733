package net.tablegen.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public abstract class CompositeRule extends Rule {

    private final List<Rule> members;

    public CompositeRule(List<Rule> members) {
        if (members == null)
            throw new NullPointerException(
                "Rule members may not be null");
        if (members.contains(null))
            throw new NullPointerException(
                "Rule members may not contain null");
        this.members = Collections.unmodifiableList(
            new ArrayList<Rule>(members));
    }

    protected abstract String getSeparator();

    protected String toStringBase() {
        StringBuilder sb = new StringBuilder("(");
        boolean first = true;
        for (Rule r : members) {
            if (first) {
                first = false;
            } else {
                sb.append(getSeparator());
            }
            sb.append(r);
        }
        return sb.append(')').toString();
    }

    protected boolean matches(Rule other) {
        return (other.getClass() == getClass() &&
                members.equals(((CompositeRule) other).getMembers()));
    }

    protected int hashCodeBase() {
        return getClass().hashCode() ^ members.hashCode();
    }

    public List<Rule> getMembers() {
        return members;
    }

    public void collectReferences(Collection<String> drain) {
        for (Rule r : members) r.collectReferences(drain);
    }

}
