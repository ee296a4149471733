package net.tablegen.grammar;

import java.util.List;

public class Sequence extends CompositeRule {

    public Sequence(List<Rule> members) {
        super(members);
    }

    protected String getSeparator() {
        return " ";
    }

}
