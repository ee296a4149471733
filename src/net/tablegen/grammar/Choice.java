package net.tablegen.grammar;

import java.util.List;

public class Choice extends CompositeRule {

    public Choice(List<Rule> members) {
        super(members);
    }

    protected String getSeparator() {
        return " | ";
    }

}
