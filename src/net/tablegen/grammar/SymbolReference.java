package net.tablegen.grammar;

import java.util.Collection;

public class SymbolReference extends Rule {

    private final String name;

    public SymbolReference(String name) {
        if (name == null)
            throw new NullPointerException(
                "SymbolReference name may not be null");
        this.name = name;
    }

    protected String toStringBase() {
        return name;
    }

    protected boolean matches(Rule other) {
        return ((other instanceof SymbolReference) &&
                name.equals(((SymbolReference) other).getName()));
    }

    protected int hashCodeBase() {
        return name.hashCode();
    }

    public String getName() {
        return name;
    }

    public void collectReferences(Collection<String> drain) {
        drain.add(name);
    }

}
