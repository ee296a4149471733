package net.tablegen.grammar;

public class StringRule extends Rule {

    private final String content;

    public StringRule(String content) {
        if (content == null)
            throw new NullPointerException(
                "StringRule content may not be null");
        this.content = content;
    }

    protected String toStringBase() {
        return '"' + content.replace("\\", "\\\\").replace("\"", "\\\"") +
            '"';
    }

    protected boolean matches(Rule other) {
        return ((other instanceof StringRule) &&
                content.equals(((StringRule) other).getContent()));
    }

    protected int hashCodeBase() {
        return content.hashCode();
    }

    public String getContent() {
        return content;
    }

}
