package net.tablegen.api;

/**
 * An (immutable) description of an ambiguous parse table cell.
 * Conflict-s are equal if-and-only-if their descriptions are textually
 * equal.
 */
public final class Conflict {

    private final String description;

    public Conflict(String description) {
        if (description == null)
            throw new NullPointerException(
                "Conflict description may not be null");
        this.description = description;
    }

    public String toString() {
        return description;
    }

    public boolean equals(Object other) {
        return ((other instanceof Conflict) &&
                description.equals(((Conflict) other).getDescription()));
    }

    public int hashCode() {
        return description.hashCode();
    }

    /**
     * The human-readable text of this conflict.
     */
    public String getDescription() {
        return description;
    }

}
