package net.tablegen.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.tablegen.api.Conflict;

/* Insertion-ordered, duplicate-free record of conflicts. Entries are never
 * removed. */
public class ConflictLog {

    private final Set<Conflict> entries;

    public ConflictLog() {
        entries = new LinkedHashSet<Conflict>();
    }

    public String toString() {
        return String.format("%s@%h%s", getClass().getName(), this,
                             entries);
    }

    /* Returns whether the conflict was not present before. */
    public boolean append(Conflict c) {
        if (c == null)
            throw new NullPointerException("Conflict may not be null");
        return entries.add(c);
    }
    public boolean append(String description) {
        return append(new Conflict(description));
    }

    public boolean contains(Conflict c) {
        return entries.contains(c);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Conflict> getEntries() {
        return Collections.unmodifiableList(
            new ArrayList<Conflict>(entries));
    }

}
