package net.tablegen.build;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.logging.Logger;
import net.tablegen.api.Conflict;
import net.tablegen.api.ConflictResolver;
import net.tablegen.api.InvalidGrammarException;
import net.tablegen.api.Utilities;
import net.tablegen.util.config.Configuration;
import org.json.JSONArray;
import org.json.JSONObject;

public class ConflictReporter {

    public static final String K_STRICT = "tablegen.conflicts.strict";
    public static final String K_QUIET = "tablegen.conflicts.quiet";

    private static final Logger LOGGER = Logger.getLogger("ConflictReporter");

    private final boolean strict;
    private final boolean quiet;

    public ConflictReporter(boolean strict, boolean quiet) {
        this.strict = strict;
        this.quiet = quiet;
    }
    public ConflictReporter(Configuration config) {
        this(Utilities.isTrue(config.get(K_STRICT)),
             Utilities.isTrue(config.get(K_QUIET)));
    }
    public ConflictReporter() {
        this(Configuration.DEFAULT);
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public int report(ConflictResolver resolver)
            throws InvalidGrammarException {
        List<Conflict> conflicts = resolver.getConflicts();
        if (! quiet) {
            for (Conflict c : conflicts) {
                LOGGER.warning("Unresolved conflict for " +
                    c.getDescription());
            }
        }
        if (conflicts.isEmpty()) {
            LOGGER.fine("No parse table conflicts");
        } else {
            LOGGER.info(conflicts.size() + " parse table conflict(s) " +
                "resolved by default");
        }
        if (strict && ! conflicts.isEmpty())
            throw new InvalidGrammarException("Grammar has " +
                conflicts.size() + " unresolved conflict(s), first: " +
                conflicts.get(0).getDescription());
        return conflicts.size();
    }

    public static JSONObject toJSON(List<Conflict> conflicts) {
        JSONArray entries = new JSONArray();
        for (Conflict c : conflicts) entries.put(c.getDescription());
        return Utilities.createJSONObject("count", conflicts.size(),
                                          "conflicts", entries);
    }

    public static void writeJSON(List<Conflict> conflicts, Writer out)
            throws IOException {
        out.write(toJSON(conflicts).toString());
        out.flush();
    }

}
