package net.tablegen.api;

import org.json.JSONObject;

/**
 * Miscellaneous utility methods.
 */
public final class Utilities {

    /* Prevent (unintended) construction */
    private Utilities() {}

    /**
     * Convenience function for creating a JSONObject.
     * params is a sequence of alternating keys and values; keys must be
     * strings.
     */
    public static JSONObject createJSONObject(Object... params) {
        if (params.length % 2 == 1)
            throw new IllegalArgumentException("Invalid parameter amount " +
                "for createJSONObject()");
        JSONObject ret = new JSONObject();
        for (int i = 0; i < params.length; i += 2) {
            if (! (params[i] instanceof String))
                throw new IllegalArgumentException("Invalid parameter " +
                    "type for createJSONObject()");
            ret.put((String) params[i], params[i + 1]);
        }
        return ret;
    }

    /**
     * Return whether the given string is not null and nonempty.
     */
    public static boolean nonempty(String s) {
        return (s != null && ! s.isEmpty());
    }

    /**
     * Return whether the string represents an affirmative value.
     * Intended to be more lenient than Boolean.parseBoolean(); accepts
     * inputs such as "1", "y", "yes", "on" (ignoring case) as true.
     */
    public static boolean isTrue(String s) {
        if (s == null) return false;
        return (Boolean.parseBoolean(s) || s.equalsIgnoreCase("1") ||
            s.equalsIgnoreCase("y") || s.equalsIgnoreCase("yes") ||
            s.equalsIgnoreCase("on"));
    }

}
