package net.parley.util;

import java.util.regex.Pattern;
import org.json.JSONObject;

public final class Util {

    private static final Pattern TRUE_RE =
        Pattern.compile("(?i)true|yes|y|on|1");

    private Util() {}

    public static boolean nonempty(String input) {
        return (input != null && ! input.isEmpty());
    }

    public static boolean isTrue(String input) {
        return (input != null && TRUE_RE.matcher(input.trim()).matches());
    }

    /**
     * Build a JSONObject from alternating keys and values.
     * Null values are left out.
     */
    public static JSONObject createJSONObject(Object... params) {
        if (params.length % 2 != 0)
            throw new IllegalArgumentException("Odd number of arguments");
        JSONObject ret = new JSONObject();
        for (int i = 0; i < params.length; i += 2) {
            if (params[i + 1] == null) continue;
            ret.put((String) params[i], params[i + 1]);
        }
        return ret;
    }

}
