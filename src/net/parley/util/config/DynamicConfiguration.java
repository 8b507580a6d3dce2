package net.parley.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.parley.util.Util;

public class DynamicConfiguration implements Configuration {

    private static final Logger LOGGER = Logger.getLogger("Config");

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(key.toUpperCase().replace(".", "_"));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> overrides;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        overrides = new LinkedHashMap<String, String>();
    }

    public synchronized String get(String key) {
        if (overrides.containsKey(key)) return overrides.get(key);
        for (Configuration src : sources) {
            String ret = src.get(key);
            if (ret != null) return ret;
        }
        return null;
    }

    public String get(String key, String def) {
        String ret = get(key);
        return (ret == null) ? def : ret;
    }

    public int getInt(String key, int def) {
        String raw = get(key);
        if (raw == null) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException exc) {
            LOGGER.warning("Ignoring non-integer value " + raw + " for " +
                key);
            return def;
        }
    }

    public long getLong(String key, long def) {
        String raw = get(key);
        if (raw == null) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException exc) {
            LOGGER.warning("Ignoring non-integer value " + raw + " for " +
                key);
            return def;
        }
    }

    public boolean getBoolean(String key) {
        return Util.isTrue(get(key));
    }

    public synchronized void put(String key, String value) {
        overrides.put(key, value);
    }

    public synchronized void remove(String key) {
        overrides.remove(key);
    }

    /**
     * Sources added later are consulted after earlier ones.
     */
    public synchronized void addSource(Configuration source) {
        sources.add(source);
    }
    public synchronized void removeSource(Configuration source) {
        sources.remove(source);
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
