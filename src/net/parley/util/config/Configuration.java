package net.parley.util.config;

/**
 * A source of string-valued settings.
 * Keys are dotted lowercase names such as "parley.port"; a null return
 * means the key is not set in this source.
 */
public interface Configuration {

    String get(String key);

}
