package org.ippcode.compiler;

import com.typesafe.config.Config;

/**
 * Settings of the translator, read from the {@code ippcode} block of the configuration.
 *
 * @param language The language name, e.g. {@code IPPcode23}. The header line is this name prefixed with a dot.
 * @param caseSensitiveHeader Whether the header must match exactly, including case.
 */
public record CompilerOptions(String language, boolean caseSensitiveHeader) {

    /** The language translated when nothing else is configured. */
    public static final String DEFAULT_LANGUAGE = "IPPcode23";

    /**
     * @return The built-in defaults: IPPcode23 with a case-sensitive header.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(DEFAULT_LANGUAGE, true);
    }

    /**
     * Reads the options from a resolved configuration.
     * @param config The application configuration.
     * @return The options; missing keys fall back to the defaults.
     */
    public static CompilerOptions fromConfig(Config config) {
        String language = config.hasPath("ippcode.language")
                ? config.getString("ippcode.language")
                : DEFAULT_LANGUAGE;
        boolean caseSensitive = !config.hasPath("ippcode.header.case-sensitive")
                || config.getBoolean("ippcode.header.case-sensitive");
        return new CompilerOptions(language, caseSensitive);
    }

    /**
     * @return The header line the source has to start with.
     */
    public String headerToken() {
        return "." + language;
    }
}
