package org.splc.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.regex.Pattern;

/**
 * Immutable settings of one compiler instance, read from the {@code splc.compiler} block.
 *
 * @param start First address assigned by the linearizer.
 * @param step Address increment of the linearizer.
 * @param strictLabels Whether an unresolved jump target fails the compilation.
 * @param freshParameterPrefix Prefix of the fresh names given to inlined parameters.
 * @param freshLocalPrefix Prefix of the fresh names given to inlined locals.
 */
public record CompilerConfig(
        int start,
        int step,
        boolean strictLabels,
        String freshParameterPrefix,
        String freshLocalPrefix
) {
    public static final String ROOT_PATH = "splc.compiler";
    static final String START_KEY = ROOT_PATH + ".linearizer.start";
    static final String STEP_KEY = ROOT_PATH + ".linearizer.step";
    static final String STRICT_LABELS_KEY = ROOT_PATH + ".linker.strict-labels";
    static final String PARAMETER_PREFIX_KEY = ROOT_PATH + ".inliner.fresh-parameter-prefix";
    static final String LOCAL_PREFIX_KEY = ROOT_PATH + ".inliner.fresh-local-prefix";

    // SPL identifiers are lower case, so an upper-case first letter keeps generated names apart
    private static final Pattern PREFIX = Pattern.compile("[A-Z][A-Za-z]*");

    public CompilerConfig {
        if (start < 0) {
            throw new IllegalArgumentException(START_KEY + " must be >= 0, got " + start);
        }
        if (step <= 0) {
            throw new IllegalArgumentException(STEP_KEY + " must be > 0, got " + step);
        }
        requirePrefix(PARAMETER_PREFIX_KEY, freshParameterPrefix);
        requirePrefix(LOCAL_PREFIX_KEY, freshLocalPrefix);
    }

    /**
     * Reads the settings from a resolved configuration that contains the {@code splc.compiler} block.
     * @param config The configuration, usually from {@link ConfigLoader}.
     * @return The validated settings.
     */
    public static CompilerConfig fromConfig(Config config) {
        return new CompilerConfig(
                config.getInt(START_KEY),
                config.getInt(STEP_KEY),
                config.getBoolean(STRICT_LABELS_KEY),
                config.getString(PARAMETER_PREFIX_KEY),
                config.getString(LOCAL_PREFIX_KEY)
        );
    }

    /**
     * @return The settings shipped in {@code reference.conf}.
     */
    public static CompilerConfig defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * @return A copy with different linearizer addressing.
     */
    public CompilerConfig withAddressing(int newStart, int newStep) {
        return new CompilerConfig(newStart, newStep, strictLabels, freshParameterPrefix, freshLocalPrefix);
    }

    private static void requirePrefix(String key, String value) {
        if (value == null || !PREFIX.matcher(value).matches()) {
            throw new IllegalArgumentException(key + " must start with an upper-case letter and contain only letters, got '" + value + "'");
        }
    }
}
