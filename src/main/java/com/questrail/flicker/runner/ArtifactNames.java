package com.questrail.flicker.runner;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic naming of trace artifacts.
 *
 * <pre>
 *   {testName}_{repetition}                full-run trace
 *   {testName}_{repetition}_{tag}          tag snapshot
 * </pre>
 *
 * The monitor's file suffix is appended to either base name. Test names, tags
 * and suffixes must be usable as a single path component.
 */
public final class ArtifactNames
{
    private static final Pattern NAME_COMPONENT = Pattern.compile("[A-Za-z0-9._-]+");

    private ArtifactNames() {
    }

    public static String runArtifact(String testName, int iteration) {
        return requireComponent(testName, "testName") + "_" + iteration;
    }

    public static String tagArtifact(String testName, int iteration, String tag) {
        return runArtifact(testName, iteration) + "_" + validateTag(tag);
    }

    /**
     * @return {@code tag}, unchanged
     * @throws IllegalArgumentException if {@code tag} cannot be used in a file name
     */
    public static String validateTag(String tag) {
        return requireComponent(tag, "tag");
    }

    /**
     * @return {@code testName}, unchanged
     * @throws IllegalArgumentException if {@code testName} cannot be used in a file name
     */
    public static String validateTestName(String testName) {
        return requireComponent(testName, "testName");
    }

    public static boolean isValidComponent(String value) {
        return value != null
            && NAME_COMPONENT.matcher(value).matches()
            && !".".equals(value)
            && !"..".equals(value);
    }

    /**
     * A suffix may be empty; otherwise it follows the component rules.
     */
    public static boolean isValidSuffix(String suffix) {
        return suffix != null && (suffix.isEmpty() || isValidComponent(suffix));
    }

    static String requireComponent(String value, String fieldName) {
        Objects.requireNonNull(value, fieldName);
        if (!isValidComponent(value)) {
            throw new IllegalArgumentException(
                fieldName + " '" + value + "' cannot be used as a file name; expected " + NAME_COMPONENT.pattern()
            );
        }
        return value;
    }
}
