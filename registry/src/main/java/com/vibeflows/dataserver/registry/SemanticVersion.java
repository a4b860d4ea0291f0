package com.vibeflows.dataserver.registry;

import java.util.regex.Pattern;

/**
 * {@code major.minor.patch} versions. Anything else, {@code "1.0"} or {@code "v1.0.0"}
 * included, is rejected.
 */
public final class SemanticVersion {
    private static final Pattern PATTERN = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private SemanticVersion() {
    }

    public static boolean isValid(String version) {
        return version != null && PATTERN.matcher(version).matches();
    }
}
