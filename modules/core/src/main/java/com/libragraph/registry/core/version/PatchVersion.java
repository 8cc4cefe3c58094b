package com.libragraph.registry.core.version;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code vMAJOR.MINOR[.PATCH]} with optional leading v. A missing patch reads as 0.
 */
public record PatchVersion(int major, int minor, int patch) {

    private static final Pattern FORMAT = Pattern.compile("^v?(\\d+)\\.(\\d+)(?:\\.(\\d+))?$");

    public static Optional<PatchVersion> parse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        Matcher m = FORMAT.matcher(version.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            int patch = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
            return Optional.of(new PatchVersion(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), patch));
        } catch (NumberFormatException e) {
            // digits overflowing int
            return Optional.empty();
        }
    }

    /**
     * @return the following patch version, or empty when the patch component is already at its maximum
     */
    public Optional<PatchVersion> nextPatch() {
        try {
            return Optional.of(new PatchVersion(major, minor, Math.addExact(patch, 1)));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "v" + major + "." + minor + "." + patch;
    }
}
