package org.stianloader.picoinstall;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An unresolved dependency as written in configuration files or in the "specifiers" table of
 * a lockfile, for example {@code jsr:@std/path@^1.0} or {@code npm:chalk@5}. The version requirement
 * may be a range, a tag such as "latest", or absent altogether.
 *
 * <p>Two requirements are only equal if their textual version requirements are equal. Semantic equivalence
 * of ranges is not considered.
 */
public final record PackageRequirement(@NotNull PackageKind kind, @NotNull String name, @Nullable String versionRequirement) {

    public PackageRequirement {
        Objects.requireNonNull(kind, "kind may not be null");
        Objects.requireNonNull(name, "name may not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Package names may not be empty");
        }
        if (versionRequirement != null && versionRequirement.isEmpty()) {
            versionRequirement = null;
        }
    }

    @NotNull
    @Contract(pure = true)
    public static PackageRequirement npm(@NotNull String name, @Nullable String versionRequirement) {
        return new PackageRequirement(PackageKind.NPM, name, versionRequirement);
    }

    @NotNull
    @Contract(pure = true)
    public static PackageRequirement jsr(@NotNull String name, @Nullable String versionRequirement) {
        return new PackageRequirement(PackageKind.JSR, name, versionRequirement);
    }

    /**
     * Parses a requirement of the form {@code scheme:name[@requirement]}.
     *
     * @param text The text to parse
     * @return The parsed requirement
     * @throws IllegalArgumentException If the scheme is missing or unknown, or the name is empty
     */
    @NotNull
    @Contract(pure = true)
    public static PackageRequirement parse(@NotNull String text) {
        int colon = text.indexOf(':');
        if (colon == -1) {
            throw new IllegalArgumentException("Package requirement \"" + text + "\" is missing a scheme such as \"npm:\" or \"jsr:\"");
        }
        PackageKind kind = PackageKind.fromScheme(text.substring(0, colon));
        if (kind == null) {
            throw new IllegalArgumentException("Package requirement \"" + text + "\" uses an unknown scheme");
        }
        String remainder = text.substring(colon + 1);
        int separator = remainder.indexOf('@', 1);
        if (separator == -1) {
            return new PackageRequirement(kind, remainder, null);
        }
        return new PackageRequirement(kind, remainder.substring(0, separator), remainder.substring(separator + 1));
    }

    /**
     * Obtains this requirement with the version requirement stripped, that is the requirement
     * that matches on the ecosystem and name alone.
     *
     * @return A requirement without a version requirement
     */
    @NotNull
    @Contract(pure = true)
    public PackageRequirement withoutVersionRequirement() {
        if (this.versionRequirement == null) {
            return this;
        }
        return new PackageRequirement(this.kind, this.name, null);
    }

    @Override
    @NotNull
    public String toString() {
        if (this.versionRequirement == null) {
            return this.kind.getSchemeWithColon() + this.name;
        }
        return this.kind.getSchemeWithColon() + this.name + '@' + this.versionRequirement;
    }
}
