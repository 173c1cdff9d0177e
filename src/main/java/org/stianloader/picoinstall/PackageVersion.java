package org.stianloader.picoinstall;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A resolved, concrete name and version pair, such as {@code @std/path@1.0.2} or {@code lodash@4.17.21}.
 *
 * <p>The version is kept as the text the registry reported. Comparing or ordering versions is the
 * business of the dependency resolver and is not done here.
 */
public final record PackageVersion(@NotNull String name, @NotNull String version) {

    public PackageVersion {
        Objects.requireNonNull(name, "name may not be null");
        Objects.requireNonNull(version, "version may not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Package names may not be empty");
        }
    }

    /**
     * Parses a {@code name@version} string. Scoped names keep their leading {@code @}.
     *
     * @param text The text to parse
     * @return The parsed name and version
     * @throws IllegalArgumentException If no version separator could be found
     */
    @NotNull
    @Contract(pure = true)
    public static PackageVersion parse(@NotNull String text) {
        int separator = PackageVersion.versionSeparator(text);
        if (separator == -1) {
            throw new IllegalArgumentException("\"" + text + "\" is not of the form name@version");
        }
        return new PackageVersion(text.substring(0, separator), text.substring(separator + 1));
    }

    /**
     * Obtains the index of the '@' that separates the name from the version, skipping the
     * leading '@' of scoped package names.
     *
     * @param text The text to search in
     * @return The index of the separator, or -1 if there is none
     */
    @Contract(pure = true)
    public static int versionSeparator(@NotNull String text) {
        if (text.length() < 2) {
            return -1;
        }
        int separator = text.indexOf('@', 1);
        if (separator == text.length() - 1) {
            return -1;
        }
        return separator;
    }

    @Override
    @NotNull
    public String toString() {
        return this.name + '@' + this.version;
    }
}
