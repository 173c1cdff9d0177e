package org.stianloader.picoinstall;

import java.util.Locale;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The ecosystem a package is published to. npm-style packages are identified by an opaque id
 * string that may carry a peer dependency suffix, JSR-style packages by their plain name and version.
 */
public enum PackageKind {
    NPM("npm"),
    JSR("jsr");

    @NotNull
    private final String scheme;

    private PackageKind(@NotNull String scheme) {
        this.scheme = scheme;
    }

    @NotNull
    @Contract(pure = true)
    public String getScheme() {
        return this.scheme;
    }

    @NotNull
    @Contract(pure = true)
    public String getSchemeWithColon() {
        return this.scheme + ':';
    }

    @Nullable
    @Contract(pure = true)
    public static PackageKind fromScheme(@NotNull String scheme) {
        String lowerScheme = scheme.toLowerCase(Locale.ROOT);
        for (PackageKind kind : PackageKind.values()) {
            if (kind.scheme.equals(lowerScheme)) {
                return kind;
            }
        }
        return null;
    }
}
