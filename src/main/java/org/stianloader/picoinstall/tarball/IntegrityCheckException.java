package org.stianloader.picoinstall.tarball;

import java.io.IOException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageVersion;

/**
 * Thrown if a downloaded tarball could not be verified against the checksum the registry advertised.
 * Neither kind of failure is worth retrying: the same bytes would be checked the same way again.
 */
public class IntegrityCheckException extends IOException {

    private static final long serialVersionUID = 5326734112389404186L;

    public static enum Reason {
        /**
         * The integrity uses an algorithm or encoding that is not supported.
         */
        NOT_IMPLEMENTED,
        /**
         * The checksum of the tarball does not match the advertised one.
         */
        MISMATCHED_CHECKSUM;
    }

    @NotNull
    private final PackageVersion packageVersion;
    @NotNull
    private final Reason reason;
    @Nullable
    private final String expected;
    @Nullable
    private final String actual;

    private IntegrityCheckException(@NotNull PackageVersion packageVersion, @NotNull Reason reason, @NotNull String message, @Nullable String expected, @Nullable String actual) {
        super(message);
        this.packageVersion = packageVersion;
        this.reason = reason;
        this.expected = expected;
        this.actual = actual;
    }

    @NotNull
    static IntegrityCheckException notImplemented(@NotNull PackageVersion packageVersion, @NotNull String kind) {
        return new IntegrityCheckException(packageVersion, Reason.NOT_IMPLEMENTED,
                "Not implemented integrity kind for " + packageVersion + ": " + kind, null, null);
    }

    @NotNull
    static IntegrityCheckException mismatch(@NotNull PackageVersion packageVersion, @NotNull String expected, @NotNull String actual) {
        return new IntegrityCheckException(packageVersion, Reason.MISMATCHED_CHECKSUM,
                "Tarball checksum did not match what was provided by the registry for " + packageVersion
                + ".\n\nExpected: " + expected + "\nActual: " + actual, expected, actual);
    }

    @NotNull
    @Contract(pure = true)
    public PackageVersion getPackageVersion() {
        return this.packageVersion;
    }

    @NotNull
    @Contract(pure = true)
    public Reason getReason() {
        return this.reason;
    }

    @Nullable
    @Contract(pure = true)
    public String getExpected() {
        return this.expected;
    }

    @Nullable
    @Contract(pure = true)
    public String getActual() {
        return this.actual;
    }
}
