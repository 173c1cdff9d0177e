package org.stianloader.picoinstall.lockfile;

import java.io.IOException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown if a lockfile cannot be read.
 */
public class LockfileException extends IOException {

    private static final long serialVersionUID = -4426071830512299771L;

    public static enum Reason {
        EMPTY,
        PARSE_ERROR,
        UNSUPPORTED_VERSION,
        INVALID_PACKAGE_ID,
        INVALID_NPM_DEPENDENCY,
        INVALID_JSR_DEPENDENCY,
        INVALID_REQUIREMENT,
        MIGRATION_FAILED;
    }

    @NotNull
    private final Reason reason;
    @Nullable
    private String filePath;

    public LockfileException(@NotNull Reason reason, @NotNull String message) {
        super(message);
        this.reason = reason;
    }

    public LockfileException(@NotNull Reason reason, @NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    @NotNull
    @Contract(pure = true)
    public Reason getReason() {
        return this.reason;
    }

    @Nullable
    @Contract(pure = true)
    public String getFilePath() {
        return this.filePath;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    LockfileException setFilePath(@Nullable String filePath) {
        this.filePath = filePath;
        return this;
    }

    @Override
    public String getMessage() {
        if (this.filePath == null) {
            return super.getMessage();
        }
        return "Unable to read lockfile " + this.filePath + ": " + super.getMessage();
    }
}
