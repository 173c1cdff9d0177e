package org.stianloader.picoinstall.installer;

import java.nio.file.Path;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown if the lockfile was modified by another party while requirements were being resolved.
 * The resolution is not written to the lockfile; the operation may be retried.
 */
public class LockfileChangedException extends RuntimeException {

    private static final long serialVersionUID = 2417355206386307429L;

    @NotNull
    private final Path lockfile;

    public LockfileChangedException(@NotNull Path lockfile) {
        super("The lockfile " + lockfile + " changed while resolving packages");
        this.lockfile = lockfile;
    }

    @NotNull
    @Contract(pure = true)
    public Path getLockfile() {
        return this.lockfile;
    }
}
