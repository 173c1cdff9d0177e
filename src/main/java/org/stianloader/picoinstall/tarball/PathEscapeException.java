package org.stianloader.picoinstall.tarball;

import java.io.IOException;
import java.nio.file.Path;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown if a tar entry would be written outside of the folder the tarball is extracted to,
 * for example through ".." path components or a directory symlink planted by an earlier run.
 */
public class PathEscapeException extends IOException {

    private static final long serialVersionUID = -2301781337165420563L;

    @NotNull
    private final String entryPath;
    @NotNull
    private final Path outputFolder;

    public PathEscapeException(@NotNull String entryPath, @NotNull Path outputFolder) {
        super("Extracted entry \"" + entryPath + "\" would escape the output folder " + outputFolder.toAbsolutePath());
        this.entryPath = entryPath;
        this.outputFolder = outputFolder;
    }

    @NotNull
    @Contract(pure = true)
    public String getEntryPath() {
        return this.entryPath;
    }

    @NotNull
    @Contract(pure = true)
    public Path getOutputFolder() {
        return this.outputFolder;
    }
}
