package org.stianloader.picoinstall.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.internal.FileUtil;

/**
 * Guards a single package folder while it is being populated.
 *
 * <p>A sentinel file is placed within the folder for as long as it is being written to. Should
 * the process die while the sentinel exists, the next reader will find the sentinel and treat the folder
 * as incomplete - that is, as if it did not exist at all. Once the folder was populated successfully
 * the sentinel is removed and the folder is considered immutable from there on.
 */
public final class FolderSyncLock {

    /**
     * Name of the sentinel file marking a package folder that is still being written to.
     */
    @NotNull
    public static final String SENTINEL_NAME = ".picoinstall_sync_lock";

    @FunctionalInterface
    public static interface FolderAction {
        void run() throws IOException;
    }

    private FolderSyncLock() {
        throw new UnsupportedOperationException();
    }

    /**
     * Checks whether the folder exists and is not marked as incomplete.
     *
     * @param folder The package folder
     * @return True if the folder may be used as-is
     */
    @Contract(pure = true)
    public static boolean isComplete(@NotNull Path folder) {
        return Files.isDirectory(folder) && !Files.exists(folder.resolve(FolderSyncLock.SENTINEL_NAME));
    }

    /**
     * Creates the output folder and runs the action while the sentinel marks the folder as incomplete.
     * On success the sentinel is removed. If the sentinel cannot be created or the action fails, the whole
     * output folder is removed and the original exception is rethrown.
     *
     * @param packageVersion The package the folder belongs to, for error reporting
     * @param outputFolder The package folder to populate
     * @param action The action populating the folder
     * @throws IOException If the action failed, or if the folder could not be set up or cleaned up
     */
    public static void withFolderLock(@NotNull PackageVersion packageVersion, @NotNull Path outputFolder, @NotNull FolderAction action) throws IOException {
        Files.createDirectories(outputFolder);
        Path sentinel = outputFolder.resolve(FolderSyncLock.SENTINEL_NAME);
        try {
            // A leftover sentinel of a crashed process is kept, so the folder stays incomplete until the action succeeds
            Files.newOutputStream(sentinel, StandardOpenOption.CREATE, StandardOpenOption.WRITE).close();
            action.run();
        } catch (IOException | RuntimeException e) {
            FolderSyncLock.removeIncomplete(packageVersion, outputFolder, e);
            throw e;
        }
        Files.deleteIfExists(sentinel);
    }

    private static void removeIncomplete(@NotNull PackageVersion packageVersion, @NotNull Path outputFolder, @NotNull Exception cause) throws IOException {
        try {
            FileUtil.deleteRecursively(outputFolder);
        } catch (IOException removalFailure) {
            if (Files.notExists(outputFolder)) {
                return;
            }
            IOException escalated = new IOException("Failed setting up package cache directory for " + packageVersion
                    + ", then failed cleaning it up.\n\nOriginal error:\n\n" + cause
                    + "\n\nRemove error:\n\n" + removalFailure
                    + "\n\nPlease manually delete this folder or you will run into issues using this package in the future:\n\n"
                    + outputFolder.toAbsolutePath(), cause);
            escalated.addSuppressed(removalFailure);
            throw escalated;
        }
    }
}
