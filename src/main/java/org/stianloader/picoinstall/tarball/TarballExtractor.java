package org.stianloader.picoinstall.tarball;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.GZIPInputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.internal.FileUtil;
import org.stianloader.picoinstall.logging.LoggingAdapter;
import org.stianloader.picoinstall.registry.DistInfo;

/**
 * Unpacks gzip compressed package tarballs.
 *
 * <p>Package tarballs wrap their contents in a single top-level directory (usually "package/"),
 * which is stripped. Only regular files and directories are extracted: symbolic links, hard links and
 * device nodes come from an untrusted source and are skipped. Every directory that is written to
 * is checked to still be located within the output folder after resolving it on disk.
 */
public final class TarballExtractor {

    /**
     * How often a failing rename of the sibling temp directory is retried before giving up.
     */
    static final int RENAME_RETRIES = 5;

    private TarballExtractor() {
        throw new UnsupportedOperationException();
    }

    /**
     * Verifies the tarball against the registry's integrity and extracts it.
     *
     * @param packageVersion The package the tarball belongs to
     * @param data The raw tarball bytes
     * @param dist The dist information of the package version
     * @param outputFolder The folder the package contents should end up in
     * @param mode Whether to extract in place or through a sibling temp directory
     * @throws IOException If verification, extraction or moving the extracted folder failed
     */
    public static void verifyAndExtract(@NotNull PackageVersion packageVersion, byte @NotNull[] data, @NotNull DistInfo dist,
            @NotNull Path outputFolder, @NotNull ExtractionMode mode) throws IOException {
        TarballIntegrity.verify(packageVersion, data, dist.getIntegrity());

        if (mode == ExtractionMode.OVERWRITE) {
            TarballExtractor.extract(data, outputFolder);
            return;
        }

        Path parent = outputFolder.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFolder = FileUtil.randomSibling(outputFolder, ".tmp-");
        try {
            TarballExtractor.extract(data, tempFolder);
        } catch (IOException | RuntimeException e) {
            try {
                FileUtil.deleteRecursively(tempFolder);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        TarballExtractor.renameWithRetries(tempFolder, outputFolder);
    }

    /**
     * Moves the freshly extracted temp folder into place. Should the destination exist by the time the
     * move is attempted, another process completed the equivalent work first: the temp folder is discarded and
     * the call succeeds. Other failures are retried with a short backoff.
     *
     * @param tempFolder The extracted folder
     * @param outputFolder The final location
     * @throws IOException If the move kept failing
     */
    static void renameWithRetries(@NotNull Path tempFolder, @NotNull Path outputFolder) throws IOException {
        int attempt = 0;
        while (true) {
            try {
                Files.move(tempFolder, outputFolder, StandardCopyOption.ATOMIC_MOVE);
                return;
            } catch (IOException e) {
                if (e instanceof FileAlreadyExistsException || e instanceof DirectoryNotEmptyException || Files.exists(outputFolder)) {
                    LoggingAdapter.getDefaultLogger().debug(TarballExtractor.class, "{} was created concurrently, discarding {}", outputFolder, tempFolder);
                    FileUtil.deleteRecursively(tempFolder);
                    return;
                }
                attempt++;
                if (attempt > TarballExtractor.RENAME_RETRIES) {
                    try {
                        FileUtil.deleteRecursively(tempFolder);
                    } catch (IOException suppressed) {
                        e.addSuppressed(suppressed);
                    }
                    throw e;
                }
                long backoff = Math.min(100L, 20L * attempt);
                LoggingAdapter.getDefaultLogger().debug(TarballExtractor.class, "Failed to move {} to {} (attempt {}), retrying in {} ms", tempFolder, outputFolder, attempt, backoff, e);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException interrupt) {
                    Thread.currentThread().interrupt();
                    InterruptedIOException ioe = new InterruptedIOException("Interrupted while moving " + tempFolder + " to " + outputFolder);
                    ioe.addSuppressed(e);
                    try {
                        FileUtil.deleteRecursively(tempFolder);
                    } catch (IOException suppressed) {
                        ioe.addSuppressed(suppressed);
                    }
                    throw ioe;
                }
            }
        }
    }

    /**
     * Extracts a gzip compressed tarball into the output folder, stripping the first path component of every entry.
     *
     * @param data The raw tarball bytes
     * @param outputFolder The folder to extract to; created if absent
     * @throws PathEscapeException If an entry would be written outside of the output folder. No further entries
     * are processed once this happens.
     * @throws IOException If reading the archive or writing a file failed
     */
    public static void extract(byte @NotNull[] data, @NotNull Path outputFolder) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            TarballExtractor.extract(in, outputFolder);
        }
    }

    /**
     * Extracts an uncompressed tar stream into the output folder, stripping the first path component of every entry.
     *
     * @param tarStream The tar stream, which is not closed by this method
     * @param outputFolder The folder to extract to; created if absent
     * @throws IOException If an entry escapes the output folder, reading the archive or writing a file failed
     */
    @SuppressWarnings("resource")
    public static void extract(@NotNull InputStream tarStream, @NotNull Path outputFolder) throws IOException {
        Files.createDirectories(outputFolder);
        Path root = outputFolder.toAbsolutePath().normalize();
        Path canonicalRoot = outputFolder.toRealPath();
        Set<Path> verifiedDirectories = new HashSet<>();
        verifiedDirectories.add(root);

        TarArchiveInputStream tar = new TarArchiveInputStream(tarStream);
        TarArchiveEntry entry;
        while ((entry = tar.getNextEntry()) != null) {
            String relativePath = TarballExtractor.stripFirstComponent(entry.getName());
            if (relativePath == null) {
                continue;
            }

            if (entry.isSymbolicLink() || entry.isLink() || entry.isCharacterDevice() || entry.isBlockDevice() || entry.isFIFO()) {
                LoggingAdapter.getDefaultLogger().warn(TarballExtractor.class, "Skipping tar entry \"{}\" of unsupported type {} while extracting to {}", entry.getName(), (char) entry.getLinkFlag(), outputFolder);
                continue;
            }
            boolean directory = entry.isDirectory();
            if (!directory && !entry.isFile()) {
                LoggingAdapter.getDefaultLogger().warn(TarballExtractor.class, "Skipping tar entry \"{}\" of unsupported type {} while extracting to {}", entry.getName(), (char) entry.getLinkFlag(), outputFolder);
                continue;
            }

            Path target = root.resolve(relativePath).normalize();
            if (!target.startsWith(root) || target.equals(root) && !directory) {
                throw new PathEscapeException(entry.getName(), outputFolder);
            }

            Path directoryPath = directory ? target : target.getParent();
            if (directoryPath != null && verifiedDirectories.add(directoryPath)) {
                Files.createDirectories(directoryPath);
                if (!directoryPath.toRealPath().startsWith(canonicalRoot)) {
                    throw new PathEscapeException(entry.getName(), outputFolder);
                }
            }

            if (directory) {
                continue;
            }

            Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
            if ((entry.getMode() & 0111) != 0 && FileUtil.isPosix(target)) {
                Set<PosixFilePermission> permissions = EnumSet.copyOf(Files.getPosixFilePermissions(target));
                permissions.add(PosixFilePermission.OWNER_EXECUTE);
                if ((entry.getMode() & 0010) != 0) {
                    permissions.add(PosixFilePermission.GROUP_EXECUTE);
                }
                if ((entry.getMode() & 0001) != 0) {
                    permissions.add(PosixFilePermission.OTHERS_EXECUTE);
                }
                Files.setPosixFilePermissions(target, permissions);
            }
        }
    }

    /**
     * Removes the wrapping directory every package tarball puts its contents in.
     *
     * @param entryName The name of the tar entry
     * @return The remaining relative path, or null if nothing remains
     */
    @Nullable
    static String stripFirstComponent(@NotNull String entryName) {
        List<String> components = new ArrayList<>();
        for (String component : entryName.replace('\\', '/').split("/")) {
            if (component.isEmpty() || component.equals(".")) {
                continue;
            }
            components.add(component);
        }
        if (components.size() <= 1) {
            return null;
        }
        return String.join("/", components.subList(1, components.size()));
    }
}
