package org.stianloader.picoinstall.internal;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import org.jetbrains.annotations.NotNull;

public class FileUtil {

    @NotNull
    private static final Set<PosixFilePermission> PRIVATE_FILE = PosixFilePermissions.fromString("rw-------");

    /**
     * Recursively deletes a file or directory. A path that does not exist (anymore) is not an error,
     * as another process may have removed it concurrently.
     *
     * @param path The path to delete
     * @throws IOException If a file or directory could not be deleted
     */
    public static void deleteRecursively(@NotNull Path path) throws IOException {
        if (Files.notExists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null && !(exc instanceof NoSuchFileException)) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Obtains a sibling of the given path with a random suffix, suitable as a temporary location
     * that is later renamed onto the given path.
     *
     * @param path The final location
     * @param infix The text placed between the file name and the random suffix
     * @return A sibling path that very likely does not exist yet
     */
    @NotNull
    public static Path randomSibling(@NotNull Path path, @NotNull String infix) {
        String suffix = Long.toHexString(ThreadLocalRandom.current().nextLong() & 0xFFFFFFFFFFL);
        return path.resolveSibling(path.getFileName().toString() + infix + suffix);
    }

    /**
     * Writes the bytes to a uniquely named sibling file which is then atomically moved over the
     * target. Readers thus either observe the old or the new content, but never a partially written file.
     * A file lock on a ".lock" sibling serializes writers within and across processes.
     *
     * @param data The data to write
     * @param to The target file
     * @param privateFile Whether the file should only be readable and writable by its owner (on POSIX file systems)
     * @throws IOException If writing or moving failed
     */
    public static void atomicWrite(byte @NotNull[] data, @NotNull Path to, boolean privateFile) throws IOException {
        Path parent = to.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path part = FileUtil.randomSibling(to, ".part-");
        Path lock = to.resolveSibling(to.getFileName().toString() + ".lock");

        try (FileChannel lockChannel = FileChannel.open(lock, StandardOpenOption.WRITE, StandardOpenOption.CREATE);
                FileLock fileLock = FileUtil.acquire(lockChannel, lock)) {
            try {
                Files.write(part, data, StandardOpenOption.CREATE_NEW);
                if (privateFile && FileUtil.isPosix(part)) {
                    Files.setPosixFilePermissions(part, FileUtil.PRIVATE_FILE);
                }
                Files.move(part, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(part);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
                throw e;
            }
        }
    }

    @NotNull
    private static FileLock acquire(@NotNull FileChannel channel, @NotNull Path lock) throws IOException {
        FileLock fileLock;
        long idleTime = 0L;
        while ((fileLock = channel.tryLock()) == null) {
            try {
                Thread.sleep(10L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for the lock on " + lock.toAbsolutePath());
            }
            if ((idleTime += 10L) > 10_000L) {
                throw new IOException("Waited more than 10 seconds to acquire lock on " + lock.toAbsolutePath());
            }
        }
        return fileLock;
    }

    public static boolean isPosix(@NotNull Path path) {
        return path.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    /**
     * Recreates the directory tree of {@code from} at {@code to}, hard linking every regular file.
     * Files that already exist at the destination are replaced by a fresh link.
     *
     * @param from The source directory
     * @param to The destination directory
     * @throws IOException If a directory could not be created or a file could not be linked
     */
    public static void hardLinkRecursively(@NotNull Path from, @NotNull Path to) throws IOException {
        Files.walkFileTree(from, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(to.resolve(from.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                Path link = to.resolve(from.relativize(file).toString());
                try {
                    Files.createLink(link, file);
                } catch (FileAlreadyExistsException e) {
                    Files.delete(link);
                    Files.createLink(link, file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
