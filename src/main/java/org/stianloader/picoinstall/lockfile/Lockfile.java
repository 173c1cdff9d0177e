package org.stianloader.picoinstall.lockfile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageKind;
import org.stianloader.picoinstall.PackageRequirement;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;
import org.stianloader.picoinstall.internal.FileUtil;
import org.stianloader.picoinstall.logging.LoggingAdapter;
import org.stianloader.picoinstall.registry.RegistryApi;

import com.google.gson.JsonObject;

/**
 * A lockfile: the persisted record of which package versions requirements resolved to and which
 * checksums the packages and remote modules had.
 *
 * <p>Every change of the content increments the {@link #getRevision() revision}, which allows callers
 * to detect that the lockfile was modified while they were working on a copy of its content.
 * All methods synchronize on the lockfile instance.
 */
public class Lockfile {

    @NotNull
    private final Path filename;
    private final boolean overwrite;
    @NotNull
    private final LockfileContent content;
    private boolean hasContentChanged;
    private long revision;
    @NotNull
    private String jsrBaseUrl = LockfilePackageGraph.DEFAULT_JSR_URL;

    private Lockfile(@NotNull Path filename, boolean overwrite, @NotNull LockfileContent content) {
        this.filename = Objects.requireNonNull(filename, "filename may not be null");
        this.overwrite = overwrite;
        this.content = content;
    }

    /**
     * Creates a lockfile without any content.
     *
     * @param filename The location the lockfile is written to
     * @param overwrite Whether the file should be written even if the content did not change
     * @return The new lockfile
     */
    @NotNull
    @Contract(pure = true)
    public static Lockfile newEmpty(@NotNull Path filename, boolean overwrite) {
        return new Lockfile(filename, overwrite, new LockfileContent());
    }

    /**
     * Creates a lockfile from the text of an existing lockfile. In overwrite mode the text is ignored
     * and the lockfile starts out empty.
     *
     * <p>Lockfiles of older versions are migrated, which fails if the lockfile has npm packages as their
     * migration requires registry metadata. Use {@link #parse(Path, String, boolean, RegistryApi, Executor)} for those.
     *
     * @param filename The location the lockfile is read from and written to
     * @param text The JSON text
     * @param overwrite Whether to discard the existing content
     * @return The parsed lockfile
     * @throws LockfileException If the text is empty, malformed or of an unsupported version
     */
    @NotNull
    public static Lockfile parse(@NotNull Path filename, @NotNull String text, boolean overwrite) throws LockfileException {
        try {
            return Lockfile.parse(filename, text, overwrite, null, Runnable::run).join();
        } catch (CompletionException e) {
            Throwable cause = ConcurrencyUtil.unwrap(e);
            if (cause instanceof LockfileException) {
                throw (LockfileException) cause;
            }
            throw e;
        }
    }

    /**
     * Creates a lockfile from the text of an existing lockfile, migrating lockfiles of older versions.
     * A migrated lockfile is not considered changed, it is only written once its content changes.
     *
     * @param filename The location the lockfile is read from and written to
     * @param text The JSON text
     * @param overwrite Whether to discard the existing content
     * @param registry The registry to look up the npm packages of version 4 lockfiles in, or null
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future holding the parsed lockfile, completing exceptionally with a {@link LockfileException}
     * if the text is empty, malformed, of an unsupported version or cannot be migrated
     */
    @NotNull
    public static CompletableFuture<Lockfile> parse(@NotNull Path filename, @NotNull String text, boolean overwrite, @Nullable RegistryApi registry, @NotNull Executor executor) {
        if (overwrite) {
            return CompletableFuture.completedFuture(Lockfile.newEmpty(filename, true));
        }
        JsonObject json;
        try {
            if (text.isBlank()) {
                throw new LockfileException(LockfileException.Reason.EMPTY, "The lockfile is empty");
            }
            json = LockfileJson.readTree(text);
            if (!LockfileMigration.needsMigration(json)) {
                return CompletableFuture.completedFuture(new Lockfile(filename, false, LockfileJson.read(json)));
            }
        } catch (LockfileException e) {
            return CompletableFuture.failedFuture(e.setFilePath(filename.toString()));
        }

        LoggingAdapter.getDefaultLogger().info(Lockfile.class, "Migrating lockfile {} to version {}", filename, LockfileJson.CURRENT_VERSION);
        return LockfileMigration.migrate(json, registry, executor).thenApply((migrated) -> {
            try {
                return new Lockfile(filename, false, LockfileJson.read(migrated));
            } catch (LockfileException e) {
                throw new CompletionException(e);
            }
        }).handle((lockfile, ex) -> {
            if (ex != null) {
                Throwable cause = ConcurrencyUtil.unwrap(ex);
                if (cause instanceof LockfileException) {
                    ((LockfileException) cause).setFilePath(filename.toString());
                }
                throw new CompletionException(cause);
            }
            return lockfile;
        });
    }

    /**
     * Reads the lockfile at the given location. A lockfile that does not exist yet is treated as empty.
     *
     * @param filename The location of the lockfile
     * @param overwrite Whether to discard the existing content
     * @return The lockfile
     * @throws IOException If the file exists but could not be read or parsed
     */
    @NotNull
    public static Lockfile load(@NotNull Path filename, boolean overwrite) throws IOException {
        if (overwrite) {
            return Lockfile.newEmpty(filename, true);
        }
        String text = Lockfile.readText(filename);
        if (text == null) {
            return Lockfile.newEmpty(filename, false);
        }
        return Lockfile.parse(filename, text, false);
    }

    /**
     * Reads the lockfile at the given location, migrating lockfiles of older versions.
     * A lockfile that does not exist yet is treated as empty.
     *
     * @param filename The location of the lockfile
     * @param overwrite Whether to discard the existing content
     * @param registry The registry to look up the npm packages of version 4 lockfiles in
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future holding the lockfile
     */
    @NotNull
    public static CompletableFuture<Lockfile> load(@NotNull Path filename, boolean overwrite, @NotNull RegistryApi registry, @NotNull Executor executor) {
        if (overwrite) {
            return CompletableFuture.completedFuture(Lockfile.newEmpty(filename, true));
        }
        return ConcurrencyUtil.schedule(() -> Lockfile.readText(filename), executor).thenCompose((text) -> {
            if (text == null) {
                return CompletableFuture.completedFuture(Lockfile.newEmpty(filename, false));
            }
            return Lockfile.parse(filename, text, false, registry, executor);
        });
    }

    @Nullable
    private static String readText(@NotNull Path filename) throws IOException {
        try {
            return Files.readString(filename, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    @NotNull
    @Contract(pure = true)
    public Path getFilename() {
        return this.filename;
    }

    @Contract(pure = true)
    public boolean isOverwrite() {
        return this.overwrite;
    }

    @Contract(pure = true)
    public synchronized boolean hasContentChanged() {
        return this.hasContentChanged;
    }

    @Contract(pure = true)
    public synchronized long getRevision() {
        return this.revision;
    }

    /**
     * Sets the location JSR packages are served from, used to find the remote checksums that belong
     * to a JSR package when it is pruned.
     *
     * @param jsrBaseUrl The base URL
     * @return The current {@link Lockfile} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "!null -> this; null -> fail")
    public synchronized Lockfile setJsrBaseUrl(@NotNull String jsrBaseUrl) {
        this.jsrBaseUrl = Objects.requireNonNull(jsrBaseUrl, "jsrBaseUrl may not be null");
        return this;
    }

    /**
     * Obtains the live content of the lockfile. Callers must synchronize on the lockfile while accessing
     * it and must not modify it directly.
     *
     * @return The content
     */
    @NotNull
    @Contract(pure = true)
    public LockfileContent getContent() {
        return this.content;
    }

    @Nullable
    @Contract(pure = true)
    public synchronized String getSpecifier(@NotNull PackageRequirement req) {
        return this.content.packages.specifiers.get(req);
    }

    @Nullable
    @Contract(pure = true)
    public synchronized NpmPackageInfo getNpmPackage(@NotNull String id) {
        return this.content.packages.npm.get(id);
    }

    @Nullable
    @Contract(pure = true)
    public synchronized JsrPackageInfo getJsrPackage(@NotNull PackageVersion nv) {
        return this.content.packages.jsr.get(nv);
    }

    @Nullable
    @Contract(pure = true)
    public synchronized String getRemote(@NotNull String url) {
        return this.content.remote.get(url);
    }

    private void markChanged() {
        this.hasContentChanged = true;
        this.revision++;
    }

    @Contract(mutates = "this")
    public synchronized void insertRemote(@NotNull String url, @NotNull String checksum) {
        if (!checksum.equals(this.content.remote.put(url, checksum))) {
            this.markChanged();
        }
    }

    @Contract(mutates = "this")
    public synchronized void insertPackageSpecifier(@NotNull PackageRequirement req, @NotNull String resolvedValue) {
        if (!resolvedValue.equals(this.content.packages.specifiers.put(req, resolvedValue))) {
            this.markChanged();
        }
    }

    @Contract(mutates = "this")
    public synchronized void insertNpmPackage(@NotNull String id, @NotNull NpmPackageInfo info) {
        if (!info.equals(this.content.packages.npm.put(id, info))) {
            this.markChanged();
        }
    }

    /**
     * Records a JSR package with the given integrity. The dependencies of an already recorded
     * package are kept.
     *
     * @param nv The package
     * @param integrity The integrity of the package
     */
    @Contract(mutates = "this")
    public synchronized void insertJsrPackage(@NotNull PackageVersion nv, @NotNull String integrity) {
        JsrPackageInfo existing = this.content.packages.jsr.get(nv);
        if (existing == null) {
            this.content.packages.jsr.put(nv, new JsrPackageInfo(integrity, new LinkedHashSet<>()));
            this.markChanged();
        } else if (!existing.integrity().equals(integrity)) {
            this.content.packages.jsr.put(nv, existing.withIntegrity(integrity));
            this.markChanged();
        }
    }

    /**
     * Adds dependencies to a recorded JSR package. Dependencies without an entry in the "specifiers"
     * table are not recorded, as well as dependencies of packages that were not recorded.
     *
     * @param nv The package
     * @param dependencies The dependencies of the package
     */
    @Contract(mutates = "this")
    public synchronized void addJsrPackageDeps(@NotNull PackageVersion nv, @NotNull Collection<PackageRequirement> dependencies) {
        JsrPackageInfo existing = this.content.packages.jsr.get(nv);
        if (existing == null) {
            return;
        }
        Set<PackageRequirement> merged = new LinkedHashSet<>(existing.dependencies());
        for (PackageRequirement dep : dependencies) {
            if (this.content.packages.specifiers.containsKey(dep)) {
                merged.add(dep);
            }
        }
        if (merged.size() != existing.dependencies().size()) {
            this.content.packages.jsr.put(nv, new JsrPackageInfo(existing.integrity(), merged));
            this.markChanged();
        }
    }

    /**
     * Records a redirect. Redirects of JSR specifiers are resolved through the "specifiers" table instead
     * and are thus not recorded.
     *
     * @param from The redirected specifier
     * @param to The target
     */
    @Contract(mutates = "this")
    public synchronized void insertRedirect(@NotNull String from, @NotNull String to) {
        if (from.startsWith(PackageKind.JSR.getSchemeWithColon())) {
            return;
        }
        if (!to.equals(this.content.redirects.put(from, to))) {
            this.markChanged();
        }
    }

    /**
     * Replaces the workspace configuration. Packages that were only needed by dependencies the new
     * configuration no longer declares are pruned from the lockfile.
     *
     * @param config The new configuration
     */
    @Contract(mutates = "this")
    public synchronized void setWorkspaceConfig(@NotNull WorkspaceConfig config) {
        WorkspaceConfig old = this.content.workspace;
        if (old.equals(config)) {
            return;
        }
        boolean wasEmpty = this.content.isEmpty();

        if (!this.content.packages.isEmpty()) {
            Set<PackageRequirement> removedDeps = new LinkedHashSet<>(old.dependencies());
            removedDeps.addAll(old.packageJsonDependencies());
            removedDeps.removeAll(config.dependencies());
            removedDeps.removeAll(config.packageJsonDependencies());

            Set<PackageRequirement> removedLinkDeps = new LinkedHashSet<>();
            for (Map.Entry<String, Set<PackageRequirement>> link : old.links().entrySet()) {
                if (!link.getValue().equals(config.links().get(link.getKey()))) {
                    removedLinkDeps.addAll(link.getValue());
                }
            }

            if (!removedDeps.isEmpty() || !removedLinkDeps.isEmpty()) {
                LoggingAdapter.getDefaultLogger().debug(Lockfile.class, "Pruning no longer declared dependencies {} and link dependencies {} from {}", removedDeps, removedLinkDeps, this.filename);
                LockfilePackageGraph graph = LockfilePackageGraph.fromLockfile(this.content.packages, this.content.remote, this.jsrBaseUrl);
                for (PackageRequirement dep : removedDeps) {
                    graph.removeRoot(dep);
                }
                for (PackageRequirement dep : removedLinkDeps) {
                    graph.removeByName(dep);
                }
                graph.populate(this.content.packages, this.content.remote);
            }
        }

        this.content.workspace = config;
        if (wasEmpty) {
            // A new lockfile only needs to be written once it records packages
            this.revision++;
        } else {
            this.markChanged();
        }
    }

    @NotNull
    @Contract(pure = true)
    public synchronized String toJsonString() {
        return LockfileJson.print(this.content);
    }

    /**
     * Obtains the bytes to write to disk.
     *
     * @return The bytes, or null if the lockfile does not need to be written
     */
    @Contract(pure = true)
    public synchronized byte @Nullable[] resolveWriteBytes() {
        if (!this.hasContentChanged && !this.overwrite) {
            return null;
        }
        return this.toJsonString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Writes the lockfile to disk if it changed (or if it is in overwrite mode). The file is replaced atomically.
     *
     * @throws IOException If writing failed
     */
    public synchronized void write() throws IOException {
        byte[] data = this.resolveWriteBytes();
        if (data == null) {
            return;
        }
        FileUtil.atomicWrite(data, this.filename, false);
        this.hasContentChanged = false;
    }
}
