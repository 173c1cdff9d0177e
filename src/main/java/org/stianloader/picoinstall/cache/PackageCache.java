package org.stianloader.picoinstall.cache;

import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;
import org.stianloader.picoinstall.internal.FileUtil;
import org.stianloader.picoinstall.logging.LoggingAdapter;
import org.stianloader.picoinstall.registry.DistInfo;
import org.stianloader.picoinstall.registry.PackageInfo;
import org.stianloader.picoinstall.registry.PackageNotFoundException;
import org.stianloader.picoinstall.registry.RegistryTransport;
import org.stianloader.picoinstall.tarball.ExtractionMode;
import org.stianloader.picoinstall.tarball.TarballExtractor;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * The on-disk cache of extracted packages and registry metadata of a single registry.
 *
 * <p>The layout is {@code <root>/<registry host>/<name>/<version>[_<copy index>]/} for package folders
 * and {@code <root>/<registry host>/<name>/registry.json} for the metadata of a package. The cache is shared
 * by all processes of the machine. It is append-only: a package folder that is complete (see {@link FolderSyncLock})
 * is never written to again, unless the {@link CacheSetting} asks for it to be reloaded.
 *
 * <p>Which packages were already reloaded is tracked per instance, so that a reload forces a single
 * download per package and run instead of one download per reference.
 */
public class PackageCache {

    @NotNull
    public static final String METADATA_FILE_NAME = "registry.json";

    @NotNull
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    @NotNull
    private final Path cacheRoot;
    @NotNull
    private final Path registryFolder;
    @NotNull
    private final RegistryTransport transport;
    @NotNull
    private final CacheSetting cacheSetting;
    @NotNull
    private final Set<PackageVersion> previouslyReloaded = ConcurrentHashMap.newKeySet();
    @NotNull
    private final Set<Path> previouslyRelinked = ConcurrentHashMap.newKeySet();
    @NotNull
    private final ConcurrentMap<PackageVersion, CompletableFuture<Path>> pendingDownloads = new ConcurrentHashMap<>();

    public PackageCache(@NotNull Path cacheRoot, @NotNull RegistryTransport transport, @NotNull CacheSetting cacheSetting) {
        this.cacheRoot = Objects.requireNonNull(cacheRoot, "The cache directory defined by \"cacheRoot\" may not be null!");
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
        this.cacheSetting = Objects.requireNonNull(cacheSetting, "cacheSetting may not be null");
        this.registryFolder = cacheRoot.resolve(PackageCache.getRegistryFolderName(transport.getBaseURI()));
        if (Files.exists(cacheRoot) && !Files.isDirectory(cacheRoot)) {
            throw new IllegalArgumentException("The \"cacheRoot\" argument must point to a directory. It currently points to " + cacheRoot.toAbsolutePath());
        }
    }

    @NotNull
    @Contract(pure = true)
    static String getRegistryFolderName(@NotNull URI registryBase) {
        String host = registryBase.getHost();
        if (host == null) {
            throw new IllegalArgumentException("Registry URI " + registryBase + " does not have a host");
        }
        if (registryBase.getPort() != -1) {
            return host + '_' + registryBase.getPort();
        }
        return host;
    }

    @NotNull
    @Contract(pure = true)
    public Path getCacheRoot() {
        return this.cacheRoot;
    }

    @NotNull
    @Contract(pure = true)
    public Path getRegistryFolder() {
        return this.registryFolder;
    }

    @NotNull
    @Contract(pure = true)
    public CacheSetting getCacheSetting() {
        return this.cacheSetting;
    }

    @NotNull
    @Contract(pure = true)
    public Path getPackageNameFolder(@NotNull String packageName) {
        Path folder = this.registryFolder.resolve(packageName).normalize();
        if (packageName.isEmpty() || !folder.startsWith(this.registryFolder.normalize()) || folder.equals(this.registryFolder.normalize())) {
            throw new IllegalArgumentException("Package name \"" + packageName + "\" cannot be mapped to a cache folder");
        }
        return folder;
    }

    @NotNull
    @Contract(pure = true)
    public Path getPackageFolder(@NotNull CacheFolderId folderId) {
        return this.getPackageNameFolder(folderId.nv().name()).resolve(folderId.getFolderName());
    }

    @NotNull
    @Contract(pure = true)
    public Path getMetadataFile(@NotNull String packageName) {
        return this.getPackageNameFolder(packageName).resolve(PackageCache.METADATA_FILE_NAME);
    }

    /**
     * Checks whether existing cache entries of the package version may be used. This is the case if
     * the cache setting trusts the package, or if it was already reloaded by this instance.
     *
     * @param nv The package version
     * @return True if the cache entry can be used
     */
    @Contract(pure = true)
    public boolean shouldUseCacheForPackage(@NotNull PackageVersion nv) {
        return this.cacheSetting.shouldUse(nv.name()) || this.previouslyReloaded.contains(nv);
    }

    /**
     * Ensures the canonical (copy index 0) folder of the package version exists and is complete,
     * downloading and extracting the tarball if needed. Concurrent requests for the same version
     * within this instance share a single download.
     *
     * @param nv The package version
     * @param dist The dist information describing where the tarball is and which checksum it has
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future holding the package folder
     */
    @NotNull
    public CompletableFuture<Path> ensurePackage(@NotNull PackageVersion nv, @NotNull DistInfo dist, @NotNull Executor executor) {
        Path packageFolder = this.getPackageFolder(new CacheFolderId(nv, 0));
        if (this.shouldUseCacheForPackage(nv) && FolderSyncLock.isComplete(packageFolder)) {
            return CompletableFuture.completedFuture(packageFolder);
        }
        if (this.cacheSetting.getMode() == CacheSetting.Mode.ONLY) {
            CompletableFuture<Path> failed = new CompletableFuture<>();
            failed.completeExceptionally(new PackageNotFoundException(nv.name(), "npm package not found in cache: \"" + nv.name() + "\", --cached-only is specified."));
            return failed;
        }
        String tarball = dist.getTarball();
        if (tarball == null) {
            CompletableFuture<Path> failed = new CompletableFuture<>();
            failed.completeExceptionally(new IOException("Registry metadata of " + nv + " does not specify a tarball location"));
            return failed;
        }

        CompletableFuture<Path> created = new CompletableFuture<>();
        CompletableFuture<Path> pending = this.pendingDownloads.putIfAbsent(nv, created);
        if (pending != null) {
            return pending;
        }
        if (this.shouldUseCacheForPackage(nv) && FolderSyncLock.isComplete(packageFolder)) {
            // Completed by a download that finished in the meantime
            this.pendingDownloads.remove(nv, created);
            created.complete(packageFolder);
            return created;
        }

        URI tarballURI = this.transport.getBaseURI().resolve(tarball);
        LoggingAdapter.getDefaultLogger().info(PackageCache.class, "Downloading {} from {}", nv, tarballURI);
        this.transport.fetch(tarballURI, executor).thenApply((data) -> {
            try {
                this.extractInto(nv, data, dist, packageFolder);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
            return packageFolder;
        }).whenComplete((folder, ex) -> {
            this.pendingDownloads.remove(nv, created);
            if (ex != null) {
                Throwable cause = ConcurrencyUtil.unwrap(ex);
                LoggingAdapter.getDefaultLogger().error(PackageCache.class, "Failed to cache {} from {}", nv, tarballURI, cause);
                created.completeExceptionally(cause);
            } else {
                created.complete(folder);
            }
        });
        return created;
    }

    private void extractInto(@NotNull PackageVersion nv, byte @NotNull[] data, @NotNull DistInfo dist, @NotNull Path packageFolder) throws IOException {
        if (Files.exists(packageFolder)) {
            // Either a reload of a complete folder or the leftovers of a crashed extraction
            LoggingAdapter.getDefaultLogger().debug(PackageCache.class, "Re-extracting {} into {}", nv, packageFolder);
            FolderSyncLock.withFolderLock(nv, packageFolder, () -> {
                TarballExtractor.verifyAndExtract(nv, data, dist, packageFolder, ExtractionMode.OVERWRITE);
            });
        } else {
            TarballExtractor.verifyAndExtract(nv, data, dist, packageFolder, ExtractionMode.ATOMIC_SIBLING);
        }
        if (!this.cacheSetting.shouldUse(nv.name())) {
            this.previouslyReloaded.add(nv);
        }
    }

    /**
     * Ensures that a copy of a package version exists. Copies are needed when peer dependency resolution gave
     * the same version different dependency sets in different parts of the graph, so that each of them needs
     * its own folder. The canonical copy (index 0) must already exist.
     *
     * <p>A copy is reused if it is complete and the cache setting trusts it. Otherwise it is recreated by hard linking
     * every file of the canonical copy, see {@link #linkPackageFolder(PackageVersion, Path, Path)}.
     *
     * @param folderId The copy to ensure, whose copy index must not be 0
     * @return The folder of the copy
     * @throws IOException If the copy could not be created
     */
    @NotNull
    public Path ensureCopy(@NotNull CacheFolderId folderId) throws IOException {
        if (folderId.copyIndex() == 0) {
            throw new IllegalArgumentException("Copy index 0 is the canonical copy of " + folderId.nv() + " and cannot be cloned");
        }
        Path copyFolder = this.getPackageFolder(folderId);
        Path originalFolder = this.getPackageFolder(new CacheFolderId(folderId.nv(), 0));
        if (!FolderSyncLock.isComplete(originalFolder)) {
            throw new IOException("Cannot copy " + folderId.nv() + " as " + originalFolder.toAbsolutePath() + " is absent or incomplete");
        }
        this.linkPackageFolder(folderId.nv(), originalFolder, copyFolder);
        return copyFolder;
    }

    /**
     * Hard links every file of a complete package folder into a target folder, guarded by the {@link FolderSyncLock}.
     * A complete target is kept if the cache setting trusts the package. Otherwise it is linked again once per
     * instance, as a reload of the source folder replaces the files the target still links to.
     *
     * @param nv The package version stored in both folders
     * @param sourceFolder The complete folder to link from
     * @param targetFolder The folder to create or refresh
     * @throws IOException If linking failed
     */
    public void linkPackageFolder(@NotNull PackageVersion nv, @NotNull Path sourceFolder, @NotNull Path targetFolder) throws IOException {
        Path key = targetFolder.toAbsolutePath().normalize();
        boolean trusted = this.cacheSetting.shouldUse(nv.name());
        if ((trusted || this.previouslyRelinked.contains(key)) && FolderSyncLock.isComplete(targetFolder)) {
            return;
        }
        FolderSyncLock.withFolderLock(nv, targetFolder, () -> {
            FileUtil.hardLinkRecursively(sourceFolder, targetFolder);
        });
        if (!trusted) {
            this.previouslyRelinked.add(key);
        }
    }

    /**
     * Reads the cached registry metadata of a package.
     *
     * @param packageName The name of the package
     * @return The metadata, or null if it was never cached
     * @throws IOException If the file exists but could not be read
     * @throws JsonParseException If the file is malformed; callers should treat this as a cache miss
     */
    @Nullable
    public PackageInfo loadMetadata(@NotNull String packageName) throws IOException {
        Path file = this.getMetadataFile(packageName);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            PackageInfo info = PackageCache.GSON.fromJson(reader, PackageInfo.class);
            if (info == null) {
                throw new JsonParseException("Empty registry metadata at " + file.toAbsolutePath());
            }
            return info;
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    /**
     * Writes the registry metadata of a package to the cache through an atomic write, with the file being
     * readable by the owner only.
     *
     * @param packageName The name of the package
     * @param info The metadata to store
     * @throws IOException If writing failed
     */
    public void saveMetadata(@NotNull String packageName, @NotNull PackageInfo info) throws IOException {
        byte[] data = PackageCache.GSON.toJson(info).getBytes(StandardCharsets.UTF_8);
        FileUtil.atomicWrite(data, this.getMetadataFile(packageName), true);
    }

    @NotNull
    @Contract(pure = true)
    static Gson getGson() {
        return PackageCache.GSON;
    }
}
