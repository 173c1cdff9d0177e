package org.stianloader.picoinstall.installer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.cache.PackageCache;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;
import org.stianloader.picoinstall.logging.LoggingAdapter;

/**
 * Installs packages into a project local directory. Packages are first placed into the global {@link PackageCache}
 * and then hard linked into {@code <local root>/<name>@<version>[_<copy index>]}, with the '/' of scoped
 * package names replaced by '+'.
 */
public class LocalDirectoryInstaller implements FilesystemInstaller {

    @NotNull
    private final PackageCache cache;
    @NotNull
    private final Path localRoot;

    public LocalDirectoryInstaller(@NotNull PackageCache cache, @NotNull Path localRoot) {
        this.cache = Objects.requireNonNull(cache, "cache may not be null");
        this.localRoot = Objects.requireNonNull(localRoot, "localRoot may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public Path getLocalFolder(@NotNull ResolvedPackage pkg) {
        PackageVersion nv = pkg.getPackageVersion();
        String folderName = nv.name().replace('/', '+') + '@' + pkg.getCacheFolderId().getFolderName();
        return this.localRoot.resolve(folderName);
    }

    @Override
    @NotNull
    public CompletableFuture<Void> cachePackages(@NotNull Collection<ResolvedPackage> packages, @NotNull Executor executor) {
        List<CompletableFuture<?>> futures = new ArrayList<>();
        for (ResolvedPackage pkg : packages) {
            futures.add(this.cache.ensurePackage(pkg.getPackageVersion(), pkg.dist(), executor).thenAcceptAsync((canonicalFolder) -> {
                try {
                    this.linkIntoLocalRoot(pkg, canonicalFolder);
                } catch (IOException e) {
                    throw new CompletionException(e);
                }
            }, executor));
        }
        return ConcurrencyUtil.allOf(futures);
    }

    private void linkIntoLocalRoot(@NotNull ResolvedPackage pkg, @NotNull Path canonicalFolder) throws IOException {
        Path target = this.getLocalFolder(pkg);
        LoggingAdapter.getDefaultLogger().debug(LocalDirectoryInstaller.class, "Linking {} into {}", pkg.id(), target);
        this.cache.linkPackageFolder(pkg.getPackageVersion(), canonicalFolder, target);
    }
}
