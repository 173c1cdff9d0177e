package org.stianloader.picoinstall.installer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.cache.PackageCache;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;

/**
 * Installs packages into the machine wide {@link PackageCache}. Packages are used straight from the cache,
 * copies for packages with different dependency sets are hard linked clones of the canonical folder.
 */
public class GlobalCacheInstaller implements FilesystemInstaller {

    @NotNull
    private final PackageCache cache;

    public GlobalCacheInstaller(@NotNull PackageCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache may not be null");
    }

    @Override
    @NotNull
    public CompletableFuture<Void> cachePackages(@NotNull Collection<ResolvedPackage> packages, @NotNull Executor executor) {
        List<CompletableFuture<?>> futures = new ArrayList<>();
        for (ResolvedPackage pkg : packages) {
            CompletableFuture<?> future = this.cache.ensurePackage(pkg.getPackageVersion(), pkg.dist(), executor);
            if (pkg.copyIndex() != 0) {
                future = future.thenApplyAsync((canonicalFolder) -> {
                    try {
                        return this.cache.ensureCopy(pkg.getCacheFolderId());
                    } catch (IOException e) {
                        throw new CompletionException(e);
                    }
                }, executor);
            }
            futures.add(future);
        }
        return ConcurrencyUtil.allOf(futures);
    }
}
