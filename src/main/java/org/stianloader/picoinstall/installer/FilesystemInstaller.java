package org.stianloader.picoinstall.installer;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;

/**
 * Places resolved packages on disk.
 */
public interface FilesystemInstaller {

    /**
     * Makes sure every given package is present on disk. Packages that already are present are left as-is.
     *
     * @param packages The packages to install
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes once all packages are present
     */
    @NotNull
    CompletableFuture<Void> cachePackages(@NotNull Collection<ResolvedPackage> packages, @NotNull Executor executor);
}
