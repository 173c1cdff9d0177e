package org.stianloader.picoinstall.registry;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageVersion;

/**
 * Access to the metadata of an npm-style registry, as consumed by dependency resolvers.
 */
public interface RegistryApi {

    @NotNull
    URI DEFAULT_NPM_REGISTRY = URI.create("https://registry.npmjs.org/");

    /**
     * Obtains the root of the registry, which default tarball locations are relative to.
     *
     * @return The registry base URI, ending with a slash
     */
    @NotNull
    @Contract(pure = true)
    URI getBaseURI();

    /**
     * Obtains the metadata of all versions of a package.
     *
     * @param packageName The name of the package
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes with the package metadata, or exceptionally with a
     * {@link PackageNotFoundException} if the package does not exist
     */
    @NotNull
    CompletableFuture<PackageInfo> packageInfo(@NotNull String packageName, @NotNull Executor executor);

    /**
     * Obtains the metadata of a single version of a package.
     *
     * @param nv The package version
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes with the version metadata, or exceptionally with a
     * {@link PackageNotFoundException} if the package or the version does not exist
     */
    @NotNull
    default CompletableFuture<PackageVersionInfo> packageVersionInfo(@NotNull PackageVersion nv, @NotNull Executor executor) {
        return this.packageInfo(nv.name(), executor).thenApply((info) -> {
            PackageVersionInfo versionInfo = info.getVersion(nv.version());
            if (versionInfo == null) {
                throw new CompletionException(new PackageNotFoundException(nv.name(), "Could not find version \"" + nv.version() + "\" of package \"" + nv.name() + "\""));
            }
            return versionInfo;
        });
    }
}
