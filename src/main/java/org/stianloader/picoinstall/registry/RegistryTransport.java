package org.stianloader.picoinstall.registry;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Fetches raw bytes from a package registry. Implementations perform the actual network I/O and
 * are free to block the threads of the supplied executor while doing so.
 */
public interface RegistryTransport {

    /**
     * Fetches the resource at the given location.
     *
     * <p>The returned future completes exceptionally with a {@link PackageNotFoundException} if
     * the registry reports the resource as absent and with another {@link java.io.IOException} on
     * transient failures.
     *
     * @param uri The absolute location of the resource
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future holding the raw bytes of the resource
     */
    @NotNull
    CompletableFuture<byte[]> fetch(@NotNull URI uri, @NotNull Executor executor);

    /**
     * Obtains the location of the registry root, which package metadata is resolved against.
     * The returned URI always ends with a slash.
     *
     * @return The registry base URI
     */
    @NotNull
    @Contract(pure = true)
    URI getBaseURI();

    @NotNull
    @Contract(pure = true)
    String getRegistryId();

    /**
     * Obtains the location of the metadata document of a package. Scoped names have their slash encoded
     * as the npm registry protocol expects.
     *
     * @param packageName The name of the package
     * @return The location of the package's metadata
     */
    @NotNull
    @Contract(pure = true)
    default URI getPackageInfoURI(@NotNull String packageName) {
        return this.getBaseURI().resolve(packageName.replace("/", "%2f"));
    }
}
