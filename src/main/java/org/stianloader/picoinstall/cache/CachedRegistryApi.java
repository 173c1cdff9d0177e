package org.stianloader.picoinstall.cache;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;
import org.stianloader.picoinstall.logging.LoggingAdapter;
import org.stianloader.picoinstall.registry.PackageInfo;
import org.stianloader.picoinstall.registry.PackageNotFoundException;
import org.stianloader.picoinstall.registry.RegistryApi;
import org.stianloader.picoinstall.registry.RegistryTransport;

import com.google.gson.JsonParseException;

/**
 * A {@link RegistryApi} that serves package metadata from memory, then from the {@link PackageCache},
 * and only then from the registry itself. Metadata fetched from the registry is written back to the cache.
 *
 * <p>Concurrent lookups of the same package share a single lookup. Failed lookups are forgotten so that
 * they can be retried.
 */
public class CachedRegistryApi implements RegistryApi {

    @NotNull
    private final PackageCache cache;
    @NotNull
    private final RegistryTransport transport;
    @NotNull
    private final ConcurrentMap<String, CompletableFuture<PackageInfo>> memoryCache = new ConcurrentHashMap<>();

    public CachedRegistryApi(@NotNull PackageCache cache, @NotNull RegistryTransport transport) {
        this.cache = Objects.requireNonNull(cache, "cache may not be null");
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public URI getBaseURI() {
        return this.transport.getBaseURI();
    }

    @Override
    @NotNull
    public CompletableFuture<PackageInfo> packageInfo(@NotNull String packageName, @NotNull Executor executor) {
        CompletableFuture<PackageInfo> created = new CompletableFuture<>();
        CompletableFuture<PackageInfo> existing = this.memoryCache.putIfAbsent(packageName, created);
        if (existing != null) {
            return existing;
        }

        ConcurrencyUtil.schedule(() -> {
            return this.loadCached(packageName);
        }, executor).thenCompose((cached) -> {
            if (cached != null) {
                return CompletableFuture.completedFuture(cached);
            }
            if (this.cache.getCacheSetting().getMode() == CacheSetting.Mode.ONLY) {
                throw new CompletionException(new PackageNotFoundException(packageName, "npm package not found in cache: \"" + packageName + "\", --cached-only is specified."));
            }
            return this.fetch(packageName, executor);
        }).whenComplete((info, ex) -> {
            if (ex != null) {
                this.memoryCache.remove(packageName, created);
                created.completeExceptionally(ConcurrencyUtil.unwrap(ex));
            } else {
                created.complete(info);
            }
        });

        return created;
    }

    @Nullable
    private PackageInfo loadCached(@NotNull String packageName) throws IOException {
        if (!this.cache.getCacheSetting().shouldUse(packageName)) {
            return null;
        }
        try {
            return this.cache.loadMetadata(packageName);
        } catch (JsonParseException e) {
            LoggingAdapter.getDefaultLogger().warn(CachedRegistryApi.class, "Ignoring malformed registry metadata of \"{}\" at {}", packageName, this.cache.getMetadataFile(packageName), e);
            return null;
        }
    }

    @NotNull
    private CompletableFuture<PackageInfo> fetch(@NotNull String packageName, @NotNull Executor executor) {
        return this.transport.fetch(this.transport.getPackageInfoURI(packageName), executor).thenApply((data) -> {
            PackageInfo info;
            try {
                info = PackageCache.getGson().fromJson(new String(data, StandardCharsets.UTF_8), PackageInfo.class);
            } catch (JsonParseException e) {
                throw new CompletionException(new IOException("Registry returned malformed metadata for \"" + packageName + "\"", e));
            }
            if (info == null) {
                throw new CompletionException(new IOException("Registry returned empty metadata for \"" + packageName + "\""));
            }
            try {
                this.cache.saveMetadata(packageName, info);
            } catch (IOException e) {
                // The metadata is still usable, it just needs to be fetched again next time
                LoggingAdapter.getDefaultLogger().warn(CachedRegistryApi.class, "Failed to cache registry metadata of \"{}\"", packageName, e);
            }
            return info;
        });
    }

    /**
     * Forgets the in-memory metadata of a package, so that the next lookup reads the cache or the registry again.
     *
     * @param packageName The name of the package
     */
    public void clearMemoryCache(@NotNull String packageName) {
        this.memoryCache.remove(packageName);
    }
}
