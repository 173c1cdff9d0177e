package org.stianloader.picoinstall.test;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;
import org.stianloader.picoinstall.registry.PackageNotFoundException;
import org.stianloader.picoinstall.registry.RegistryTransport;

/**
 * Serves resources from memory and counts how often each of them was fetched.
 */
class StubRegistryTransport implements RegistryTransport {

    static final URI BASE = URI.create("https://registry.example:8443/");

    final Map<URI, byte[]> resources = new ConcurrentHashMap<>();
    final Map<URI, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();

    @NotNull
    StubRegistryTransport serve(@NotNull String path, byte @NotNull[] data) {
        this.resources.put(BASE.resolve(path), data);
        return this;
    }

    int getFetchCount(@NotNull String path) {
        AtomicInteger count = this.fetchCounts.get(BASE.resolve(path));
        return count == null ? 0 : count.get();
    }

    int getTotalFetchCount() {
        return this.fetchCounts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    @Override
    @NotNull
    public CompletableFuture<byte[]> fetch(@NotNull URI uri, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> {
            this.fetchCounts.computeIfAbsent(uri, (ignored) -> new AtomicInteger()).incrementAndGet();
            byte[] data = this.resources.get(uri);
            if (data == null) {
                throw new PackageNotFoundException(uri.getPath(), "404 Not Found: " + uri);
            }
            return data;
        }, executor);
    }

    @Override
    @NotNull
    public URI getBaseURI() {
        return BASE;
    }

    @Override
    @NotNull
    public String getRegistryId() {
        return "stub";
    }
}
