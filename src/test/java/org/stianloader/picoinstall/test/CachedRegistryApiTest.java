package org.stianloader.picoinstall.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.cache.CacheSetting;
import org.stianloader.picoinstall.cache.CachedRegistryApi;
import org.stianloader.picoinstall.cache.PackageCache;
import org.stianloader.picoinstall.registry.PackageInfo;
import org.stianloader.picoinstall.registry.PackageNotFoundException;
import org.stianloader.picoinstall.registry.PackageVersionInfo;

public class CachedRegistryApiTest {

    private static final String CHALK_METADATA = "{\"name\":\"chalk\",\"dist-tags\":{\"latest\":\"5.0.0\"},"
            + "\"versions\":{\"5.0.0\":{\"name\":\"chalk\",\"version\":\"5.0.0\","
            + "\"dist\":{\"tarball\":\"https://registry.example:8443/chalk/-/chalk-5.0.0.tgz\",\"integrity\":\"sha512-abc\"},"
            + "\"dependencies\":{\"ansi-styles\":\"^6.0.0\"}}}}";

    @Test
    public void testFetchesOnceAndCaches(@TempDir Path dir) throws Exception {
        StubRegistryTransport transport = new StubRegistryTransport().serve("chalk", CHALK_METADATA.getBytes(StandardCharsets.UTF_8));
        PackageCache cache = new PackageCache(dir, transport, CacheSetting.USE);
        CachedRegistryApi api = new CachedRegistryApi(cache, transport);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CompletableFuture<PackageInfo> first = api.packageInfo("chalk", executor);
            CompletableFuture<PackageInfo> second = api.packageInfo("chalk", executor);
            assertSame(first.get(), second.get());
            assertEquals("5.0.0", first.get().getDistTags().get("latest"));
        } finally {
            executor.shutdown();
        }
        assertEquals(1, transport.getFetchCount("chalk"));
        assertTrue(Files.isRegularFile(cache.getMetadataFile("chalk")));

        // A fresh instance reads the metadata from disk
        CachedRegistryApi fromDisk = new CachedRegistryApi(cache, transport);
        PackageVersionInfo version = fromDisk.packageVersionInfo(new PackageVersion("chalk", "5.0.0"), Runnable::run).get();
        assertEquals("^6.0.0", version.getDependencies().get("ansi-styles"));
        assertNotNull(version.getDist());
        assertEquals("sha512-abc", version.getDist().getIntegrityText());
        assertEquals(1, transport.getFetchCount("chalk"));
    }

    @Test
    public void testScopedPackageURI(@TempDir Path dir) throws Exception {
        StubRegistryTransport transport = new StubRegistryTransport().serve("@scope%2fpkg", "{\"name\":\"@scope/pkg\",\"versions\":{}}".getBytes(StandardCharsets.UTF_8));
        CachedRegistryApi api = new CachedRegistryApi(new PackageCache(dir, transport, CacheSetting.USE), transport);
        assertEquals("@scope/pkg", api.packageInfo("@scope/pkg", Runnable::run).get().getName());
    }

    @Test
    public void testMissingPackage(@TempDir Path dir) throws Exception {
        StubRegistryTransport transport = new StubRegistryTransport();
        CachedRegistryApi api = new CachedRegistryApi(new PackageCache(dir, transport, CacheSetting.USE), transport);
        ExecutionException e = assertThrows(ExecutionException.class, () -> api.packageInfo("absent", Runnable::run).get());
        assertInstanceOf(PackageNotFoundException.class, e.getCause());

        // Failures are not remembered
        transport.serve("absent", "{\"name\":\"absent\",\"versions\":{}}".getBytes(StandardCharsets.UTF_8));
        assertEquals("absent", api.packageInfo("absent", Runnable::run).get().getName());
    }

    @Test
    public void testMissingVersion(@TempDir Path dir) {
        StubRegistryTransport transport = new StubRegistryTransport().serve("chalk", CHALK_METADATA.getBytes(StandardCharsets.UTF_8));
        CachedRegistryApi api = new CachedRegistryApi(new PackageCache(dir, transport, CacheSetting.USE), transport);
        ExecutionException e = assertThrows(ExecutionException.class, () -> api.packageVersionInfo(new PackageVersion("chalk", "9.9.9"), Runnable::run).get());
        assertInstanceOf(PackageNotFoundException.class, e.getCause());
    }

    @Test
    public void testMalformedCacheIsRefetched(@TempDir Path dir) throws Exception {
        StubRegistryTransport transport = new StubRegistryTransport().serve("chalk", CHALK_METADATA.getBytes(StandardCharsets.UTF_8));
        PackageCache cache = new PackageCache(dir, transport, CacheSetting.USE);
        Files.createDirectories(cache.getMetadataFile("chalk").getParent());
        Files.writeString(cache.getMetadataFile("chalk"), "{\"versions\": [", StandardCharsets.UTF_8);

        PackageInfo info = new CachedRegistryApi(cache, transport).packageInfo("chalk", Runnable::run).get();
        assertEquals("chalk", info.getName());
        assertEquals(1, transport.getFetchCount("chalk"));
    }

    @Test
    public void testCacheOnly(@TempDir Path dir) throws Exception {
        StubRegistryTransport transport = new StubRegistryTransport().serve("chalk", CHALK_METADATA.getBytes(StandardCharsets.UTF_8));
        new CachedRegistryApi(new PackageCache(dir, transport, CacheSetting.USE), transport).packageInfo("chalk", Runnable::run).get();

        CachedRegistryApi offline = new CachedRegistryApi(new PackageCache(dir, transport, CacheSetting.ONLY), transport);
        assertEquals("chalk", offline.packageInfo("chalk", Runnable::run).get().getName());
        ExecutionException e = assertThrows(ExecutionException.class, () -> offline.packageInfo("lodash", Runnable::run).get());
        assertInstanceOf(PackageNotFoundException.class, e.getCause());
        assertEquals(1, transport.getTotalFetchCount());
    }

    @Test
    public void testClearMemoryCacheUnderReload(@TempDir Path dir) throws Exception {
        StubRegistryTransport transport = new StubRegistryTransport().serve("chalk", CHALK_METADATA.getBytes(StandardCharsets.UTF_8));
        CachedRegistryApi api = new CachedRegistryApi(new PackageCache(dir, transport, CacheSetting.RELOAD_ALL), transport);

        api.packageInfo("chalk", Runnable::run).get();
        api.packageInfo("chalk", Runnable::run).get();
        assertEquals(1, transport.getFetchCount("chalk"));

        // The cached registry.json is not trusted, so the registry is queried again
        api.clearMemoryCache("chalk");
        api.packageInfo("chalk", Runnable::run).get();
        assertEquals(2, transport.getFetchCount("chalk"));
    }
}
