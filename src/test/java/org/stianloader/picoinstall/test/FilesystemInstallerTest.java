package org.stianloader.picoinstall.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picoinstall.PackageIdentity.NpmPackageId;
import org.stianloader.picoinstall.cache.CacheSetting;
import org.stianloader.picoinstall.cache.FolderSyncLock;
import org.stianloader.picoinstall.cache.PackageCache;
import org.stianloader.picoinstall.installer.GlobalCacheInstaller;
import org.stianloader.picoinstall.installer.LocalDirectoryInstaller;
import org.stianloader.picoinstall.installer.ResolvedPackage;
import org.stianloader.picoinstall.registry.DistInfo;

public class FilesystemInstallerTest {

    @Test
    public void testGlobalCacheWithCopies(@TempDir Path dir) throws Exception {
        byte[] tarball = TarballFixtures.simplePackage("chalk");
        StubRegistryTransport transport = new StubRegistryTransport().serve("chalk.tgz", tarball);
        PackageCache cache = new PackageCache(dir, transport, CacheSetting.USE);
        DistInfo dist = new DistInfo("chalk.tgz", null, TarballFixtures.sha512Integrity(tarball));

        ResolvedPackage canonical = ResolvedPackage.of(new NpmPackageId("chalk@5.0.0"), 0, dist, Collections.emptyMap());
        ResolvedPackage copy = ResolvedPackage.of(new NpmPackageId("chalk@5.0.0_supports-color@9.0.0"), 1, dist, Collections.emptyMap());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            new GlobalCacheInstaller(cache).cachePackages(List.of(canonical, copy), executor).get();
        } finally {
            executor.shutdown();
        }
        assertTrue(FolderSyncLock.isComplete(cache.getPackageFolder(canonical.getCacheFolderId())));
        assertTrue(FolderSyncLock.isComplete(cache.getPackageFolder(copy.getCacheFolderId())));
        assertTrue(Files.isRegularFile(dir.resolve("registry.example_8443/chalk/5.0.0_1/package.json")));
        assertEquals(1, transport.getFetchCount("chalk.tgz"));
    }

    @Test
    public void testGlobalCacheReportsFailures(@TempDir Path dir) {
        StubRegistryTransport transport = new StubRegistryTransport();
        PackageCache cache = new PackageCache(dir, transport, CacheSetting.USE);
        ResolvedPackage missing = ResolvedPackage.of(new NpmPackageId("missing@1.0.0"), 0, new DistInfo("missing.tgz", null, null), Collections.emptyMap());
        assertThrows(ExecutionException.class, () -> new GlobalCacheInstaller(cache).cachePackages(List.of(missing), Runnable::run).get());
    }

    @Test
    public void testLocalDirectory(@TempDir Path dir) throws Exception {
        byte[] tarball = TarballFixtures.simplePackage("scoped");
        StubRegistryTransport transport = new StubRegistryTransport().serve("scoped.tgz", tarball);
        PackageCache cache = new PackageCache(dir.resolve("cache"), transport, CacheSetting.USE);
        DistInfo dist = new DistInfo("scoped.tgz", null, TarballFixtures.sha512Integrity(tarball));
        ResolvedPackage pkg = ResolvedPackage.of(new NpmPackageId("@scope/pkg@1.0.0"), 2, dist, Collections.emptyMap());

        LocalDirectoryInstaller installer = new LocalDirectoryInstaller(cache, dir.resolve("node_modules/.deno"));
        installer.cachePackages(List.of(pkg), Runnable::run).get();

        Path local = dir.resolve("node_modules/.deno/@scope+pkg@1.0.0_2");
        assertEquals(local, installer.getLocalFolder(pkg));
        assertTrue(FolderSyncLock.isComplete(local));
        assertEquals("module.exports = 'scoped';", Files.readString(local.resolve("lib/index.js"), StandardCharsets.UTF_8));

        // Installing again is a no-op
        installer.cachePackages(List.of(pkg), Runnable::run).get();
        assertEquals(1, transport.getFetchCount("scoped.tgz"));
    }

    @Test
    public void testLocalDirectoryRelinkedOnReload(@TempDir Path dir) throws Exception {
        byte[] tarball = TarballFixtures.simplePackage("pkg");
        StubRegistryTransport transport = new StubRegistryTransport().serve("pkg.tgz", tarball);
        DistInfo dist = new DistInfo("pkg.tgz", null, TarballFixtures.sha512Integrity(tarball));
        ResolvedPackage pkg = ResolvedPackage.of(new NpmPackageId("pkg@1.0.0"), 0, dist, Collections.emptyMap());
        Path localRoot = dir.resolve("node_modules/.deno");

        LocalDirectoryInstaller installer = new LocalDirectoryInstaller(new PackageCache(dir.resolve("cache"), transport, CacheSetting.USE), localRoot);
        installer.cachePackages(List.of(pkg), Runnable::run).get();
        Path local = installer.getLocalFolder(pkg);
        Files.writeString(local.resolve("package.json"), "CORRUPT", StandardCharsets.UTF_8);

        LocalDirectoryInstaller reloading = new LocalDirectoryInstaller(new PackageCache(dir.resolve("cache"), transport, CacheSetting.RELOAD_ALL), localRoot);
        reloading.cachePackages(List.of(pkg), Runnable::run).get();
        assertEquals("{\"name\":\"pkg\"}", Files.readString(local.resolve("package.json"), StandardCharsets.UTF_8));
        assertEquals(2, transport.getFetchCount("pkg.tgz"));
    }
}
