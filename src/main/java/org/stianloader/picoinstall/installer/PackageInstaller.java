package org.stianloader.picoinstall.installer;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageIdentity.NpmPackageId;
import org.stianloader.picoinstall.PackageKind;
import org.stianloader.picoinstall.PackageRequirement;
import org.stianloader.picoinstall.lockfile.Lockfile;
import org.stianloader.picoinstall.logging.LoggingAdapter;
import org.stianloader.picoinstall.registry.RegistryApi;

/**
 * Ties dependency resolution, the lockfile and the placement of packages on disk together.
 *
 * <p>The methods of this class may be called concurrently. Resolution is delegated to the {@link DependencyResolver},
 * whose snapshots are written to the lockfile (if one is set) and handed to the {@link FilesystemInstaller}.
 * Installing packages on disk is serialized through a {@link TaskQueue} so that overlapping requests of
 * several callers only install each package once. Which packages were installed already is remembered
 * per instance.
 */
public class PackageInstaller {

    @NotNull
    public static final String DEFAULT_IMPLICIT_TYPES_PACKAGE = "@types/node";

    @NotNull
    private final DependencyResolver resolver;
    @NotNull
    private final FilesystemInstaller filesystemInstaller;
    @NotNull
    private final TaskQueue installQueue = new TaskQueue();
    @NotNull
    private final Set<NpmPackageId> cachedPackages = ConcurrentHashMap.newKeySet();
    @NotNull
    private final AtomicBoolean topLevelInstallAttempted = new AtomicBoolean();
    @Nullable
    private volatile Lockfile lockfile;
    /**
     * Lockfile revisions produced by this installer, keyed by the revision before a write and mapped to the revision after it.
     */
    @NotNull
    private final NavigableMap<Long, Long> ownLockfileRevisions = new TreeMap<>();
    @NotNull
    private volatile List<PackageRequirement> topLevelRequirements = Collections.emptyList();
    @NotNull
    private volatile URI registryBase = RegistryApi.DEFAULT_NPM_REGISTRY;
    @Nullable
    private volatile String implicitTypesPackage = PackageInstaller.DEFAULT_IMPLICIT_TYPES_PACKAGE;

    public PackageInstaller(@NotNull DependencyResolver resolver, @NotNull FilesystemInstaller filesystemInstaller) {
        this.resolver = Objects.requireNonNull(resolver, "resolver may not be null");
        this.filesystemInstaller = Objects.requireNonNull(filesystemInstaller, "filesystemInstaller may not be null");
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public PackageInstaller setLockfile(@Nullable Lockfile lockfile) {
        synchronized (this.ownLockfileRevisions) {
            this.ownLockfileRevisions.clear();
            this.lockfile = lockfile;
        }
        return this;
    }

    /**
     * Sets the registry the resolver obtains packages from. Tarball locations other than the registry's default
     * location are recorded in the lockfile. Defaults to {@link RegistryApi#DEFAULT_NPM_REGISTRY}.
     *
     * @param registryBase The registry base URI, ending with a slash
     * @return The current {@link PackageInstaller} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "!null -> this; null -> fail")
    public PackageInstaller setRegistryBase(@NotNull URI registryBase) {
        this.registryBase = Objects.requireNonNull(registryBase, "registryBase may not be null");
        return this;
    }

    /**
     * Sets the remote requirements the project declares, which are resolved by {@link #ensureTopLevelInstall(Executor)}.
     *
     * @param requirements The declared requirements
     * @return The current {@link PackageInstaller} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "!null -> this; null -> fail")
    public PackageInstaller setTopLevelRequirements(@NotNull Collection<PackageRequirement> requirements) {
        this.topLevelRequirements = List.copyOf(requirements);
        return this;
    }

    /**
     * Sets the package providing the type definitions of the platform, which is assumed to always be
     * present. Defaults to {@value #DEFAULT_IMPLICIT_TYPES_PACKAGE}.
     *
     * @param packageName The name of the npm package, or null to not inject any package
     * @return The current {@link PackageInstaller} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public PackageInstaller setImplicitTypesPackage(@Nullable String packageName) {
        this.implicitTypesPackage = packageName;
        return this;
    }

    @NotNull
    @Contract(pure = true)
    public ResolutionSnapshot getSnapshot() {
        return this.resolver.snapshot();
    }

    /**
     * Resolves requirements and records the resolution in the lockfile.
     *
     * <p>If the lockfile was changed by someone other than this installer while the requirements were resolved,
     * the returned future completes exceptionally with a {@link LockfileChangedException} and the lockfile is left untouched.
     *
     * @param requirements The requirements to resolve
     * @param caching Whether the resolved packages should be installed on disk
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes once the requirements are resolved (and installed, if requested)
     */
    @NotNull
    public CompletableFuture<Void> addRequirements(@NotNull Collection<PackageRequirement> requirements, boolean caching, @NotNull Executor executor) {
        return this.addRequirements(requirements, caching, false, executor);
    }

    @NotNull
    public CompletableFuture<Void> addAndCacheRequirements(@NotNull Collection<PackageRequirement> requirements, @NotNull Executor executor) {
        return this.addRequirements(requirements, true, false, executor);
    }

    @NotNull
    private CompletableFuture<Void> addRequirements(@NotNull Collection<PackageRequirement> requirements, boolean caching, boolean refreshMetadata, @NotNull Executor executor) {
        if (requirements.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        Lockfile lockfile = this.lockfile;
        long revision = lockfile == null ? 0L : lockfile.getRevision();

        return this.resolver.addRequirements(requirements, refreshMetadata, executor).thenCompose((snapshot) -> {
            if (lockfile != null) {
                this.writeToLockfile(lockfile, revision, snapshot);
            }
            if (!caching) {
                return CompletableFuture.completedFuture(null);
            }
            return this.cachePackages(executor);
        });
    }

    private void writeToLockfile(@NotNull Lockfile lockfile, long revisionBefore, @NotNull ResolutionSnapshot snapshot) {
        synchronized (lockfile) {
            long current = lockfile.getRevision();
            if (current - revisionBefore != this.countOwnRevisions(revisionBefore, current)) {
                throw new LockfileChangedException(lockfile.getFilename());
            }
            snapshot.getRoots().forEach((req, id) -> {
                if (req.kind() == PackageKind.NPM) {
                    lockfile.insertPackageSpecifier(req, id.getVersionAndSuffix());
                }
            });
            URI registryBase = this.registryBase;
            for (ResolvedPackage pkg : snapshot.getPackages()) {
                lockfile.insertNpmPackage(pkg.id().id(), pkg.toLockfileInfo(registryBase));
            }
            long after = lockfile.getRevision();
            if (after != current) {
                synchronized (this.ownLockfileRevisions) {
                    if (this.lockfile == lockfile) {
                        this.ownLockfileRevisions.put(current, after);
                    }
                }
            }
        }
    }

    /**
     * Counts the revision increments within {@code (from, to]} that were caused by writes of this installer.
     */
    private long countOwnRevisions(long from, long to) {
        long count = 0L;
        synchronized (this.ownLockfileRevisions) {
            for (Map.Entry<Long, Long> write : this.ownLockfileRevisions.entrySet()) {
                long start = Math.max(write.getKey(), from);
                long end = Math.min(write.getValue(), to);
                if (end > start) {
                    count += end - start;
                }
            }
        }
        return count;
    }

    /**
     * Installs every package of the current resolution that this installer did not install yet.
     *
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes once the packages are installed
     */
    @NotNull
    public CompletableFuture<Void> cachePackages(@NotNull Executor executor) {
        return this.installQueue.run(() -> {
            // The snapshot is taken once the permit is held, so that it includes the work of previous holders
            ResolutionSnapshot snapshot = this.resolver.snapshot();
            List<ResolvedPackage> missing = new ArrayList<>();
            for (ResolvedPackage pkg : snapshot.getPackages()) {
                if (!this.cachedPackages.contains(pkg.id())) {
                    missing.add(pkg);
                }
            }
            if (missing.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            LoggingAdapter.getDefaultLogger().debug(PackageInstaller.class, "Installing {} packages", missing.size());
            return this.filesystemInstaller.cachePackages(missing, executor).thenRun(() -> {
                for (ResolvedPackage pkg : missing) {
                    this.cachedPackages.add(pkg.id());
                }
            });
        });
    }

    /**
     * Resolves the top level requirements of the project, once. Nothing is done if every top level requirement
     * is already part of the resolution. Otherwise all of them are resolved again with refreshed registry metadata,
     * without installing them.
     *
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes once the top level requirements are resolved
     */
    @NotNull
    public CompletableFuture<Void> ensureTopLevelInstall(@NotNull Executor executor) {
        if (!this.topLevelInstallAttempted.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        List<PackageRequirement> requirements = new ArrayList<>();
        for (PackageRequirement req : this.topLevelRequirements) {
            if (req.kind() == PackageKind.NPM) {
                requirements.add(req);
            }
        }
        ResolutionSnapshot snapshot = this.resolver.snapshot();
        boolean allResolved = true;
        for (PackageRequirement req : requirements) {
            if (snapshot.resolveRequirement(req) == null) {
                allResolved = false;
                break;
            }
        }
        if (allResolved) {
            return CompletableFuture.completedFuture(null);
        }
        return this.addRequirements(requirements, false, true, executor);
    }

    /**
     * Adds the implicit types package as a requirement, unless a top level requirement already resolved to it.
     *
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes once the package is resolved
     */
    @NotNull
    public CompletableFuture<Void> injectImplicitTypesPackage(@NotNull Executor executor) {
        String packageName = this.implicitTypesPackage;
        if (packageName == null || this.resolver.snapshot().getTopLevelPackageNames().contains(packageName)) {
            return CompletableFuture.completedFuture(null);
        }
        return this.addRequirements(Collections.singletonList(PackageRequirement.npm(packageName, null)), false, false, executor);
    }
}
