package org.stianloader.picoinstall.test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageIdentity.NpmPackageId;
import org.stianloader.picoinstall.PackageRequirement;
import org.stianloader.picoinstall.installer.DependencyResolver;
import org.stianloader.picoinstall.installer.ResolutionSnapshot;
import org.stianloader.picoinstall.installer.ResolvedPackage;
import org.stianloader.picoinstall.registry.DistInfo;
import org.stianloader.picoinstall.registry.PackageNotFoundException;

/**
 * Resolves requirements through a fixed table. Every call waits for the gate that was set at the time of the call.
 */
class StubDependencyResolver implements DependencyResolver {

    final Map<PackageRequirement, ResolvedPackage> available = new ConcurrentHashMap<>();
    final List<Collection<PackageRequirement>> calls = Collections.synchronizedList(new ArrayList<>());
    final List<Boolean> refreshFlags = Collections.synchronizedList(new ArrayList<>());
    volatile CompletableFuture<Void> gate = CompletableFuture.completedFuture(null);
    private ResolutionSnapshot snapshot = ResolutionSnapshot.EMPTY;

    @NotNull
    StubDependencyResolver add(@NotNull String requirement, @NotNull String id) {
        this.available.put(PackageRequirement.parse(requirement),
                ResolvedPackage.of(new NpmPackageId(id), 0, new DistInfo(id + ".tgz", null, "sha512-" + id), Collections.emptyMap()));
        return this;
    }

    @Override
    @NotNull
    public synchronized ResolutionSnapshot snapshot() {
        return this.snapshot;
    }

    @Override
    @NotNull
    public CompletableFuture<ResolutionSnapshot> addRequirements(@NotNull Collection<PackageRequirement> requirements, boolean refreshMetadata, @NotNull Executor executor) {
        this.calls.add(List.copyOf(requirements));
        this.refreshFlags.add(refreshMetadata);
        return this.gate.thenApplyAsync((ignored) -> {
            synchronized (this) {
                Map<PackageRequirement, NpmPackageId> roots = new LinkedHashMap<>(this.snapshot.getRoots());
                List<ResolvedPackage> packages = new ArrayList<>(this.snapshot.getPackages());
                for (PackageRequirement req : requirements) {
                    ResolvedPackage pkg = this.available.get(req);
                    if (pkg == null) {
                        throw new CompletionException(new PackageNotFoundException(req.name(), "No such package: " + req));
                    }
                    roots.put(req, pkg.id());
                    if (this.snapshot.getPackage(pkg.id()) == null && !packages.contains(pkg)) {
                        packages.add(pkg);
                    }
                }
                this.snapshot = new ResolutionSnapshot(roots, packages);
                return this.snapshot;
            }
        }, executor);
    }
}
