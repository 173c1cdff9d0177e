package org.stianloader.picoinstall.installer;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageIdentity.NpmPackageId;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.cache.CacheFolderId;
import org.stianloader.picoinstall.lockfile.NpmPackageInfo;
import org.stianloader.picoinstall.registry.DistInfo;
import org.stianloader.picoinstall.registry.PackageVersionInfo;

/**
 * A package as resolved by a {@link DependencyResolver}. Dependency maps go from the name the
 * dependency is required under to the id of the package it resolved to.
 *
 * @param id The id of the package, including the peer dependency suffix if any
 * @param copyIndex The cache folder copy the package is installed into
 * @param dist Where the tarball of the package can be found
 * @param dependencies The resolved dependencies
 * @param optionalDependencies The resolved optional dependencies
 * @param optionalPeers The resolved optional peer dependencies
 * @param os The operating systems the package supports, empty for all
 * @param cpu The cpu architectures the package supports, empty for all
 * @param deprecated Whether the version is deprecated
 * @param hasScripts Whether the package declares install scripts
 * @param hasBin Whether the package provides executables
 */
public final record ResolvedPackage(@NotNull NpmPackageId id,
        int copyIndex,
        @NotNull DistInfo dist,
        @NotNull SortedMap<String, String> dependencies,
        @NotNull SortedMap<String, String> optionalDependencies,
        @NotNull SortedMap<String, String> optionalPeers,
        @NotNull List<String> os,
        @NotNull List<String> cpu,
        boolean deprecated,
        boolean hasScripts,
        boolean hasBin) {

    public ResolvedPackage {
        Objects.requireNonNull(id, "id may not be null");
        Objects.requireNonNull(dist, "dist may not be null");
        if (copyIndex < 0) {
            throw new IllegalArgumentException("copyIndex may not be negative, got " + copyIndex);
        }
        dependencies = Collections.unmodifiableSortedMap(new TreeMap<>(dependencies));
        optionalDependencies = Collections.unmodifiableSortedMap(new TreeMap<>(optionalDependencies));
        optionalPeers = Collections.unmodifiableSortedMap(new TreeMap<>(optionalPeers));
        os = List.copyOf(os);
        cpu = List.copyOf(cpu);
    }

    @NotNull
    @Contract(pure = true)
    public static ResolvedPackage of(@NotNull NpmPackageId id, int copyIndex, @NotNull DistInfo dist, @NotNull Map<String, String> dependencies) {
        return new ResolvedPackage(id, copyIndex, dist, new TreeMap<>(dependencies), new TreeMap<>(), new TreeMap<>(),
                Collections.emptyList(), Collections.emptyList(), false, false, false);
    }

    /**
     * Creates a resolved package from the registry metadata of its version. Resolved dependencies that the
     * metadata lists as optional dependencies or as optional peer dependencies are sorted into the respective
     * map, every other resolved dependency is a regular dependency.
     *
     * @param id The id of the package
     * @param copyIndex The cache folder copy the package is installed into
     * @param info The registry metadata of the version
     * @param resolvedDependencies The ids the dependencies resolved to, keyed by the name they are required under
     * @return The resolved package
     * @throws IllegalArgumentException If the metadata lacks the "dist" section
     */
    @NotNull
    @Contract(pure = true)
    public static ResolvedPackage fromVersionInfo(@NotNull NpmPackageId id, int copyIndex, @NotNull PackageVersionInfo info, @NotNull Map<String, String> resolvedDependencies) {
        DistInfo dist = info.getDist();
        if (dist == null) {
            throw new IllegalArgumentException("Registry metadata of " + id + " does not have a \"dist\" section");
        }
        SortedMap<String, String> dependencies = new TreeMap<>();
        SortedMap<String, String> optionalDependencies = new TreeMap<>();
        SortedMap<String, String> optionalPeers = new TreeMap<>();
        resolvedDependencies.forEach((name, depId) -> {
            if (info.getOptionalDependencies().containsKey(name)) {
                optionalDependencies.put(name, depId);
            } else if (info.getPeerDependencies().containsKey(name) && info.isOptionalPeer(name)) {
                optionalPeers.put(name, depId);
            } else {
                dependencies.put(name, depId);
            }
        });
        return new ResolvedPackage(id, copyIndex, dist, dependencies, optionalDependencies, optionalPeers,
                info.getOs(), info.getCpu(), info.isDeprecated(), info.hasInstallScripts(), info.hasBin());
    }

    @NotNull
    @Contract(pure = true)
    public PackageVersion getPackageVersion() {
        return this.id.toPackageVersion();
    }

    @NotNull
    @Contract(pure = true)
    public CacheFolderId getCacheFolderId() {
        return new CacheFolderId(this.getPackageVersion(), this.copyIndex);
    }

    /**
     * Converts the package to its lockfile entry. The "integrity" field of the dist information
     * is recorded, or the legacy sha1 "shasum" if the registry did not provide it. The tarball location is
     * only recorded if it differs from the default location of the registry.
     *
     * @param registryBase The base URI of the registry the package was resolved from
     * @return The lockfile entry
     */
    @NotNull
    @Contract(pure = true)
    public NpmPackageInfo toLockfileInfo(@NotNull URI registryBase) {
        String integrity = this.dist.getIntegrityText();
        if (integrity == null) {
            integrity = this.dist.getShasum();
        }
        String tarball = this.dist.isDefaultTarball(registryBase, this.getPackageVersion()) ? null : this.dist.getTarball();
        return new NpmPackageInfo(integrity, this.dependencies, this.optionalDependencies, this.optionalPeers,
                this.os, this.cpu, tarball, this.deprecated, this.hasScripts, this.hasBin);
    }
}
