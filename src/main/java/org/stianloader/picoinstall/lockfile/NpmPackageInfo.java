package org.stianloader.picoinstall.lockfile;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The lockfile entry of a resolved npm package. Dependencies map the name under which the dependency is
 * required to the id of the resolved package (e.g. {@code "ansi-styles" -> "ansi-styles@4.1.0"}).
 *
 * @param integrity The integrity of the tarball, null for packages that are not fetched from a registry
 * @param dependencies The resolved dependencies
 * @param optionalDependencies The resolved optional dependencies
 * @param optionalPeers The resolved optional peer dependencies
 * @param os The operating systems the package is restricted to, empty if not restricted
 * @param cpu The cpu architectures the package is restricted to, empty if not restricted
 * @param tarball The tarball location if it deviates from the registry default
 * @param deprecated Whether the version is deprecated
 * @param scripts Whether the package has lifecycle scripts
 * @param bin Whether the package provides executables
 */
public final record NpmPackageInfo(@Nullable String integrity,
        @NotNull SortedMap<String, String> dependencies,
        @NotNull SortedMap<String, String> optionalDependencies,
        @NotNull SortedMap<String, String> optionalPeers,
        @NotNull List<String> os,
        @NotNull List<String> cpu,
        @Nullable String tarball,
        boolean deprecated,
        boolean scripts,
        boolean bin) {

    public NpmPackageInfo {
        dependencies = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(dependencies, "dependencies may not be null")));
        optionalDependencies = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(optionalDependencies, "optionalDependencies may not be null")));
        optionalPeers = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(optionalPeers, "optionalPeers may not be null")));
        os = List.copyOf(Objects.requireNonNull(os, "os may not be null"));
        cpu = List.copyOf(Objects.requireNonNull(cpu, "cpu may not be null"));
    }

    @NotNull
    @Contract(pure = true)
    public static NpmPackageInfo of(@Nullable String integrity, @NotNull Map<String, String> dependencies) {
        return new NpmPackageInfo(integrity, new TreeMap<>(dependencies), new TreeMap<>(), new TreeMap<>(),
                Collections.emptyList(), Collections.emptyList(), null, false, false, false);
    }

    /**
     * Creates a copy of this entry that only retains the dependencies whose package id passes the filter.
     *
     * @param keepId The filter applied to the package ids of all dependency kinds
     * @return The filtered copy, or this instance if nothing was filtered out
     */
    @NotNull
    @Contract(pure = true)
    public NpmPackageInfo retainDependencies(@NotNull Predicate<String> keepId) {
        SortedMap<String, String> deps = NpmPackageInfo.filter(this.dependencies, keepId);
        SortedMap<String, String> optionalDeps = NpmPackageInfo.filter(this.optionalDependencies, keepId);
        SortedMap<String, String> peers = NpmPackageInfo.filter(this.optionalPeers, keepId);
        if (deps.size() == this.dependencies.size() && optionalDeps.size() == this.optionalDependencies.size() && peers.size() == this.optionalPeers.size()) {
            return this;
        }
        return new NpmPackageInfo(this.integrity, deps, optionalDeps, peers, this.os, this.cpu, this.tarball, this.deprecated, this.scripts, this.bin);
    }

    @NotNull
    private static SortedMap<String, String> filter(@NotNull SortedMap<String, String> source, @NotNull Predicate<String> keepId) {
        SortedMap<String, String> filtered = new TreeMap<>();
        source.forEach((name, id) -> {
            if (keepId.test(id)) {
                filtered.put(name, id);
            }
        });
        return filtered;
    }
}
