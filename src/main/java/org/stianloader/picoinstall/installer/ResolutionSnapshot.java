package org.stianloader.picoinstall.installer;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageIdentity.NpmPackageId;
import org.stianloader.picoinstall.PackageRequirement;

/**
 * An immutable view of the packages a {@link DependencyResolver} resolved so far.
 */
public final class ResolutionSnapshot {

    @NotNull
    public static final ResolutionSnapshot EMPTY = new ResolutionSnapshot(Collections.emptyMap(), Collections.emptyList());

    @NotNull
    private final Map<PackageRequirement, NpmPackageId> roots;
    @NotNull
    private final Map<NpmPackageId, ResolvedPackage> packages;

    /**
     * Creates a snapshot.
     *
     * @param roots The requirements that were resolved, mapped to the package they resolved to
     * @param packages Every package of the resolution
     * @throws IllegalArgumentException If a root resolved to a package that is not part of the resolution
     */
    public ResolutionSnapshot(@NotNull Map<PackageRequirement, NpmPackageId> roots, @NotNull Collection<ResolvedPackage> packages) {
        Map<NpmPackageId, ResolvedPackage> packageMap = new LinkedHashMap<>();
        for (ResolvedPackage pkg : packages) {
            packageMap.put(pkg.id(), pkg);
        }
        roots.forEach((req, id) -> {
            if (!packageMap.containsKey(Objects.requireNonNull(id, "root ids may not be null"))) {
                throw new IllegalArgumentException("Requirement " + req + " resolved to " + id + ", which is not part of the resolution");
            }
        });
        this.roots = Collections.unmodifiableMap(new LinkedHashMap<>(roots));
        this.packages = Collections.unmodifiableMap(packageMap);
    }

    @Nullable
    @Contract(pure = true)
    public ResolvedPackage resolveRequirement(@NotNull PackageRequirement req) {
        NpmPackageId id = this.roots.get(req);
        if (id == null) {
            return null;
        }
        return this.packages.get(id);
    }

    @NotNull
    @Contract(pure = true)
    public Map<PackageRequirement, NpmPackageId> getRoots() {
        return this.roots;
    }

    @NotNull
    @Contract(pure = true)
    public Collection<ResolvedPackage> getPackages() {
        return this.packages.values();
    }

    @Nullable
    @Contract(pure = true)
    public ResolvedPackage getPackage(@NotNull NpmPackageId id) {
        return this.packages.get(id);
    }

    /**
     * Obtains the names of the packages the root requirements resolved to.
     *
     * @return The names of all top level packages
     */
    @NotNull
    @Contract(pure = true)
    public Set<String> getTopLevelPackageNames() {
        Set<String> names = new LinkedHashSet<>();
        for (NpmPackageId id : this.roots.values()) {
            names.add(id.getName());
        }
        return names;
    }
}
