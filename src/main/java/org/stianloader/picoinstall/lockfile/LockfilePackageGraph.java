package org.stianloader.picoinstall.lockfile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageIdentity;
import org.stianloader.picoinstall.PackageIdentity.JsrPackageId;
import org.stianloader.picoinstall.PackageIdentity.NpmPackageId;
import org.stianloader.picoinstall.PackageRequirement;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.logging.LoggingAdapter;

/**
 * The in-memory graph of all packages of a lockfile, used to prune entries that are no longer
 * reachable after the declared dependencies changed.
 *
 * <p>Packages are stored in a table keyed by their {@link PackageIdentity}. Instead of holding references
 * to each other, every package records the identities of the packages depending on it (the dependents).
 * The dependents sets are the exact transpose of the dependency edges. Dependencies of JSR packages are
 * requirements that are resolved through the root map, which mirrors the "specifiers" table of the lockfile.
 *
 * <p>Instances are not thread safe.
 */
public final class LockfilePackageGraph {

    private static final class GraphPackage {
        @NotNull
        private final Set<PackageIdentity> dependents = new LinkedHashSet<>();
        @Nullable
        private final NpmPackageInfo npmInfo;
        @Nullable
        private final JsrPackageInfo jsrInfo;

        private GraphPackage(@Nullable NpmPackageInfo npmInfo, @Nullable JsrPackageInfo jsrInfo) {
            this.npmInfo = npmInfo;
            this.jsrInfo = jsrInfo;
        }
    }

    /**
     * The location JSR packages are downloaded from. Remote checksums below this URL belong to JSR packages.
     */
    @NotNull
    public static final String DEFAULT_JSR_URL = "https://jsr.io/";

    @NotNull
    private final Map<PackageRequirement, PackageIdentity> roots = new LinkedHashMap<>();
    @NotNull
    private final Map<PackageIdentity, GraphPackage> packages = new LinkedHashMap<>();
    @NotNull
    private final SortedMap<String, String> remotes = new TreeMap<>();
    @NotNull
    private final String jsrBaseUrl;

    private LockfilePackageGraph(@NotNull String jsrBaseUrl) {
        this.jsrBaseUrl = jsrBaseUrl.endsWith("/") ? jsrBaseUrl : jsrBaseUrl + '/';
    }

    @NotNull
    public static LockfilePackageGraph fromLockfile(@NotNull PackagesContent content, @NotNull Map<String, String> remotes) {
        return LockfilePackageGraph.fromLockfile(content, remotes, LockfilePackageGraph.DEFAULT_JSR_URL);
    }

    /**
     * Builds the graph from the package tables of a lockfile.
     *
     * @param content The package tables
     * @param remotes The remote checksum table
     * @param jsrBaseUrl The location JSR packages are served from
     * @return The newly created graph
     * @throws IllegalArgumentException If an npm specifier value or package id is malformed
     */
    @NotNull
    public static LockfilePackageGraph fromLockfile(@NotNull PackagesContent content, @NotNull Map<String, String> remotes, @NotNull String jsrBaseUrl) {
        LockfilePackageGraph graph = new LockfilePackageGraph(Objects.requireNonNull(jsrBaseUrl, "jsrBaseUrl may not be null"));
        graph.remotes.putAll(remotes);

        content.specifiers.forEach((req, value) -> {
            PackageIdentity id;
            switch (req.kind()) {
            case NPM:
                id = new NpmPackageId(req.name() + '@' + value);
                break;
            case JSR:
                id = new JsrPackageId(new PackageVersion(req.name(), value));
                break;
            default:
                throw new IllegalStateException("Unknown package kind: " + req.kind());
            }
            graph.roots.put(req, id);
        });

        content.npm.forEach((id, info) -> graph.packages.put(new NpmPackageId(id), new GraphPackage(info, null)));
        content.jsr.forEach((nv, info) -> graph.packages.put(new JsrPackageId(nv), new GraphPackage(null, info)));

        // Reverse edges
        graph.packages.forEach((id, pkg) -> {
            for (PackageIdentity dependency : graph.getDependencies(pkg)) {
                GraphPackage target = graph.packages.get(dependency);
                if (target != null) {
                    target.dependents.add(id);
                }
            }
        });

        return graph;
    }

    @NotNull
    private List<PackageIdentity> getDependencies(@NotNull GraphPackage pkg) {
        List<PackageIdentity> dependencies = new ArrayList<>();
        NpmPackageInfo npmInfo = pkg.npmInfo;
        if (npmInfo != null) {
            npmInfo.dependencies().values().forEach((id) -> dependencies.add(new NpmPackageId(id)));
            npmInfo.optionalDependencies().values().forEach((id) -> dependencies.add(new NpmPackageId(id)));
            npmInfo.optionalPeers().values().forEach((id) -> dependencies.add(new NpmPackageId(id)));
        }
        JsrPackageInfo jsrInfo = pkg.jsrInfo;
        if (jsrInfo != null) {
            for (PackageRequirement req : jsrInfo.dependencies()) {
                PackageIdentity resolved = this.roots.get(req);
                // Unresolved requirements refer to packages outside of the lockfile, such as workspace members
                if (resolved != null) {
                    dependencies.add(resolved);
                }
            }
        }
        return dependencies;
    }

    /**
     * Removes a root requirement.
     *
     * <p>For npm packages only the root entry is removed. The package itself stays in the table, as
     * resolvers reuse the already resolved npm subgraphs when they run again. For JSR packages every JSR
     * package reachable from the root, through dependencies as well as through dependents, is removed
     * alongside every root resolving to such a package and the remote checksums of the packages.
     *
     * @param req The root requirement to remove
     * @return True if the requirement was a root
     */
    @Contract(mutates = "this")
    public boolean removeRoot(@NotNull PackageRequirement req) {
        PackageIdentity rootId = this.roots.get(req);
        if (rootId == null) {
            return false;
        }
        if (!(rootId instanceof JsrPackageId)) {
            this.roots.remove(req);
            return true;
        }

        Set<PackageIdentity> collected = new LinkedHashSet<>();
        Deque<PackageIdentity> pending = new ArrayDeque<>();
        pending.add(rootId);
        while (!pending.isEmpty()) {
            PackageIdentity current = pending.poll();
            if (!(current instanceof JsrPackageId) || !collected.add(current)) {
                continue;
            }
            GraphPackage pkg = this.packages.get(current);
            if (pkg == null) {
                continue;
            }
            pending.addAll(this.getDependencies(pkg));
            pending.addAll(pkg.dependents);
        }

        LoggingAdapter.getDefaultLogger().debug(LockfilePackageGraph.class, "Removing {} along with the JSR packages {}", req, collected);

        for (PackageIdentity id : collected) {
            this.packages.remove(id);
            PackageVersion nv = ((JsrPackageId) id).nv();
            String prefix = this.jsrBaseUrl + nv.name() + '/' + nv.version() + '/';
            this.remotes.keySet().removeIf((url) -> url.startsWith(prefix));
        }
        this.roots.values().removeIf(collected::contains);
        for (GraphPackage pkg : this.packages.values()) {
            pkg.dependents.removeAll(collected);
        }
        return true;
    }

    /**
     * Removes every root with the same kind and name as the given requirement, regardless of the
     * version requirement.
     *
     * @param req The requirement whose version requirement is ignored
     * @see #removeRoot(PackageRequirement)
     */
    @Contract(mutates = "this")
    public void removeByName(@NotNull PackageRequirement req) {
        List<PackageRequirement> matching = new ArrayList<>();
        for (PackageRequirement root : this.roots.keySet()) {
            if (root.kind() == req.kind() && root.name().equals(req.name())) {
                matching.add(root);
            }
        }
        for (PackageRequirement root : matching) {
            this.removeRoot(root);
        }
    }

    /**
     * Writes the graph back into lockfile tables, replacing their previous content. Dependencies
     * that are no longer part of the graph are dropped from the package entries.
     *
     * @param out The package tables to write to
     * @param outRemotes The remote checksum table to write to
     */
    public void populate(@NotNull PackagesContent out, @NotNull Map<String, String> outRemotes) {
        out.clear();
        this.roots.forEach((req, id) -> {
            if (id instanceof NpmPackageId) {
                out.specifiers.put(req, ((NpmPackageId) id).getVersionAndSuffix());
            } else {
                out.specifiers.put(req, ((JsrPackageId) id).nv().version());
            }
        });
        this.packages.forEach((id, pkg) -> {
            NpmPackageInfo npmInfo = pkg.npmInfo;
            JsrPackageInfo jsrInfo = pkg.jsrInfo;
            if (npmInfo != null) {
                out.npm.put(((NpmPackageId) id).id(), npmInfo.retainDependencies((depId) -> this.packages.containsKey(new NpmPackageId(depId))));
            } else if (jsrInfo != null) {
                out.jsr.put(((JsrPackageId) id).nv(), jsrInfo.retainDependencies(this.roots::containsKey));
            }
        });
        outRemotes.clear();
        outRemotes.putAll(this.remotes);
    }

    @NotNull
    @Contract(pure = true)
    public Map<PackageRequirement, PackageIdentity> getRoots() {
        return Collections.unmodifiableMap(this.roots);
    }

    @NotNull
    @Contract(pure = true)
    public Set<PackageIdentity> getPackages() {
        return Collections.unmodifiableSet(this.packages.keySet());
    }

    /**
     * Obtains the packages that depend on the given package.
     *
     * @param id The package
     * @return The dependents, or an empty set if the package is not part of the graph
     */
    @NotNull
    @Contract(pure = true)
    public Set<PackageIdentity> getDependents(@NotNull PackageIdentity id) {
        GraphPackage pkg = this.packages.get(id);
        if (pkg == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(pkg.dependents);
    }

    @NotNull
    @Contract(pure = true)
    public SortedMap<String, String> getRemotes() {
        return Collections.unmodifiableSortedMap(this.remotes);
    }
}
