package org.stianloader.picoinstall.lockfile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageRequirement;

/**
 * The dependencies a workspace declares, as recorded in the "workspace" section of the lockfile.
 *
 * @param dependencies The requirements declared in the workspace configuration file
 * @param packageJsonDependencies The requirements declared in the package.json
 * @param links Linked local packages, keyed by their requirement text (e.g. {@code npm:my-lib@1.0.0}),
 * with the requirements they declare themselves
 */
public final record WorkspaceConfig(@NotNull Set<PackageRequirement> dependencies,
        @NotNull Set<PackageRequirement> packageJsonDependencies,
        @NotNull Map<String, Set<PackageRequirement>> links) {

    @NotNull
    public static final WorkspaceConfig EMPTY = new WorkspaceConfig(Collections.emptySet(), Collections.emptySet(), Collections.emptyMap());

    public WorkspaceConfig {
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(dependencies, "dependencies may not be null")));
        packageJsonDependencies = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(packageJsonDependencies, "packageJsonDependencies may not be null")));
        Map<String, Set<PackageRequirement>> copiedLinks = new LinkedHashMap<>();
        Objects.requireNonNull(links, "links may not be null").forEach((name, deps) -> {
            copiedLinks.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(deps)));
        });
        links = Collections.unmodifiableMap(copiedLinks);
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.dependencies.isEmpty() && this.packageJsonDependencies.isEmpty() && this.links.isEmpty();
    }
}
