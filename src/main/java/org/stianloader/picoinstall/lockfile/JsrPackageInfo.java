package org.stianloader.picoinstall.lockfile;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageRequirement;

/**
 * The lockfile entry of a resolved JSR package. Dependencies are recorded as requirements; they are resolved
 * through the "specifiers" table of the lockfile. They only serve to tell when a package can be removed.
 */
public final record JsrPackageInfo(@NotNull String integrity, @NotNull Set<PackageRequirement> dependencies) {

    public JsrPackageInfo {
        Objects.requireNonNull(integrity, "integrity may not be null");
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(dependencies, "dependencies may not be null")));
    }

    @NotNull
    @Contract(pure = true)
    public JsrPackageInfo withIntegrity(@NotNull String integrity) {
        return new JsrPackageInfo(integrity, this.dependencies);
    }

    @NotNull
    @Contract(pure = true)
    public JsrPackageInfo retainDependencies(@NotNull Predicate<PackageRequirement> keep) {
        Set<PackageRequirement> retained = new LinkedHashSet<>();
        for (PackageRequirement req : this.dependencies) {
            if (keep.test(req)) {
                retained.add(req);
            }
        }
        if (retained.size() == this.dependencies.size()) {
            return this;
        }
        return new JsrPackageInfo(this.integrity, retained);
    }
}
