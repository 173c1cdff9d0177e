package org.stianloader.picoinstall.lockfile;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageRequirement;
import org.stianloader.picoinstall.PackageVersion;

/**
 * The package related tables of a lockfile.
 *
 * <ul>
 * <li>{@link #specifiers}: requirements to their resolved value, e.g. {@code jsr:@std/path@^1 -> 1.0.2},
 * {@code npm:chalk@5 -> 5.0.0} or, for npm packages with peer dependencies, {@code 5.0.0_supports-color@9.0.0}.</li>
 * <li>{@link #jsr}: resolved JSR packages.</li>
 * <li>{@link #npm}: resolved npm packages, keyed by their package id.</li>
 * </ul>
 */
public final class PackagesContent {

    @NotNull
    static final Comparator<PackageVersion> NV_ORDER = Comparator.comparing(PackageVersion::name).thenComparing(PackageVersion::version);

    @NotNull
    public final Map<PackageRequirement, String> specifiers = new HashMap<>();
    @NotNull
    public final SortedMap<PackageVersion, JsrPackageInfo> jsr = new TreeMap<>(PackagesContent.NV_ORDER);
    @NotNull
    public final SortedMap<String, NpmPackageInfo> npm = new TreeMap<>();

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.specifiers.isEmpty() && this.jsr.isEmpty() && this.npm.isEmpty();
    }

    @Contract(mutates = "this")
    public void clear() {
        this.specifiers.clear();
        this.jsr.clear();
        this.npm.clear();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PackagesContent) {
            PackagesContent other = (PackagesContent) obj;
            return other.specifiers.equals(this.specifiers) && other.jsr.equals(this.jsr) && other.npm.equals(this.npm);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return this.specifiers.hashCode() ^ this.npm.hashCode();
    }
}
