package org.stianloader.picoinstall;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The identity of a resolved package within a lockfile.
 *
 * <p>npm packages are identified through an opaque id string ({@link NpmPackageId}) that encodes
 * the name and version as well as, for packages that had to be duplicated because they resolve
 * their peer dependencies differently in different parts of the graph, a peer dependency suffix
 * (e.g. {@code chalk@5.0.0_supports-color@9.0.0}). JSR packages are identified by their plain
 * {@link PackageVersion} ({@link JsrPackageId}).
 */
public interface PackageIdentity {

    @NotNull
    @Contract(pure = true)
    PackageKind getKind();

    /**
     * Obtains the name of the package this identity refers to.
     *
     * @return The package name
     */
    @NotNull
    @Contract(pure = true)
    String getName();

    public static final record NpmPackageId(@NotNull String id) implements PackageIdentity {
        public NpmPackageId {
            Objects.requireNonNull(id, "id may not be null");
            if (PackageVersion.versionSeparator(id) == -1) {
                throw new IllegalArgumentException("\"" + id + "\" is not a valid npm package id");
            }
        }

        @Override
        @NotNull
        public PackageKind getKind() {
            return PackageKind.NPM;
        }

        @Override
        @NotNull
        public String getName() {
            return this.id.substring(0, PackageVersion.versionSeparator(this.id));
        }

        /**
         * Obtains everything after the name, that is the version followed by the peer dependency suffix, if any.
         * This is the value stored in the "specifiers" table of a lockfile.
         *
         * @return The version and peer suffix
         */
        @NotNull
        @Contract(pure = true)
        public String getVersionAndSuffix() {
            return this.id.substring(PackageVersion.versionSeparator(this.id) + 1);
        }

        /**
         * Obtains the name and version of the package without any peer dependency suffix.
         *
         * @return The name and version
         */
        @NotNull
        @Contract(pure = true)
        public PackageVersion toPackageVersion() {
            String version = this.getVersionAndSuffix();
            int suffix = version.indexOf('_');
            if (suffix != -1) {
                version = version.substring(0, suffix);
            }
            return new PackageVersion(this.getName(), version);
        }

        @Override
        @NotNull
        public String toString() {
            return this.id;
        }
    }

    public static final record JsrPackageId(@NotNull PackageVersion nv) implements PackageIdentity {
        public JsrPackageId {
            Objects.requireNonNull(nv, "nv may not be null");
        }

        @Override
        @NotNull
        public PackageKind getKind() {
            return PackageKind.JSR;
        }

        @Override
        @NotNull
        public String getName() {
            return this.nv.name();
        }

        @Override
        @NotNull
        public String toString() {
            return this.nv.toString();
        }
    }
}
