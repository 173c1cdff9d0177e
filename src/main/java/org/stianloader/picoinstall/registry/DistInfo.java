package org.stianloader.picoinstall.registry;

import java.net.URI;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.tarball.IntegrityDescriptor;

import com.google.gson.annotations.SerializedName;

/**
 * The "dist" section of a package version's registry metadata: where the tarball lives
 * and which checksum it is expected to have.
 */
public class DistInfo {
    @Nullable
    @SerializedName("tarball")
    private String tarball;
    @Nullable
    @SerializedName("shasum")
    private String shasum;
    @Nullable
    @SerializedName("integrity")
    private String integrity;

    public DistInfo() {
        // Gson
    }

    public DistInfo(@NotNull String tarball, @Nullable String shasum, @Nullable String integrity) {
        this.tarball = tarball;
        this.shasum = shasum;
        this.integrity = integrity;
    }

    @Nullable
    @Contract(pure = true)
    public String getTarball() {
        return this.tarball;
    }

    @Nullable
    @Contract(pure = true)
    public String getShasum() {
        return this.shasum;
    }

    @Nullable
    @Contract(pure = true)
    public String getIntegrityText() {
        return this.integrity;
    }

    /**
     * Obtains the integrity the tarball is expected to have. The "integrity" field takes
     * precedence over the legacy "shasum" field.
     *
     * @return The integrity descriptor, {@link IntegrityDescriptor#NONE} if neither field is set
     */
    @NotNull
    @Contract(pure = true)
    public IntegrityDescriptor getIntegrity() {
        return IntegrityDescriptor.of(this.integrity, this.shasum);
    }

    /**
     * Obtains the location a registry serves the tarball of a package version at unless its metadata says otherwise,
     * that is {@code <registry>/<name>/-/<unscoped name>-<version>.tgz}.
     *
     * @param registryBase The registry base URI, ending with a slash
     * @param nv The package version
     * @return The default tarball location
     */
    @NotNull
    @Contract(pure = true)
    public static URI getDefaultTarballURI(@NotNull URI registryBase, @NotNull PackageVersion nv) {
        String name = nv.name();
        String unscopedName = name.substring(name.indexOf('/') + 1);
        return registryBase.resolve(name + "/-/" + unscopedName + '-' + nv.version() + ".tgz");
    }

    /**
     * Checks whether the tarball lives at the {@link #getDefaultTarballURI(URI, PackageVersion) default location}.
     * A relative tarball location is resolved against the registry base first.
     *
     * @param registryBase The registry base URI, ending with a slash
     * @param nv The package version described by this instance
     * @return True if the tarball location is absent or the default one
     */
    @Contract(pure = true)
    public boolean isDefaultTarball(@NotNull URI registryBase, @NotNull PackageVersion nv) {
        String tarball = this.tarball;
        if (tarball == null) {
            return true;
        }
        return registryBase.resolve(tarball).equals(DistInfo.getDefaultTarballURI(registryBase, nv));
    }
}
