package org.stianloader.picoinstall.registry;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageVersion;

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

/**
 * The registry metadata of a single published version of a package.
 */
public class PackageVersionInfo {

    public static class PeerDependencyMeta {
        @SerializedName("optional")
        private boolean optional;

        @Contract(pure = true)
        public boolean isOptional() {
            return this.optional;
        }
    }

    @Nullable
    @SerializedName("name")
    private String name;
    @Nullable
    @SerializedName("version")
    private String version;
    @Nullable
    @SerializedName("dist")
    private DistInfo dist;
    @Nullable
    @SerializedName("dependencies")
    private Map<String, String> dependencies;
    @Nullable
    @SerializedName("optionalDependencies")
    private Map<String, String> optionalDependencies;
    @Nullable
    @SerializedName("peerDependencies")
    private Map<String, String> peerDependencies;
    @Nullable
    @SerializedName("peerDependenciesMeta")
    private Map<String, PeerDependencyMeta> peerDependenciesMeta;
    @Nullable
    @SerializedName("os")
    private List<String> os;
    @Nullable
    @SerializedName("cpu")
    private List<String> cpu;
    @Nullable
    @SerializedName("deprecated")
    private String deprecated;
    @Nullable
    @SerializedName("bin")
    private JsonElement bin;
    @Nullable
    @SerializedName("scripts")
    private Map<String, String> scripts;

    public PackageVersionInfo() {
        // Gson
    }

    public PackageVersionInfo(@NotNull PackageVersion nv, @NotNull DistInfo dist, @NotNull Map<String, String> dependencies) {
        this.name = nv.name();
        this.version = nv.version();
        this.dist = dist;
        this.dependencies = dependencies;
    }

    @Nullable
    public String getName() {
        return this.name;
    }

    @Nullable
    public String getVersion() {
        return this.version;
    }

    @Nullable
    public DistInfo getDist() {
        return this.dist;
    }

    @NotNull
    public Map<String, String> getDependencies() {
        return this.dependencies == null ? Collections.emptyMap() : Collections.unmodifiableMap(this.dependencies);
    }

    @NotNull
    public Map<String, String> getOptionalDependencies() {
        return this.optionalDependencies == null ? Collections.emptyMap() : Collections.unmodifiableMap(this.optionalDependencies);
    }

    @NotNull
    public Map<String, String> getPeerDependencies() {
        return this.peerDependencies == null ? Collections.emptyMap() : Collections.unmodifiableMap(this.peerDependencies);
    }

    @Contract(pure = true)
    public boolean isOptionalPeer(@NotNull String dependencyName) {
        if (this.peerDependenciesMeta == null) {
            return false;
        }
        PeerDependencyMeta meta = this.peerDependenciesMeta.get(dependencyName);
        return meta != null && meta.isOptional();
    }

    @NotNull
    public List<String> getOs() {
        return this.os == null ? Collections.emptyList() : Collections.unmodifiableList(this.os);
    }

    @NotNull
    public List<String> getCpu() {
        return this.cpu == null ? Collections.emptyList() : Collections.unmodifiableList(this.cpu);
    }

    @Nullable
    public String getDeprecationMessage() {
        return this.deprecated;
    }

    public boolean isDeprecated() {
        return this.deprecated != null;
    }

    public boolean hasBin() {
        return this.bin != null && !this.bin.isJsonNull();
    }

    /**
     * Checks whether the package runs lifecycle scripts upon installation.
     *
     * @return True if a preinstall, install or postinstall script is declared
     */
    public boolean hasInstallScripts() {
        if (this.scripts == null) {
            return false;
        }
        return this.scripts.containsKey("preinstall") || this.scripts.containsKey("install") || this.scripts.containsKey("postinstall");
    }
}
