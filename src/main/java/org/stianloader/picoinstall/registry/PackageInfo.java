package org.stianloader.picoinstall.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.google.gson.annotations.SerializedName;

/**
 * The full registry metadata of a package: all its published versions and its distribution tags.
 * This is also the format in which the metadata is cached on disk.
 */
public class PackageInfo {
    @Nullable
    @SerializedName("name")
    private String name;
    @Nullable
    @SerializedName("versions")
    private Map<String, PackageVersionInfo> versions;
    @Nullable
    @SerializedName("dist-tags")
    private Map<String, String> distTags;

    public PackageInfo() {
        // Gson
    }

    public PackageInfo(@NotNull String name) {
        this.name = name;
        this.versions = new LinkedHashMap<>();
        this.distTags = new LinkedHashMap<>();
    }

    @Nullable
    public String getName() {
        return this.name;
    }

    @NotNull
    public Map<String, PackageVersionInfo> getVersions() {
        return this.versions == null ? Collections.emptyMap() : Collections.unmodifiableMap(this.versions);
    }

    @Nullable
    @Contract(pure = true)
    public PackageVersionInfo getVersion(@NotNull String version) {
        return this.versions == null ? null : this.versions.get(version);
    }

    @NotNull
    public Map<String, String> getDistTags() {
        return this.distTags == null ? Collections.emptyMap() : Collections.unmodifiableMap(this.distTags);
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public PackageInfo addVersion(@NotNull String version, @NotNull PackageVersionInfo info) {
        if (this.versions == null) {
            this.versions = new LinkedHashMap<>();
        }
        this.versions.put(version, info);
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public PackageInfo setDistTag(@NotNull String tag, @NotNull String version) {
        if (this.distTags == null) {
            this.distTags = new LinkedHashMap<>();
        }
        this.distTags.put(tag, version);
        return this;
    }
}
