package org.stianloader.picoinstall.lockfile;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;
import org.stianloader.picoinstall.registry.DistInfo;
import org.stianloader.picoinstall.registry.PackageVersionInfo;
import org.stianloader.picoinstall.registry.RegistryApi;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Upgrades the JSON tree of lockfiles written in an older format to the current version.
 *
 * <p>A lockfile without a "version" field is a version 1 lockfile, which only knew remote module checksums.
 * Versions 1 to 4 are rewritten step by step. The step to version 5 needs registry metadata as version 4
 * did not record optional dependencies, platform restrictions and the other npm package flags.
 */
final class LockfileMigration {

    private LockfileMigration() {
        throw new UnsupportedOperationException();
    }

    /**
     * Checks whether the tree needs to be migrated, that is whether it is not already of the current version.
     *
     * @param json The root of the lockfile
     * @return True if {@link #migrate(JsonObject, RegistryApi, Executor)} must be applied before reading the tree
     */
    @Contract(pure = true)
    static boolean needsMigration(@NotNull JsonObject json) {
        JsonElement version = json.get("version");
        return version == null || !version.isJsonPrimitive() || !LockfileJson.CURRENT_VERSION.equals(version.getAsString());
    }

    /**
     * Migrates a lockfile of any older version to version 5.
     *
     * @param json The root of the lockfile, which is modified in place where possible
     * @param registry The registry to obtain npm package metadata from, or null if none is available
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future holding the migrated tree, completing exceptionally with a {@link LockfileException}
     */
    @NotNull
    static CompletableFuture<JsonObject> migrate(@NotNull JsonObject json, @Nullable RegistryApi registry, @NotNull Executor executor) {
        JsonObject version4;
        try {
            version4 = LockfileMigration.migrateToVersion4(json);
        } catch (LockfileException e) {
            return CompletableFuture.failedFuture(e);
        }
        return LockfileMigration.transform4To5(version4, registry, executor);
    }

    @NotNull
    static JsonObject migrateToVersion4(@NotNull JsonObject json) throws LockfileException {
        try {
            JsonElement versionElement = json.get("version");
            String version = versionElement == null || versionElement.isJsonNull() ? null : versionElement.getAsString();
            if (version == null) {
                json = LockfileMigration.transform1To2(json);
                version = "2";
            }
            switch (version) {
            case "2":
                LockfileMigration.transform2To3(json);
                // fall through
            case "3":
                LockfileMigration.transform3To4(json);
                // fall through
            case "4":
                return json;
            default:
                throw new LockfileException(LockfileException.Reason.UNSUPPORTED_VERSION, "Unsupported lockfile version \"" + version + "\". Only versions up to " + LockfileJson.CURRENT_VERSION + " are supported.");
            }
        } catch (IllegalStateException | UnsupportedOperationException | ClassCastException e) {
            throw new LockfileException(LockfileException.Reason.PARSE_ERROR, "Malformed lockfile: " + e.getMessage(), e);
        }
    }

    /**
     * Version 1 lockfiles are a plain map of remote module URLs to checksums.
     */
    @NotNull
    static JsonObject transform1To2(@NotNull JsonObject json) {
        JsonObject migrated = new JsonObject();
        migrated.addProperty("version", "2");
        migrated.add("remote", json);
        return migrated;
    }

    /**
     * Moves the "npm" section below "packages" and prefixes its specifiers with the package kind.
     */
    static void transform2To3(@NotNull JsonObject json) {
        json.addProperty("version", "3");
        JsonElement npmElement = json.remove("npm");
        if (npmElement == null || !npmElement.isJsonObject()) {
            return;
        }
        JsonObject npm = npmElement.getAsJsonObject();
        JsonObject packages = new JsonObject();
        JsonElement npmPackages = npm.get("packages");
        if (npmPackages != null) {
            packages.add("npm", npmPackages);
        }
        JsonElement npmSpecifiers = npm.get("specifiers");
        if (npmSpecifiers != null && npmSpecifiers.isJsonObject()) {
            JsonObject specifiers = new JsonObject();
            for (Map.Entry<String, JsonElement> entry : npmSpecifiers.getAsJsonObject().entrySet()) {
                JsonElement value = entry.getValue();
                if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
                    specifiers.addProperty("npm:" + entry.getKey(), "npm:" + value.getAsString());
                }
            }
            if (specifiers.size() != 0) {
                packages.add("specifiers", specifiers);
            }
        }
        json.add("packages", packages);
    }

    /**
     * Switches npm dependencies from objects to the compact array form, shortens JSR dependencies and specifier values
     * and moves everything within "packages" to the root.
     */
    static void transform3To4(@NotNull JsonObject json) throws LockfileException {
        json.addProperty("version", "4");
        JsonElement packagesElement = json.remove("packages");
        if (packagesElement == null || !packagesElement.isJsonObject()) {
            return;
        }
        JsonObject packages = packagesElement.getAsJsonObject();

        JsonElement npmElement = packages.get("npm");
        if (npmElement != null && npmElement.isJsonObject()) {
            JsonObject npm = npmElement.getAsJsonObject();
            Map<String, Integer> versionsPerName = new HashMap<>();
            for (String id : npm.keySet()) {
                String[] nv = LockfileMigration.splitId(id);
                if (nv != null) {
                    versionsPerName.merge(nv[0], 1, Integer::sum);
                }
            }
            for (Map.Entry<String, JsonElement> entry : npm.entrySet()) {
                if (!entry.getValue().isJsonObject()) {
                    continue;
                }
                JsonObject pkg = entry.getValue().getAsJsonObject();
                JsonElement depsElement = pkg.remove("dependencies");
                if (depsElement == null || !depsElement.isJsonObject()) {
                    continue;
                }
                JsonArray deps = new JsonArray();
                // Sorted by dependency name
                for (Map.Entry<String, JsonElement> dep : new TreeMap<>(depsElement.getAsJsonObject().asMap()).entrySet()) {
                    String depId = dep.getValue().getAsString();
                    String[] nv = LockfileMigration.splitId(depId);
                    if (nv == null) {
                        throw new LockfileException(LockfileException.Reason.INVALID_NPM_DEPENDENCY, "Invalid npm package id \"" + depId + "\" of dependency \"" + dep.getKey() + "\" of " + entry.getKey());
                    }
                    if (dep.getKey().equals(nv[0])) {
                        boolean singleVersion = versionsPerName.getOrDefault(nv[0], 0) == 1;
                        deps.add(singleVersion ? nv[0] : nv[0] + '@' + nv[1]);
                    } else {
                        deps.add(dep.getKey() + "@npm:" + nv[0] + '@' + nv[1]);
                    }
                }
                pkg.add("dependencies", deps);
            }
        }

        JsonElement specifiersElement = packages.get("specifiers");
        if (specifiersElement != null && specifiersElement.isJsonObject()) {
            JsonObject specifiers = specifiersElement.getAsJsonObject();
            Map<String, Integer> specifiersPerName = new HashMap<>();
            for (String key : specifiers.keySet()) {
                String[] req = LockfileMigration.splitRequirement(key);
                if (req != null) {
                    specifiersPerName.merge(req[0], 1, Integer::sum);
                }
            }

            JsonElement jsrElement = packages.get("jsr");
            if (jsrElement != null && jsrElement.isJsonObject()) {
                for (JsonElement pkgElement : jsrElement.getAsJsonObject().asMap().values()) {
                    if (!pkgElement.isJsonObject()) {
                        continue;
                    }
                    JsonElement depsElement = pkgElement.getAsJsonObject().get("dependencies");
                    if (depsElement == null || !depsElement.isJsonArray()) {
                        continue;
                    }
                    JsonArray deps = depsElement.getAsJsonArray();
                    for (int i = 0; i < deps.size(); i++) {
                        String[] req = LockfileMigration.splitRequirement(deps.get(i).getAsString());
                        if (req != null && specifiersPerName.getOrDefault(req[0], 0) == 1) {
                            deps.set(i, new JsonPrimitive(req[0]));
                        }
                    }
                }
            }

            for (Map.Entry<String, JsonElement> entry : specifiers.entrySet()) {
                String[] value = LockfileMigration.splitRequirement(entry.getValue().getAsString());
                if (value != null && value[1] != null) {
                    entry.setValue(new JsonPrimitive(value[1]));
                }
            }
        }

        for (Map.Entry<String, JsonElement> entry : packages.entrySet()) {
            json.add(entry.getKey(), entry.getValue());
        }
    }

    @NotNull
    static CompletableFuture<JsonObject> transform4To5(@NotNull JsonObject json, @Nullable RegistryApi registry, @NotNull Executor executor) {
        Set<PackageVersion> nvs;
        try {
            nvs = LockfileMigration.collectNpmPackages(json);
        } catch (IllegalStateException | UnsupportedOperationException | ClassCastException e) {
            return CompletableFuture.failedFuture(new LockfileException(LockfileException.Reason.PARSE_ERROR, "Malformed lockfile: " + e.getMessage(), e));
        }
        if (nvs.isEmpty()) {
            return LockfileMigration.completeTransform4To5(json, new HashMap<>(), RegistryApi.DEFAULT_NPM_REGISTRY);
        }
        if (registry == null) {
            return CompletableFuture.failedFuture(new LockfileException(LockfileException.Reason.MIGRATION_FAILED,
                    "Migrating the npm packages of a version 4 lockfile requires access to the npm registry"));
        }

        Map<PackageVersion, CompletableFuture<PackageVersionInfo>> futures = new LinkedHashMap<>();
        for (PackageVersion nv : nvs) {
            futures.put(nv, registry.packageVersionInfo(nv, executor));
        }
        return ConcurrencyUtil.allOf(futures.values()).handle((ignored, ex) -> {
            if (ex != null) {
                Throwable cause = ConcurrencyUtil.unwrap(ex);
                throw new CompletionException(new LockfileException(LockfileException.Reason.MIGRATION_FAILED, "Failed obtaining npm package information: " + cause.getMessage(), cause));
            }
            Map<PackageVersion, PackageVersionInfo> infos = new HashMap<>();
            futures.forEach((nv, future) -> infos.put(nv, future.join()));
            return infos;
        }).thenCompose((infos) -> LockfileMigration.completeTransform4To5(json, infos, registry.getBaseURI()));
    }

    @NotNull
    private static CompletableFuture<JsonObject> completeTransform4To5(@NotNull JsonObject json, @NotNull Map<PackageVersion, PackageVersionInfo> infos, @NotNull URI registryBase) {
        try {
            LockfileMigration.transform4To5(json, infos, registryBase);
            return CompletableFuture.completedFuture(json);
        } catch (LockfileException e) {
            return CompletableFuture.failedFuture(e);
        } catch (IllegalStateException | UnsupportedOperationException | ClassCastException e) {
            return CompletableFuture.failedFuture(new LockfileException(LockfileException.Reason.PARSE_ERROR, "Malformed lockfile: " + e.getMessage(), e));
        }
    }

    /**
     * Moves optional dependencies out of "dependencies" and records the npm package information that
     * version 4 lacked.
     *
     * @param json The root of a version 4 lockfile, modified in place
     * @param infos The registry metadata of every package of the "npm" table
     * @param registryBase The registry the metadata is from
     * @throws LockfileException If the metadata of a package is missing
     */
    static void transform4To5(@NotNull JsonObject json, @NotNull Map<PackageVersion, PackageVersionInfo> infos, @NotNull URI registryBase) throws LockfileException {
        json.addProperty("version", "5");
        JsonElement npmElement = json.get("npm");
        if (npmElement == null || !npmElement.isJsonObject()) {
            return;
        }
        JsonObject npm = npmElement.getAsJsonObject();
        Map<String, String> versionByName = new HashMap<>();
        Map<String, PackageVersion> nvById = new LinkedHashMap<>();
        for (String id : npm.keySet()) {
            String[] parts = LockfileMigration.splitDependency(id, versionByName);
            if (parts == null) {
                continue;
            }
            versionByName.put(parts[1], parts[2]);
            nvById.put(id, new PackageVersion(parts[1], parts[2]));
        }

        for (Map.Entry<String, PackageVersion> entry : nvById.entrySet()) {
            JsonElement pkgElement = npm.get(entry.getKey());
            if (!pkgElement.isJsonObject()) {
                continue;
            }
            PackageVersionInfo info = infos.get(entry.getValue());
            if (info == null) {
                throw new LockfileException(LockfileException.Reason.MIGRATION_FAILED, "Missing npm package information of " + entry.getValue());
            }
            JsonObject pkg = pkgElement.getAsJsonObject();

            Map<String, String> existingDeps = new LinkedHashMap<>();
            JsonElement depsElement = pkg.remove("dependencies");
            if (depsElement != null && depsElement.isJsonArray()) {
                for (JsonElement dep : depsElement.getAsJsonArray()) {
                    String depId = dep.getAsString();
                    String[] parts = LockfileMigration.splitDependency(depId, versionByName);
                    if (parts != null) {
                        existingDeps.put(parts[0], depId);
                    }
                }
            }

            Map<String, String> optionalDependencies = info.getOptionalDependencies();
            if (!optionalDependencies.isEmpty()) {
                List<String> optional = new ArrayList<>();
                for (String name : new TreeMap<>(optionalDependencies).keySet()) {
                    String depId = existingDeps.remove(name);
                    if (depId != null) {
                        optional.add(depId);
                    }
                }
                pkg.add("optionalDependencies", LockfileMigration.toArray(optional));
            }

            List<String> optionalPeers = new ArrayList<>();
            new TreeMap<>(info.getPeerDependencies()).forEach((name, range) -> {
                if (info.isOptionalPeer(name)) {
                    optionalPeers.add(name + '@' + range);
                }
            });
            if (!optionalPeers.isEmpty()) {
                pkg.add("optionalPeers", LockfileMigration.toArray(optionalPeers));
            }

            if (!existingDeps.isEmpty()) {
                pkg.add("dependencies", LockfileMigration.toArray(existingDeps.values()));
            }
            if (!info.getCpu().isEmpty()) {
                pkg.add("cpu", LockfileMigration.toArray(info.getCpu()));
            }
            if (!info.getOs().isEmpty()) {
                pkg.add("os", LockfileMigration.toArray(info.getOs()));
            }
            DistInfo dist = info.getDist();
            if (dist != null && !dist.isDefaultTarball(registryBase, entry.getValue())) {
                pkg.addProperty("tarball", dist.getTarball());
            }
            if (info.isDeprecated()) {
                pkg.addProperty("deprecated", true);
            }
            if (info.hasInstallScripts()) {
                pkg.addProperty("scripts", true);
            }
            if (info.hasBin()) {
                pkg.addProperty("bin", true);
            }
        }
    }

    @NotNull
    private static Set<PackageVersion> collectNpmPackages(@NotNull JsonObject json) {
        Set<PackageVersion> nvs = new LinkedHashSet<>();
        JsonElement npmElement = json.get("npm");
        if (npmElement == null || !npmElement.isJsonObject()) {
            return nvs;
        }
        Map<String, String> versionByName = new HashMap<>();
        for (String id : npmElement.getAsJsonObject().keySet()) {
            String[] parts = LockfileMigration.splitDependency(id, versionByName);
            if (parts != null) {
                versionByName.put(parts[1], parts[2]);
                nvs.add(new PackageVersion(parts[1], parts[2]));
            }
        }
        return nvs;
    }

    /**
     * Splits a package id into name and version, ignoring a leading '@' of scoped names.
     *
     * @return The name and version, or null if the id has no version
     */
    @Nullable
    private static String[] splitId(@NotNull String id) {
        if (id.isEmpty()) {
            return null;
        }
        int separator = id.indexOf('@', 1);
        if (separator == -1) {
            return null;
        }
        return new String[] {id.substring(0, separator), id.substring(separator + 1)};
    }

    /**
     * Splits a requirement such as {@code jsr:@std/path@^1} into the prefixed name and the version requirement.
     * The version requirement is null if the requirement only names a package.
     *
     * @return The name and version requirement, or null if the text is too short to be a requirement
     */
    @Nullable
    private static String[] splitRequirement(@NotNull String text) {
        if (text.length() < 5) {
            return null;
        }
        int separator = text.indexOf('@', 5);
        if (separator == -1) {
            return new String[] {text, null};
        }
        return new String[] {text.substring(0, separator), text.substring(separator + 1)};
    }

    /**
     * Splits an npm dependency as written by version 4 into the name it is required under, the package name
     * and the version without peer dependency suffix. Bare names are resolved through the versions seen so far.
     *
     * @return The three parts, or null if the dependency cannot be split
     */
    @Nullable
    private static String[] splitDependency(@NotNull String dependency, @NotNull Map<String, String> versionByName) {
        String key;
        String right;
        String[] nv = LockfileMigration.splitId(dependency);
        if (nv != null) {
            key = nv[0];
            right = nv[1];
        } else {
            right = versionByName.get(dependency);
            if (right == null) {
                return null;
            }
            key = dependency;
        }

        String packageName;
        String version;
        if (right.startsWith("npm:")) {
            String[] aliased = LockfileMigration.splitId(right.substring(4));
            if (aliased == null) {
                return null;
            }
            packageName = aliased[0];
            version = aliased[1];
        } else {
            packageName = key;
            version = right;
        }
        int peerSuffix = version.indexOf('_');
        if (peerSuffix != -1) {
            version = version.substring(0, peerSuffix);
        }
        return new String[] {key, packageName, version};
    }

    @NotNull
    private static JsonArray toArray(@NotNull Iterable<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(new JsonPrimitive(value));
        }
        return array;
    }
}
