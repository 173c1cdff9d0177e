package org.stianloader.picoinstall.lockfile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoinstall.PackageRequirement;
import org.stianloader.picoinstall.PackageVersion;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Reads and writes the JSON representation (version "5") of a lockfile. Older versions are
 * upgraded by {@link LockfileMigration} beforehand.
 *
 * <p>npm dependencies are stored in a compact form: a plain {@code name} if the name maps to exactly
 * one package id within the "npm" table, {@code name@version} otherwise, and {@code alias@npm:name@version}
 * if the dependency is required under a different name than the package's own.
 */
final class LockfileJson {

    @NotNull
    static final String CURRENT_VERSION = "5";

    @NotNull
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private LockfileJson() {
        throw new UnsupportedOperationException();
    }

    @NotNull
    static JsonObject readTree(@NotNull String text) throws LockfileException {
        JsonElement rootElement;
        try {
            rootElement = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new LockfileException(LockfileException.Reason.PARSE_ERROR, "Invalid JSON: " + e.getMessage(), e);
        }
        if (!rootElement.isJsonObject()) {
            throw new LockfileException(LockfileException.Reason.PARSE_ERROR, "Expected the lockfile to be a JSON object");
        }
        return rootElement.getAsJsonObject();
    }

    @NotNull
    static LockfileContent read(@NotNull JsonObject json) throws LockfileException {
        try {
            String version = LockfileJson.optString(json, "version");
            if (!LockfileJson.CURRENT_VERSION.equals(version)) {
                throw new LockfileException(LockfileException.Reason.UNSUPPORTED_VERSION, "Unsupported lockfile version \"" + version + "\". Only version " + LockfileJson.CURRENT_VERSION + " can be read without migrating it.");
            }

            LockfileContent content = new LockfileContent();
            for (Map.Entry<String, String> entry : LockfileJson.stringMap(json, "specifiers").entrySet()) {
                content.packages.specifiers.put(LockfileJson.parseRequirement(entry.getKey()), entry.getValue());
            }
            LockfileJson.readNpm(json, content.packages);
            LockfileJson.readJsr(json, content.packages);
            content.redirects.putAll(LockfileJson.stringMap(json, "redirects"));
            content.remote.putAll(LockfileJson.stringMap(json, "remote"));
            content.workspace = LockfileJson.readWorkspace(json);
            return content;
        } catch (IllegalStateException | UnsupportedOperationException | ClassCastException e) {
            // Gson throws these when a value has an unexpected JSON type
            throw new LockfileException(LockfileException.Reason.PARSE_ERROR, "Malformed lockfile: " + e.getMessage(), e);
        }
    }

    private static void readNpm(@NotNull JsonObject json, @NotNull PackagesContent packages) throws LockfileException {
        JsonObject npm = LockfileJson.optObject(json, "npm");
        if (npm == null || npm.size() == 0) {
            return;
        }

        Map<String, String> versionByName = new HashMap<>();
        for (String id : npm.keySet()) {
            int separator = PackageVersion.versionSeparator(id);
            if (separator == -1) {
                throw new LockfileException(LockfileException.Reason.INVALID_PACKAGE_ID, "Invalid npm package id \"" + id + "\"");
            }
            versionByName.put(id.substring(0, separator), id.substring(separator + 1));
        }

        for (Map.Entry<String, JsonElement> entry : npm.entrySet()) {
            JsonObject raw = entry.getValue().getAsJsonObject();
            SortedMap<String, String> dependencies = new TreeMap<>();
            SortedMap<String, String> optionalDependencies = new TreeMap<>();
            SortedMap<String, String> optionalPeers = new TreeMap<>();
            for (String dep : LockfileJson.stringList(raw, "dependencies")) {
                LockfileJson.readNpmDependency(dep, versionByName, dependencies);
            }
            for (String dep : LockfileJson.stringList(raw, "optionalDependencies")) {
                LockfileJson.readNpmDependency(dep, versionByName, optionalDependencies);
            }
            for (String dep : LockfileJson.stringList(raw, "optionalPeers")) {
                LockfileJson.readNpmDependency(dep, versionByName, optionalPeers);
            }
            packages.npm.put(entry.getKey(), new NpmPackageInfo(LockfileJson.optString(raw, "integrity"),
                    dependencies, optionalDependencies, optionalPeers,
                    LockfileJson.stringList(raw, "os"), LockfileJson.stringList(raw, "cpu"),
                    LockfileJson.optString(raw, "tarball"),
                    LockfileJson.optBoolean(raw, "deprecated"), LockfileJson.optBoolean(raw, "scripts"), LockfileJson.optBoolean(raw, "bin")));
        }
    }

    private static void readNpmDependency(@NotNull String dep, @NotNull Map<String, String> versionByName, @NotNull Map<String, String> out) throws LockfileException {
        String left;
        String right;
        int separator = PackageVersion.versionSeparator(dep);
        if (separator != -1) {
            left = dep.substring(0, separator);
            right = dep.substring(separator + 1);
        } else {
            right = versionByName.get(dep);
            if (right == null) {
                throw new LockfileException(LockfileException.Reason.INVALID_NPM_DEPENDENCY, "Could not find npm package \"" + dep + "\" referenced as a dependency");
            }
            left = dep;
        }

        if (right.startsWith("npm:")) {
            // alias@npm:package@version
            String aliased = right.substring(4);
            int aliasSeparator = PackageVersion.versionSeparator(aliased);
            if (aliasSeparator == -1) {
                throw new LockfileException(LockfileException.Reason.INVALID_NPM_DEPENDENCY, "Invalid npm package dependency \"" + dep + "\"");
            }
            out.put(left, aliased);
        } else {
            out.put(left, left + '@' + right);
        }
    }

    private static void readJsr(@NotNull JsonObject json, @NotNull PackagesContent packages) throws LockfileException {
        JsonObject jsr = LockfileJson.optObject(json, "jsr");
        if (jsr == null || jsr.size() == 0) {
            return;
        }

        // Dependencies of JSR packages may omit the version requirement, in which case they refer to the
        // specifier of the same name. Exact matches take precedence.
        Map<PackageRequirement, PackageRequirement> toResolvedSpecifier = new HashMap<>();
        for (PackageRequirement req : packages.specifiers.keySet()) {
            toResolvedSpecifier.put(req, req);
        }
        for (PackageRequirement req : packages.specifiers.keySet()) {
            toResolvedSpecifier.putIfAbsent(req.withoutVersionRequirement(), req);
        }

        for (Map.Entry<String, JsonElement> entry : jsr.entrySet()) {
            PackageVersion nv;
            try {
                nv = PackageVersion.parse(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new LockfileException(LockfileException.Reason.INVALID_PACKAGE_ID, "Invalid JSR package \"" + entry.getKey() + "\"", e);
            }
            JsonObject raw = entry.getValue().getAsJsonObject();
            Set<PackageRequirement> dependencies = new LinkedHashSet<>();
            for (String rawDep : LockfileJson.stringList(raw, "dependencies")) {
                PackageRequirement dep;
                try {
                    dep = PackageRequirement.parse(rawDep);
                } catch (IllegalArgumentException e) {
                    // Not a package requirement, such as a remote module
                    continue;
                }
                PackageRequirement resolved = toResolvedSpecifier.get(dep);
                if (resolved == null) {
                    throw new LockfileException(LockfileException.Reason.INVALID_JSR_DEPENDENCY, "Could not find specifier for dependency \"" + rawDep + "\" of JSR package " + nv);
                }
                dependencies.add(resolved);
            }
            String integrity = LockfileJson.optString(raw, "integrity");
            packages.jsr.put(nv, new JsrPackageInfo(integrity == null ? "" : integrity, dependencies));
        }
    }

    @NotNull
    private static WorkspaceConfig readWorkspace(@NotNull JsonObject json) throws LockfileException {
        JsonObject workspace = LockfileJson.optObject(json, "workspace");
        if (workspace == null) {
            return WorkspaceConfig.EMPTY;
        }
        Set<PackageRequirement> dependencies = LockfileJson.requirementSet(workspace);
        JsonObject packageJson = LockfileJson.optObject(workspace, "packageJson");
        Set<PackageRequirement> packageJsonDependencies = packageJson == null ? new LinkedHashSet<>() : LockfileJson.requirementSet(packageJson);
        Map<String, Set<PackageRequirement>> links = new LinkedHashMap<>();
        JsonObject rawLinks = LockfileJson.optObject(workspace, "links");
        if (rawLinks != null) {
            for (Map.Entry<String, JsonElement> link : rawLinks.entrySet()) {
                links.put(link.getKey(), LockfileJson.requirementSet(link.getValue().getAsJsonObject()));
            }
        }
        return new WorkspaceConfig(dependencies, packageJsonDependencies, links);
    }

    @NotNull
    private static Set<PackageRequirement> requirementSet(@NotNull JsonObject holder) throws LockfileException {
        Set<PackageRequirement> reqs = new LinkedHashSet<>();
        for (String text : LockfileJson.stringList(holder, "dependencies")) {
            reqs.add(LockfileJson.parseRequirement(text));
        }
        return reqs;
    }

    @NotNull
    private static PackageRequirement parseRequirement(@NotNull String text) throws LockfileException {
        try {
            return PackageRequirement.parse(text);
        } catch (IllegalArgumentException e) {
            throw new LockfileException(LockfileException.Reason.INVALID_REQUIREMENT, "Invalid package requirement \"" + text + "\"", e);
        }
    }

    @NotNull
    static String print(@NotNull LockfileContent content) {
        JsonObject json = new JsonObject();
        json.addProperty("version", LockfileJson.CURRENT_VERSION);

        PackagesContent packages = content.packages;
        if (!packages.specifiers.isEmpty()) {
            SortedMap<String, String> specifiers = new TreeMap<>();
            packages.specifiers.forEach((req, value) -> specifiers.put(req.toString(), value));
            json.add("specifiers", LockfileJson.toObject(specifiers));
        }

        if (!packages.jsr.isEmpty()) {
            JsonObject jsr = new JsonObject();
            packages.jsr.forEach((nv, info) -> {
                JsonObject entry = new JsonObject();
                entry.addProperty("integrity", info.integrity());
                if (!info.dependencies().isEmpty()) {
                    List<String> deps = new ArrayList<>();
                    info.dependencies().forEach((req) -> deps.add(req.toString()));
                    deps.sort(null);
                    entry.add("dependencies", LockfileJson.toArray(deps));
                }
                jsr.add(nv.toString(), entry);
            });
            json.add("jsr", jsr);
        }

        if (!packages.npm.isEmpty()) {
            Map<String, Integer> idsPerName = new HashMap<>();
            for (String id : packages.npm.keySet()) {
                idsPerName.merge(id.substring(0, PackageVersion.versionSeparator(id)), 1, Integer::sum);
            }
            JsonObject npm = new JsonObject();
            packages.npm.forEach((id, info) -> {
                JsonObject entry = new JsonObject();
                if (info.integrity() != null) {
                    entry.addProperty("integrity", info.integrity());
                }
                LockfileJson.addNonEmpty(entry, "dependencies", LockfileJson.printNpmDependencies(info.dependencies(), idsPerName, packages.npm));
                LockfileJson.addNonEmpty(entry, "optionalDependencies", LockfileJson.printNpmDependencies(info.optionalDependencies(), idsPerName, packages.npm));
                LockfileJson.addNonEmpty(entry, "optionalPeers", LockfileJson.printNpmDependencies(info.optionalPeers(), idsPerName, packages.npm));
                LockfileJson.addNonEmpty(entry, "os", info.os());
                LockfileJson.addNonEmpty(entry, "cpu", info.cpu());
                if (info.tarball() != null) {
                    entry.addProperty("tarball", info.tarball());
                }
                if (info.deprecated()) {
                    entry.addProperty("deprecated", true);
                }
                if (info.scripts()) {
                    entry.addProperty("scripts", true);
                }
                if (info.bin()) {
                    entry.addProperty("bin", true);
                }
                npm.add(id, entry);
            });
            json.add("npm", npm);
        }

        if (!content.redirects.isEmpty()) {
            json.add("redirects", LockfileJson.toObject(content.redirects));
        }
        if (!content.remote.isEmpty()) {
            json.add("remote", LockfileJson.toObject(content.remote));
        }

        WorkspaceConfig workspace = content.workspace;
        if (!workspace.isEmpty()) {
            JsonObject workspaceJson = new JsonObject();
            LockfileJson.addNonEmpty(workspaceJson, "dependencies", LockfileJson.sortedRequirements(workspace.dependencies()));
            if (!workspace.packageJsonDependencies().isEmpty()) {
                JsonObject packageJson = new JsonObject();
                packageJson.add("dependencies", LockfileJson.toArray(LockfileJson.sortedRequirements(workspace.packageJsonDependencies())));
                workspaceJson.add("packageJson", packageJson);
            }
            if (!workspace.links().isEmpty()) {
                JsonObject links = new JsonObject();
                new TreeMap<>(workspace.links()).forEach((name, deps) -> {
                    JsonObject link = new JsonObject();
                    LockfileJson.addNonEmpty(link, "dependencies", LockfileJson.sortedRequirements(deps));
                    links.add(name, link);
                });
                workspaceJson.add("links", links);
            }
            json.add("workspace", workspaceJson);
        }

        return LockfileJson.GSON.toJson(json) + '\n';
    }

    @NotNull
    private static List<String> printNpmDependencies(@NotNull SortedMap<String, String> dependencies, @NotNull Map<String, Integer> idsPerName, @NotNull Map<String, NpmPackageInfo> table) {
        List<String> printed = new ArrayList<>(dependencies.size());
        dependencies.forEach((key, id) -> {
            int separator = PackageVersion.versionSeparator(id);
            String name = id.substring(0, separator);
            if (!key.equals(name)) {
                printed.add(key + "@npm:" + id);
            } else if (idsPerName.getOrDefault(name, 0) == 1 && table.containsKey(id)) {
                printed.add(name);
            } else {
                printed.add(id);
            }
        });
        return printed;
    }

    @NotNull
    private static List<String> sortedRequirements(@NotNull Collection<PackageRequirement> reqs) {
        List<String> out = new ArrayList<>();
        reqs.forEach((req) -> out.add(req.toString()));
        out.sort(null);
        return out;
    }

    private static void addNonEmpty(@NotNull JsonObject target, @NotNull String key, @NotNull List<String> values) {
        if (!values.isEmpty()) {
            target.add(key, LockfileJson.toArray(values));
        }
    }

    @NotNull
    private static JsonArray toArray(@NotNull Collection<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(new JsonPrimitive(value));
        }
        return array;
    }

    @NotNull
    private static JsonObject toObject(@NotNull Map<String, String> map) {
        JsonObject object = new JsonObject();
        map.forEach(object::addProperty);
        return object;
    }

    @Nullable
    private static JsonObject optObject(@NotNull JsonObject json, @NotNull String key) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return element.getAsJsonObject();
    }

    @Nullable
    private static String optString(@NotNull JsonObject json, @NotNull String key) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return element.getAsString();
    }

    private static boolean optBoolean(@NotNull JsonObject json, @NotNull String key) {
        JsonElement element = json.get(key);
        return element != null && !element.isJsonNull() && element.getAsBoolean();
    }

    @NotNull
    private static List<String> stringList(@NotNull JsonObject json, @NotNull String key) {
        JsonElement element = json.get(key);
        List<String> out = new ArrayList<>();
        if (element == null || element.isJsonNull()) {
            return out;
        }
        for (JsonElement item : element.getAsJsonArray()) {
            out.add(item.getAsString());
        }
        return out;
    }

    @NotNull
    private static Map<String, String> stringMap(@NotNull JsonObject json, @NotNull String key) {
        JsonObject object = LockfileJson.optObject(json, key);
        Map<String, String> out = new LinkedHashMap<>();
        if (object == null) {
            return out;
        }
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            out.put(entry.getKey(), entry.getValue().getAsString());
        }
        return out;
    }
}
