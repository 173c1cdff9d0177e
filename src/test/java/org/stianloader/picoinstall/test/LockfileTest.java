package org.stianloader.picoinstall.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picoinstall.PackageRequirement;
import org.stianloader.picoinstall.PackageVersion;
import org.stianloader.picoinstall.lockfile.Lockfile;
import org.stianloader.picoinstall.lockfile.LockfileException;
import org.stianloader.picoinstall.lockfile.NpmPackageInfo;
import org.stianloader.picoinstall.lockfile.WorkspaceConfig;

public class LockfileTest {

    private static final Path LOCKFILE_PATH = Paths.get("deno.lock");

    private static final String LOCKFILE = String.join("\n",
            "{",
            "  \"version\": \"5\",",
            "  \"specifiers\": {",
            "    \"jsr:@scope/a@1\": \"1.0.0\",",
            "    \"npm:chalk@5\": \"5.0.0\",",
            "    \"npm:strip-ansi@6\": \"6.0.1\"",
            "  },",
            "  \"jsr\": {",
            "    \"@scope/a@1.0.0\": {",
            "      \"integrity\": \"abc123\",",
            "      \"dependencies\": [",
            "        \"npm:chalk@5\"",
            "      ]",
            "    }",
            "  },",
            "  \"npm\": {",
            "    \"ansi-regex@5.0.1\": {",
            "      \"integrity\": \"sha512-ansi5\"",
            "    },",
            "    \"ansi-regex@6.0.1\": {",
            "      \"integrity\": \"sha512-ansi6\"",
            "    },",
            "    \"chalk@5.0.0\": {",
            "      \"integrity\": \"sha512-chalk\",",
            "      \"dependencies\": [",
            "        \"ansi-regex@6.0.1\",",
            "        \"old-ansi@npm:ansi-regex@5.0.1\",",
            "        \"supports-color\"",
            "      ],",
            "      \"os\": [",
            "        \"darwin\",",
            "        \"linux\"",
            "      ],",
            "      \"bin\": true",
            "    },",
            "    \"strip-ansi@6.0.1\": {",
            "      \"integrity\": \"sha512-strip\",",
            "      \"dependencies\": [",
            "        \"ansi-regex@5.0.1\"",
            "      ]",
            "    },",
            "    \"supports-color@9.0.0\": {",
            "      \"integrity\": \"sha512-sc\"",
            "    }",
            "  },",
            "  \"redirects\": {",
            "    \"https://deno.land/x/mod.ts\": \"https://deno.land/x@1.0.0/mod.ts\"",
            "  },",
            "  \"remote\": {",
            "    \"https://deno.land/x@1.0.0/mod.ts\": \"deadbeef\"",
            "  },",
            "  \"workspace\": {",
            "    \"dependencies\": [",
            "      \"jsr:@scope/a@1\",",
            "      \"npm:chalk@5\"",
            "    ],",
            "    \"packageJson\": {",
            "      \"dependencies\": [",
            "        \"npm:strip-ansi@6\"",
            "      ]",
            "    }",
            "  }",
            "}") + "\n";

    @Test
    public void testParse() throws IOException {
        Lockfile lockfile = Lockfile.parse(LOCKFILE_PATH, LOCKFILE, false);
        assertEquals("1.0.0", lockfile.getSpecifier(PackageRequirement.parse("jsr:@scope/a@1")));
        assertEquals("5.0.0", lockfile.getSpecifier(PackageRequirement.parse("npm:chalk@5")));

        NpmPackageInfo chalk = lockfile.getNpmPackage("chalk@5.0.0");
        assertNotNull(chalk);
        assertEquals(Map.of("ansi-regex", "ansi-regex@6.0.1", "old-ansi", "ansi-regex@5.0.1", "supports-color", "supports-color@9.0.0"), chalk.dependencies());
        assertEquals(List.of("darwin", "linux"), chalk.os());
        assertTrue(chalk.bin());
        assertFalse(chalk.scripts());

        assertEquals(Set.of(PackageRequirement.parse("npm:chalk@5")), lockfile.getJsrPackage(new PackageVersion("@scope/a", "1.0.0")).dependencies());
        assertEquals("deadbeef", lockfile.getRemote("https://deno.land/x@1.0.0/mod.ts"));
        assertEquals(Set.of(PackageRequirement.parse("npm:strip-ansi@6")), lockfile.getContent().workspace.packageJsonDependencies());
        assertFalse(lockfile.hasContentChanged());
        assertNull(lockfile.resolveWriteBytes());
    }

    @Test
    public void testPrintIsStable() throws IOException {
        assertEquals(LOCKFILE, Lockfile.parse(LOCKFILE_PATH, LOCKFILE, false).toJsonString());
    }

    @Test
    public void testJsrDependencyWithoutVersionRequirement() throws IOException {
        String text = "{\"version\":\"5\",\"specifiers\":{\"jsr:@scope/a@1\":\"1.0.0\",\"jsr:@scope/b@^2\":\"2.1.0\"},"
                + "\"jsr\":{\"@scope/a@1.0.0\":{\"integrity\":\"a\",\"dependencies\":[\"jsr:@scope/b\"]},\"@scope/b@2.1.0\":{\"integrity\":\"b\"}}}";
        Lockfile lockfile = Lockfile.parse(LOCKFILE_PATH, text, false);
        assertEquals(Set.of(PackageRequirement.parse("jsr:@scope/b@^2")), lockfile.getJsrPackage(new PackageVersion("@scope/a", "1.0.0")).dependencies());
    }

    @Test
    public void testErrors() {
        LockfileException e = assertThrows(LockfileException.class, () -> Lockfile.parse(LOCKFILE_PATH, "  \n", false));
        assertEquals(LockfileException.Reason.EMPTY, e.getReason());
        assertEquals("deno.lock", e.getFilePath());
        assertTrue(e.getMessage().contains("deno.lock"), e.getMessage());

        e = assertThrows(LockfileException.class, () -> Lockfile.parse(LOCKFILE_PATH, "{\"version\":\"4.1\"}", false));
        assertEquals(LockfileException.Reason.UNSUPPORTED_VERSION, e.getReason());

        e = assertThrows(LockfileException.class, () -> Lockfile.parse(LOCKFILE_PATH, "{\"version\":", false));
        assertEquals(LockfileException.Reason.PARSE_ERROR, e.getReason());

        e = assertThrows(LockfileException.class, () -> Lockfile.parse(LOCKFILE_PATH, "{\"version\":\"5\",\"npm\":{\"chalk\":{}}}", false));
        assertEquals(LockfileException.Reason.INVALID_PACKAGE_ID, e.getReason());

        e = assertThrows(LockfileException.class, () -> Lockfile.parse(LOCKFILE_PATH, "{\"version\":\"5\",\"npm\":{\"chalk@5.0.0\":{\"dependencies\":[\"missing\"]}}}", false));
        assertEquals(LockfileException.Reason.INVALID_NPM_DEPENDENCY, e.getReason());

        e = assertThrows(LockfileException.class, () -> Lockfile.parse(LOCKFILE_PATH, "{\"version\":\"5\",\"jsr\":{\"@scope/a@1.0.0\":{\"integrity\":\"a\",\"dependencies\":[\"jsr:@scope/missing\"]}}}", false));
        assertEquals(LockfileException.Reason.INVALID_JSR_DEPENDENCY, e.getReason());
    }

    @Test
    public void testOverwriteIgnoresContent() throws IOException {
        Lockfile lockfile = Lockfile.parse(LOCKFILE_PATH, "this is not json", true);
        assertTrue(lockfile.getContent().isEmpty());
        assertArrayEquals("{\n  \"version\": \"5\"\n}\n".getBytes(StandardCharsets.UTF_8), lockfile.resolveWriteBytes());
    }

    @Test
    public void testInsertTracksChanges() {
        Lockfile lockfile = Lockfile.newEmpty(LOCKFILE_PATH, false);
        long revision = lockfile.getRevision();

        lockfile.insertRemote("https://deno.land/x/mod.ts", "abc");
        assertTrue(lockfile.hasContentChanged());
        assertTrue(lockfile.getRevision() > revision);

        revision = lockfile.getRevision();
        lockfile.insertRemote("https://deno.land/x/mod.ts", "abc");
        lockfile.insertRedirect("jsr:@std/path", "jsr:@std/path@1.0.0");
        assertEquals(revision, lockfile.getRevision());
        assertTrue(lockfile.getContent().redirects.isEmpty());

        PackageRequirement pathReq = PackageRequirement.parse("jsr:@std/path@1");
        PackageVersion pathNv = new PackageVersion("@std/path", "1.0.2");
        lockfile.insertPackageSpecifier(pathReq, "1.0.2");
        lockfile.insertJsrPackage(pathNv, "integrity");
        lockfile.addJsrPackageDeps(pathNv, List.of(PackageRequirement.parse("jsr:@std/assert@1"), pathReq));
        // Only dependencies with a specifier are recorded
        assertEquals(Set.of(pathReq), lockfile.getJsrPackage(pathNv).dependencies());

        lockfile.insertJsrPackage(pathNv, "other-integrity");
        assertEquals("other-integrity", lockfile.getJsrPackage(pathNv).integrity());
        assertEquals(Set.of(pathReq), lockfile.getJsrPackage(pathNv).dependencies());

        lockfile.insertNpmPackage("chalk@5.0.0", NpmPackageInfo.of("sha512-chalk", Collections.emptyMap()));
        assertNotNull(lockfile.resolveWriteBytes());
    }

    @Test
    public void testWorkspaceConfigPrunesRemovedDependencies() throws IOException {
        Lockfile lockfile = Lockfile.parse(LOCKFILE_PATH, LOCKFILE, false);
        lockfile.setWorkspaceConfig(new WorkspaceConfig(Set.of(PackageRequirement.parse("npm:chalk@5")),
                Set.of(PackageRequirement.parse("npm:strip-ansi@6")), Collections.emptyMap()));

        assertTrue(lockfile.hasContentChanged());
        assertNull(lockfile.getSpecifier(PackageRequirement.parse("jsr:@scope/a@1")));
        assertNull(lockfile.getJsrPackage(new PackageVersion("@scope/a", "1.0.0")));
        assertEquals("5.0.0", lockfile.getSpecifier(PackageRequirement.parse("npm:chalk@5")));

        // npm packages stay in the lockfile when their root is removed
        lockfile.setWorkspaceConfig(new WorkspaceConfig(Collections.emptySet(), Set.of(PackageRequirement.parse("npm:strip-ansi@6")), Collections.emptyMap()));
        assertNull(lockfile.getSpecifier(PackageRequirement.parse("npm:chalk@5")));
        assertNotNull(lockfile.getNpmPackage("chalk@5.0.0"));
    }

    @Test
    public void testWorkspaceConfigPrunesChangedLinks() throws IOException {
        Lockfile lockfile = Lockfile.parse(LOCKFILE_PATH, LOCKFILE, false);
        WorkspaceConfig base = lockfile.getContent().workspace;
        lockfile.setWorkspaceConfig(new WorkspaceConfig(base.dependencies(), base.packageJsonDependencies(),
                Map.of("npm:my-lib@1.0.0", Set.of(PackageRequirement.parse("npm:strip-ansi@6")))));
        assertEquals("6.0.1", lockfile.getSpecifier(PackageRequirement.parse("npm:strip-ansi@6")));

        lockfile.setWorkspaceConfig(new WorkspaceConfig(base.dependencies(), base.packageJsonDependencies(),
                Map.of("npm:my-lib@1.0.0", Set.of(PackageRequirement.parse("npm:strip-ansi@7")))));
        assertNull(lockfile.getSpecifier(PackageRequirement.parse("npm:strip-ansi@6")));
    }

    @Test
    public void testWorkspaceConfigOnEmptyLockfile() {
        Lockfile lockfile = Lockfile.newEmpty(LOCKFILE_PATH, false);
        lockfile.setWorkspaceConfig(new WorkspaceConfig(Set.of(PackageRequirement.parse("npm:chalk@5")), Collections.emptySet(), Collections.emptyMap()));
        assertFalse(lockfile.hasContentChanged());
        assertNull(lockfile.resolveWriteBytes());
        assertEquals(Set.of(PackageRequirement.parse("npm:chalk@5")), lockfile.getContent().workspace.dependencies());
    }

    @Test
    public void testWriteAndLoad(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("deno.lock");
        Lockfile missing = Lockfile.load(file, false);
        assertTrue(missing.getContent().isEmpty());
        missing.write();
        assertFalse(Files.exists(file));

        Lockfile lockfile = Lockfile.parse(file, LOCKFILE, false);
        lockfile.insertRemote("https://deno.land/y.ts", "0123");
        lockfile.write();
        assertFalse(lockfile.hasContentChanged());

        Lockfile reloaded = Lockfile.load(file, false);
        assertEquals("0123", reloaded.getRemote("https://deno.land/y.ts"));
        assertEquals(lockfile.toJsonString(), Files.readString(file, StandardCharsets.UTF_8));
    }
}
