package org.stianloader.picoinstall.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.stianloader.picoinstall.PackageIdentity.NpmPackageId;
import org.stianloader.picoinstall.PackageKind;
import org.stianloader.picoinstall.PackageRequirement;
import org.stianloader.picoinstall.PackageVersion;

public class PackageRequirementTest {

    @Test
    public void testParse() {
        assertEquals(PackageRequirement.jsr("@std/path", "^1.0"), PackageRequirement.parse("jsr:@std/path@^1.0"));
        assertEquals(PackageRequirement.npm("chalk", "5"), PackageRequirement.parse("npm:chalk@5"));
        assertEquals(PackageRequirement.npm("@types/node", null), PackageRequirement.parse("npm:@types/node"));
        assertNull(PackageRequirement.parse("npm:chalk@").versionRequirement());
        assertEquals(PackageKind.JSR, PackageRequirement.parse("jsr:@scope/a").kind());

        assertThrows(IllegalArgumentException.class, () -> PackageRequirement.parse("chalk@5"));
        assertThrows(IllegalArgumentException.class, () -> PackageRequirement.parse("pypi:requests"));
        assertThrows(IllegalArgumentException.class, () -> PackageRequirement.parse("npm:"));
    }

    @Test
    public void testToString() {
        assertEquals("jsr:@std/path@^1.0", PackageRequirement.jsr("@std/path", "^1.0").toString());
        assertEquals("npm:@types/node", PackageRequirement.npm("@types/node", "").toString());
        assertEquals(PackageRequirement.npm("chalk", null), PackageRequirement.npm("chalk", "5").withoutVersionRequirement());
    }

    @Test
    public void testPackageVersion() {
        assertEquals(new PackageVersion("@scope/pkg", "1.0.0"), PackageVersion.parse("@scope/pkg@1.0.0"));
        assertEquals("lodash@4.17.21", new PackageVersion("lodash", "4.17.21").toString());
        assertEquals(-1, PackageVersion.versionSeparator("@scope/pkg"));
        assertEquals(-1, PackageVersion.versionSeparator("lodash@"));
        assertThrows(IllegalArgumentException.class, () -> PackageVersion.parse("lodash"));
    }

    @Test
    public void testNpmPackageId() {
        NpmPackageId id = new NpmPackageId("chalk@5.0.0_supports-color@9.0.0");
        assertEquals("chalk", id.getName());
        assertEquals("5.0.0_supports-color@9.0.0", id.getVersionAndSuffix());
        assertEquals(new PackageVersion("chalk", "5.0.0"), id.toPackageVersion());
        assertEquals("@scope/pkg", new NpmPackageId("@scope/pkg@1.0.0").getName());
        assertThrows(IllegalArgumentException.class, () -> new NpmPackageId("chalk"));
    }
}
