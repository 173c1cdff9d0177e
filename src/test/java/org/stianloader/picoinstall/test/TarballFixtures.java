package org.stianloader.picoinstall.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import org.jetbrains.annotations.NotNull;

/**
 * Builds gzip compressed tarballs for tests.
 */
final class TarballFixtures {

    @NotNull
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    @NotNull
    private final TarArchiveOutputStream tar;

    TarballFixtures() {
        try {
            this.tar = new TarArchiveOutputStream(new GZIPOutputStream(this.bytes));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        this.tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
    }

    @NotNull
    TarballFixtures file(@NotNull String name, @NotNull String content) throws IOException {
        return this.file(name, content, 0644);
    }

    @NotNull
    TarballFixtures file(@NotNull String name, @NotNull String content, int mode) throws IOException {
        byte[] data = content.getBytes(StandardCharsets.UTF_8);
        TarArchiveEntry entry = new TarArchiveEntry(name);
        entry.setSize(data.length);
        entry.setMode(mode);
        this.tar.putArchiveEntry(entry);
        this.tar.write(data);
        this.tar.closeArchiveEntry();
        return this;
    }

    @NotNull
    TarballFixtures directory(@NotNull String name) throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(name.endsWith("/") ? name : name + "/");
        this.tar.putArchiveEntry(entry);
        this.tar.closeArchiveEntry();
        return this;
    }

    @NotNull
    TarballFixtures symlink(@NotNull String name, @NotNull String target) throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(name, TarConstants.LF_SYMLINK);
        entry.setLinkName(target);
        this.tar.putArchiveEntry(entry);
        this.tar.closeArchiveEntry();
        return this;
    }

    byte @NotNull[] build() throws IOException {
        this.tar.close();
        return this.bytes.toByteArray();
    }

    static byte @NotNull[] simplePackage(@NotNull String marker) throws IOException {
        return new TarballFixtures()
                .file("package/package.json", "{\"name\":\"" + marker + "\"}")
                .file("package/lib/index.js", "module.exports = '" + marker + "';")
                .build();
    }

    @NotNull
    static String sha512Integrity(byte @NotNull[] data) {
        return "sha512-" + Base64.getEncoder().encodeToString(TarballFixtures.digest("SHA-512", data));
    }

    static byte @NotNull[] digest(@NotNull String algorithm, byte @NotNull[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
