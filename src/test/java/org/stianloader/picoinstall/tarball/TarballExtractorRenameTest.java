package org.stianloader.picoinstall.tarball;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TarballExtractorRenameTest {

    private static Path extractedFolder(Path dir) throws IOException {
        Path temp = Files.createDirectories(dir.resolve(".tmp-pkg"));
        Files.writeString(temp.resolve("package.json"), "{\"name\":\"pkg\"}", StandardCharsets.UTF_8);
        return temp;
    }

    @Test
    public void testRetriesExhausted(@TempDir Path dir) throws IOException {
        Path temp = TarballExtractorRenameTest.extractedFolder(dir);
        Path output = dir.resolve("missing-parent/1.0.0");

        assertThrows(NoSuchFileException.class, () -> TarballExtractor.renameWithRetries(temp, output));
        assertFalse(Files.exists(temp));
        assertFalse(Files.exists(output));
    }

    @Test
    public void testLateDestinationIsSuccess(@TempDir Path dir) throws Exception {
        Path temp = TarballExtractorRenameTest.extractedFolder(dir);
        Path output = dir.resolve("late-parent/1.0.0");

        // Another process finishes the same package while the first attempts fail
        CompletableFuture<Void> concurrentWriter = CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(30L);
                Files.createDirectories(output);
                Files.writeString(output.resolve("package.json"), "{\"name\":\"pkg\"}", StandardCharsets.UTF_8);
            } catch (IOException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        TarballExtractor.renameWithRetries(temp, output);
        concurrentWriter.get();
        assertFalse(Files.exists(temp));
        assertTrue(Files.isRegularFile(output.resolve("package.json")));
    }
}
