package org.stianloader.picoinstall.tarball;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageVersion;

/**
 * Verifies downloaded tarballs against the integrity advertised by the registry.
 */
public final class TarballIntegrity {

    private TarballIntegrity() {
        throw new UnsupportedOperationException();
    }

    /**
     * Computes the digest of the data that the descriptor asks for and compares it with the
     * descriptor's hash, encoded the same way the descriptor encodes it. A descriptor of
     * {@link IntegrityDescriptor#NONE} asserts nothing and thus always passes.
     *
     * @param packageVersion The package the data belongs to, for error reporting
     * @param data The raw tarball bytes
     * @param descriptor The advertised integrity
     * @throws IntegrityCheckException If the descriptor kind or algorithm is not supported,
     * or if the checksum does not match
     */
    public static void verify(@NotNull PackageVersion packageVersion, byte @NotNull[] data, @NotNull IntegrityDescriptor descriptor) throws IntegrityCheckException {
        if (descriptor instanceof IntegrityDescriptor.Hashed) {
            IntegrityDescriptor.Hashed hashed = (IntegrityDescriptor.Hashed) descriptor;
            String algorithm;
            switch (hashed.algorithm()) {
            case "sha512":
                algorithm = "SHA-512";
                break;
            case "sha1":
                algorithm = "SHA-1";
                break;
            default:
                throw IntegrityCheckException.notImplemented(packageVersion, hashed.algorithm());
            }
            String actual = Base64.getEncoder().encodeToString(TarballIntegrity.digest(algorithm, data));
            if (!actual.equals(hashed.encodedHash())) {
                throw IntegrityCheckException.mismatch(packageVersion, hashed.encodedHash(), actual);
            }
        } else if (descriptor instanceof IntegrityDescriptor.LegacyHex) {
            String expected = ((IntegrityDescriptor.LegacyHex) descriptor).sha1Hex();
            String actual = HexFormat.of().formatHex(TarballIntegrity.digest("SHA-1", data));
            if (!actual.equals(expected.toLowerCase(Locale.ROOT))) {
                throw IntegrityCheckException.mismatch(packageVersion, expected, actual);
            }
        } else if (descriptor instanceof IntegrityDescriptor.UnknownKind) {
            throw IntegrityCheckException.notImplemented(packageVersion, ((IntegrityDescriptor.UnknownKind) descriptor).name());
        } else if (descriptor != IntegrityDescriptor.NONE) {
            throw IntegrityCheckException.notImplemented(packageVersion, descriptor.getClass().getSimpleName());
        }
    }

    private static byte @NotNull[] digest(@NotNull String algorithm, byte @NotNull[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            // Every JVM is required to ship SHA-1 and SHA-512
            throw new IllegalStateException("Missing message digest " + algorithm, e);
        }
    }
}
