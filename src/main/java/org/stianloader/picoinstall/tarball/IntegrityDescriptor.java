package org.stianloader.picoinstall.tarball;

import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The checksum a tarball is expected to have, as advertised by the registry.
 *
 * <ul>
 * <li>{@link Hashed}: a subresource-integrity style {@code algorithm-base64hash} string.</li>
 * <li>{@link LegacyHex}: the legacy hex encoded sha1 "shasum".</li>
 * <li>{@link UnknownKind}: an integrity string that could not be split into algorithm and hash.</li>
 * <li>{@link #NONE}: no integrity was asserted by the registry.</li>
 * </ul>
 */
public interface IntegrityDescriptor {

    @NotNull
    public static final IntegrityDescriptor NONE = new None();

    @NotNull
    @Contract(pure = true)
    public static IntegrityDescriptor of(@Nullable String integrity, @Nullable String shasum) {
        if (integrity != null) {
            int separator = integrity.indexOf('-');
            if (separator <= 0 || separator == integrity.length() - 1) {
                return new UnknownKind(integrity);
            }
            return new Hashed(integrity.substring(0, separator).toLowerCase(Locale.ROOT), integrity.substring(separator + 1));
        } else if (shasum != null) {
            return new LegacyHex(shasum);
        }
        return IntegrityDescriptor.NONE;
    }

    public static final record Hashed(@NotNull String algorithm, @NotNull String encodedHash) implements IntegrityDescriptor {
        public Hashed {
            Objects.requireNonNull(algorithm, "algorithm may not be null");
            Objects.requireNonNull(encodedHash, "encodedHash may not be null");
        }

        @Override
        @NotNull
        public String toString() {
            return this.algorithm + '-' + this.encodedHash;
        }
    }

    public static final record LegacyHex(@NotNull String sha1Hex) implements IntegrityDescriptor {
        public LegacyHex {
            Objects.requireNonNull(sha1Hex, "sha1Hex may not be null");
        }

        @Override
        @NotNull
        public String toString() {
            return this.sha1Hex;
        }
    }

    public static final record UnknownKind(@NotNull String name) implements IntegrityDescriptor {
        public UnknownKind {
            Objects.requireNonNull(name, "name may not be null");
        }
    }

    static final record None() implements IntegrityDescriptor {
    }
}
