package org.stianloader.picoinstall.cache;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageVersion;

/**
 * Identifies a package folder within the cache. Copy index 0 is the canonical extraction of a version,
 * higher indices are hard linked clones for packages that need different dependency sets in different
 * parts of the graph.
 */
public final record CacheFolderId(@NotNull PackageVersion nv, int copyIndex) {
    public CacheFolderId {
        Objects.requireNonNull(nv, "nv may not be null");
        if (copyIndex < 0) {
            throw new IllegalArgumentException("copyIndex may not be negative, got " + copyIndex);
        }
    }

    @NotNull
    public String getFolderName() {
        if (this.copyIndex == 0) {
            return this.nv.version();
        }
        return this.nv.version() + '_' + this.copyIndex;
    }
}
