package org.stianloader.picoinstall.lockfile;

import java.util.SortedMap;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Everything a lockfile stores.
 */
public final class LockfileContent {
    @NotNull
    public final PackagesContent packages = new PackagesContent();
    @NotNull
    public final SortedMap<String, String> redirects = new TreeMap<>();
    /**
     * Mapping between "http:" and "https:" URLs and the checksum of the module they served.
     */
    @NotNull
    public final SortedMap<String, String> remote = new TreeMap<>();
    @NotNull
    public WorkspaceConfig workspace = WorkspaceConfig.EMPTY;

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.packages.isEmpty() && this.redirects.isEmpty() && this.remote.isEmpty() && this.workspace.isEmpty();
    }
}
