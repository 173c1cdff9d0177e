package org.stianloader.picoinstall.cache;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Governs how far existing cache entries are trusted.
 */
public final class CacheSetting {

    public static enum Mode {
        /**
         * Only use the cache, never hit the network.
         */
        ONLY,
        /**
         * Ignore every cache entry and fetch everything anew.
         */
        RELOAD_ALL,
        /**
         * Fetch the named packages anew, use the cache for everything else.
         */
        RELOAD_SOME,
        /**
         * Use cache entries wherever present.
         */
        USE;
    }

    @NotNull
    public static final CacheSetting ONLY = new CacheSetting(Mode.ONLY, Collections.emptySet());
    @NotNull
    public static final CacheSetting RELOAD_ALL = new CacheSetting(Mode.RELOAD_ALL, Collections.emptySet());
    @NotNull
    public static final CacheSetting USE = new CacheSetting(Mode.USE, Collections.emptySet());

    @NotNull
    private final Mode mode;
    @NotNull
    private final Set<String> reloadedNames;

    private CacheSetting(@NotNull Mode mode, @NotNull Set<String> reloadedNames) {
        this.mode = mode;
        this.reloadedNames = reloadedNames;
    }

    @NotNull
    @Contract(pure = true)
    public static CacheSetting reloadSome(@NotNull Collection<@NotNull String> packageNames) {
        return new CacheSetting(Mode.RELOAD_SOME, Collections.unmodifiableSet(new LinkedHashSet<>(packageNames)));
    }

    @NotNull
    @Contract(pure = true)
    public Mode getMode() {
        return this.mode;
    }

    @NotNull
    @Contract(pure = true)
    public Set<String> getReloadedNames() {
        return this.reloadedNames;
    }

    /**
     * Checks whether existing cache entries of the package may be trusted.
     *
     * @param packageName The name of the package
     * @return False under {@link #RELOAD_ALL} or if the package is one of the packages to reload, true otherwise
     */
    @Contract(pure = true)
    public boolean shouldUse(@NotNull String packageName) {
        switch (this.mode) {
        case RELOAD_ALL:
            return false;
        case RELOAD_SOME:
            return !this.reloadedNames.contains(packageName);
        default:
            return true;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof CacheSetting) {
            return ((CacheSetting) obj).mode == this.mode && ((CacheSetting) obj).reloadedNames.equals(this.reloadedNames);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.mode, this.reloadedNames);
    }

    @Override
    public String toString() {
        return this.mode == Mode.RELOAD_SOME ? "RELOAD_SOME" + this.reloadedNames : this.mode.name();
    }
}
