package org.stianloader.picoinstall.installer;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.PackageRequirement;

/**
 * Resolves version requirements to concrete packages. Implementations own the resolution state; the
 * {@link PackageInstaller} only ever consumes the snapshots they produce.
 */
public interface DependencyResolver {

    /**
     * Obtains the current state of the resolution.
     *
     * @return The latest snapshot
     */
    @NotNull
    ResolutionSnapshot snapshot();

    /**
     * Adds requirements to the resolution.
     *
     * @param requirements The requirements to resolve
     * @param refreshMetadata Whether cached registry metadata should be reloaded before resolving
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future completing with the snapshot that includes the requirements
     */
    @NotNull
    CompletableFuture<ResolutionSnapshot> addRequirements(@NotNull Collection<PackageRequirement> requirements, boolean refreshMetadata, @NotNull Executor executor);
}
