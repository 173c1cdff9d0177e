package org.stianloader.picoinstall.registry;

import java.io.IOException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown if the registry does not know about a package or version. Unlike other {@link IOException IOExceptions}
 * this is not a transient failure, so resolvers may move on to other candidates instead of aborting.
 */
public class PackageNotFoundException extends IOException {

    private static final long serialVersionUID = 8123990423475612117L;

    @NotNull
    private final String packageName;

    public PackageNotFoundException(@NotNull String packageName, @NotNull String message) {
        super(message);
        this.packageName = packageName;
    }

    @NotNull
    @Contract(pure = true)
    public String getPackageName() {
        return this.packageName;
    }
}
