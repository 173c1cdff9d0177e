package org.stianloader.picoinstall.registry;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLConnection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;
import org.stianloader.picoinstall.logging.LoggingAdapter;

public class URIRegistryTransport implements RegistryTransport {

    @NotNull
    private final URI base;
    @NotNull
    private final String id;
    private int timeoutMillis = 60_000;

    public URIRegistryTransport(@NotNull String id, @NotNull URI base) {
        if (base.getPath() == null || base.getPath().isEmpty()) {
            base = base.resolve("/");
        } else if (!base.getPath().endsWith("/")) {
            base = base.resolve(base.getPath() + "/");
        }
        this.base = base;
        this.id = id;
    }

    protected byte @NotNull[] fetch0(@NotNull URI uri) throws IOException {
        LoggingAdapter.getDefaultLogger().debug(URIRegistryTransport.class, "Downloading {}", uri);
        URLConnection connection = uri.toURL().openConnection();
        connection.setConnectTimeout(this.timeoutMillis);
        connection.setReadTimeout(this.timeoutMillis);
        if (connection instanceof HttpURLConnection) {
            HttpURLConnection httpUrlConn = (HttpURLConnection) connection;
            int responseCode = httpUrlConn.getResponseCode();
            if (responseCode == HttpURLConnection.HTTP_NOT_FOUND) {
                throw new PackageNotFoundException(uri.getPath(), "Query for " + connection.getURL() + " returned with a response code of 404 (Not Found)");
            }
            if ((responseCode / 100) != 2) {
                throw new IOException("Query for " + connection.getURL() + " returned with a response code of " + responseCode + " (" + httpUrlConn.getResponseMessage() + ")");
            }
        }

        try (InputStream is = connection.getInputStream()) {
            return is.readAllBytes();
        }
    }

    @Override
    @NotNull
    public CompletableFuture<byte[]> fetch(@NotNull URI uri, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> {
            return this.fetch0(uri);
        }, executor);
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public URI getBaseURI() {
        return this.base;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getRegistryId() {
        return this.id;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public URIRegistryTransport setTimeout(int timeoutMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeoutMillis may not be negative");
        }
        this.timeoutMillis = timeoutMillis;
        return this;
    }
}
