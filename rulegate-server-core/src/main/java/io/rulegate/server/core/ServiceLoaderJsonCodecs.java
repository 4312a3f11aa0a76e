package io.rulegate.server.core;

import io.rulegate.json.spi.JsonCodec;
import io.rulegate.json.spi.JsonCodecProvider;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Discovers the {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class ServiceLoaderJsonCodecs {

    private ServiceLoaderJsonCodecs() {}

    /**
     * First codec registered under {@code META-INF/services}.
     *
     * @throws IllegalStateException if no provider is on the class path
     */
    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        for (JsonCodecProvider provider : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            JsonCodec codec = provider.codec();
            if (codec != null) return codec;
        }
        throw new IllegalStateException("No " + JsonCodecProvider.class.getName()
                + " found; add rulegate-json-jackson to the class path or configure a codec");
    }

    public static JsonCodec defaultCodec() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return load(cl != null ? cl : ServiceLoaderJsonCodecs.class.getClassLoader());
    }
}
