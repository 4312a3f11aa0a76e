package io.rulegate.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for {@link JsonCodec} implementations.
 *
 * <p>Register implementations in {@code META-INF/services/io.rulegate.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Returns the codec contributed by this provider.
     */
    JsonCodec codec();
}
