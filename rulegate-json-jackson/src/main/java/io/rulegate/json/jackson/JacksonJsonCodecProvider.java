package io.rulegate.json.jackson;

import io.rulegate.json.spi.JsonCodec;
import io.rulegate.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec codec() {
        return new JacksonJsonCodec();
    }
}
