package io.rulegate.json.jackson;

import io.rulegate.json.spi.JsonCodec;
import io.rulegate.json.spi.JsonCodecProvider;
import io.rulegate.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JsonCodec codec = new JacksonJsonCodec();

    @Test
    void keepsNullEntriesInsideMaps() throws Exception {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", "p1");
        record.put("owner", null);

        assertThat(codec.writeString(record)).isEqualTo("{\"id\":\"p1\",\"owner\":null}");
    }

    @Test
    void omitsNullPropertiesOfPojos() throws Exception {
        assertThat(codec.writeString(new Ack("s1", null))).isEqualTo("{\"id\":\"s1\"}");
    }

    @Test
    void ignoresUnknownPropertiesWhenReading() throws Exception {
        Ack ack = codec.readValue("{\"id\":\"s1\",\"filter\":\"a=1\",\"extra\":true}", Ack.class);
        assertThat(ack.id).isEqualTo("s1");
        assertThat(ack.filter).isEqualTo("a=1");
    }

    @Test
    void readsRecordTreesFromStreams() throws Exception {
        byte[] json = "{\"views\":20,\"tags\":[\"a\"],\"ratio\":0.5}".getBytes(StandardCharsets.UTF_8);
        @SuppressWarnings("unchecked")
        Map<String, Object> record = codec.readValue(new ByteArrayInputStream(json), Map.class);

        assertThat(record).containsEntry("views", 20).containsEntry("ratio", 0.5);
        assertThat((List<Object>) record.get("tags")).containsExactly("a");
    }

    @Test
    void wrapsMalformedInput() {
        assertThatThrownBy(() -> codec.readValue("{not json", Map.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readValue((InputStream) null, Map.class))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void discoverableThroughServiceLoader() {
        assertThat(ServiceLoader.load(JsonCodecProvider.class))
                .anySatisfy(p -> assertThat(p.codec()).isInstanceOf(JacksonJsonCodec.class));
    }

    public static final class Ack {
        public String id;
        public String filter;

        public Ack() {
        }

        Ack(String id, String filter) {
            this.id = id;
            this.filter = filter;
        }
    }
}
