package jsontree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import jsontree.JsonException.ExtensionException;
import jsontree.JsonException.SyntaxException;
import jsontree.JsonException.UndefinedFieldException;
import lombok.Data;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonTest {

    static class Cutie implements NodeDecodable {
        static final int SNEK = 0;
        static final int PUPPER = 1;
        static final int FROGGO = 2;

        int kind;

        @Override
        public void decodeNode(Node node) {
            if (!(node instanceof StringNode name)) throw new IllegalArgumentException("string expected");
            switch (name.value()) {
                case "snek" -> kind = SNEK;
                case "pupper" -> kind = PUPPER;
                case "froggo" -> kind = FROGGO;
                default -> throw new IllegalArgumentException("unknown kind of cutie: " + name.value());
            }
        }
    }

    @Data
    static class Event {
        public String type;
        public long seq;
    }

    @Nested
    class UnmarshalTests {

        @Test
        void unmarshal() {
            var ref = new Ref<Map<String, List<Integer>>>() {};
            Json.unmarshal("{\"a\":[1,2],\"b\":[]}", ref);

            assertThat(ref.get()).isEqualTo(Map.of("a", List.of(1, 2), "b", List.of()));
        }

        @Test
        void unmarshalBytes() {
            var ref = Ref.of(String.class);
            Json.unmarshal("\"hé世\"".getBytes(StandardCharsets.UTF_8), ref);

            assertThat(ref.get()).isEqualTo("hé世");
        }

        @Test
        void surrogatePairEscape() {
            var ref = Ref.of(String.class);
            Json.unmarshal("\"\\uD834\\uDD1E\"", ref);

            assertThat(ref.get()).isEqualTo(new String(Character.toChars(0x1D11E)));
            assertThat(ref.get().codePointAt(0)).isEqualTo(0x1D11E);
        }

        @Test
        void syntaxErrorsSurface() {
            assertThatThrownBy(() -> Json.unmarshal("[1,", Ref.of(Object.class)))
                    .isInstanceOf(SyntaxException.class);
        }

        @Test
        void customNodeDecoder() {
            var ref = new Ref<List<Cutie>>() {};
            Json.unmarshal("[\"snek\",\"pupper\",\"froggo\"]", ref);

            assertThat(ref.get()).extracting(c -> c.kind).containsExactly(Cutie.SNEK, Cutie.PUPPER, Cutie.FROGGO);
            assertThatThrownBy(() -> Json.unmarshal("[\"kitty\"]", ref))
                    .isInstanceOf(ExtensionException.class)
                    .hasRootCauseMessage("unknown kind of cutie: kitty");
        }
    }

    @Nested
    class StreamTests {

        @Test
        void decodeStream() {
            var decoder = Json.newDecoder(new StringReader(
                    "{\"type\":\"a\",\"seq\":1}\n{\"type\":\"b\",\"seq\":2}\n{\"type\":\"c\",\"seq\":3}\n"));

            var events = new ArrayList<Event>();
            var event = Ref.of(Event.class);
            while (decoder.decode(event)) {
                events.add(event.get());
                event = Ref.of(Event.class);
            }

            assertThat(events).extracting(Event::getType).containsExactly("a", "b", "c");
            assertThat(events).extracting(Event::getSeq).containsExactly(1L, 2L, 3L);
            assertThat(decoder.decode(Ref.of(Event.class))).isFalse();
        }

        @Test
        void decodeStreamInPlace() {
            var decoder = Json.newDecoder(new StringReader("[1,2] [3]"));
            var ref = new Ref<List<Integer>>() {};

            assertThat(decoder.decode(ref)).isTrue();
            assertThat(ref.get()).containsExactly(1, 2);
            assertThat(decoder.decode(ref)).isTrue();
            assertThat(ref.get()).containsExactly(3);
            assertThat(decoder.decode(ref)).isFalse();
            assertThat(ref.get()).containsExactly(3);
        }

        @Test
        void streamOptions() {
            var strict = Json.newDecoder(new StringReader("{\"type\":\"a\",\"extra\":1}")).disallowUnknownFields();
            assertThatThrownBy(() -> strict.decode(new Event())).isInstanceOf(UndefinedFieldException.class);

            var asString = Json.newDecoder(new StringReader("{\"seq\":\"9\"}"));
            var ref = new Ref<Map<String, Long>>() {};
            asString.options(Option.elements(Option.asString())).decode(ref);
            assertThat(ref.get()).containsEntry("seq", 9L);
        }
    }
}
