package jsontree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

class EncodingRegistryTest {

    @Test
    void defaults() {
        var registry = EncodingRegistry.defaultRegistry();

        assertThat(registry.lookup("base64")).isSameAs(Encoding.BASE64);
        assertThat(registry.lookup("hex")).isSameAs(Encoding.HEX);
        assertThat(registry.lookup("base32")).isNull();
        assertThat(EncodingRegistry.defaultRegistry()).isSameAs(registry);
    }

    @Test
    void newRegistryIsEmpty() {
        var registry = new EncodingRegistry();

        assertThat(registry.lookup("base64")).isNull();
        assertThat(registry.lookup("hex")).isNull();
        assertThat(EncodingRegistry.withDefaults().lookup("hex")).isSameAs(Encoding.HEX);
    }

    @Test
    void duplicateRegistration() {
        var registry = EncodingRegistry.withDefaults();

        assertThatThrownBy(() -> registry.register("hex", Encoding.BASE64))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Duplicate encoding: hex");
        assertThat(registry.lookup("hex")).isSameAs(Encoding.HEX);
    }

    @Test
    void decode() {
        // @spotless:off
        var table = new Object[][] {
                {Encoding.BASE64, "YWFh", "aaa"},
                {Encoding.BASE64, "YQ==", "a"},
                {Encoding.BASE64, "", ""},
                {Encoding.HEX, "616161", "aaa"},
                {Encoding.HEX, "4A4b", "JK"},
        };
        // @spotless:on

        assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
            var row = table[i];
            var encoding = (Encoding) row[0];
            var input = (String) row[1];
            var actual = new String(encoding.decode(input), StandardCharsets.UTF_8);
            assertThat(actual).as("Case %d: %s %s", i, encoding, input).isEqualTo(row[2]);
        }));
    }

    @Test
    void rejectsMalformedInput() {
        // @spotless:off
        var table = new Object[][] {
                {Encoding.BASE64, "YQ"},
                {Encoding.BASE64, "616161"},
                {Encoding.BASE64, "Y!=="},
                {Encoding.HEX, "abc"},
                {Encoding.HEX, "zz"},
        };
        // @spotless:on

        assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
            var row = table[i];
            var encoding = (Encoding) row[0];
            var input = (String) row[1];
            assertThatThrownBy(() -> encoding.decode(input))
                    .as("Case %d: %s %s", i, encoding, input)
                    .isInstanceOf(IllegalArgumentException.class);
        }));
    }

    @Test
    void encode() {
        var bytes = "aaa".getBytes(StandardCharsets.UTF_8);

        assertThat(Encoding.BASE64.encode(bytes)).isEqualTo("YWFh");
        assertThat(Encoding.HEX.encode(bytes)).isEqualTo("616161");
    }

    @Test
    @SneakyThrows
    void lookupsWhileRegistering() {
        int names = 200;
        int readers = 3;
        var registry = new EncodingRegistry();
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(readers + 1);
        try {
            var writer = pool.submit(() -> {
                start.await();
                for (int i = 0; i < names; i++) registry.register("enc" + i, Encoding.HEX);
                return null;
            });
            var seen = new ArrayList<Future<Integer>>();
            for (int r = 0; r < readers; r++) {
                seen.add(pool.submit(() -> {
                    start.await();
                    int found = 0;
                    for (int i = 0; i < names; i++) {
                        var encoding = registry.lookup("enc" + i);
                        if (encoding == null) continue;
                        assertThat(encoding).isSameAs(Encoding.HEX);
                        found++;
                    }
                    return found;
                }));
            }
            start.countDown();
            writer.get(10, TimeUnit.SECONDS);
            for (var f : seen) assertThat(f.get(10, TimeUnit.SECONDS)).isBetween(0, names);
        } finally {
            pool.shutdownNow();
        }

        assertAll(IntStream.range(0, names)
                .mapToObj(i -> () -> assertThat(registry.lookup("enc" + i)).as("Case %d", i).isSameAs(Encoding.HEX)));
    }
}
