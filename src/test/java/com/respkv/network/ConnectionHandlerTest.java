package com.respkv.network;

import com.respkv.core.ExpiringStore;
import com.respkv.core.KVStore;
import com.respkv.network.protocol.Frame;
import com.respkv.network.protocol.FrameCodec;
import com.respkv.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ConnectionHandlerTest {

    private ExpiringStore store;
    private MetricsCollector metrics;

    @BeforeEach
    void setUp() {
        store = new ExpiringStore();
        metrics = new MetricsCollector();
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private static byte[] requests(Frame... frames) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Frame frame : frames) {
            out.writeBytes(FrameCodec.serialize(frame));
        }
        return out.toByteArray();
    }

    private static Frame command(String... parts) {
        Frame[] elements = new Frame[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = Frame.bulk(parts[i]);
        }
        return Frame.array(elements);
    }

    private String serve(byte[] input) {
        return serve(input, store);
    }

    private String serve(byte[] input, KVStore target) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Connection connection = new Connection(new ByteArrayInputStream(input), out, 1024 * 1024);
        new ConnectionHandler(connection, target, metrics, null).run();
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void run_answersEachRequestInOrder() {
        String replies = serve(requests(
            command("SET", "foo", "bar"),
            command("GET", "foo"),
            command("PING")));

        assertThat(replies).isEqualTo("+OK\r\n$3\r\nbar\r\n+PONG\r\n");
        assertThat(metrics.getActiveConnections()).isZero();
        assertThat(metrics.getTotalConnections()).isEqualTo(1);
    }

    @Test
    void run_commandErrorsKeepConnectionOpen() {
        String replies = serve(requests(
            command("FOO"),
            command("SET", "k"),
            command("SET", "k", "v", "NX"),
            command("PING")));

        assertThat(replies).isEqualTo(
            "-ERR unknown command 'foo'\r\n" +
            "-ERR wrong number of arguments for 'set' command\r\n" +
            "-ERR syntax error\r\n" +
            "+PONG\r\n");
        assertThat(metrics.getCommandErrors()).isEqualTo(2);
    }

    @Test
    void run_protocolErrorClosesConnection() {
        byte[] input = "!garbage\r\n*1\r\n$4\r\nPING\r\n".getBytes(StandardCharsets.UTF_8);

        String replies = serve(input);

        assertThat(replies).isEmpty();
        assertThat(metrics.getProtocolErrors()).isEqualTo(1);
    }

    @Test
    void run_nonArrayRequestClosesConnection() {
        String replies = serve(requests(Frame.simple("PING"), command("PING")));

        assertThat(replies).isEmpty();
        assertThat(metrics.getProtocolErrors()).isEqualTo(1);
    }

    @Test
    void run_repliesBeforeMidFrameDisconnect() {
        byte[] complete = requests(command("PING"));
        byte[] partial = "*2\r\n$3\r\nGET".getBytes(StandardCharsets.UTF_8);
        byte[] input = new byte[complete.length + partial.length];
        System.arraycopy(complete, 0, input, 0, complete.length);
        System.arraycopy(partial, 0, input, complete.length, partial.length);

        assertThat(serve(input)).isEqualTo("+PONG\r\n");
    }

    @Test
    void process_recordsCommandMetrics() {
        ConnectionHandler handler = new ConnectionHandler(
            new Connection(new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream(), 1024),
            store, metrics, null);

        handler.process(command("GET", "missing"));
        handler.process(command("SET", "k", "v"));
        handler.process(command("GET", "k"));

        assertThat(metrics.getCommandCount("get")).isEqualTo(2);
        assertThat(metrics.getCommandCount("set")).isEqualTo(1);
        assertThat(metrics.getHitRate()).isEqualTo(0.5);
    }

    @Test
    void process_storeFailure_becomesInternalError() {
        KVStore failing = new KVStore() {
            @Override
            public void set(String key, byte[] value) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void set(String key, byte[] value, Duration ttl) {
                throw new IllegalStateException("boom");
            }

            @Override
            public Optional<byte[]> get(String key) {
                throw new IllegalStateException("boom");
            }

            @Override
            public boolean delete(String key) {
                return false;
            }

            @Override
            public boolean exists(String key) {
                return false;
            }

            @Override
            public int size() {
                return 0;
            }

            @Override
            public void clear() {
            }
        };

        String replies = serve(requests(command("GET", "k"), command("PING")), failing);

        assertThat(replies).isEqualTo("-ERR internal error\r\n+PONG\r\n");
        assertThat(metrics.getInternalErrors()).isEqualTo(1);
    }
}
