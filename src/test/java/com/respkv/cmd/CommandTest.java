package com.respkv.cmd;

import com.respkv.core.ExpiringStore;
import com.respkv.network.protocol.Frame;
import com.respkv.network.protocol.ProtocolException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CommandTest {

    private ExpiringStore store;

    @BeforeEach
    void setUp() {
        store = new ExpiringStore();
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private static Frame request(String... parts) {
        List<Frame> elements = new ArrayList<>();
        for (String part : parts) {
            elements.add(Frame.bulk(part));
        }
        return Frame.array(elements);
    }

    private Frame run(String... parts) {
        return Command.decode(request(parts)).apply(store);
    }

    // ==================== Decoding ====================

    @Test
    void decode_get() {
        Command command = Command.decode(request("GET", "foo"));

        assertThat(command).isInstanceOf(Get.class);
        assertThat(((Get) command).getKey()).isEqualTo("foo");
        assertThat(command.getName()).isEqualTo("get");
    }

    @Test
    void decode_nameIsCaseInsensitive() {
        assertThat(Command.decode(request("gEt", "foo"))).isInstanceOf(Get.class);
        assertThat(Command.decode(request("ping"))).isInstanceOf(Ping.class);
    }

    @Test
    void decode_acceptsSimpleStringArguments() {
        Command command = Command.decode(Frame.array(Frame.simple("GET"), Frame.simple("k")));

        assertThat(((Get) command).getKey()).isEqualTo("k");
    }

    @Test
    void decode_setWithEx() {
        Set set = (Set) Command.decode(request("SET", "k", "v", "EX", "10"));

        assertThat(set.getKey()).isEqualTo("k");
        assertThat(set.getValue()).isEqualTo("v".getBytes(StandardCharsets.UTF_8));
        assertThat(set.getExpire()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void decode_setWithPx_lowerCaseOption() {
        Set set = (Set) Command.decode(request("set", "k", "v", "px", "250"));

        assertThat(set.getExpire()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void decode_setWithIntegerFrameAmount() {
        Frame frame = Frame.array(Frame.bulk("SET"), Frame.bulk("k"), Frame.bulk("v"),
            Frame.bulk("EX"), Frame.integer(3));

        assertThat(((Set) Command.decode(frame)).getExpire()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void decode_setWithoutExpire() {
        assertThat(((Set) Command.decode(request("SET", "k", "v"))).getExpire()).isNull();
    }

    @Test
    void decode_setUnknownOption_syntaxError() {
        assertThatThrownBy(() -> Command.decode(request("SET", "k", "v", "FOO", "1")))
            .isInstanceOf(CommandException.class)
            .hasMessage("ERR syntax error");
    }

    @Test
    void decode_setNonNumericAmount() {
        assertThatThrownBy(() -> Command.decode(request("SET", "k", "v", "EX", "soon")))
            .isInstanceOf(CommandException.class)
            .hasMessage("ERR value is not an integer or out of range");
    }

    @Test
    void decode_setNonPositiveAmount() {
        assertThatThrownBy(() -> Command.decode(request("SET", "k", "v", "PX", "0")))
            .isInstanceOf(CommandException.class)
            .hasMessage("ERR invalid expire time in 'set' command");
        assertThatThrownBy(() -> Command.decode(request("SET", "k", "v", "EX", "-3")))
            .isInstanceOf(CommandException.class)
            .hasMessage("ERR invalid expire time in 'set' command");
    }

    @Test
    void decode_setMissingValue_wrongArity() {
        assertThatThrownBy(() -> Command.decode(request("SET", "k")))
            .isInstanceOf(CommandException.class)
            .hasMessage("ERR wrong number of arguments for 'set' command");
    }

    @Test
    void decode_getExtraArgument_wrongArity() {
        assertThatThrownBy(() -> Command.decode(request("GET", "a", "b")))
            .isInstanceOf(CommandException.class)
            .hasMessage("ERR wrong number of arguments for 'get' command");
    }

    @Test
    void decode_pingTooManyArguments_wrongArity() {
        assertThatThrownBy(() -> Command.decode(request("PING", "a", "b")))
            .isInstanceOf(CommandException.class)
            .hasMessage("ERR wrong number of arguments for 'ping' command");
    }

    @Test
    void decode_unknownCommand_ignoresArguments() {
        Command command = Command.decode(request("FOO", "x", "y"));

        assertThat(command).isInstanceOf(Unknown.class);
        assertThat(((Unknown) command).getCommandName()).isEqualTo("foo");
        assertThat(command.getName()).isEqualTo("unknown");
    }

    @Test
    void decode_nonArray_isProtocolError() {
        assertThatThrownBy(() -> Command.decode(Frame.bulk("GET")))
            .isInstanceOf(ProtocolException.class);
    }

    @Test
    void decode_emptyArray_isProtocolError() {
        assertThatThrownBy(() -> Command.decode(Frame.array()))
            .isInstanceOf(ProtocolException.class);
    }

    @Test
    void decode_nonStringName_isCommandError() {
        assertThatThrownBy(() -> Command.decode(Frame.array(Frame.integer(1))))
            .isInstanceOf(CommandException.class);
    }

    // ==================== Execution ====================

    @Test
    void apply_setThenGet() {
        assertThat(run("SET", "foo", "bar")).isEqualTo(Frame.simple("OK"));
        assertThat(run("GET", "foo")).isEqualTo(Frame.bulk("bar"));
    }

    @Test
    void apply_getMissing_returnsNull() {
        assertThat(run("GET", "missing").isNull()).isTrue();
    }

    @Test
    void apply_setWithPx_expires() throws InterruptedException {
        run("SET", "k", "v", "PX", "100");
        assertThat(run("GET", "k")).isEqualTo(Frame.bulk("v"));

        Thread.sleep(150);

        assertThat(run("GET", "k").isNull()).isTrue();
    }

    @Test
    void apply_setWithoutExpire_clearsPreviousExpire() throws InterruptedException {
        run("SET", "k", "v1", "PX", "50");
        run("SET", "k", "v2");

        Thread.sleep(100);

        assertThat(run("GET", "k")).isEqualTo(Frame.bulk("v2"));
    }

    @Test
    void apply_pingWithoutMessage() {
        assertThat(run("PING")).isEqualTo(Frame.simple("PONG"));
    }

    @Test
    void apply_pingWithMessage_echoesBulk() {
        assertThat(run("PING", "hello")).isEqualTo(Frame.bulk("hello"));
    }

    @Test
    void apply_unknown_returnsError() {
        Frame reply = run("FOO");

        assertThat(reply.isError()).isTrue();
        assertThat(reply.getText()).isEqualTo("ERR unknown command 'foo'");
    }

    @Test
    void unknown_nameWithNewlines_staysOnOneLine() {
        Frame reply = new Unknown("a\r\nb").apply(store);

        assertThat(reply.getText()).isEqualTo("ERR unknown command 'a  b'");
    }

    @Test
    void apply_getBinaryValue() {
        byte[] value = {0x00, (byte) 0xFF, '\r', '\n'};
        Command set = Command.decode(Frame.array(Frame.bulk("SET"), Frame.bulk("bin"), Frame.bulk(value)));
        set.apply(store);

        assertThat(run("GET", "bin").getBytes()).isEqualTo(value);
    }
}
