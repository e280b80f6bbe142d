package com.respkv.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ServerConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("respkv.port");
        System.clearProperty("respkv.bind");
        System.clearProperty("respkv.max.frame.mb");
    }

    @Test
    void defaults() {
        ServerConfig config = new ServerConfig();

        assertThat(config.getPort()).isEqualTo(6379);
        assertThat(config.getBindAddress()).isEqualTo("127.0.0.1");
        assertThat(config.getMaxFrameBytes()).isEqualTo(ServerConfig.DEFAULT_MAX_FRAME_BYTES);
        assertThat(config.getBacklog()).isEqualTo(128);
    }

    @Test
    void builder_setsValues() {
        ServerConfig config = ServerConfig.builder()
            .port(7000)
            .bindAddress("0.0.0.0")
            .maxFrameBytes(4096)
            .backlog(16)
            .build();

        assertThat(config.getPort()).isEqualTo(7000);
        assertThat(config.getBindAddress()).isEqualTo("0.0.0.0");
        assertThat(config.getMaxFrameBytes()).isEqualTo(4096);
        assertThat(config.getBacklog()).isEqualTo(16);
    }

    @Test
    void builder_acceptsEphemeralPort() {
        assertThat(ServerConfig.builder().port(0).build().getPort()).isZero();
    }

    @Test
    void setPort_rejectsOutOfRange() {
        ServerConfig config = new ServerConfig();

        assertThatThrownBy(() -> config.setPort(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.setPort(65536)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setters_rejectInvalidValues() {
        ServerConfig config = new ServerConfig();

        assertThatThrownBy(() -> config.setBindAddress("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.setMaxFrameBytes(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.setBacklog(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromEnvironment_readsSystemProperties() {
        // Environment variables take precedence; skip when the build environment sets them
        assumeTrue(System.getenv("RESPKV_PORT") == null);
        assumeTrue(System.getenv("RESPKV_MAX_FRAME_MB") == null);
        System.setProperty("respkv.port", "7777");
        System.setProperty("respkv.max.frame.mb", "2");

        ServerConfig config = ServerConfig.fromEnvironment();

        assertThat(config.getPort()).isEqualTo(7777);
        assertThat(config.getMaxFrameBytes()).isEqualTo(2 * 1024 * 1024);
    }

    @Test
    void fromEnvironment_ignoresInvalidValues() {
        assumeTrue(System.getenv("RESPKV_PORT") == null);
        assumeTrue(System.getenv("RESPKV_MAX_FRAME_MB") == null);
        System.setProperty("respkv.port", "not-a-port");
        System.setProperty("respkv.max.frame.mb", "-4");

        ServerConfig config = ServerConfig.fromEnvironment();

        assertThat(config.getPort()).isEqualTo(ServerConfig.DEFAULT_PORT);
        assertThat(config.getMaxFrameBytes()).isEqualTo(ServerConfig.DEFAULT_MAX_FRAME_BYTES);
    }

    @Test
    void toString_includesSettings() {
        assertThat(new ServerConfig().toString()).contains("port=6379", "bindAddress='127.0.0.1'");
    }
}
