package com.respkv.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the RespKV server.
 *
 * Defaults can be overridden through environment variables or system properties;
 * the environment variable wins when both are set:
 * <ul>
 *   <li>RESPKV_PORT / respkv.port</li>
 *   <li>RESPKV_BIND / respkv.bind</li>
 *   <li>RESPKV_MAX_FRAME_MB / respkv.max.frame.mb</li>
 * </ul>
 */
public class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_BIND_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_MAX_FRAME_BYTES = 512 * 1024 * 1024 + 1024;
    public static final int DEFAULT_BACKLOG = 128;

    private int port = DEFAULT_PORT;
    private String bindAddress = DEFAULT_BIND_ADDRESS;
    private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;
    private int backlog = DEFAULT_BACKLOG;

    public ServerConfig() {
    }

    /**
     * Create a config with defaults, then apply environment variables and system properties.
     */
    public static ServerConfig fromEnvironment() {
        ServerConfig config = new ServerConfig();
        Integer port = readInt("RESPKV_PORT", "respkv.port");
        if (port != null) {
            if (port < 0 || port > 65535) {
                logger.warn("Ignoring out-of-range port {}, using {}", port, DEFAULT_PORT);
            } else {
                config.port = port;
            }
        }
        String bind = read("RESPKV_BIND", "respkv.bind");
        if (bind != null) {
            config.bindAddress = bind.trim();
        }
        Integer maxFrameMb = readInt("RESPKV_MAX_FRAME_MB", "respkv.max.frame.mb");
        if (maxFrameMb != null) {
            if (maxFrameMb <= 0 || maxFrameMb > 2047) {
                logger.warn("Ignoring invalid max frame size {} MB, using default", maxFrameMb);
            } else {
                config.maxFrameBytes = maxFrameMb * 1024 * 1024;
            }
        }
        return config;
    }

    /**
     * Create a config builder starting from defaults.
     */
    public static Builder builder() {
        return new Builder(new ServerConfig());
    }

    /**
     * Create a config builder starting from the environment.
     */
    public static Builder builderFromEnvironment() {
        return new Builder(fromEnvironment());
    }

    private static String read(String envKey, String propKey) {
        String value = System.getenv(envKey);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propKey);
        }
        if (value == null || value.isEmpty()) {
            return null;
        }
        return value;
    }

    private static Integer readInt(String envKey, String propKey) {
        String value = read(envKey, propKey);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value: {}, using default", envKey, value);
            return null;
        }
    }

    public int getPort() {
        return port;
    }

    /**
     * Set the listen port. Zero picks an ephemeral port.
     */
    public void setPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        if (bindAddress == null || bindAddress.isEmpty()) {
            throw new IllegalArgumentException("bindAddress must not be empty");
        }
        this.bindAddress = bindAddress;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive, got: " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    public int getBacklog() {
        return backlog;
    }

    public void setBacklog(int backlog) {
        if (backlog <= 0) {
            throw new IllegalArgumentException("backlog must be positive, got: " + backlog);
        }
        this.backlog = backlog;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
               "bindAddress='" + bindAddress + '\'' +
               ", port=" + port +
               ", maxFrameBytes=" + maxFrameBytes +
               ", backlog=" + backlog +
               '}';
    }

    /**
     * Builder for ServerConfig.
     */
    public static class Builder {
        private final ServerConfig config;

        private Builder(ServerConfig config) {
            this.config = config;
        }

        public Builder port(int port) {
            config.setPort(port);
            return this;
        }

        public Builder bindAddress(String bindAddress) {
            config.setBindAddress(bindAddress);
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            config.setMaxFrameBytes(maxFrameBytes);
            return this;
        }

        public Builder backlog(int backlog) {
            config.setBacklog(backlog);
            return this;
        }

        public ServerConfig build() {
            return config;
        }
    }
}
