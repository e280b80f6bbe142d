package com.respkv;

import com.respkv.config.ServerConfig;
import com.respkv.core.ExpiringStore;
import com.respkv.network.TcpServer;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * RespKV server entry point.
 * Owns the store, the metrics and the TCP listener for one process.
 */
public class RespKVServer {

    private static final Logger logger = LoggerFactory.getLogger(RespKVServer.class);

    private static final String VERSION = "1.0.0";

    private final ServerConfig config;
    private final ExpiringStore store;
    private final MetricsCollector metrics;
    private final TcpServer tcpServer;
    private final CountDownLatch shutdownLatch;

    /**
     * Create a server on the given port with defaults for everything else.
     *
     * @param port the port to listen on, 0 for an ephemeral port
     */
    public RespKVServer(int port) {
        this(ServerConfig.builderFromEnvironment().port(port).build());
    }

    /**
     * Create a new server.
     *
     * @param config the server configuration
     */
    public RespKVServer(ServerConfig config) {
        this(config, new ExpiringStore(), new MetricsCollector());
    }

    /**
     * Create a server with custom store and metrics.
     *
     * @param config  the server configuration
     * @param store   the key-value store to use
     * @param metrics the metrics collector to use
     */
    public RespKVServer(ServerConfig config, ExpiringStore store, MetricsCollector metrics) {
        this.config = config;
        this.store = store;
        this.metrics = metrics;
        this.shutdownLatch = new CountDownLatch(1);
        this.metrics.bindStore(store::size, store::expiredCount);
        this.tcpServer = new TcpServer(config, store, metrics);
    }

    /**
     * Start the server.
     */
    public void start() throws IOException {
        logger.info("Starting RespKV Server v{}", VERSION);
        logger.info("Config: {}", config);

        tcpServer.start();

        logger.info("RespKV Server started successfully on port {}", getPort());
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }, "respkv-shutdown"));

        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (shutdownLatch.getCount() == 0) {
            return;
        }
        logger.info("Stopping RespKV Server");

        tcpServer.stop();
        store.shutdown();

        shutdownLatch.countDown();
        logger.info("RespKV Server stopped");
        logger.debug("{}", metrics.summary());
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the port the server listens on.
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    /**
     * Get the underlying store.
     */
    public ExpiringStore getStore() {
        return store;
    }

    /**
     * Get the metrics collector.
     */
    public MetricsCollector getMetrics() {
        return metrics;
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        ServerConfig.Builder builder = ServerConfig.builderFromEnvironment();

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--port":
                    case "-p":
                        if (i + 1 >= args.length) {
                            exitWithError("--port requires a value");
                        }
                        try {
                            builder.port(Integer.parseInt(args[++i]));
                        } catch (NumberFormatException e) {
                            exitWithError("Invalid port number: " + args[i]);
                        } catch (IllegalArgumentException e) {
                            exitWithError("Port must be between 0 and 65535");
                        }
                        break;
                    case "--bind":
                    case "-b":
                        if (i + 1 >= args.length) {
                            exitWithError("--bind requires a value");
                        }
                        builder.bindAddress(args[++i]);
                        break;
                    case "--help":
                    case "-h":
                        printHelp();
                        return;
                    case "--version":
                    case "-v":
                        System.out.println("RespKV Server v" + VERSION);
                        return;
                    default:
                        exitWithError("Unknown option: " + args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            exitWithError(e.getMessage());
        }

        printBanner();
        ensureLogsDirectory();

        RespKVServer server = new RespKVServer(builder.build());
        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void ensureLogsDirectory() {
        File logsDir = new File("logs");
        if (!logsDir.exists()) {
            if (logsDir.mkdir()) {
                logger.info("Created logs directory");
            } else {
                logger.warn("Failed to create logs directory, file logging may not work");
            }
        }
    }

    private static void printBanner() {
        System.out.println();
        System.out.println("  ___             _  ____   __");
        System.out.println(" | _ \\___ ____ __| |/ /\\ \\ / /");
        System.out.println(" |   / -_|_-< '_ \\ ' <  \\ V / ");
        System.out.println(" |_|_\\___/__/ .__/_|\\_\\  \\_/  ");
        System.out.println("            |_|               ");
        System.out.println();
        System.out.println("  In-Memory RESP Key-Value Server v" + VERSION);
        System.out.println();
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("RespKV Server - In-Memory RESP Key-Value Server");
        System.out.println();
        System.out.println("Usage: respkv [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -p, --port <port>      Port to listen on (default: 6379)");
        System.out.println("  -b, --bind <address>   Address to bind (default: 127.0.0.1)");
        System.out.println("  -h, --help             Show this help message");
        System.out.println("  -v, --version          Show version");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  RESPKV_PORT, RESPKV_BIND, RESPKV_MAX_FRAME_MB");
        System.out.println("  (or system properties respkv.port, respkv.bind, respkv.max.frame.mb)");
        System.out.println();
        System.out.println("Supported commands: PING [message], GET key, SET key value [EX seconds | PX milliseconds]");
        System.out.println();
    }
}
