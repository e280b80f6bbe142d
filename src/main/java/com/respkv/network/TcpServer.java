package com.respkv.network;

import com.respkv.config.ServerConfig;
import com.respkv.core.KVStore;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking TCP server for RespKV.
 * Accepts connections on one thread and serves each connection on its own
 * thread, all sharing a single store.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);

    private final ServerConfig config;
    private final KVStore store;
    private final MetricsCollector metrics;
    private final AtomicBoolean running;
    private final Set<ConnectionHandler> connections;
    private final ExecutorService connectionPool;

    private volatile ServerSocket serverSocket;
    private Thread serverThread;

    /**
     * Create a new TCP server.
     *
     * @param config  listen address, port and frame limits
     * @param store   the key-value store shared by every connection
     * @param metrics the metrics collector
     */
    public TcpServer(ServerConfig config, KVStore store, MetricsCollector metrics) {
        this.config = config;
        this.store = store;
        this.metrics = metrics;
        this.running = new AtomicBoolean(false);
        this.connections = ConcurrentHashMap.newKeySet();
        AtomicInteger threadCounter = new AtomicInteger();
        this.connectionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "respkv-conn-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Bind and start accepting on a background thread.
     *
     * @throws IOException if the server cannot bind
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }
        bind();
        serverThread = new Thread(this::acceptLoop, "respkv-server-" + getPort());
        serverThread.start();
    }

    /**
     * Bind and accept connections on the calling thread until {@link #stop()} is called.
     *
     * @throws IOException if the server cannot bind
     */
    public void run() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }
        bind();
        acceptLoop();
    }

    private void bind() throws IOException {
        ServerSocket socket = new ServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(InetAddress.getByName(config.getBindAddress()), config.getPort()),
                config.getBacklog());
        } catch (IOException e) {
            running.set(false);
            socket.close();
            throw e;
        }
        serverSocket = socket;
        logger.info("RespKV server listening on {}:{}", config.getBindAddress(), socket.getLocalPort());
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Accept failed: {}", e.getMessage());
                    continue;
                }
                break;
            }

            try {
                accept(socket);
            } catch (IOException | RuntimeException e) {
                logger.error("Error setting up connection {}: {}", socket.getRemoteSocketAddress(), e.getMessage(), e);
                closeQuietly(socket);
            }
        }

        cleanup();
    }

    private void accept(Socket socket) throws IOException {
        socket.setTcpNoDelay(true);
        socket.setKeepAlive(true);

        ConnectionHandler handler = new ConnectionHandler(
            new Connection(socket, config.getMaxFrameBytes()), store, metrics, this);
        connections.add(handler);
        try {
            connectionPool.execute(handler);
        } catch (RejectedExecutionException e) {
            logger.warn("Rejected connection from {}: server is shutting down", handler.getRemoteAddress());
            handler.close();
            return;
        }
        logger.debug("Accepted connection from {}", handler.getRemoteAddress());
    }

    /**
     * Stop accepting and close every open connection.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping RespKV server on port {}", getPort());

        // Unblocks accept()
        ServerSocket socket = serverSocket;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                logger.debug("Error closing server socket: {}", e.getMessage());
            }
        }

        if (serverThread != null && serverThread != Thread.currentThread()) {
            try {
                serverThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void cleanup() {
        for (ConnectionHandler handler : connections) {
            handler.close();
        }
        connections.clear();

        connectionPool.shutdown();
        try {
            if (!connectionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                connectionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            connectionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        ServerSocket socket = serverSocket;
        if (socket != null && !socket.isClosed()) {
            closeQuietly(socket);
        }

        logger.info("RespKV server stopped on port {}", getPort());
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("Error closing {}: {}", closeable, e.getMessage());
        }
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Get the port this server is listening on; the bound port once started.
     */
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : config.getPort();
    }

    /**
     * Remove a connection from tracking.
     * Package-private, called by ConnectionHandler when connection is closed.
     */
    void removeConnection(ConnectionHandler handler) {
        connections.remove(handler);
    }
}
