package com.respkv.network;

import com.respkv.cmd.Command;
import com.respkv.cmd.CommandException;
import com.respkv.cmd.Get;
import com.respkv.core.KVStore;
import com.respkv.network.protocol.Frame;
import com.respkv.network.protocol.ProtocolException;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Serves one client connection: reads a request frame, runs the command
 * against the shared store and writes the reply, until the client goes away.
 *
 * Malformed frames and mid-frame disconnects close this connection only.
 * Invalid commands are answered with an error reply and the loop continues.
 */
public class ConnectionHandler implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final Connection connection;
    private final KVStore store;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private volatile boolean closed = false;

    /**
     * @param connection the client connection
     * @param store      the store shared by all connections
     * @param metrics    the metrics collector
     * @param server     the owning server, notified on close (nullable)
     */
    public ConnectionHandler(Connection connection, KVStore store, MetricsCollector metrics, TcpServer server) {
        this.connection = connection;
        this.store = store;
        this.metrics = metrics;
        this.server = server;
    }

    @Override
    public void run() {
        metrics.connectionOpened();
        logger.debug("New connection from {}", connection.getRemoteAddress());
        try {
            while (!closed) {
                Optional<Frame> request = connection.readFrame();
                if (request.isEmpty()) {
                    logger.debug("Client {} disconnected", connection.getRemoteAddress());
                    break;
                }
                connection.writeFrame(process(request.get()));
            }
        } catch (ProtocolException e) {
            metrics.recordProtocolError();
            logger.warn("Protocol violation from {} (closing connection): {}",
                connection.getRemoteAddress(), e.getMessage());
        } catch (ConnectionResetException e) {
            logger.warn("Client {} disconnected mid-frame: {}", connection.getRemoteAddress(), e.getMessage());
        } catch (IOException e) {
            if (closed) {
                logger.debug("Connection {} closed during I/O: {}", connection.getRemoteAddress(), e.getMessage());
            } else {
                logger.warn("I/O error on {}: {}", connection.getRemoteAddress(), e.getMessage());
            }
        } finally {
            close();
            metrics.connectionClosed();
        }
    }

    /**
     * Turn one request frame into its reply.
     *
     * @param request the request frame
     * @return the reply frame; invalid commands yield an error frame
     * @throws ProtocolException if the request is not a command array
     */
    Frame process(Frame request) {
        long start = System.nanoTime();
        Command command;
        try {
            command = Command.decode(request);
        } catch (CommandException e) {
            metrics.recordCommandError();
            logger.debug("Rejected command from {}: {}", connection.getRemoteAddress(), e.getMessage());
            return Frame.error(e.getMessage());
        }

        Frame reply;
        try {
            reply = command.apply(store);
        } catch (CommandException e) {
            metrics.recordCommandError();
            reply = Frame.error(e.getMessage());
        } catch (IllegalArgumentException e) {
            metrics.recordCommandError();
            logger.warn("Invalid argument for command {}: {}", command.getName(), e.getMessage());
            reply = Frame.error("ERR " + e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordInternalError();
            logger.error("Error processing command {}: {}", command.getName(), e.toString(), e);
            reply = Frame.error("ERR internal error");
        }

        metrics.recordCommand(command.getName(), System.nanoTime() - start);
        if (command instanceof Get && !reply.isError()) {
            metrics.recordGetResult(!reply.isNull());
        }
        logger.trace("{} -> {}", command, reply);
        return reply;
    }

    /**
     * Close this connection and release resources.
     * Idempotent and safe to call from any thread.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        connection.close();
        if (server != null) {
            server.removeConnection(this);
        }
        logger.debug("Connection closed: {}", connection.getRemoteAddress());
    }

    public String getRemoteAddress() {
        return connection.getRemoteAddress();
    }
}
