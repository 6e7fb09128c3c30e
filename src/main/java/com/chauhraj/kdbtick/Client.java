package com.chauhraj.kdbtick;

import java.io.Closeable;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chauhraj.kdbtick.config.ConnectionSettings;
import com.chauhraj.kdbtick.datatypes.CharVector;
import com.chauhraj.kdbtick.protocol.KException;

/**
 * Publishes payloads to a kdb+ tickerplant, e.g. {@code .u.updjson[`hass_event; "{...}"]}.
 * <p>
 * Failures never escape: they are logged, the connection is dropped and the call returns {@code false}.
 * The next {@link #send} reconnects. Like {@link Connection}, a client is not thread-safe.
 * </p>
 */
public class Client implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(Client.class);

    private final ConnectionSettings settings;
    private final Connection connection = new Connection();

    public Client(ConnectionSettings settings) {
        this.settings = settings;
    }

    /**
     * Opens the connection, replacing any open one.
     * @return true if connected
     */
    public boolean connect() {
        connection.close();
        try {
            connection.connect(settings.getHost(), settings.getPort(), settings.getCredentials(),
                settings.isTls(), settings.getTimeoutMillis());
            connection.setCompressionEnabled(settings.isCompression());
            logger.info("Connected to kdb+ at {}:{}", settings.getHost(), settings.getPort());
            return true;
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to connect to kdb+ at {}:{}", settings.getHost(), settings.getPort(), e);
            return false;
        }
    }

    /** Probes the connection with a round trip. */
    public boolean isConnected() {
        return connection.isConnected();
    }

    /**
     * Sends with the configured function and table name.
     * @see #send(String, String, String)
     */
    public boolean send(String payload) {
        return send(settings.getFunction(), settings.getTableName(), payload);
    }

    /**
     * Calls {@code function[`tableName; "payload"]} remotely, connecting first if needed.
     * @param function name of the remote function
     * @param tableName sent as a symbol
     * @param payload sent as a char vector
     * @return true if the call was delivered, and for sync sends, accepted
     */
    public boolean send(String function, String tableName, String payload) {
        if (!connection.isConnected() && !connect()) {
            return false;
        }
        try {
            if (settings.isSync()) {
                connection.sendSync(function, tableName, new CharVector(payload));
            } else {
                connection.sendAsync(function, tableName, new CharVector(payload));
            }
            return true;
        } catch (KException e) {
            logger.error("kdb+ rejected {}[`{}]: {}", function, tableName, e.getMessage());
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to send to kdb+", e);
        }
        connection.close();
        return false;
    }

    Connection getConnection() {
        return connection;
    }

    @Override
    public void close() {
        connection.close();
    }
}
