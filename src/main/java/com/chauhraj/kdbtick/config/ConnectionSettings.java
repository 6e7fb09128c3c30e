package com.chauhraj.kdbtick.config;

import java.util.Objects;

import com.typesafe.config.Config;

/**
 * Immutable connection and publishing settings. Built from the {@code kdbtick.connection} block and
 * adjusted with the {@code with*} methods, e.g. from a connection URL.
 */
public final class ConnectionSettings {
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final boolean tls;
    private final int timeoutMillis;
    private final boolean compression;
    private final boolean sync;
    private final String function;
    private final String tableName;

    public ConnectionSettings(String host, int port, String username, String password, boolean tls,
                              int timeoutMillis, boolean compression, boolean sync, String function, String tableName) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeoutMillis);
        }
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.username = username == null ? "" : username;
        this.password = password == null ? "" : password;
        this.tls = tls;
        this.timeoutMillis = timeoutMillis;
        this.compression = compression;
        this.sync = sync;
        this.function = Objects.requireNonNull(function, "function");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
    }

    static ConnectionSettings fromConfig(Config c) {
        return new ConnectionSettings(
            c.getString("host"),
            c.getInt("port"),
            c.getString("username"),
            c.getString("password"),
            c.getBoolean("tls"),
            c.getInt("timeoutMillis"),
            c.getBoolean("compression"),
            c.getBoolean("sync"),
            c.getString("function"),
            c.getString("tableName"));
    }

    public ConnectionSettings withHost(String host, int port) {
        return new ConnectionSettings(host, port, username, password, tls, timeoutMillis, compression, sync, function, tableName);
    }

    public ConnectionSettings withCredentials(String username, String password) {
        return new ConnectionSettings(host, port, username, password, tls, timeoutMillis, compression, sync, function, tableName);
    }

    public ConnectionSettings withTls(boolean tls) {
        return new ConnectionSettings(host, port, username, password, tls, timeoutMillis, compression, sync, function, tableName);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    /** The handshake credential string, empty when neither user nor password is set. */
    public String getCredentials() {
        return username.isEmpty() && password.isEmpty() ? "" : username + ":" + password;
    }

    public boolean isTls() {
        return tls;
    }

    public int getTimeoutMillis() {
        return timeoutMillis;
    }

    public boolean isCompression() {
        return compression;
    }

    public boolean isSync() {
        return sync;
    }

    public String getFunction() {
        return function;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public String toString() {
        return "ConnectionSettings{host=" + host + ", port=" + port + ", username=" + username
            + ", tls=" + tls + ", timeoutMillis=" + timeoutMillis + ", compression=" + compression
            + ", sync=" + sync + ", function=" + function + ", tableName=" + tableName + '}';
    }
}
