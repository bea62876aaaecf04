package uk.sky.pglock;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

/**
 * Settings for the dedicated connection opened by each lock attempt.
 */
public class ConnectionConfig {

    static final String HOST_VARIABLE = "DATABASE_HOST";
    static final String PORT_VARIABLE = "DATABASE_PORT";
    static final String DATABASE_VARIABLE = "DATABASE_NAME";
    static final String USER_VARIABLE = "DATABASE_USER";
    static final String PASSWORD_VARIABLE = "DATABASE_PASSWORD";

    private final String host;
    private final int port;
    private final String database;
    private final String user;
    private final String password;
    private final Duration connectTimeout;
    private final String applicationName;

    private ConnectionConfig(String host, int port, String database, String user, String password, Duration connectTimeout, String applicationName) {
        this.host = requireNonNull(host);
        this.port = port;
        this.database = requireNonNull(database, "database must be provided");
        this.user = requireNonNull(user, "user must be provided");
        this.password = password;
        this.connectTimeout = requireNonNull(connectTimeout);
        this.applicationName = applicationName;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUser() {
        return user;
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * @return the application name to report to the server, if one was configured. Otherwise each
     * lock attempt generates its own.
     */
    public Optional<String> getApplicationName() {
        return Optional.ofNullable(applicationName);
    }

    public String getJdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    @Override
    public String toString() {
        return String.format("%s@%s:%d/%s", user, host, port, database);
    }

    public static ConnectionConfigBuilder builder() {
        return new ConnectionConfigBuilder();
    }

    /**
     * Reads the connection settings from {@code DATABASE_HOST}, {@code DATABASE_PORT},
     * {@code DATABASE_NAME}, {@code DATABASE_USER} and {@code DATABASE_PASSWORD}.
     *
     * @return config built from the process environment
     * @throws NullPointerException if {@code DATABASE_HOST}, {@code DATABASE_NAME} or {@code DATABASE_USER} is missing
     */
    public static ConnectionConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ConnectionConfig fromEnvironment(Map<String, String> environment) {
        String host = emptyToNull(environment.get(HOST_VARIABLE));
        String database = emptyToNull(environment.get(DATABASE_VARIABLE));
        String user = emptyToNull(environment.get(USER_VARIABLE));
        String port = emptyToNull(environment.get(PORT_VARIABLE));

        checkNotNull(host, "'%s' should be set to the host name of the database server", HOST_VARIABLE);
        checkNotNull(database, "'%s' should be set to the name of the database", DATABASE_VARIABLE);
        checkNotNull(user, "'%s' should be set to the database user", USER_VARIABLE);

        ConnectionConfigBuilder builder = builder()
                .withHost(host)
                .withDatabase(database)
                .withUser(user)
                .withPassword(emptyToNull(environment.get(PASSWORD_VARIABLE)));
        if (port != null) {
            builder.withPort(Integer.parseInt(port));
        }
        return builder.build();
    }

    public static class ConnectionConfigBuilder {

        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String user;
        private String password;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private String applicationName;

        private ConnectionConfigBuilder() {}

        /**
         * @param host defaults to localhost
         * @return this
         */
        public ConnectionConfigBuilder withHost(String host) {
            this.host = requireNonNull(host, "host must not be null");
            return this;
        }

        /**
         * @param port defaults to 5432
         * @return this
         * @throws IllegalArgumentException if value is outside 1-65535
         */
        public ConnectionConfigBuilder withPort(int port) {
            if (port < 1 || port > 65535)
                throw new IllegalArgumentException("Port must be between 1 and 65535: " + port);

            this.port = port;
            return this;
        }

        public ConnectionConfigBuilder withDatabase(String database) {
            this.database = database;
            return this;
        }

        public ConnectionConfigBuilder withUser(String user) {
            this.user = user;
            return this;
        }

        public ConnectionConfigBuilder withPassword(String password) {
            this.password = password;
            return this;
        }

        /**
         * Duration to wait for the connection to be established.
         *
         * @param connectTimeout defaults to 10 seconds, zero waits indefinitely
         * @return this
         * @throws IllegalArgumentException if value is less than 0
         */
        public ConnectionConfigBuilder withConnectTimeout(Duration connectTimeout) {
            if (connectTimeout.toMillis() < 0)
                throw new IllegalArgumentException("Connect timeout must be positive: " + connectTimeout.toMillis());

            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * Name reported in {@code pg_stat_activity} for every lock connection.
         *
         * @param applicationName defaults to {@code <random uuid>-<lock name>-lock}
         * @return this
         */
        public ConnectionConfigBuilder withApplicationName(String applicationName) {
            this.applicationName = applicationName;
            return this;
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(host, port, database, user, password, connectTimeout, applicationName);
        }
    }
}
