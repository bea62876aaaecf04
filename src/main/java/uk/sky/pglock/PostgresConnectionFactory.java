package uk.sky.pglock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.sky.pglock.exception.ConnectionException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens plain, unpooled connections through the PostgreSQL JDBC driver.
 */
public class PostgresConnectionFactory implements ConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(PostgresConnectionFactory.class);

    @Override
    public Connection connect(ConnectionConfig config, String applicationName) throws ConnectionException {
        Properties properties = connectionProperties(config, applicationName);
        try {
            log.debug("Opening connection to {} as '{}'", config, applicationName);
            return configure(DriverManager.getConnection(config.getJdbcUrl(), properties));
        } catch (SQLException e) {
            log.warn("Unable to open connection to {}", config, e);
            throw new ConnectionException(String.format("Failed to open connection to %s", config), e);
        }
    }

    static Properties connectionProperties(ConnectionConfig config, String applicationName) {
        Properties properties = new Properties();
        properties.setProperty("user", config.getUser());
        config.getPassword().ifPresent(password -> properties.setProperty("password", password));
        properties.setProperty("connectTimeout", Long.toString(connectTimeoutSeconds(config)));
        properties.setProperty("ApplicationName", applicationName);
        return properties;
    }

    // the driver reads 0 as no timeout
    private static long connectTimeoutSeconds(ConnectionConfig config) {
        long millis = config.getConnectTimeout().toMillis();
        return (millis + 999) / 1000;
    }

    static Connection configure(Connection connection) throws SQLException {
        try {
            connection.setAutoCommit(true);
            return connection;
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }
}
