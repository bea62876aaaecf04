package uk.sky.pglock;

import uk.sky.pglock.exception.ConnectionException;

import java.sql.Connection;

/**
 * Opens the dedicated session a lock attempt holds its lock on.
 */
public interface ConnectionFactory {

    /**
     * Every call must return a new connection. Connections handed out here are owned by a single
     * lock attempt and are never pooled, as the advisory lock lives exactly as long as the session.
     *
     * @param config          where and as whom to connect
     * @param applicationName name the session reports to the server
     * @return an open connection in auto-commit mode
     * @throws ConnectionException if the connection cannot be established
     */
    Connection connect(ConnectionConfig config, String applicationName) throws ConnectionException;
}
