package org.querydump.exception;

/**
 * The source database could not be reached, rejected the credentials, or failed
 * while executing or fetching the query.
 */
public class ConnectionException extends QueryDumpException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
