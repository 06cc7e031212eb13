package org.querydump.exception;

/**
 * Base class of every failure that aborts an export.
 * An export is all-or-nothing: none of these are retried or recovered internally.
 */
public abstract class QueryDumpException extends Exception {

    protected QueryDumpException(String message) {
        super(message);
    }

    protected QueryDumpException(String message, Throwable cause) {
        super(message, cause);
    }
}
