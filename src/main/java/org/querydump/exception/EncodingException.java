package org.querydump.exception;

/**
 * A row value cannot be represented under the active output format.
 */
public class EncodingException extends QueryDumpException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
