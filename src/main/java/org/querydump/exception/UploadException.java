package org.querydump.exception;

/**
 * The remote storage rejected an object. Files uploaded before the failure are not rolled back.
 */
public class UploadException extends QueryDumpException {

    private final String objectName;

    public UploadException(String objectName, String message, Throwable cause) {
        super(message, cause);
        this.objectName = objectName;
    }

    public String getObjectName() {
        return objectName;
    }
}
