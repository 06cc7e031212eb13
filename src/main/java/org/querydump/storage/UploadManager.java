package org.querydump.storage;

import org.querydump.exception.UploadException;

import java.nio.file.Path;

/**
 * Uploads local files to remote object storage.
 */
public interface UploadManager {

    /**
     * @param container  bucket or directory receiving the object
     * @param objectName name of the object in the container
     * @param localFile  file whose bytes are uploaded
     * @param mimeType   content type of the object
     */
    void upload(String container, String objectName, Path localFile, String mimeType) throws UploadException;
}
