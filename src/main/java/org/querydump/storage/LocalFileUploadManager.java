package org.querydump.storage;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FileUtils;
import org.querydump.exception.UploadException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * "Uploads" by copying files below a local directory. The MIME type is only logged.
 */
@Log4j2
public class LocalFileUploadManager implements UploadManager {

    @Override
    public void upload(String directory, String objectName, Path localFile, String mimeType) throws UploadException {
        File target = new File(directory, objectName);
        try {
            FileUtils.copyFile(localFile.toFile(), target);
            log.info("Copied {} to {} ({})", objectName, target.getAbsolutePath(), mimeType);
        } catch (IOException e) {
            throw new UploadException(objectName, "Could not copy " + objectName + " to " + target.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }
}
