package org.querydump.file;

import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A local temporary file holding the bytes of one object to upload.
 * The size counts every byte written, including the ones still buffered.
 */
public class OutputFile implements Closeable {

    private static final Logger LOG = LogManager.getLogger(OutputFile.class.getName());
    private static final int BUFFER_SIZE = 64 * 1024;

    private final String objectName;
    private final Path path;
    private OutputStream out;
    private long size;

    private OutputFile(String objectName, Path path, OutputStream out) {
        this.objectName = objectName;
        this.path = path;
        this.out = out;
    }

    /**
     * Creates an empty temporary file in the given directory, or in the default temp directory if null.
     */
    public static OutputFile create(String objectName, Path tempDirectory) throws IOException {
        Path path = tempDirectory == null
                ? Files.createTempFile("querydump-", ".tmp")
                : Files.createTempFile(tempDirectory, "querydump-", ".tmp");
        LOG.debug("Created local file {} for object {}", path, objectName);
        return new OutputFile(objectName, path, new BufferedOutputStream(Files.newOutputStream(path), BUFFER_SIZE));
    }

    public void write(byte[] bytes) throws IOException {
        if (out == null) {
            throw new IllegalStateException("Output file for " + objectName + " is already closed");
        }
        out.write(bytes);
        size += bytes.length;
    }

    public String getObjectName() {
        return objectName;
    }

    public Path getPath() {
        return path;
    }

    public long getSize() {
        return size;
    }

    public boolean isClosed() {
        return out == null;
    }

    /**
     * Flushes the buffered bytes to disk and closes the file. Later calls do nothing.
     */
    @Override
    public void close() throws IOException {
        if (out != null) {
            OutputStream stream = out;
            out = null;
            stream.close();
        }
    }

    /**
     * Closes and removes the local file, logging instead of throwing.
     */
    public void delete() {
        try {
            close();
        } catch (IOException e) {
            LOG.warn("Could not close local file {}: {}", path, e.getMessage());
        }
        if (!FileUtils.deleteQuietly(path.toFile())) {
            LOG.warn("Could not delete local file {}", path);
        }
    }

    @Override
    public String toString() {
        return objectName + " (" + path + ", " + size + " bytes)";
    }
}
