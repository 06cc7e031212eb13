package org.querydump.file;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.IntFunction;

/**
 * Appends records to a sequence of local files, starting a new file once the current one
 * has reached the size threshold.
 * <p>
 * The size is checked after each record is appended, so a file can exceed the threshold by up to one record.
 * Every file starts with the header record, when there is one.
 */
public class SplitFileWriter {

    private static final Logger LOG = LogManager.getLogger(SplitFileWriter.class.getName());

    private final IntFunction<String> objectNames;
    private final long approxMaxFileSizeBytes;
    private final byte[] header;
    private final Path tempDirectory;
    private final FileSet fileSet = new FileSet();

    private OutputFile current;
    private int fileNo = 0;
    private boolean finished = false;

    /**
     * Opens the first file immediately.
     *
     * @param template               names of the data files
     * @param approxMaxFileSizeBytes size after which the next record goes to a new file
     * @param header                 record written first in every file, or null
     * @param tempDirectory          directory of the local files, null for the default temp directory
     */
    public SplitFileWriter(FilenameTemplate template, long approxMaxFileSizeBytes, byte[] header, Path tempDirectory) throws IOException {
        this(template::format, approxMaxFileSizeBytes, header, tempDirectory);
    }

    private SplitFileWriter(IntFunction<String> objectNames, long approxMaxFileSizeBytes, byte[] header, Path tempDirectory) throws IOException {
        if (approxMaxFileSizeBytes <= 0) {
            throw new IllegalArgumentException("approxMaxFileSizeBytes must be positive");
        }
        this.objectNames = objectNames;
        this.approxMaxFileSizeBytes = approxMaxFileSizeBytes;
        this.header = header;
        this.tempDirectory = tempDirectory;
        openNext();
    }

    /**
     * A writer of exactly one file that never rolls over.
     */
    public static SplitFileWriter singleFile(String objectName, Path tempDirectory) throws IOException {
        return new SplitFileWriter(fileNo -> objectName, Long.MAX_VALUE, null, tempDirectory);
    }

    public void write(byte[] record) throws IOException {
        if (finished) {
            throw new IllegalStateException("The writer is already finished");
        }
        current.write(record);
        if (current.getSize() >= approxMaxFileSizeBytes) {
            rollover();
        }
    }

    public long currentSize() {
        return current.getSize();
    }

    public String currentObjectName() {
        return current.getObjectName();
    }

    private void rollover() throws IOException {
        LOG.info("File {} reached {} bytes, starting a new file", current.getObjectName(), current.getSize());
        current.close();
        fileNo++;
        openNext();
    }

    private void openNext() throws IOException {
        current = OutputFile.create(objectNames.apply(fileNo), tempDirectory);
        fileSet.add(current);
        if (header != null) {
            current.write(header);
        }
    }

    /**
     * Flushes and closes every file and returns them. Can only be called once.
     */
    public FileSet finish() throws IOException {
        if (finished) {
            throw new IllegalStateException("The writer is already finished");
        }
        finished = true;
        for (OutputFile file : fileSet) {
            file.close();
        }
        return fileSet;
    }

    /**
     * Discards every file written so far.
     */
    public void abort() {
        finished = true;
        fileSet.close();
    }
}
