package org.querydump.file;

import org.querydump.exception.EncodingException;

/**
 * Serializes rows of already converted values into the bytes of one output record.
 */
public interface RecordEncoder {

    FileFormats getFileFormat();

    /**
     * @param values converted values, one per column in column order
     * @return the complete record including its line terminator
     */
    byte[] encode(Object[] values) throws EncodingException;

    /**
     * @return the header record written at the top of every file, or null if files have no header
     */
    byte[] encodeHeader() throws EncodingException;
}
