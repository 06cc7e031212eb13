package org.querydump.file;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object names mapped to their local files, in creation order.
 * Closing the set deletes the local files.
 */
public class FileSet implements Iterable<OutputFile>, Closeable {

    private final Map<String, OutputFile> files = new LinkedHashMap<>();

    public void add(OutputFile file) {
        if (files.containsKey(file.getObjectName())) {
            throw new IllegalArgumentException("Duplicate object name in file set: " + file.getObjectName());
        }
        files.put(file.getObjectName(), file);
    }

    public void addAll(FileSet other) {
        for (OutputFile file : other) {
            add(file);
        }
    }

    public boolean contains(String objectName) {
        return files.containsKey(objectName);
    }

    public OutputFile get(String objectName) {
        return files.get(objectName);
    }

    public List<String> getObjectNames() {
        return Collections.unmodifiableList(new ArrayList<>(files.keySet()));
    }

    public int size() {
        return files.size();
    }

    @Override
    public Iterator<OutputFile> iterator() {
        return Collections.unmodifiableCollection(files.values()).iterator();
    }

    @Override
    public void close() {
        for (OutputFile file : files.values()) {
            file.delete();
        }
    }
}
