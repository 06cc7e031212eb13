package org.querydump.storage;

import org.querydump.exception.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Paths;

/**
 * The parsed sink connect string: {@code s3://host[:port]/bucket} or {@code file:///directory}.
 */
public final class SinkLocation {

    public static final String S3_SCHEME = "s3";
    public static final String FILE_SCHEME = "file";

    private final String scheme;
    private final String endpoint;
    private final String container;

    private SinkLocation(String scheme, String endpoint, String container) {
        this.scheme = scheme;
        this.endpoint = endpoint;
        this.container = container;
    }

    public static SinkLocation parse(String sinkConnect) throws ConfigurationException {
        if (sinkConnect == null || sinkConnect.isEmpty()) {
            throw new ConfigurationException("The sink connect string is not defined");
        }
        URI uri;
        try {
            uri = new URI(sinkConnect);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Malformed sink connect string '" + sinkConnect + "'", e);
        }

        if (S3_SCHEME.equalsIgnoreCase(uri.getScheme())) {
            String bucket = uri.getPath() == null ? "" : uri.getPath().replaceAll("^/+|/+$", "");
            if (uri.getHost() == null || bucket.isEmpty()) {
                throw new ConfigurationException("The S3 sink must be s3://host[:port]/bucket, got '" + sinkConnect + "'");
            }
            String endpoint = uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
            return new SinkLocation(S3_SCHEME, endpoint, bucket);
        } else if (FILE_SCHEME.equalsIgnoreCase(uri.getScheme())) {
            return new SinkLocation(FILE_SCHEME, null, Paths.get(uri).toString());
        }
        throw new ConfigurationException("Unsupported sink '" + sinkConnect + "'. The allowed schemes are s3:// and file://");
    }

    public String getScheme() {
        return scheme;
    }

    /**
     * @return host and port of the S3 service, null for file sinks
     */
    public String getEndpoint() {
        return endpoint;
    }

    /**
     * @return the bucket for S3 sinks, the directory for file sinks
     */
    public String getContainer() {
        return container;
    }

    public boolean isS3() {
        return S3_SCHEME.equals(scheme);
    }

    @Override
    public String toString() {
        return isS3() ? "s3://" + endpoint + "/" + container : "file://" + container;
    }
}
