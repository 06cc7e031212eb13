package org.querydump.storage;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class UploadManagerFactoryTest {

    @Test
    void testAccept_file() throws Exception {
        UploadManager manager = new UploadManagerFactory().accept(SinkLocation.parse("file:///tmp/exports"), null);

        assertTrue(manager instanceof LocalFileUploadManager);
    }

    @Test
    void testAccept_s3WithStaticCredentials() throws Exception {
        Properties params = new Properties();
        params.setProperty("accessKey", "test");
        params.setProperty("secretKey", "test");
        params.setProperty("region", "eu-west-1");

        UploadManager manager = new UploadManagerFactory().accept(SinkLocation.parse("s3://localhost:4566/exports"), params);

        assertTrue(manager instanceof S3UploadManager);
    }
}
