package org.querydump.storage;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import lombok.extern.log4j.Log4j2;
import org.querydump.exception.UploadException;

import java.nio.file.Path;

@Log4j2
public class S3UploadManager implements UploadManager {

    private final AmazonS3 s3Client;

    public S3UploadManager(AmazonS3 s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public void upload(String bucket, String objectName, Path localFile, String mimeType) throws UploadException {
        ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentType(mimeType);
        metadata.setContentLength(localFile.toFile().length());

        PutObjectRequest request = new PutObjectRequest(bucket, objectName, localFile.toFile()).withMetadata(metadata);
        try {
            s3Client.putObject(request);
            log.info("Uploaded s3://{}/{} ({})", bucket, objectName, mimeType);
        } catch (AmazonClientException e) {
            throw new UploadException(objectName, "Could not upload " + objectName + " to bucket " + bucket + ": " + e.getMessage(), e);
        }
    }
}
