package org.querydump.storage;

import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import lombok.extern.log4j.Log4j2;

import java.util.Properties;

@Log4j2
public class UploadManagerFactory {

    private static final String DEFAULT_REGION = "us-east-1";

    /**
     * Instantiate the UploadManager for the sink location.
     *
     * @param location         the parsed sink connect string
     * @param connectionParams the 'sink.connect.parameter.*' options: accessKey, secretKey, region, secure
     */
    public UploadManager accept(SinkLocation location, Properties connectionParams) {
        if (location.isS3()) {
            log.info("return S3UploadManager for {}", location);
            return new S3UploadManager(createS3Client(location, connectionParams == null ? new Properties() : connectionParams));
        } else {
            log.info("return LocalFileUploadManager for {}", location);
            return new LocalFileUploadManager();
        }
    }

    AmazonS3 createS3Client(SinkLocation location, Properties params) {
        // AWS itself is https, local S3 emulators are usually plain http
        boolean awsEndpoint = location.getEndpoint().endsWith("amazonaws.com");
        String protocol = Boolean.parseBoolean(params.getProperty("secure", String.valueOf(awsEndpoint))) ? "https://" : "http://";
        String region = params.getProperty("region", DEFAULT_REGION);

        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
                .withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(protocol + location.getEndpoint(), region))
                .withPathStyleAccessEnabled(true);

        String accessKey = params.getProperty("accessKey");
        String secretKey = params.getProperty("secretKey");
        if (accessKey != null && secretKey != null) {
            builder.withCredentials(new AWSStaticCredentialsProvider(new BasicAWSCredentials(accessKey, secretKey)));
        } else {
            log.debug("No S3 accessKey/secretKey given, using the default credentials provider chain");
            builder.withCredentials(DefaultAWSCredentialsProviderChain.getInstance());
        }
        return builder.build();
    }
}
