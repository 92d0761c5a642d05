package com.grorchestrator.orchestration.adapter.impl;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.Protocol;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.*;
import com.grorchestrator.configuration.properties.predefined.BackupProperties;
import com.grorchestrator.orchestration.adapter.api.ObjectStorageAdapter;
import com.grorchestrator.orchestration.exception.DownloadException;
import com.grorchestrator.orchestration.exception.InitializationException;
import com.grorchestrator.orchestration.exception.UploadException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.io.IOUtils;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@ApplicationScoped
public class S3ObjectStorageAdapter implements ObjectStorageAdapter {

    @Inject
    BackupProperties backupProperties;

    private AmazonS3 s3Client;

    @Override
    public void initializeAndValidate() throws InitializationException {
        log.info("Initializing S3 object storage adapter.");

        BackupProperties.S3BackupProperties s3Properties = backupProperties.s3();

        Protocol protocol = s3Properties.protocol().equals(BackupProperties.ProtocolType.HTTP) ? Protocol.HTTP : Protocol.HTTPS;

        s3Client = AmazonS3ClientBuilder.standard()
                .withEndpointConfiguration(
                        new AwsClientBuilder.EndpointConfiguration(
                                s3Properties.endpoint(),
                                s3Properties.region()
                        )
                )
                .withPathStyleAccessEnabled(true)
                .withClientConfiguration(
                        new ClientConfiguration()
                                .withProtocol(protocol)
                                .withConnectionTimeout(30000)
                )
                .withCredentials(
                        new AWSStaticCredentialsProvider(
                                new BasicAWSCredentials(
                                        s3Properties.accessKey(),
                                        s3Properties.secretKey()
                                )
                        )
                )
                .build();

        boolean bucketExists;

        try {
            // connectivity check + validation of bucket presence
            bucketExists = s3Client.doesBucketExistV2(s3Properties.bucket());
        } catch (Exception e) {
            throw new InitializationException("Failed to check bucket in S3! Have you configured s3 properly?", e);
        }

        if (!bucketExists) {
            throw new InitializationException("Bucket '" + s3Properties.bucket() + "' not found, but backups are enabled! Create this bucket or/and change configuration!");
        }

        log.info("S3 object storage adapter initialization completed!");
    }

    @Override
    public void uploadStream(String key, InputStream inputStream) throws UploadException {
        String bucket = backupProperties.s3().bucket();
        InitiateMultipartUploadResult initResponse;

        try {
            initResponse = s3Client.initiateMultipartUpload(new InitiateMultipartUploadRequest(bucket, key));
        } catch (Exception e) {
            closeQuietly(inputStream);
            throw new UploadException("Failed to start upload of " + key, e);
        }

        List<PartETag> eTags = new ArrayList<>();
        byte[] buf = new byte[backupProperties.s3().multipartUploadPartSizeMb() * 1024 * 1024];
        int partNumber = 1;

        try {
            while (true) {
                int bytesRead = IOUtils.read(inputStream, buf);

                if (bytesRead == 0) {
                    break;
                }

                UploadPartRequest uploadRequest = new UploadPartRequest()
                        .withBucketName(bucket)
                        .withKey(key)
                        .withUploadId(initResponse.getUploadId())
                        .withPartSize(bytesRead)
                        .withPartNumber(partNumber)
                        .withInputStream(new ByteArrayInputStream(buf, 0, bytesRead));

                UploadPartResult uploadResult = s3Client.uploadPart(uploadRequest);
                eTags.add(uploadResult.getPartETag());

                partNumber++;
            }

            s3Client.completeMultipartUpload(new CompleteMultipartUploadRequest(bucket, key, initResponse.getUploadId(), eTags));
        } catch (Exception e) {
            abortUpload(bucket, key, initResponse.getUploadId());
            throw new UploadException("Failed to upload " + key, e);
        } finally {
            closeQuietly(inputStream);
        }
    }

    @Override
    public void uploadContent(String key, String content) throws UploadException {
        try {
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            ObjectMetadata metadata = new ObjectMetadata();
            metadata.setContentLength(bytes.length);
            s3Client.putObject(backupProperties.s3().bucket(), key, new ByteArrayInputStream(bytes), metadata);
        } catch (Exception e) {
            throw new UploadException("Failed to upload " + key, e);
        }
    }

    @Override
    public List<String> listKeys(String prefix) {
        List<String> keys = new ArrayList<>();
        ListObjectsV2Request request = new ListObjectsV2Request()
                .withBucketName(backupProperties.s3().bucket())
                .withPrefix(prefix);
        ListObjectsV2Result result;

        do {
            result = s3Client.listObjectsV2(request);
            if (CollectionUtils.isNotEmpty(result.getObjectSummaries())) {
                result.getObjectSummaries().forEach(summary -> keys.add(summary.getKey()));
            }
            request.setContinuationToken(result.getNextContinuationToken());
        } while (result.isTruncated());

        return keys;
    }

    @Override
    public String readContent(String key) throws DownloadException {
        try {
            return s3Client.getObjectAsString(backupProperties.s3().bucket(), key);
        } catch (Exception e) {
            throw new DownloadException("Failed to read " + key, e);
        }
    }

    @Override
    public InputStream download(String key) throws DownloadException {
        try {
            return s3Client.getObject(backupProperties.s3().bucket(), key).getObjectContent();
        } catch (Exception e) {
            throw new DownloadException("Failed to download " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return s3Client.doesObjectExist(backupProperties.s3().bucket(), key);
    }

    private void abortUpload(String bucket, String key, String uploadId) {
        // free space
        while (true) {
            try {
                s3Client.abortMultipartUpload(new AbortMultipartUploadRequest(bucket, key, uploadId));
                PartListing partListing = s3Client.listParts(new ListPartsRequest(bucket, key, uploadId));

                if (CollectionUtils.isEmpty(partListing.getParts())) {
                    break;
                }

                Thread.sleep(1000);
            } catch (InterruptedException interruptedException) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.debug("Stopped aborting upload of {}: {}", key, e.getMessage());
                break;
            }
        }
    }

    private void closeQuietly(InputStream inputStream) {
        try {
            inputStream.close();
        } catch (Exception e) {
            log.debug("Failed to close upload stream", e);
        }
    }
}
