package com.grorchestrator.orchestration.adapter.api;

import com.grorchestrator.orchestration.exception.DownloadException;
import com.grorchestrator.orchestration.exception.InitializationException;
import com.grorchestrator.orchestration.exception.UploadException;

import java.io.InputStream;
import java.util.List;

/**
 * Interface for object storage where backups are kept. Keys are full object keys inside the configured bucket.
 */
public interface ObjectStorageAdapter {

    /**
     * Initializes adapter and performs basic calls to check if initialized successfully and if configuration is valid.
     *
     * @throws InitializationException if failed to initialize
     */
    void initializeAndValidate() throws InitializationException;

    /**
     * Uploads stream using multipart upload.
     *
     * @param inputStream stream to upload. Uploaded as-is. Will be closed after completion.
     * @throws UploadException if upload failed. Partially uploaded parts are aborted.
     */
    void uploadStream(String key, InputStream inputStream) throws UploadException;

    void uploadContent(String key, String content) throws UploadException;

    /**
     * @return keys starting with prefix. Empty list if nothing found.
     */
    List<String> listKeys(String prefix);

    String readContent(String key) throws DownloadException;

    /**
     * @return stream with object content. Caller must close it.
     */
    InputStream download(String key) throws DownloadException;

    boolean exists(String key);
}
