package com.yizhaoqi.kb.storage;

import java.io.IOException;

/**
 * Object storage holding the bytes of file-backed documents.
 */
public interface BlobStorage {

    /**
     * Reads the whole object behind {@code locator}.
     *
     * @throws IOException when the object is missing or storage is unreachable
     */
    byte[] fetchBytes(String locator) throws IOException;

    /**
     * Removes the object behind {@code locator}. Best-effort: failures are logged, never thrown.
     */
    void deleteBlob(String locator);
}
