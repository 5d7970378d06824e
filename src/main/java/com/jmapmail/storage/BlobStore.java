package com.jmapmail.storage;

import java.io.IOException;

/**
 * Content-addressed binary storage keyed by lowercase SHA-256 hex
 */
public interface BlobStore {

    /**
     * Store bytes under their hash (no-op when already present)
     * @return storage key relative to the store root
     */
    String put(String sha256, byte[] data) throws IOException;

    /**
     * @return stored bytes, or null when missing
     */
    byte[] get(String sha256) throws IOException;

    boolean exists(String sha256);

    /**
     * @return true if an object was removed
     */
    boolean delete(String sha256);
}
