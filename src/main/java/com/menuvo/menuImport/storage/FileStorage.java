package com.menuvo.menuImport.storage;

/**
 * Byte store for uploaded import files, addressed by opaque keys.
 */
public interface FileStorage {

    /**
     * @throws FileStorageException if the bytes cannot be written
     */
    void putFile(String key, byte[] content);

    /**
     * @throws FileStorageException if no file exists under the key or it cannot be read
     */
    byte[] getFile(String key);
}
