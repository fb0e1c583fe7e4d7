package com.menuvo.menuImport.storage;

import com.menuvo.menuImport.MenuImportException;

/**
 * Exception thrown when an import file cannot be stored or read.
 */
public class FileStorageException extends MenuImportException {

    public FileStorageException(String message) {
        super(message);
    }

    public FileStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
