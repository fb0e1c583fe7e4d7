package com.menuvo.menuImport;

/**
 * Base type for all menu import failures.
 */
public class MenuImportException extends RuntimeException {

    public MenuImportException(String message) {
        super(message);
    }

    public MenuImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
