package com.menuvo.menuImport.extraction.exception;

import com.menuvo.menuImport.MenuImportException;

/**
 * Exception thrown when the bytes of a menu file do not match their declared format.
 */
public class TextExtractionException extends MenuImportException {

    public TextExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
