package com.menuvo.menuImport.extraction.exception;

import com.menuvo.menuImport.MenuImportException;

/**
 * Exception thrown when a menu file is declared in a format we cannot read.
 */
public class UnsupportedFormatException extends MenuImportException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
