package com.menuvo.menuImport.ai.exception;

import com.menuvo.menuImport.MenuImportException;

/**
 * Exception thrown when the AI completion service cannot be reached or rejects the call
 * (network, quota, authentication, missing configuration).
 */
public class AiServiceException extends MenuImportException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
