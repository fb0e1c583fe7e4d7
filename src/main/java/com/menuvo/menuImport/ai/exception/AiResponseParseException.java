package com.menuvo.menuImport.ai.exception;

import com.menuvo.menuImport.MenuImportException;

/**
 * Exception thrown when model output cannot be turned into menu data.
 * The message is safe to show to merchants; raw model output is never attached.
 */
public class AiResponseParseException extends MenuImportException {

    public static final String DEFAULT_MESSAGE = "The AI response could not be read as menu data";

    public AiResponseParseException() {
        super(DEFAULT_MESSAGE);
    }

    public AiResponseParseException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }
}
