package com.groundwave.zettelkasten.error;

/**
 * Org to HTML conversion could not produce output for the given content.
 */
public class RenderException extends ZettelkastenException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
