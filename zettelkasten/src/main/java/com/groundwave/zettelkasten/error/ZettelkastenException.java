package com.groundwave.zettelkasten.error;

/**
 * Base type for failures of zettelkasten operations that callers are expected to handle.
 */
public class ZettelkastenException extends Exception {

    public ZettelkastenException(String message) {
        super(message);
    }

    public ZettelkastenException(String message, Throwable cause) {
        super(message, cause);
    }
}
