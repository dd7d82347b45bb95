package com.groundwave.zettelkasten.error;

/**
 * The requested note exists but its access directive does not allow it to be served here.
 */
public class RestrictedNoteException extends ZettelkastenException {

    public RestrictedNoteException(String message) {
        super(message);
    }
}
