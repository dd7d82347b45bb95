package com.groundwave.zettelkasten.error;

/**
 * Raised when a caller passes a note id that is not an RFC 4122 UUID.
 */
public class InvalidNoteIdException extends ZettelkastenException {

    private final String noteId;

    public InvalidNoteIdException(String noteId) {
        super("Invalid note id: " + noteId);
        this.noteId = noteId;
    }

    public String getNoteId() {
        return noteId;
    }
}
