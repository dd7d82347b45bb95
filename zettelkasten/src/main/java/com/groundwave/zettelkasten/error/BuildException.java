package com.groundwave.zettelkasten.error;

/**
 * A cache build failed as a whole, e.g. because a directory could not be listed
 * or the build was cancelled. Per-file failures never surface as a BuildException.
 */
public class BuildException extends ZettelkastenException {

    public BuildException(String message) {
        super(message);
    }

    public BuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
