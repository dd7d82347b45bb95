package com.groundwave.zettelkasten.error;

/**
 * A WebDAV request failed, either with an unexpected HTTP status or at the transport level.
 * Transport failures (timeouts, refused connections, cancellation) carry status {@code -1}.
 */
public class RemoteFetchException extends ZettelkastenException {

    public static final int NO_STATUS = -1;

    private final String url;
    private final int status;

    public RemoteFetchException(String url, int status) {
        super("WebDAV request to " + url + " failed: HTTP " + status);
        this.url = url;
        this.status = status;
    }

    public RemoteFetchException(String url, Throwable cause) {
        super("WebDAV request to " + url + " failed: " + cause.getMessage(), cause);
        this.url = url;
        this.status = NO_STATUS;
    }

    public String getUrl() {
        return url;
    }

    public int getStatus() {
        return status;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public boolean isTransportFailure() {
        return status == NO_STATUS;
    }
}
