package com.groundwave.zettelkasten.support;

/**
 * Builds DAV: multistatus bodies for PROPFIND stubs.
 */
public final class Multistatus {

    private final StringBuilder body = new StringBuilder()
        .append("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n")
        .append("<d:multistatus xmlns:d=\"DAV:\">\n");

    public static Multistatus of(String collectionHref) {
        return new Multistatus().collection(collectionHref);
    }

    public Multistatus collection(String href) {
        body.append("  <d:response><d:href>").append(href).append("</d:href><d:propstat><d:prop>")
            .append("<d:resourcetype><d:collection/></d:resourcetype>")
            .append("</d:prop><d:status>HTTP/1.1 200 OK</d:status></d:propstat></d:response>\n");
        return this;
    }

    public Multistatus file(String href, long length) {
        body.append("  <d:response><d:href>").append(href).append("</d:href><d:propstat><d:prop>")
            .append("<d:resourcetype/>")
            .append("<d:getcontentlength>").append(length).append("</d:getcontentlength>")
            .append("<d:getlastmodified>Tue, 02 Jan 2024 10:15:30 GMT</d:getlastmodified>")
            .append("</d:prop><d:status>HTTP/1.1 200 OK</d:status></d:propstat></d:response>\n");
        return this;
    }

    public String build() {
        return body + "</d:multistatus>\n";
    }
}
