package com.groundwave.zettelkasten.io;

import com.groundwave.zettelkasten.config.ZettelkastenConfig;
import com.groundwave.zettelkasten.error.RemoteFetchException;
import lombok.extern.slf4j.Slf4j;
import org.xml.sax.SAXException;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * Minimal read-only WebDAV client: PROPFIND (Depth 1) listings and GET.
 *
 * Requests carry HTTP Basic credentials when both username and password are
 * configured, otherwise they are anonymous. Every request is bounded by the
 * configured timeout since the server is expected to be on the same network.
 * Interrupting the calling thread aborts the request in flight.
 */
@Slf4j
public class WebDavClient {

    private static final String PROPFIND_BODY = """
        <?xml version="1.0" encoding="utf-8"?>
        <D:propfind xmlns:D="DAV:">
          <D:prop>
            <D:resourcetype/>
            <D:getcontentlength/>
            <D:getlastmodified/>
          </D:prop>
        </D:propfind>
        """;

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String authorization;

    public WebDavClient(ZettelkastenConfig config) {
        this.requestTimeout = config.getRequestTimeout();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        this.authorization = config.hasCredentials()
            ? basicAuthorization(config.getUsername(), config.getPassword())
            : null;

        log.info("WebDavClient initialized (timeout: {}ms, authenticated: {})",
            requestTimeout.toMillis(), authorization != null);
    }

    /**
     * List the members of a collection.
     *
     * @param url collection URL
     * @return members excluding the collection itself; empty if the collection does not exist
     * @throws RemoteFetchException on any non-404 failure
     */
    public List<WebDavEntry> listDirectory(String url) throws RemoteFetchException {
        HttpRequest request = newRequest(url)
            .header("Depth", "1")
            .header("Content-Type", "application/xml; charset=utf-8")
            .method("PROPFIND", HttpRequest.BodyPublishers.ofString(PROPFIND_BODY, StandardCharsets.UTF_8))
            .build();

        HttpResponse<byte[]> response = send(url, request);

        if (response.statusCode() == 404) {
            log.debug("WebDAV collection not found: {}", url);
            return List.of();
        }
        if (response.statusCode() != 207 && response.statusCode() != 200) {
            throw new RemoteFetchException(url, response.statusCode());
        }

        List<WebDavEntry> entries = parseMultistatus(url, response.body());
        String selfPath = trimTrailingSlash(MultistatusHandler.decodePath(url));

        List<WebDavEntry> members = entries.stream()
            .filter(entry -> !trimTrailingSlash(entry.getPath()).equals(selfPath))
            .toList();

        log.debug("Listed {} items in {}", members.size(), url);
        return members;
    }

    /**
     * Fetch a resource body.
     *
     * @throws RemoteFetchException if the status is not 200 or the transport fails
     */
    public byte[] fetch(String url) throws RemoteFetchException {
        HttpRequest request = newRequest(url).GET().build();

        HttpResponse<byte[]> response = send(url, request);
        if (response.statusCode() != 200) {
            throw new RemoteFetchException(url, response.statusCode());
        }
        return response.body();
    }

    /**
     * Fetch a resource body decoded as UTF-8.
     */
    public String fetchString(String url) throws RemoteFetchException {
        return new String(fetch(url), StandardCharsets.UTF_8);
    }

    private HttpRequest.Builder newRequest(String url) throws RemoteFetchException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(url)).timeout(requestTimeout);
        } catch (IllegalArgumentException e) {
            throw new RemoteFetchException(url, e);
        }
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder;
    }

    private HttpResponse<byte[]> send(String url, HttpRequest request) throws RemoteFetchException {
        log.debug("{} {}", request.method(), url);
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteFetchException(url, e);
        } catch (IOException e) {
            throw new RemoteFetchException(url, e);
        }
    }

    private List<WebDavEntry> parseMultistatus(String url, byte[] body) throws RemoteFetchException {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            SAXParser parser = factory.newSAXParser();

            MultistatusHandler handler = new MultistatusHandler();
            parser.parse(new ByteArrayInputStream(body), handler);
            return handler.getEntries();
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new RemoteFetchException(url, e);
        }
    }

    private static String basicAuthorization(String username, String password) {
        String token = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    private static String trimTrailingSlash(String path) {
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
