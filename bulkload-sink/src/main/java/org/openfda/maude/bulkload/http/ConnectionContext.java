package org.openfda.maude.bulkload.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import lombok.Getter;

/**
 * Where and how to reach the search cluster.
 */
@Getter
public class ConnectionContext {
    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final String authorizationHeader;

    public ConnectionContext(String host, boolean insecure) {
        this(host, null, null, insecure);
    }

    /**
     * @param host {@code http(s)://host:port}; a bare {@code host:port} is treated as http
     */
    public ConnectionContext(String host, String username, String password, boolean insecure) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host must be provided");
        }
        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException("Both username and password must be provided");
        }
        String withScheme = host.contains("://") ? host : "http://" + host;
        try {
            this.uri = new URI(withScheme);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid host: " + host, e);
        }
        if ("http".equalsIgnoreCase(uri.getScheme())) {
            this.protocol = Protocol.HTTP;
        } else if ("https".equalsIgnoreCase(uri.getScheme())) {
            this.protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Unsupported scheme in host: " + host);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("No hostname found in: " + host);
        }
        this.insecure = insecure;
        this.authorizationHeader = username == null ? null
            : "Basic " + Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "ConnectionContext{uri=" + uri + ", insecure=" + insecure + ", auth=" + (authorizationHeader != null) + "}";
    }
}
