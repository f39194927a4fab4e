package org.openfda.maude.bulkload.http;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionContextTest {

    @Test
    void bareHostDefaultsToHttp() {
        var context = new ConnectionContext("localhost:9200", false);
        assertEquals(ConnectionContext.Protocol.HTTP, context.getProtocol());
        assertEquals(9200, context.getUri().getPort());
        assertNull(context.getAuthorizationHeader());
    }

    @Test
    void httpsWithCredentials() {
        var context = new ConnectionContext("https://search.example.org:443", "user", "pass", true);
        assertEquals(ConnectionContext.Protocol.HTTPS, context.getProtocol());
        assertTrue(context.isInsecure());
        // base64("user:pass")
        assertEquals("Basic dXNlcjpwYXNz", context.getAuthorizationHeader());
    }

    @Test
    void rejectsHalfCredentialsAndBadSchemes() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionContext("localhost:9200", "user", null, false));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionContext("ftp://localhost", false));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionContext(" ", false));
    }
}
