package org.openfda.maude.bulkload.http;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.tcp.SslProvider;

/**
 * Minimal asynchronous REST client for the search cluster, on Reactor Netty.
 */
@Slf4j
public class RestClient {
    private static final String USER_AGENT_HEADER_NAME = HttpHeaderNames.USER_AGENT.toString();
    private static final String CONTENT_TYPE_HEADER_NAME = HttpHeaderNames.CONTENT_TYPE.toString();
    private static final String AUTHORIZATION_HEADER_NAME = HttpHeaderNames.AUTHORIZATION.toString();

    private static final String USER_AGENT = "MaudePipeline-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String NDJSON_CONTENT_TYPE = "application/x-ndjson";

    private final ConnectionContext connectionContext;
    private final HttpClient client;

    public RestClient(ConnectionContext connectionContext) {
        this.connectionContext = connectionContext;
        HttpClient httpClient = HttpClient.create();
        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            httpClient = httpClient.secure(connectionContext.isInsecure()
                ? getInsecureSslProvider()
                : SslProvider.defaultClientProvider());
        }
        this.client = httpClient
            .baseUrl(connectionContext.getUri().toString())
            .keepAlive(true);
    }

    private static SslProvider getInsecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }

    public Mono<HttpResponse> asyncRequest(HttpMethod method, String path, String body, String contentType) {
        Map<String, String> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, USER_AGENT);
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, contentType);
        }
        if (connectionContext.getAuthorizationHeader() != null) {
            headers.put(AUTHORIZATION_HEADER_NAME, connectionContext.getAuthorizationHeader());
        }
        log.atDebug().setMessage("{} /{}").addArgument(method).addArgument(path).log();
        return client
            .headers(h -> headers.forEach(h::add))
            .request(method)
            .uri("/" + path)
            .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
            .responseSingle((response, bytes) -> bytes.asString(StandardCharsets.UTF_8)
                .singleOptional()
                .map(bodyOp -> new HttpResponse(
                    response.status().code(),
                    response.status().reasonPhrase(),
                    bodyOp.orElse(null)
                )));
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest(HttpMethod.GET, path, null, null);
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return asyncRequest(HttpMethod.PUT, path, body, JSON_CONTENT_TYPE);
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest(HttpMethod.POST, path, body, JSON_CONTENT_TYPE);
    }

    public Mono<HttpResponse> postNdjsonAsync(String path, String body) {
        return asyncRequest(HttpMethod.POST, path, body, NDJSON_CONTENT_TYPE);
    }

    public Mono<HttpResponse> deleteAsync(String path) {
        return asyncRequest(HttpMethod.DELETE, path, null, null);
    }
}
