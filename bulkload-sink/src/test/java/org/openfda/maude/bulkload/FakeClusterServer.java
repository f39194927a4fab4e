package org.openfda.maude.bulkload;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import io.netty.handler.codec.http.HttpResponseStatus;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

/**
 * In-process HTTP server standing in for a search cluster. Records every request and answers
 * from a caller supplied responder.
 */
class FakeClusterServer implements AutoCloseable {

    record RecordedRequest(String method, String uri, String contentType, String authorization, String body) {}

    record Reply(int status, String body) {
        static Reply ok(String body) {
            return new Reply(200, body);
        }
    }

    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final DisposableServer server;

    FakeClusterServer(Function<RecordedRequest, Reply> responder) {
        this.server = HttpServer.create()
            .host("localhost")
            .port(0)
            .handle((request, response) -> request.receive()
                .aggregate()
                .asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    var recorded = new RecordedRequest(
                        request.method().name(),
                        request.uri(),
                        request.requestHeaders().get("Content-Type"),
                        request.requestHeaders().get("Authorization"),
                        body);
                    requests.add(recorded);
                    var reply = responder.apply(recorded);
                    return response.status(HttpResponseStatus.valueOf(reply.status()))
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(reply.body()))
                        .then();
                }))
            .bindNow();
    }

    String getHost() {
        return "http://localhost:" + server.port();
    }

    List<RecordedRequest> getRequests() {
        return requests;
    }

    List<RecordedRequest> requestsTo(String method, String uriSuffix) {
        return requests.stream()
            .filter(r -> r.method().equals(method) && r.uri().endsWith(uriSuffix))
            .toList();
    }

    @Override
    public void close() {
        server.disposeNow();
    }
}
