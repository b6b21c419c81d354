package com.netcracker.core.provisioning.http;

import com.netcracker.core.provisioning.exception.ControllerStartupException;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Minimal GET-only HTTP listener serving a fixed set of paths.
 */
@Slf4j
public class EndpointServer {
    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(10);
    static final String TEXT_PLAIN = "text/plain; charset=utf-8";

    private final Vertx vertx;
    private final String name;
    private final Map<String, Route> routes;
    private HttpServer server;

    public EndpointServer(Vertx vertx, String name, Map<String, Route> routes) {
        this.vertx = vertx;
        this.name = name;
        this.routes = Map.copyOf(routes);
    }

    /**
     * @throws ControllerStartupException if the port cannot be bound
     */
    public synchronized void start(int port) {
        try {
            server = vertx.createHttpServer()
                    .requestHandler(this::handle)
                    .listen(port)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(BIND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControllerStartupException("Interrupted while binding %s endpoint on port %d".formatted(name, port), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ControllerStartupException("Cannot bind %s endpoint on port %d".formatted(name, port), e);
        }
        log.info("{} endpoint listening on port {} ({})", name, server.actualPort(), routes.keySet());
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        try {
            server.close().toCompletionStage().toCompletableFuture().get(BIND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Error while closing {} endpoint", name, e);
        }
        server = null;
    }

    public synchronized int actualPort() {
        return server == null ? -1 : server.actualPort();
    }

    void handle(HttpServerRequest request) {
        Route route = routes.get(request.path());
        if (route == null) {
            respond(request, 404, TEXT_PLAIN, "not found");
            return;
        }
        if (request.method() != HttpMethod.GET) {
            request.response().putHeader(HttpHeaders.ALLOW, "GET");
            respond(request, 405, TEXT_PLAIN, "method not allowed");
            return;
        }
        try {
            respond(request, 200, route.getContentType(), route.getBody().get());
        } catch (RuntimeException e) {
            log.error("{} endpoint failed to serve '{}'", name, request.path(), e);
            respond(request, 500, TEXT_PLAIN, "internal error");
        }
    }

    private static void respond(HttpServerRequest request, int status, String contentType, String body) {
        request.response()
                .setStatusCode(status)
                .putHeader(HttpHeaders.CONTENT_TYPE, contentType)
                .end(body);
    }

    @Value
    public static class Route {
        String contentType;
        Supplier<String> body;

        public static Route text(String body) {
            return new Route(TEXT_PLAIN, () -> body);
        }
    }
}
