package io.asap.server.vertx;

import static io.asap.util.Assert.checkNotNullParam;
import static io.vertx.core.http.HttpHeaders.CACHE_CONTROL;
import static io.vertx.core.http.HttpHeaders.CONTENT_TYPE;
import static io.vertx.core.http.HttpHeaders.ETAG;
import static io.vertx.core.http.HttpHeaders.IF_NONE_MATCH;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.asap.server.ServerCallContext;
import io.asap.server.executors.BoundedExecutor;
import io.asap.server.handlers.DispatchInterceptor;
import io.asap.server.handlers.Dispatcher;
import io.asap.server.handlers.HandlerRegistry;
import io.asap.server.ratelimit.TokenBucket;
import io.asap.spec.ASAPConstants;
import io.asap.spec.Manifest;
import io.asap.spec.RateLimitedError;
import io.asap.transport.jsonrpc.handler.JSONRPCHandler;
import io.asap.transport.jsonrpc.handler.JSONRPCResult;
import io.asap.util.Utils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ASAP agent server on Vert.x Web.
 *
 * <h2>Routes</h2>
 * <ul>
 *   <li>{@code POST /asap} - JSON-RPC {@code asap.send}, bodies above the configured size are
 *       rejected with 413</li>
 *   <li>{@code GET /.well-known/asap/manifest.json} - the agent manifest with an {@code ETag}
 *       and {@code Cache-Control: public, max-age=<n>}; 304 when {@code If-None-Match} matches</li>
 *   <li>{@code GET /asap/ws} - WebSocket carrying one JSON-RPC request per text frame, limited
 *       per connection by a {@link TokenBucket}</li>
 * </ul>
 *
 * <p>Async handlers run on the event loop; synchronous handlers run on a {@link BoundedExecutor}
 * sized by {@link ASAPServerConfig#getMaxThreads()}. A saturated executor answers 503 so clients
 * back off and retry.
 *
 * <pre>{@code
 * ASAPServer server = ASAPServer.builder(manifest)
 *         .registry(HandlerRegistry.createDefault())
 *         .config(ASAPServerConfig.builder().port(0).build())
 *         .build();
 * int port = server.start().join();
 * ...
 * server.stop().join();
 * }</pre>
 */
public class ASAPServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ASAPServer.class);

    private static final String APPLICATION_JSON = "application/json";
    private static final short WS_CLOSE_POLICY_VIOLATION = 1008;
    private static final TypeReference<Object> JSON_TYPE_REFERENCE = new TypeReference<>() {};

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final Manifest manifest;
    private final ASAPServerConfig config;
    private final BoundedExecutor executor;
    private final JSONRPCHandler jsonRpcHandler;
    private final @Nullable CallContextFactory callContextFactory;
    private final String manifestJson;
    private final String manifestEtag;
    private volatile @Nullable HttpServer httpServer;

    private ASAPServer(Builder builder) {
        this.manifest = builder.manifest;
        this.config = builder.config;
        this.callContextFactory = builder.callContextFactory;
        this.ownsVertx = builder.vertx == null;
        this.vertx = builder.vertx != null ? builder.vertx : Vertx.vertx();
        this.executor = new BoundedExecutor(config.getMaxThreads(), builder.meterRegistry);
        Dispatcher dispatcher = new Dispatcher(builder.registry, executor, builder.interceptors, builder.meterRegistry);
        this.jsonRpcHandler = new JSONRPCHandler(dispatcher, builder.meterRegistry);
        try {
            this.manifestJson = Utils.toJsonString(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize manifest " + manifest.id(), e);
        }
        this.manifestEtag = etagOf(manifestJson);
    }

    public static Builder builder(Manifest manifest) {
        return new Builder(manifest);
    }

    /**
     * Starts listening.
     *
     * @return the actual port, useful when the configured port is 0
     */
    public CompletableFuture<Integer> start() {
        Router router = Router.router(vertx);
        router.post(ASAPConstants.ASAP_PATH)
                .handler(BodyHandler.create().setBodyLimit(config.getMaxRequestSize()))
                .handler(this::handleJsonRpc);
        router.get(ASAPConstants.MANIFEST_PATH).handler(this::handleManifest);
        router.get(ASAPConstants.WEBSOCKET_PATH).handler(this::handleWebSocketUpgrade);

        HttpServerOptions options = new HttpServerOptions()
                .setHost(config.getHost())
                .setPort(config.getPort())
                .setMaxWebSocketMessageSize((int) Math.min(Integer.MAX_VALUE, config.getMaxRequestSize()));

        return vertx.createHttpServer(options)
                .requestHandler(router)
                .listen()
                .map(server -> {
                    httpServer = server;
                    LOGGER.info("ASAP server for {} listening on {}:{}", manifest.id(), config.getHost(), server.actualPort());
                    return server.actualPort();
                })
                .toCompletionStage()
                .toCompletableFuture();
    }

    /**
     * Stops listening and shuts the handler threads down. A stopped server cannot be restarted.
     *
     * @return a future completed once the server is closed
     */
    public CompletableFuture<Void> stop() {
        HttpServer server = httpServer;
        httpServer = null;
        Future<Void> closed = server == null ? Future.succeededFuture() : server.close();
        return closed
                .eventually(v -> {
                    executor.shutdown(false);
                    LOGGER.info("ASAP server for {} stopped", manifest.id());
                    return ownsVertx ? vertx.close() : Future.succeededFuture();
                })
                .toCompletionStage()
                .toCompletableFuture();
    }

    /**
     * @return the listening port, or -1 if the server is not started
     */
    public int getPort() {
        HttpServer server = httpServer;
        return server == null ? -1 : server.actualPort();
    }

    public Manifest getManifest() {
        return manifest;
    }

    public BoundedExecutor getExecutor() {
        return executor;
    }

    private void handleJsonRpc(RoutingContext rc) {
        ServerCallContext context = createCallContext(rc, "jsonrpc");
        String body = rc.body().asString();
        Context vertxContext = vertx.getOrCreateContext();
        Future.fromCompletionStage(jsonRpcHandler.handle(body == null ? "" : body, context), vertxContext)
                .onComplete(ar -> {
                    JSONRPCResult result = ar.succeeded() ? ar.result() : jsonRpcHandler.errorResult(null, ar.cause());
                    HttpServerResponse response = rc.response().setStatusCode(result.statusCode());
                    result.headers().forEach((name, value) -> response.putHeader(name, value));
                    response.putHeader(CONTENT_TYPE, APPLICATION_JSON).end(result.body());
                });
    }

    private void handleManifest(RoutingContext rc) {
        HttpServerResponse response = rc.response()
                .putHeader(ETAG, manifestEtag)
                .putHeader(CACHE_CONTROL, "public, max-age=" + config.getManifestMaxAge().toSeconds());
        if (etagMatches(rc.request().getHeader(IF_NONE_MATCH))) {
            response.setStatusCode(304).end();
            return;
        }
        response.putHeader(CONTENT_TYPE, APPLICATION_JSON).end(manifestJson);
    }

    private boolean etagMatches(@Nullable String ifNoneMatch) {
        if (ifNoneMatch == null) {
            return false;
        }
        for (String candidate : ifNoneMatch.split(",")) {
            String tag = candidate.trim();
            if (tag.startsWith("W/")) {
                tag = tag.substring(2);
            }
            if (tag.equals("*") || tag.equals(manifestEtag)) {
                return true;
            }
        }
        return false;
    }

    private void handleWebSocketUpgrade(RoutingContext rc) {
        Map<String, Object> state = createCallContext(rc, "websocket").getState();
        rc.request().toWebSocket()
                .onSuccess(ws -> serveWebSocket(ws, state))
                .onFailure(e -> LOGGER.warn("WebSocket upgrade from {} failed: {}",
                        rc.request().remoteAddress(), e.getMessage()));
    }

    /**
     * Frames of one connection are handled on its event loop one at a time, so the connection's
     * bucket is never used concurrently.
     */
    @SuppressWarnings("unchecked")
    private void serveWebSocket(ServerWebSocket ws, Map<String, Object> connectionState) {
        double rate = config.getWebSocketMessageRate();
        TokenBucket bucket = rate > 0 ? new TokenBucket(rate) : null;
        boolean[] rateLimited = {false};
        LOGGER.info("WebSocket connected from {}", ws.remoteAddress());

        ws.textMessageHandler(text -> {
            if (rateLimited[0]) {
                return;
            }
            ServerCallContext context = new ServerCallContext(manifest, new HashMap<>(connectionState));
            Object json;
            try {
                json = Utils.unmarshalFrom(text, JSON_TYPE_REFERENCE);
            } catch (JsonProcessingException e) {
                reply(ws, jsonRpcHandler.handle(text, context));
                return;
            }
            Object id = json instanceof Map<?, ?> map ? map.get("id") : null;
            if (bucket != null && !bucket.consume()) {
                rateLimited[0] = true;
                LOGGER.warn("WebSocket {} exceeded {} messages per second, closing", ws.remoteAddress(), rate);
                JSONRPCResult result = jsonRpcHandler.errorResult(
                        id instanceof String || id instanceof Number ? id : null,
                        new RateLimitedError(bucket.secondsUntilAvailable(1)));
                ws.writeTextMessage(result.body())
                        .eventually(v -> ws.close(WS_CLOSE_POLICY_VIOLATION, "Rate limit exceeded"));
                return;
            }
            if (json instanceof Map<?, ?> map) {
                reply(ws, jsonRpcHandler.handle((Map<String, Object>) map, context));
            } else {
                reply(ws, jsonRpcHandler.handle(text, context));
            }
        });
        ws.exceptionHandler(e -> LOGGER.warn("WebSocket {} error: {}", ws.remoteAddress(), e.getMessage()));
        ws.closeHandler(v -> LOGGER.info("WebSocket {} closed", ws.remoteAddress()));
    }

    private void reply(ServerWebSocket ws, CompletableFuture<JSONRPCResult> result) {
        Future.fromCompletionStage(result, vertx.getOrCreateContext())
                .onSuccess(r -> {
                    if (!ws.isClosed()) {
                        ws.writeTextMessage(r.body());
                    }
                })
                .onFailure(e -> LOGGER.warn("Unable to answer WebSocket frame: {}", e.getMessage()));
    }

    private ServerCallContext createCallContext(RoutingContext rc, String transport) {
        if (callContextFactory != null) {
            return callContextFactory.build(rc);
        }
        Map<String, Object> state = new HashMap<>();
        Map<String, String> headers = new HashMap<>();
        rc.request().headers().names().forEach(name -> headers.put(name, rc.request().getHeader(name)));
        state.put(ServerCallContext.HEADERS_KEY, headers);
        state.put(ServerCallContext.TRANSPORT_KEY, transport);
        return new ServerCallContext(manifest, state);
    }

    private static String etagOf(String json) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json.getBytes(StandardCharsets.UTF_8));
            return "\"" + HexFormat.of().formatHex(digest) + "\"";
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static class Builder {
        private final Manifest manifest;
        private HandlerRegistry registry = HandlerRegistry.createDefault();
        private ASAPServerConfig config = ASAPServerConfig.defaults();
        private final List<DispatchInterceptor> interceptors = new ArrayList<>();
        private MeterRegistry meterRegistry = Metrics.globalRegistry;
        private @Nullable CallContextFactory callContextFactory;
        private @Nullable Vertx vertx;

        private Builder(Manifest manifest) {
            this.manifest = checkNotNullParam("manifest", manifest);
        }

        public Builder registry(HandlerRegistry registry) {
            this.registry = checkNotNullParam("registry", registry);
            return this;
        }

        public Builder config(ASAPServerConfig config) {
            this.config = checkNotNullParam("config", config);
            return this;
        }

        public Builder addInterceptor(DispatchInterceptor interceptor) {
            this.interceptors.add(checkNotNullParam("interceptor", interceptor));
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = checkNotNullParam("meterRegistry", meterRegistry);
            return this;
        }

        public Builder callContextFactory(CallContextFactory callContextFactory) {
            this.callContextFactory = checkNotNullParam("callContextFactory", callContextFactory);
            return this;
        }

        /**
         * Runs the server on an existing Vert.x instance, which {@link #stop()} then leaves open.
         *
         * @param vertx the Vert.x instance
         * @return this builder
         */
        public Builder vertx(Vertx vertx) {
            this.vertx = checkNotNullParam("vertx", vertx);
            return this;
        }

        public ASAPServer build() {
            return new ASAPServer(this);
        }
    }
}
