package io.lightchain.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.CharsetUtil;

import javax.net.ssl.SSLException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client side of a newline-delimited JSON-RPC 2.0 connection. Responses are matched to requests by id;
 * notifications are routed to the subscription registered for {@code (method, first param)}.
 */
public final class JsonRpcSession implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(JsonRpcSession.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_LINE_BYTES = 16 << 20;

    private final String host;
    private final int port;
    private final boolean tls;
    private final long timeoutMillis;

    private final NioEventLoopGroup group = new NioEventLoopGroup(1);
    private final AtomicLong nextId = new AtomicLong();
    private final Map<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final Map<String, Consumer<JsonNode>> subscriptions = new ConcurrentHashMap<>();

    private volatile Channel channel;

    public JsonRpcSession(String host, int port, boolean tls, long timeoutMillis) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.tls = tls;
        this.timeoutMillis = Math.max(1L, timeoutMillis);
    }

    public void connect() throws InterruptedException {
        SslContext sslContext = null;
        if (tls) {
            try {
                sslContext = SslContextBuilder.forClient().build();
            } catch (SSLException e) {
                throw new IllegalStateException("Failed to initialise TLS", e);
            }
        }
        SslContext ssl = sslContext;
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (ssl != null) {
                            ch.pipeline().addLast(ssl.newHandler(ch.alloc(), host, port));
                        }
                        configurePipeline(ch.pipeline());
                    }
                });
        var future = bootstrap.connect(host, port).await();
        if (!future.isSuccess()) {
            throw new RpcException(RpcException.DISCONNECTED,
                    "Failed to connect to " + host + ':' + port, future.cause());
        }
        channel = future.channel();
        LOG.info(() -> "Connected to server " + host + ':' + port + (tls ? " (tls)" : ""));
    }

    public boolean isConnected() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    public String endpoint() {
        return host + ':' + port;
    }

    public CompletableFuture<JsonNode> request(String method, Object... params) {
        long id = nextId.incrementAndGet();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            future.completeExceptionally(new RpcException(RpcException.DISCONNECTED, "not connected"));
            return future;
        }
        ObjectNode req = MAPPER.createObjectNode();
        req.put("jsonrpc", "2.0");
        req.put("id", id);
        req.put("method", method);
        ArrayNode arr = req.putArray("params");
        for (Object p : params) {
            arr.add(MAPPER.valueToTree(p));
        }
        String line;
        try {
            line = MAPPER.writeValueAsString(req) + "\n";
        } catch (JsonProcessingException e) {
            future.completeExceptionally(e);
            return future;
        }
        pending.put(id, future);
        future.whenComplete((r, e) -> pending.remove(id));
        LOG.fine(() -> "--> " + method + " #" + id);
        ch.writeAndFlush(line).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                future.completeExceptionally(new RpcException(RpcException.DISCONNECTED,
                        "write failed for " + method, f.cause()));
            }
        });
        return future.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    /** Blocking request; the result node, which is a JSON null for a null result. */
    public JsonNode call(String method, Object... params) throws InterruptedException {
        try {
            return request(method, params).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RpcException rpc) {
                throw rpc;
            }
            if (cause instanceof TimeoutException) {
                throw new RpcException(RpcException.TIMEOUT, method + " timed out after " + timeoutMillis + " ms");
            }
            throw new RpcException(RpcException.DISCONNECTED, method + " failed", cause);
        }
    }

    /**
     * Registers {@code onStatus} for notifications of {@code method} about {@code key}, then sends the
     * subscription and hands it the initial result.
     */
    public void subscribe(String method, String key, Consumer<JsonNode> onStatus) throws InterruptedException {
        subscriptions.put(method + '|' + key, onStatus);
        JsonNode initial = call(method, key);
        onStatus.accept(initial);
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully();
        subscriptions.clear();
        failPending("session closed");
        LOG.info(() -> "Session to " + endpoint() + " closed");
    }

    private void failPending(String reason) {
        for (CompletableFuture<JsonNode> f : pending.values()) {
            f.completeExceptionally(new RpcException(RpcException.DISCONNECTED, reason));
        }
        pending.clear();
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new LineBasedFrameDecoder(MAX_LINE_BYTES));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new SessionHandler());
    }

    private void dispatch(JsonNode msg) {
        JsonNode idNode = msg.get("id");
        if (idNode != null && !idNode.isNull()) {
            CompletableFuture<JsonNode> future = pending.get(idNode.asLong());
            if (future == null) {
                LOG.fine(() -> "Dropping response for unknown id " + idNode);
                return;
            }
            JsonNode error = msg.get("error");
            if (error != null && !error.isNull()) {
                future.completeExceptionally(new RpcException(error.path("code").asInt(),
                        error.path("message").asText(error.toString())));
            } else {
                future.complete(msg.path("result"));
            }
            return;
        }
        JsonNode method = msg.get("method");
        JsonNode params = msg.get("params");
        if (method == null || params == null || !params.isArray() || params.size() < 2) {
            LOG.fine(() -> "Ignoring unexpected message " + msg);
            return;
        }
        Consumer<JsonNode> handler = subscriptions.get(method.asText() + '|' + params.get(0).asText());
        if (handler == null) {
            LOG.fine(() -> "No subscription for " + method.asText() + ' ' + params.get(0).asText());
            return;
        }
        handler.accept(params.get(1));
    }

    private final class SessionHandler extends SimpleChannelInboundHandler<String> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line) {
            if (line.isBlank()) {
                return;
            }
            JsonNode msg;
            try {
                msg = MAPPER.readTree(line);
            } catch (JsonProcessingException e) {
                LOG.log(Level.WARNING, "Unparseable message from " + endpoint(), e);
                ctx.close();
                return;
            }
            dispatch(msg);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            failPending("connection to " + endpoint() + " lost");
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Session channel error", cause);
            ctx.close();
        }
    }
}
