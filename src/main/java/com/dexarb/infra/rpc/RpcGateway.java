package com.dexarb.infra.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * JSON-RPC client over a pool of endpoints. Every call is throttled by the chosen endpoint's token bucket
 * and concurrency gate; transient failures are retried on the next endpoint in round-robin order.
 */
@Slf4j
public class RpcGateway {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final List<RpcEndpoint> endpoints;
    private final RetryPolicy retryPolicy;
    @Getter
    private final long chainId;
    private final AtomicInteger cursor = new AtomicInteger();
    private final AtomicLong ids = new AtomicLong();

    public RpcGateway(OkHttpClient httpClient, ObjectMapper objectMapper, List<RpcEndpoint> endpoints,
            RetryPolicy retryPolicy, long chainId) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("at least one RPC endpoint is required");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy;
        this.chainId = chainId;
        log.info("RPC gateway ready: chainId={} endpoints={}", chainId, this.endpoints);
    }

    public JsonNode call(String method, List<?> params) {
        return call(method, params, RevertHandling.FAIL_FAST, Function.identity());
    }

    public JsonNode call(String method, List<?> params, RevertHandling revertHandling) {
        return call(method, params, revertHandling, Function.identity());
    }

    /**
     * Performs the call and applies {@code decoder} to the result inside the same attempt, so a decoder
     * that rejects the payload with an {@link RpcException} goes through the same retry decision.
     */
    public <T> T call(String method, List<?> params, RevertHandling revertHandling, Function<JsonNode, T> decoder) {
        return retryPolicy.execute(
                (error, attempt) -> retryMode(error, attempt, revertHandling),
                attempt -> {
                    RpcEndpoint endpoint = nextEndpoint();
                    return endpoint.execute(() -> decoder.apply(send(endpoint, method, params)));
                });
    }

    /**
     * Broadcast variant of {@link #call}: a request that may have reached a node is never repeated, so only
     * rate limiting and refused connections move on to the next endpoint.
     */
    public JsonNode submit(String method, List<?> params) {
        return retryPolicy.execute(
                (error, attempt) -> {
                    if (!(error instanceof RpcException rpc)) {
                        return RetryPolicy.RetryMode.NONE;
                    }
                    if (rpc.getKind() == RpcErrorKind.RATE_LIMITED) {
                        return RetryPolicy.RetryMode.BACKOFF;
                    }
                    return neverSent(rpc) ? RetryPolicy.RetryMode.IMMEDIATE : RetryPolicy.RetryMode.NONE;
                },
                attempt -> {
                    RpcEndpoint endpoint = nextEndpoint();
                    return endpoint.execute(() -> send(endpoint, method, params));
                });
    }

    /**
     * True when the failure happened before any byte of the request left this process.
     */
    static boolean neverSent(RpcException e) {
        return e.getKind() == RpcErrorKind.NETWORK
                && (e.getCause() instanceof ConnectException || e.getCause() instanceof UnknownHostException);
    }

    public List<RpcEndpoint> endpoints() {
        return endpoints;
    }

    RpcEndpoint nextEndpoint() {
        int i = Math.floorMod(cursor.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }

    private RetryPolicy.RetryMode retryMode(RuntimeException error, int attempt, RevertHandling revertHandling) {
        if (!(error instanceof RpcException rpc)) {
            return RetryPolicy.RetryMode.NONE;
        }
        return switch (rpc.getKind()) {
            case RATE_LIMITED -> RetryPolicy.RetryMode.BACKOFF;
            case NETWORK -> RetryPolicy.RetryMode.IMMEDIATE;
            case REVERTED, MALFORMED -> revertHandling == RevertHandling.RETRY_ONCE && attempt == 1
                    ? RetryPolicy.RetryMode.BACKOFF
                    : RetryPolicy.RetryMode.NONE;
            case INSUFFICIENT_LIQUIDITY, RPC_ERROR -> RetryPolicy.RetryMode.NONE;
        };
    }

    private JsonNode send(RpcEndpoint endpoint, String method, List<?> params) {
        String payload;
        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("jsonrpc", "2.0");
            body.put("id", ids.incrementAndGet());
            body.put("method", method);
            body.set("params", objectMapper.valueToTree(params == null ? List.of() : params));
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable params for " + method, e);
        }

        Request request = new Request.Builder()
                .url(endpoint.getUrl())
                .post(RequestBody.create(payload, JSON))
                .header("Accept", "application/json")
                .build();

        log.debug("[RPC] -> {} {}", endpoint.getUrl(), method);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw RpcErrorClassifier.fromHttpStatus(endpoint.getUrl(), method, response.code());
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new RpcException(RpcErrorKind.NETWORK, method + " on " + endpoint + " returned no body");
            }
            JsonNode root = objectMapper.readTree(responseBody.string());
            JsonNode error = root.get("error");
            if (error != null && !error.isNull()) {
                throw RpcErrorClassifier.fromJsonRpcError(endpoint.getUrl(), method, error);
            }
            JsonNode result = root.get("result");
            if (result == null) {
                throw new RpcException(RpcErrorKind.MALFORMED, method + " on " + endpoint + " returned no result");
            }
            return result;
        } catch (JsonProcessingException e) {
            // proxies answer with HTML error pages under load
            throw new RpcException(RpcErrorKind.NETWORK, method + " on " + endpoint + " returned non-JSON body", e);
        } catch (IOException e) {
            throw RpcErrorClassifier.fromIoException(endpoint.getUrl(), method, e);
        }
    }
}
