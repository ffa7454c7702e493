package com.dexarb.infra.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Maps transport failures and JSON-RPC error objects to an {@link RpcErrorKind}. Decisions use the HTTP
 * status, the JSON-RPC code and the revert payload; the node's free-text message is only carried along.
 */
@Slf4j
public final class RpcErrorClassifier {

    static final String ERROR_STRING_SELECTOR = "0x08c379a0";

    private static final int EXECUTION_REVERTED = 3;
    private static final int REVERT_ALT = -32015;
    private static final int LIMIT_EXCEEDED = -32005;
    private static final int RATE_EXCEEDED = -32029;
    private static final int RESOURCE_UNAVAILABLE = -32002;
    private static final int INTERNAL_ERROR = -32603;

    private static final Function ERROR_STRING = new Function(
            "Error", List.of(), List.of(new TypeReference<Utf8String>() {
            }));

    private RpcErrorClassifier() {
    }

    public static RpcErrorKind classifyHttpStatus(int status) {
        if (status == 429) {
            return RpcErrorKind.RATE_LIMITED;
        }
        if (status >= 500 || status == 408) {
            return RpcErrorKind.NETWORK;
        }
        return RpcErrorKind.RPC_ERROR;
    }

    public static RpcException fromHttpStatus(String endpoint, String method, int status) {
        RpcErrorKind kind = classifyHttpStatus(status);
        return new RpcException(kind, status, null,
                method + " on " + endpoint + " failed with HTTP " + status, null);
    }

    public static RpcException fromIoException(String endpoint, String method, IOException e) {
        return new RpcException(RpcErrorKind.NETWORK,
                method + " on " + endpoint + " failed: " + e.getClass().getSimpleName(), e);
    }

    public static RpcException fromJsonRpcError(String endpoint, String method, JsonNode error) {
        int code = error.path("code").asInt();
        String message = error.path("message").asText("");
        String data = revertData(error.get("data"));

        RpcErrorKind kind;
        String reason = null;
        if (code == LIMIT_EXCEEDED || code == RATE_EXCEEDED) {
            kind = RpcErrorKind.RATE_LIMITED;
        } else if (code == RESOURCE_UNAVAILABLE || code == INTERNAL_ERROR) {
            kind = RpcErrorKind.NETWORK;
        } else if (code == EXECUTION_REVERTED || code == REVERT_ALT || data != null) {
            if (data == null || data.length() <= 2) {
                kind = RpcErrorKind.MALFORMED;
            } else {
                reason = decodeRevertReason(data);
                kind = isLiquidityReason(reason) ? RpcErrorKind.INSUFFICIENT_LIQUIDITY : RpcErrorKind.REVERTED;
            }
        } else {
            kind = RpcErrorKind.RPC_ERROR;
        }
        String text = method + " on " + endpoint + " returned " + code + " (" + message + ")"
                + (reason != null ? " reason=" + reason : "");
        return new RpcException(kind, code, reason, text, null);
    }

    /**
     * Decodes a Solidity {@code Error(string)} payload. Custom errors and panics yield null.
     */
    public static String decodeRevertReason(String data) {
        if (data == null || !data.toLowerCase(Locale.ROOT).startsWith(ERROR_STRING_SELECTOR)) {
            return null;
        }
        try {
            List<Type> decoded = FunctionReturnDecoder.decode(data.substring(ERROR_STRING_SELECTOR.length()),
                    ERROR_STRING.getOutputParameters());
            return decoded.isEmpty() ? null : ((Utf8String) decoded.get(0)).getValue();
        } catch (RuntimeException e) {
            log.debug("Undecodable Error(string) payload {}: {}", data, e.toString());
            return null;
        }
    }

    private static boolean isLiquidityReason(String reason) {
        return reason != null && reason.toUpperCase(Locale.ROOT).contains("INSUFFICIENT_LIQUIDITY");
    }

    private static String revertData(JsonNode data) {
        if (data == null || data.isNull()) {
            return null;
        }
        // some nodes nest the payload as {"data": "0x..."}
        JsonNode node = data.isObject() ? data.get("data") : data;
        if (node == null || !node.isTextual()) {
            return null;
        }
        String hex = node.asText().trim();
        return hex.startsWith("0x") ? hex : null;
    }
}
