package com.dexarb.infra;

import com.dexarb.domain.TxReceipt;
import com.dexarb.infra.rpc.RevertHandling;
import com.dexarb.infra.rpc.RpcErrorKind;
import com.dexarb.infra.rpc.RpcException;
import com.dexarb.infra.rpc.RpcGateway;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed Ethereum reads and writes on top of the gateway. ABI encoding and decoding go through web3j.
 */
@RequiredArgsConstructor
public class EvmClient {

    private final RpcGateway gateway;

    public long chainId() {
        return gateway.getChainId();
    }

    /**
     * eth_call against the latest block. A successful call that returns no data counts as MALFORMED.
     */
    public List<Type> call(String to, Function function, RevertHandling revertHandling) {
        Map<String, String> tx = new LinkedHashMap<>();
        tx.put("to", to);
        tx.put("data", FunctionEncoder.encode(function));
        return gateway.call("eth_call", List.of(tx, "latest"), revertHandling, result -> {
            String hex = result.asText("");
            if (hex.length() <= 2) {
                throw new RpcException(RpcErrorKind.MALFORMED, function.getName() + " on " + to + " returned no data");
            }
            List<Type> decoded = FunctionReturnDecoder.decode(hex, function.getOutputParameters());
            if (decoded.size() != function.getOutputParameters().size()) {
                throw new RpcException(RpcErrorKind.MALFORMED, function.getName() + " on " + to + " returned " + hex);
            }
            return decoded;
        });
    }

    public BigInteger balanceOf(String token, String owner) {
        Function fn = new Function("balanceOf", List.of(new Address(owner)),
                List.of(new TypeReference<Uint256>() {
                }));
        return (BigInteger) call(token, fn, RevertHandling.FAIL_FAST).get(0).getValue();
    }

    public BigInteger allowance(String token, String owner, String spender) {
        Function fn = new Function("allowance", List.of(new Address(owner), new Address(spender)),
                List.of(new TypeReference<Uint256>() {
                }));
        return (BigInteger) call(token, fn, RevertHandling.FAIL_FAST).get(0).getValue();
    }

    public int decimals(String token) {
        Function fn = new Function("decimals", List.of(), List.of(new TypeReference<Uint8>() {
        }));
        return ((BigInteger) call(token, fn, RevertHandling.FAIL_FAST).get(0).getValue()).intValueExact();
    }

    public String symbol(String token) {
        Function fn = new Function("symbol", List.of(), List.of(new TypeReference<Utf8String>() {
        }));
        return (String) call(token, fn, RevertHandling.FAIL_FAST).get(0).getValue();
    }

    public BigInteger gasPrice() {
        return quantity(gateway.call("eth_gasPrice", List.of()));
    }

    public BigInteger nativeBalance(String address) {
        return quantity(gateway.call("eth_getBalance", List.of(address, "latest")));
    }

    public BigInteger pendingNonce(String address) {
        return quantity(gateway.call("eth_getTransactionCount", List.of(address, "pending")));
    }

    public BigInteger estimateGas(String from, String to, String data) {
        Map<String, String> tx = new LinkedHashMap<>();
        tx.put("from", from);
        tx.put("to", to);
        tx.put("data", data);
        return quantity(gateway.call("eth_estimateGas", List.of(tx)));
    }

    /**
     * Broadcasts without rotating to another endpoint once the request may have been delivered.
     */
    public String sendRawTransaction(String signedHex) {
        return gateway.submit("eth_sendRawTransaction", List.of(signedHex)).asText();
    }

    /**
     * Whether the node has the transaction in its pool or in a block.
     */
    public boolean transactionKnown(String txHash) {
        JsonNode tx = gateway.call("eth_getTransactionByHash", List.of(txHash));
        return tx != null && !tx.isNull();
    }

    public Optional<TxReceipt> receipt(String txHash) {
        JsonNode r = gateway.call("eth_getTransactionReceipt", List.of(txHash));
        if (r == null || r.isNull()) {
            return Optional.empty();
        }
        boolean success = "0x1".equals(r.path("status").asText());
        BigInteger gasUsed = r.hasNonNull("gasUsed") ? Numeric.decodeQuantity(r.get("gasUsed").asText()) : null;
        BigInteger block = r.hasNonNull("blockNumber") ? Numeric.decodeQuantity(r.get("blockNumber").asText()) : null;
        return Optional.of(new TxReceipt(txHash, success, gasUsed, block));
    }

    private static BigInteger quantity(JsonNode node) {
        if (node == null || !node.isTextual()) {
            throw new RpcException(RpcErrorKind.MALFORMED, "expected hex quantity, got " + node);
        }
        return Numeric.decodeQuantity(node.asText());
    }
}
