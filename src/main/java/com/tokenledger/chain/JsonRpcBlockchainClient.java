package com.tokenledger.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenledger.common.ChainReference;
import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ERC-20 token access over Ethereum JSON-RPC.
 *
 * Handles:
 * - Receipts, block height and Transfer log decoding for deposit verification
 * - Fee data, gas estimation and submission for withdrawals
 * - Polling for a submitted transfer to be mined
 *
 * Transfers are sent with {@code eth_sendTransaction} from the hot-wallet address;
 * the node (or the signer attached to it) holds the key and assigns nonces.
 */
@Component
@Slf4j
public class JsonRpcBlockchainClient implements BlockchainClient {

    static final String TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    private static final String BALANCE_OF_SELECTOR = "0x70a08231";
    private static final String DECIMALS_SELECTOR = "0x313ce567";
    private static final String TRANSFER_SELECTOR = "0xa9059cbb";

    private final RestTemplate restTemplate;
    private final String rpcUrl;
    private final String tokenContractAddress;
    private final String hotWalletAddress;
    private final long pollIntervalMs;
    private final long receiptTimeoutMs;
    private final AtomicLong requestIds = new AtomicLong();

    private volatile Integer tokenDecimals;

    @Autowired
    public JsonRpcBlockchainClient(
            @Value("${token-ledger.chain.rpc-url:http://localhost:8545}") String rpcUrl,
            @Value("${token-ledger.chain.token-contract-address}") String tokenContractAddress,
            @Value("${token-ledger.chain.hot-wallet-address}") String hotWalletAddress,
            @Value("${token-ledger.chain.token-decimals:0}") int tokenDecimals,
            @Value("${token-ledger.chain.receipt-poll-interval-ms:3000}") long pollIntervalMs,
            @Value("${token-ledger.chain.receipt-timeout-ms:300000}") long receiptTimeoutMs) {

        this(new RestTemplate(), rpcUrl, tokenContractAddress, hotWalletAddress,
            tokenDecimals, pollIntervalMs, receiptTimeoutMs);
    }

    JsonRpcBlockchainClient(RestTemplate restTemplate, String rpcUrl, String tokenContractAddress,
                            String hotWalletAddress, int tokenDecimals, long pollIntervalMs,
                            long receiptTimeoutMs) {
        ChainReference.validateAddress(tokenContractAddress);
        ChainReference.validateAddress(hotWalletAddress);

        this.restTemplate = restTemplate;
        this.rpcUrl = rpcUrl;
        this.tokenContractAddress = tokenContractAddress;
        this.hotWalletAddress = hotWalletAddress;
        this.tokenDecimals = tokenDecimals > 0 ? tokenDecimals : null;
        this.pollIntervalMs = pollIntervalMs;
        this.receiptTimeoutMs = receiptTimeoutMs;

        log.info("Blockchain client initialized: rpcUrl={}, token={}, hotWallet={}",
            rpcUrl, tokenContractAddress, hotWalletAddress);
    }

    @Override
    public BigDecimal getBalance(String address) {
        ChainReference.validateAddress(address);

        Map<String, Object> call = new LinkedHashMap<>();
        call.put("to", tokenContractAddress);
        call.put("data", BALANCE_OF_SELECTOR + pad32(strip0x(address)));

        BigInteger units = toBigInteger(call("eth_call", call, "latest"));
        return new BigDecimal(units, decimals());
    }

    @Override
    public Optional<Receipt> getReceipt(String reference) {
        JsonNode result = call("eth_getTransactionReceipt", reference);
        if (result == null || result.isNull()) {
            return Optional.empty();
        }

        Receipt.ReceiptBuilder receipt = Receipt.builder()
            .reference(result.path("transactionHash").asText(reference))
            .blockNumber(toBigInteger(result.get("blockNumber")).longValueExact())
            .successful("0x1".equals(result.path("status").asText()));

        for (JsonNode entry : result.path("logs")) {
            ReceiptLog.ReceiptLogBuilder receiptLog = ReceiptLog.builder()
                .address(entry.path("address").asText())
                .data(entry.path("data").asText("0x"));
            for (JsonNode topic : entry.path("topics")) {
                receiptLog.topic(topic.asText());
            }
            receipt.log(receiptLog.build());
        }

        return Optional.of(receipt.build());
    }

    @Override
    public long currentBlockHeight() {
        return toBigInteger(call("eth_blockNumber")).longValueExact();
    }

    @Override
    public List<TransferEvent> parseTransferEvents(Receipt receipt) {
        List<TransferEvent> transfers = new ArrayList<>();

        for (ReceiptLog entry : receipt.getLogs()) {
            if (!ChainReference.sameAddress(entry.getAddress(), tokenContractAddress)) {
                continue;
            }
            List<String> topics = entry.getTopics();
            if (topics.size() < 3 || !TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
                continue;
            }

            BigInteger units = parseHex(entry.getData());
            transfers.add(new TransferEvent(
                topicToAddress(topics.get(1)),
                topicToAddress(topics.get(2)),
                new BigDecimal(units, decimals())
            ));
        }

        return transfers;
    }

    @Override
    public BigInteger toChainUnits(Money amount) {
        if (amount.getCurrency() != Currency.USDT) {
            throw new IllegalArgumentException("Only token amounts can be sent on chain: " + amount);
        }
        try {
            return amount.getAmount().movePointRight(decimals()).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount " + amount + " is finer than the token's precision", e);
        }
    }

    @Override
    public FeeData getFeeData() {
        BigInteger gasPrice = toBigInteger(call("eth_gasPrice"));

        JsonNode block = call("eth_getBlockByNumber", "latest", false);
        JsonNode baseFee = block == null ? null : block.get("baseFeePerGas");
        if (baseFee == null || baseFee.isNull()) {
            return FeeData.builder().gasPrice(gasPrice).build();
        }

        BigInteger priorityFee = toBigInteger(call("eth_maxPriorityFeePerGas"));
        return FeeData.builder()
            .gasPrice(gasPrice)
            .maxPriorityFeePerGas(priorityFee)
            .maxFeePerGas(toBigInteger(baseFee).multiply(BigInteger.TWO).add(priorityFee))
            .build();
    }

    @Override
    public BigInteger estimateTransferGas(String toAddress, BigInteger units) {
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", hotWalletAddress);
        tx.put("to", tokenContractAddress);
        tx.put("data", transferCalldata(toAddress, units));

        return toBigInteger(call("eth_estimateGas", tx));
    }

    /**
     * Synchronized so that transfers leave this process one at a time and the
     * signer assigns consecutive nonces.
     */
    @Override
    public synchronized SubmittedTransfer submitTransfer(TransferRequest request) {
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", hotWalletAddress);
        tx.put("to", tokenContractAddress);
        tx.put("data", transferCalldata(request.getToAddress(), request.getUnits()));
        tx.put("gas", toHex(request.getGasLimit()));

        FeeData fees = request.getFeeData();
        if (fees.supportsDynamicFees()) {
            tx.put("maxFeePerGas", toHex(fees.getMaxFeePerGas()));
            tx.put("maxPriorityFeePerGas", toHex(fees.getMaxPriorityFeePerGas()));
        } else {
            tx.put("gasPrice", toHex(fees.getGasPrice()));
        }

        JsonNode result = call("eth_sendTransaction", tx);
        if (result == null || !result.isTextual()) {
            throw new ChainClientException("Node returned no transaction reference");
        }

        log.info("Submitted transfer of {} units to {}: ref={}",
            request.getUnits(), request.getToAddress(), result.asText());

        return new SubmittedTransfer(result.asText());
    }

    @Override
    public Receipt waitMined(String reference) {
        long deadline = System.currentTimeMillis() + receiptTimeoutMs;

        while (true) {
            Optional<Receipt> receipt = getReceipt(reference);
            if (receipt.isPresent()) {
                return receipt.get();
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new ChainClientException(
                    "Transaction " + reference + " not mined within " + receiptTimeoutMs + " ms");
            }
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChainClientException("Interrupted while waiting for " + reference, e);
            }
        }
    }

    private int decimals() {
        Integer decimals = tokenDecimals;
        if (decimals == null) {
            Map<String, Object> call = new LinkedHashMap<>();
            call.put("to", tokenContractAddress);
            call.put("data", DECIMALS_SELECTOR);

            decimals = toBigInteger(call("eth_call", call, "latest")).intValueExact();
            tokenDecimals = decimals;
            log.info("Token {} uses {} decimals", tokenContractAddress, decimals);
        }
        return decimals;
    }

    private JsonNode call(String method, Object... params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        request.put("params", Arrays.asList(params));

        log.debug("RPC {} {}", method, request.get("params"));

        JsonNode response;
        try {
            response = restTemplate.postForObject(rpcUrl, request, JsonNode.class);
        } catch (RestClientException e) {
            log.error("RPC {} failed", method, e);
            throw new ChainClientException("Blockchain node unavailable", e);
        }

        if (response == null) {
            throw new ChainClientException("Empty response to " + method);
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            log.error("RPC {} returned error: {}", method, error);
            throw new ChainClientException("Blockchain node rejected " + method + ": " + error.path("message").asText());
        }
        return response.get("result");
    }

    private static String transferCalldata(String toAddress, BigInteger units) {
        return TRANSFER_SELECTOR + pad32(strip0x(toAddress)) + pad32(units.toString(16));
    }

    private static String topicToAddress(String topic) {
        return "0x" + strip0x(topic).substring(24);
    }

    private static BigInteger toBigInteger(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new ChainClientException("Missing numeric value in node response");
        }
        return parseHex(node.asText());
    }

    private static BigInteger parseHex(String hex) {
        String digits = strip0x(hex);
        return digits.isEmpty() ? BigInteger.ZERO : new BigInteger(digits, 16);
    }

    private static String toHex(BigInteger value) {
        return "0x" + value.toString(16);
    }

    private static String strip0x(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    private static String pad32(String hexDigits) {
        StringBuilder padded = new StringBuilder(64);
        for (int i = hexDigits.length(); i < 64; i++) {
            padded.append('0');
        }
        return padded.append(hexDigits.toLowerCase()).toString();
    }
}
