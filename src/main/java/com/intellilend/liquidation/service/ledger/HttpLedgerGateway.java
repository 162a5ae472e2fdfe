package com.intellilend.liquidation.service.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intellilend.liquidation.common.exception.ContractRevertException;
import com.intellilend.liquidation.common.exception.LedgerException;
import com.intellilend.liquidation.common.exception.ValidationException;
import com.intellilend.liquidation.dto.AuctionStartResult;
import com.intellilend.liquidation.dto.LiquidationHistoryEntry;
import com.intellilend.liquidation.dto.ProtectionDetails;
import com.intellilend.liquidation.dto.TxResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * LedgerGateway over the ledger adapter's JSON/HTTP surface.
 * <p>
 * Every request names the contract it targets through {@code X-Contract-Address}.
 * HTTP 409/422 mean the contract reverted; any other non-2xx is a transport failure.
 */
@Slf4j
public class HttpLedgerGateway implements LedgerGateway {

    private static final String CONTRACT_HEADER = "X-Contract-Address";

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Duration timeout;
    private final String lendingPool;
    private final String auctionContract;
    private final String protectionContract;

    public HttpLedgerGateway(HttpClient http,
                             ObjectMapper mapper,
                             String baseUrl,
                             Duration timeout,
                             String lendingPool,
                             String auctionContract,
                             String protectionContract) {
        this.http = http;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.lendingPool = lendingPool;
        this.auctionContract = auctionContract;
        this.protectionContract = protectionContract;
    }

    @Override
    public BigDecimal getDebt(String borrower) {
        JsonNode body = get("/borrowers/" + enc(borrower) + "/debt", lendingPool);
        return amount(body, "amount");
    }

    @Override
    public BigDecimal getCollateral(String borrower) {
        JsonNode body = get("/borrowers/" + enc(borrower) + "/collateral", lendingPool);
        return amount(body, "amount");
    }

    @Override
    public List<String> listActiveBorrowers() {
        JsonNode body = get("/borrowers", lendingPool);
        if (!body.isArray()) throw new LedgerException("Borrower list is not an array");
        List<String> out = new ArrayList<>(body.size());
        for (JsonNode n : body) {
            if (n.isTextual() && !n.asText().isBlank()) out.add(n.asText());
        }
        return out;
    }

    @Override
    public boolean hasActiveProtection(String borrower) {
        JsonNode body = get("/protection/" + enc(borrower), protectionContract);
        return body.path("active").asBoolean(false);
    }

    @Override
    public Optional<ProtectionDetails> getProtectionDetails(String borrower) {
        JsonNode body = get("/protection/" + enc(borrower), protectionContract);
        if (!body.path("active").asBoolean(false)) return Optional.empty();
        return Optional.of(new ProtectionDetails(
                amount(body, "amount"),
                instant(body, "expirationTime"),
                body.path("remainingUses").asInt(0)));
    }

    @Override
    public TxResult activateProtection(String borrower) {
        JsonNode body = post("/protection/" + enc(borrower) + "/activate", protectionContract, mapper.createObjectNode());
        return tx(body);
    }

    @Override
    public AuctionStartResult startAuction(String borrower,
                                           BigDecimal collateralAmount,
                                           BigDecimal startPrice,
                                           BigDecimal reservePrice,
                                           long durationSec) {
        ObjectNode req = mapper.createObjectNode();
        req.put("borrower", borrower);
        req.put("collateralAmount", collateralAmount.toPlainString());
        req.put("startPrice", startPrice.toPlainString());
        req.put("reservePrice", reservePrice.toPlainString());
        req.put("duration", durationSec);

        JsonNode body = post("/auctions", auctionContract, req);
        String auctionId = body.path("auctionId").asText(null);
        return new AuctionStartResult(auctionId, tx(body));
    }

    @Override
    public TxResult liquidate(String borrower) {
        JsonNode body = post("/borrowers/" + enc(borrower) + "/liquidate", lendingPool, mapper.createObjectNode());
        return tx(body);
    }

    @Override
    public List<LiquidationHistoryEntry> getLiquidationHistory(String borrower) {
        JsonNode body = get("/borrowers/" + enc(borrower) + "/liquidations", lendingPool);
        if (!body.isArray()) return List.of();
        List<LiquidationHistoryEntry> out = new ArrayList<>(body.size());
        for (JsonNode n : body) {
            out.add(new LiquidationHistoryEntry(
                    instant(n, "timestamp"),
                    amount(n, "collateralLiquidated"),
                    amount(n, "debtCovered"),
                    n.path("liquidator").asText(null),
                    n.path("transactionHash").asText(null),
                    n.path("blockNumber").asLong(0L)));
        }
        return out;
    }

    // ---------- transport ----------

    private JsonNode get(String path, String contract) {
        return send(request(path, contract).GET().build());
    }

    private JsonNode post(String path, String contract, JsonNode payload) {
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new ValidationException("Cannot serialize request for " + path, e);
        }
        return send(request(path, contract)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build());
    }

    private HttpRequest.Builder request(String path, String contract) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (contract != null) b.header(CONTRACT_HEADER, contract);
        return b;
    }

    private JsonNode send(HttpRequest req) {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LedgerException("Ledger unreachable: " + req.uri() + " - " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerException("Interrupted calling " + req.uri(), e);
        }

        int sc = resp.statusCode();
        if (sc == 409 || sc == 422) {
            throw new ContractRevertException(req.method() + " " + req.uri().getPath() + " reverted: " + resp.body());
        }
        if (!is2xx(sc)) {
            throw new LedgerException("HTTP " + sc + " - " + resp.body());
        }
        String body = resp.body();
        if (body == null || body.isBlank()) return mapper.createObjectNode();
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new LedgerException("Unreadable ledger response from " + req.uri().getPath(), e);
        }
    }

    // ---------- decoding ----------

    private static TxResult tx(JsonNode body) {
        String hash = body.path("transactionHash").asText(null);
        boolean success = body.path("success").asBoolean(hash != null);
        return success ? TxResult.ok(hash) : TxResult.failed(hash, body.path("error").asText("transaction failed"));
    }

    static BigDecimal amount(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            throw new ValidationException("Missing amount '" + field + "'");
        }
        try {
            BigDecimal out = v.isNumber() ? v.decimalValue() : new BigDecimal(v.asText().trim());
            if (out.signum() < 0) throw new ValidationException("Negative amount '" + field + "': " + out);
            return out;
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid amount '" + field + "': " + v.asText(), e);
        }
    }

    private static Instant instant(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return Instant.ofEpochSecond(v.asLong());
        try {
            return Instant.parse(v.asText());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid timestamp '" + field + "': " + v.asText(), e);
        }
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static boolean is2xx(int sc) {
        return sc >= 200 && sc < 300;
    }
}
