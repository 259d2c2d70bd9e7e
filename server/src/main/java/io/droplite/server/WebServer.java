package io.droplite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.droplite.core.Bytes32;
import io.droplite.core.Category;
import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionException;
import io.droplite.core.DistributionRecord;
import io.droplite.core.Failure;
import io.droplite.core.SlotKey;
import io.droplite.core.batch.Batch;
import io.droplite.core.batch.BatchBuilder;
import io.droplite.core.batch.ClaimTicket;
import io.droplite.server.claim.ClaimProcessor;
import io.droplite.server.claim.ClaimRequest;
import io.droplite.server.claim.TransferException;
import io.droplite.server.distribution.Submission;
import io.droplite.server.distribution.SubmissionValidator;
import io.droplite.server.dto.ClaimBody;
import io.droplite.server.dto.ClaimResponse;
import io.droplite.server.dto.DistributionResponse;
import io.droplite.server.dto.ProofResponse;
import io.droplite.server.dto.SubmitRequest;
import io.droplite.server.relayer.BatchArchive;
import io.droplite.storage.DistributionLedger;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Thin HTTP adapter over SubmissionValidator, ClaimProcessor and the ledger.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert results back into JSON.
 *  - Map failures to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /distributions                              Submit a signed tree
 *   - POST /claims                                     Claim one leaf
 *   - GET  /distributions/{day}/{category}[/{sub}]     Finalized record
 *   - GET  /days/current                               Current distribution day
 *   - GET  /proofs/{day}/{category}/{user}             Leaf index + proof from the archive
 *   - GET  /admin/health                               Basic health check
 *
 * Status mapping:
 *   NO_DISTRIBUTION 404; ALREADY_SUBMITTED, ALREADY_CLAIMED, NONCE_REPLAY 409;
 *   INVALID_SIGNATURE, UNAUTHORIZED 403; other failures and bad input 400;
 *   failed value release 502; oversized body 413; anything else 500.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final SubmissionValidator validator;
    private final ClaimProcessor claims;
    private final DistributionLedger ledger;
    private final BatchArchive archive;

    public WebServer(int port,
                     SubmissionValidator validator,
                     ClaimProcessor claims,
                     DistributionLedger ledger,
                     BatchArchive archive) {
        this.validator = validator;
        this.claims = claims;
        this.ledger = ledger;
        this.archive = archive;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/distributions".equals(path) && "POST".equals(method)) {
                        handleBody(exchange, SubmitRequest.class, this::submit);
                    } else if ("/claims".equals(path) && "POST".equals(method)) {
                        handleBody(exchange, ClaimBody.class, this::claim);
                    } else if (path.startsWith("/distributions/") && "GET".equals(method)) {
                        handleGet(exchange, () -> getDistribution(segments(path, "/distributions/")));
                    } else if (path.startsWith("/proofs/") && "GET".equals(method)) {
                        handleGet(exchange, () -> getProof(segments(path, "/proofs/")));
                    } else if ("/days/current".equals(path) && "GET".equals(method)) {
                        handleGet(exchange, () -> Map.of("day", ledger.currentDay()));
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, -1, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    // ---------- handlers ----------

    private Object submit(SubmitRequest req) {
        var submission = new Submission(
                req.day,
                categoryCode(req.category),
                req.subBatch,
                Bytes32.fromHex(required(req.merkleRoot, "merkleRoot")),
                req.users,
                req.points,
                req.amounts == null ? List.of() : req.amounts.stream().map(WebServer::uint).toList(),
                uint(required(req.nonce, "nonce")),
                req.deadline,
                Numeric.hexStringToByteArray(required(req.signature, "signature")),
                required(req.submitter, "submitter")
        );
        DistributionRecord record = validator.submit(submission);

        // trusted roots may not be derivable from the arrays; only archive what matches
        Batch batch = BatchBuilder.build(record.slot(),
                BatchBuilder.zip(submission.users(), submission.points(), submission.amounts()));
        if (batch.root().equals(record.root())) archive.put(batch);
        return DistributionResponse.of(record, BigInteger.ZERO);
    }

    private Object claim(ClaimBody body) {
        List<Bytes32> proof = new ArrayList<>();
        if (body.proof != null) body.proof.forEach(p -> proof.add(Bytes32.fromHex(p)));
        var req = new ClaimRequest(body.day, Category.parse(body.category), body.subBatch, body.points,
                uint(required(body.rewardAmount, "rewardAmount")), body.index, proof);

        ClaimRecord c = claims.claim(req, required(body.caller, "caller"));
        var dto = new ClaimResponse();
        dto.ok = true;
        dto.day = c.slot().day();
        dto.category = c.slot().category().name();
        dto.subBatch = c.slot().subBatch();
        dto.user = c.user();
        dto.amount = c.amount().toString();
        dto.claimedAt = c.claimedAt();
        return dto;
    }

    /** /distributions/{day}/{category}[/{subBatch}] */
    private Object getDistribution(List<String> parts) {
        if (parts.size() < 2 || parts.size() > 3) {
            throw new IllegalArgumentException("expected /distributions/{day}/{category}[/{subBatch}]");
        }
        SlotKey slot = new SlotKey(parseLong(parts.get(0), "day"), Category.parse(parts.get(1)),
                parts.size() == 3 ? (int) parseLong(parts.get(2), "subBatch") : 0);
        DistributionRecord r = ledger.get(slot)
                .orElseThrow(() -> new DistributionException(Failure.NO_DISTRIBUTION, "no distribution for " + slot));
        return DistributionResponse.of(r, ledger.claimedTotal(slot));
    }

    /** /proofs/{day}/{category}/{user} */
    private Object getProof(List<String> parts) {
        if (parts.size() != 3) throw new IllegalArgumentException("expected /proofs/{day}/{category}/{user}");
        long day = parseLong(parts.get(0), "day");
        Category category = Category.parse(parts.get(1));
        String user = parts.get(2);

        Batch batch = archive.batchFor(day, category, user)
                .orElseThrow(() -> new DistributionException(Failure.NO_DISTRIBUTION,
                        "no archived batch for " + user + " on " + day + "/" + category));
        ClaimTicket t = batch.ticket(user).orElseThrow();

        var dto = new ProofResponse();
        dto.day = day;
        dto.category = category.name();
        dto.subBatch = batch.slot().subBatch();
        dto.merkleRoot = batch.root().toHex();
        dto.user = t.user();
        dto.points = t.points();
        dto.reward = t.reward().toString();
        dto.index = t.index();
        dto.proof = t.proof().stream().map(Bytes32::toHex).toList();
        return dto;
    }

    // ---------- plumbing ----------

    private interface Action {
        Object run();
    }

    private void handleGet(HttpServerExchange ex, Action action) {
        String method = "GET";
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            send(ex, status, action.run());
        } catch (Exception e) {
            error = e;
            status = fail(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, status, totalMs, -1, error);
        }
    }

    private <T> void handleBody(HttpServerExchange ex, Class<T> type, Function<T, Object> action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String method = exchange.getRequestMethod().toString();
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long ledgerMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            T req = json.readValue(data, type);
                            long sStart = System.nanoTime();
                            Object result = action.apply(req);
                            ledgerMs = (System.nanoTime() - sStart) / 1_000_000L;
                            status = 200;
                            send(exchange, status, result);
                        }
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        error = e;
                        status = fail(exchange, e);
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest(method, path, exchange.getStatusCode(), totalMs, ledgerMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    String method = exchange.getRequestMethod().toString();
                    String path = exchange.getRequestPath();
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(method, path, status, 0, -1, ioEx);
                }
        );
    }

    /** Write the error body for e and return the status used. */
    private int fail(HttpServerExchange ex, Exception e) {
        int status;
        Object body;
        if (e instanceof DistributionException de) {
            status = statusFor(de.failure());
            body = Map.of("error", de.failure().name(), "message", Objects.toString(de.getMessage(), ""));
        } else if (e instanceof TransferException te) {
            status = 502;
            body = Map.of("error", "TRANSFER_FAILED", "message", Objects.toString(te.getMessage(), ""));
        } else if (e instanceof IllegalArgumentException bad) {
            status = 400;
            body = Map.of("error", "BAD_REQUEST", "message", Objects.toString(bad.getMessage(), ""));
        } else {
            status = 500;
            body = Map.of("error", e.getClass().getSimpleName(), "message", Objects.toString(e.getMessage(), ""));
        }
        send(ex, status, body);
        return status;
    }

    static int statusFor(Failure failure) {
        return switch (failure) {
            case NO_DISTRIBUTION -> 404;
            case ALREADY_SUBMITTED, ALREADY_CLAIMED, NONCE_REPLAY -> 409;
            case INVALID_SIGNATURE, UNAUTHORIZED -> 403;
            default -> 400;
        };
    }

    private static List<String> segments(String path, String prefix) {
        String rest = path.substring(prefix.length());
        List<String> parts = new ArrayList<>();
        for (String p : rest.split("/")) {
            if (!p.isBlank()) parts.add(p);
        }
        return parts;
    }

    /** Raw code so that range errors surface from the validator in its check order. */
    private static int categoryCode(String s) {
        String t = required(s, "category").trim();
        if (Character.isDigit(t.charAt(0))) {
            long code = parseLong(t, "category");
            return code > 0xFF ? -1 : (int) code;
        }
        for (Category c : Category.values()) {
            if (c.name().equalsIgnoreCase(t)) return c.code();
        }
        return -1;
    }

    private static long parseLong(String s, String name) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(name + " must be an integer: " + s, nfe);
        }
    }

    private static BigInteger uint(String s) {
        try {
            BigInteger v = new BigInteger(s.trim());
            if (v.signum() < 0) throw new IllegalArgumentException("value must be >= 0: " + s);
            return v;
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("not a base-10 integer: " + s, nfe);
        }
    }

    private static String required(String v, String name) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException(name + " is required");
        return v;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
