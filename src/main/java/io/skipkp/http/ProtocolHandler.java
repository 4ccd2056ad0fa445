package io.skipkp.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.skipkp.config.KeyProviderConfig;
import io.skipkp.keystore.KeyStore;
import io.skipkp.model.KeyProviderException;
import io.skipkp.runtime.KeyProviderRuntime;
import io.skipkp.security.KeyMaterial;
import io.skipkp.sync.ReceiveResult;
import io.skipkp.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Routes the key provider endpoints. Validates parameters and delegates; holds no state.
 *
 * <pre>
 * GET  /capabilities
 * GET  /key?remoteSystemID=..&amp;size=..
 * GET  /key/{keyId}?remoteSystemID=..
 * GET  /entropy?minentropy=..
 * POST /sync
 * GET  /status/sync
 * GET  /status/health
 * </pre>
 */
public final class ProtocolHandler implements HttpHandler {
    static final int MAX_SYNC_BODY_BYTES = 1 << 20;

    private final KeyProviderRuntime runtime;
    private final KeyProviderConfig config;

    public ProtocolHandler(KeyProviderRuntime runtime) {
        this.runtime = runtime;
        this.config = runtime.config();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            route(exchange);
        } catch (KeyProviderException e) {
            writeJson(exchange, Map.of("error", e.getMessage()), e.httpStatus());
        } catch (RuntimeException e) {
            System.err.println("WARN request " + exchange.getRequestMethod() + " "
                    + exchange.getRequestURI().getRawPath() + " failed: " + e);
            writeJson(exchange, Map.of("error", "internal_error"), 500);
        } finally {
            exchange.close();
        }
    }

    private void route(HttpExchange exchange) throws IOException {
        String path = normalizePath(exchange.getRequestURI().getRawPath());
        switch (path) {
            case "/capabilities" -> {
                if (requireMethod(exchange, "GET")) {
                    writeJson(exchange, runtime.capabilities().describe(), 200);
                }
            }
            case "/key" -> {
                if (requireMethod(exchange, "GET")) {
                    handleGenerate(exchange);
                }
            }
            case "/entropy" -> {
                if (requireMethod(exchange, "GET")) {
                    handleEntropy(exchange);
                }
            }
            case "/sync" -> {
                if (requireMethod(exchange, "POST")) {
                    handleSync(exchange);
                }
            }
            case "/status/sync" -> {
                if (requireMethod(exchange, "GET")) {
                    writeJson(exchange, runtime.syncStatus(), 200);
                }
            }
            case "/status/health" -> {
                if (requireMethod(exchange, "GET")) {
                    KeyProviderRuntime.HealthOutcome health = runtime.health();
                    writeJson(exchange, health, health.ok() ? 200 : 503);
                }
            }
            default -> {
                if (path.startsWith("/key/") && path.indexOf('/', "/key/".length()) < 0) {
                    if (requireMethod(exchange, "GET")) {
                        String keyId = URLDecoder.decode(path.substring("/key/".length()), StandardCharsets.UTF_8);
                        handleRetrieve(exchange, keyId);
                    }
                } else {
                    writeJson(exchange, Map.of("error", "not_found"), 404);
                }
            }
        }
    }

    private void handleGenerate(HttpExchange exchange) throws IOException {
        Map<String, String> q = parseQuery(exchange.getRequestURI());
        String remoteSystemId = requireRemoteSystemId(q);
        int size = parseIntParam(q.get("size"), config.defaultKeySizeBits(), "size");
        try (KeyStore.GeneratedKey key = runtime.keyStore().generate(remoteSystemId, size)) {
            writeKey(exchange, key.keyId(), key.keyMaterial());
        }
    }

    private void handleRetrieve(HttpExchange exchange, String keyId) throws IOException {
        Map<String, String> q = parseQuery(exchange.getRequestURI());
        String remoteSystemId = requireRemoteSystemId(q);
        try (KeyMaterial material = runtime.keyStore().retrieve(keyId, remoteSystemId)) {
            writeKey(exchange, keyId.toLowerCase(Locale.ROOT), material);
        }
    }

    private void handleEntropy(HttpExchange exchange) throws IOException {
        Map<String, String> q = parseQuery(exchange.getRequestURI());
        int bits = parseIntParam(q.get("minentropy"), config.defaultEntropyBits(), "minentropy");
        if (bits < config.minEntropyBits() || bits > config.maxEntropyBits() || bits % 8 != 0) {
            throw KeyProviderException.validation("minentropy must be between " + config.minEntropyBits()
                    + " and " + config.maxEntropyBits() + " and a multiple of 8");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("randomStr", runtime.entropy().generate(bits));
        body.put("minentropy", bits);
        writeJson(exchange, body, 200);
    }

    private void handleSync(HttpExchange exchange) throws IOException {
        String body = readBody(exchange);
        ReceiveResult result = runtime.messenger().receive(body);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "ok");
        out.put("message", result.message());
        writeJson(exchange, out, 200);
    }

    /**
     * Serializes the key response, writes it, then wipes the serialized bytes. The caller closes
     * the material buffer afterwards.
     */
    private static void writeKey(HttpExchange exchange, String keyId, KeyMaterial material) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("keyId", keyId);
        body.put("key", material.toHex());
        byte[] bytes = Jsons.mapper().writeValueAsBytes(body);
        try {
            writeBytes(exchange, bytes, 200);
        } finally {
            KeyMaterial.wipe(bytes);
        }
    }

    private static String requireRemoteSystemId(Map<String, String> q) {
        String remoteSystemId = q.get("remoteSystemID");
        if (remoteSystemId == null || remoteSystemId.isBlank()) {
            throw KeyProviderException.validation("remoteSystemID is required");
        }
        return remoteSystemId;
    }

    private static int parseIntParam(String raw, int fallback, String name) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw KeyProviderException.validation("Invalid " + name + ": must be an integer");
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readNBytes(MAX_SYNC_BODY_BYTES + 1);
            if (bytes.length > MAX_SYNC_BODY_BYTES) {
                throw KeyProviderException.validation("Sync message too large");
            }
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", method);
        writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
        return false;
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        if (rawPath.length() > 1 && rawPath.endsWith("/")) {
            return rawPath.substring(0, rawPath.length() - 1);
        }
        return rawPath;
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.putIfAbsent(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.putIfAbsent(key, value);
            }
        }
        return out;
    }

    static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        writeBytes(exchange, Jsons.toJson(body).getBytes(StandardCharsets.UTF_8), status);
    }

    private static void writeBytes(HttpExchange exchange, byte[] bytes, int status) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
