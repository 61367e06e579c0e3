package com.elssolution.greenguard.integration;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/** Small helpers shared by the provider clients. */
public final class HttpSupport {

    private HttpSupport() {}

    public static String truncate(String s, int limit) {
        if (s == null) return "";
        return s.length() <= limit ? s : s.substring(0, Math.max(0, limit)) + "…";
    }

    public static String safeJoin(String base, String path) {
        if (base == null) return path;
        if (base.endsWith("/") && path.startsWith("/")) return base.substring(0, base.length() - 1) + path;
        if (!base.endsWith("/") && !path.startsWith("/")) return base + "/" + path;
        return base + path;
    }

    private static boolean isNumericText(String s) {
        if (s == null || s.isBlank()) return false;
        try { Double.parseDouble(s.trim()); return true; } catch (NumberFormatException e) { return false; }
    }

    /** Reads a numeric field; handles numbers-as-strings too. */
    public static Double nodeNum(JsonNode obj, String field) {
        JsonNode n = obj.path(field);
        if (n.isNumber()) return n.asDouble();
        if (n.isTextual() && isNumericText(n.asText())) return Double.parseDouble(n.asText().trim());
        return null;
    }

    /**
     * Cancels {@code exchange} when {@code dependent} fails first, e.g. on caller
     * cancellation or {@code orTimeout}. Cancelling a {@code sendAsync} future aborts the HTTP exchange.
     */
    public static <T> CompletableFuture<T> linkCancellation(CompletableFuture<T> dependent,
                                                            CompletableFuture<?> exchange) {
        dependent.whenComplete((v, ex) -> {
            if (ex != null && !exchange.isDone()) exchange.cancel(true);
        });
        return dependent;
    }
}
