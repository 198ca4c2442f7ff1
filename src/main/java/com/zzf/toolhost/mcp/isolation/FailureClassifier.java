package com.zzf.toolhost.mcp.isolation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.zzf.toolhost.mcp.error.CircuitOpenException;
import com.zzf.toolhost.mcp.error.ConfigurationException;
import com.zzf.toolhost.mcp.error.ProviderConnectionException;
import com.zzf.toolhost.mcp.error.ProviderFatalException;
import com.zzf.toolhost.mcp.error.ProviderProtocolException;
import com.zzf.toolhost.mcp.error.ProviderTimeoutException;
import com.zzf.toolhost.mcp.error.QuarantinedServerException;
import com.zzf.toolhost.mcp.error.ServerNotFoundException;
import com.zzf.toolhost.mcp.error.ServerUnavailableException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failure to a {@link FailureCategory}. Typed exceptions win; otherwise the
 * message is matched against known patterns along the cause chain.
 */
public final class FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;
    private static final List<String> FATAL_HINTS = List.of(
            "unauthorized", "forbidden", "authentication", "permission denied", "401", "403");
    private static final List<String> TRANSIENT_HINTS = List.of(
            "timeout", "timed out", "connection reset", "connection refused", "broken pipe",
            "rate limit", "overloaded", "temporarily unavailable", "429", "502", "503", "504");
    private static final List<String> PROTOCOL_HINTS = List.of(
            "json", "decode", "malformed", "parse", "protocol", "unexpected response");

    private FailureClassifier() {
    }

    public static FailureCategory classify(Throwable error) {
        if (error == null) {
            return FailureCategory.PROTOCOL;
        }
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureCategory typed = byType(current);
            if (typed != null) {
                return typed;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureCategory byMessage = byMessage(current.getMessage());
            if (byMessage != null) {
                return byMessage;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return FailureCategory.PROTOCOL;
    }

    private static FailureCategory byType(Throwable t) {
        if (t instanceof ExecutionException || t instanceof CompletionException) {
            return null;
        }
        if (t instanceof ProviderFatalException) {
            return FailureCategory.FATAL;
        }
        if (t instanceof ConfigurationException) {
            return FailureCategory.CONFIGURATION;
        }
        if (t instanceof ServerUnavailableException
                || t instanceof CircuitOpenException
                || t instanceof QuarantinedServerException
                || t instanceof ServerNotFoundException) {
            return FailureCategory.REJECTED;
        }
        if (t instanceof ProviderProtocolException || t instanceof JsonProcessingException) {
            return FailureCategory.PROTOCOL;
        }
        if (t instanceof ProviderTimeoutException
                || t instanceof ProviderConnectionException
                || t instanceof TimeoutException
                || t instanceof IOException
                || t instanceof UncheckedIOException) {
            return FailureCategory.TRANSIENT;
        }
        return null;
    }

    private static FailureCategory byMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (containsAny(lower, FATAL_HINTS)) {
            return FailureCategory.FATAL;
        }
        if (containsAny(lower, TRANSIENT_HINTS)) {
            return FailureCategory.TRANSIENT;
        }
        if (containsAny(lower, PROTOCOL_HINTS)) {
            return FailureCategory.PROTOCOL;
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> hints) {
        for (String hint : hints) {
            if (text.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
