package com.zzf.toolhost.mcp.isolation;

import com.fasterxml.jackson.core.JsonParseException;
import com.zzf.toolhost.mcp.error.CircuitOpenException;
import com.zzf.toolhost.mcp.error.ConfigurationException;
import com.zzf.toolhost.mcp.error.ProviderFatalException;
import com.zzf.toolhost.mcp.error.ProviderTimeoutException;
import com.zzf.toolhost.mcp.error.QuarantinedServerException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailureClassifierTest {

    @Test
    void shouldClassifyTypedFailures() {
        assertEquals(FailureCategory.TRANSIENT,
                FailureClassifier.classify(new ProviderTimeoutException("fs", "call", Duration.ofSeconds(1))));
        assertEquals(FailureCategory.FATAL, FailureClassifier.classify(new ProviderFatalException("fs", "boom")));
        assertEquals(FailureCategory.CONFIGURATION, FailureClassifier.classify(new ConfigurationException("fs", "bad")));
        assertEquals(FailureCategory.REJECTED, FailureClassifier.classify(new CircuitOpenException("fs", 1000L)));
        assertEquals(FailureCategory.REJECTED, FailureClassifier.classify(new QuarantinedServerException("fs", "fatal")));
        assertEquals(FailureCategory.PROTOCOL,
                FailureClassifier.classify(new JsonParseException(null, "Unexpected character")));
    }

    @Test
    void shouldLookThroughWrappers() {
        Exception wrapped = new ExecutionException("call failed", new IOException("pipe closed"));
        assertEquals(FailureCategory.TRANSIENT, FailureClassifier.classify(wrapped));
    }

    @Test
    void shouldFallBackToMessageHints() {
        assertEquals(FailureCategory.FATAL, FailureClassifier.classify(new RuntimeException("HTTP 401 Unauthorized")));
        assertEquals(FailureCategory.TRANSIENT, FailureClassifier.classify(new RuntimeException("status 503 from upstream")));
        assertEquals(FailureCategory.TRANSIENT, FailureClassifier.classify(new IllegalStateException("Connection reset by peer")));
        assertEquals(FailureCategory.PROTOCOL, FailureClassifier.classify(new RuntimeException("malformed frame")));
    }

    @Test
    void shouldTreatUnknownAsProtocolWithoutRetry() {
        FailureCategory category = FailureClassifier.classify(new RuntimeException("something odd"));
        assertEquals(FailureCategory.PROTOCOL, category);
        assertTrue(category.isCounted());
        assertFalse(category.isRetryable());
    }
}
