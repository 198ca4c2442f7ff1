package com.zzf.toolhost.mcp.server;

/**
 * Receives diagnostic lines emitted by a provider connection.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void accept(String line);
}
