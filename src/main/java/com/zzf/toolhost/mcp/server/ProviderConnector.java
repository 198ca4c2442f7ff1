package com.zzf.toolhost.mcp.server;

import com.zzf.toolhost.mcp.config.ServerConfig;

/**
 * Opens connections to tool providers. The returned connection is fully initialized.
 */
public interface ProviderConnector {

    ProviderConnection connect(ServerConfig config, DiagnosticSink diagnostics) throws Exception;
}
