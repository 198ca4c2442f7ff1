package com.zzf.toolhost.mcp.error;

/**
 * 工具提供方异常基类, 携带稳定的错误码供上层展示.
 */
public class ToolProviderException extends RuntimeException {

    private final String errorCode;
    private final String serverId;

    public ToolProviderException(String errorCode, String serverId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.serverId = serverId;
    }

    public ToolProviderException(String errorCode, String serverId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.serverId = serverId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getServerId() {
        return serverId;
    }
}
