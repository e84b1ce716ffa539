package com.chainwatch.ingestion.adapter;

/**
 * Thrown when an RPC call fails: transport error, JSON-RPC error object, or unparseable response.
 */
public class RpcException extends RuntimeException {

    /** JSON-RPC error code, null for transport failures. */
    private final Integer code;

    public RpcException(String message) {
        this(message, null, null);
    }

    public RpcException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public RpcException(String message, Integer code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Integer getCode() {
        return code;
    }
}
