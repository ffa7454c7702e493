package com.dexarb.infra.rpc;

import lombok.Getter;

@Getter
public class RpcException extends RuntimeException {

    private final RpcErrorKind kind;
    private final Integer code;
    private final String revertReason;

    public RpcException(RpcErrorKind kind, String message) {
        this(kind, null, null, message, null);
    }

    public RpcException(RpcErrorKind kind, String message, Throwable cause) {
        this(kind, null, null, message, cause);
    }

    public RpcException(RpcErrorKind kind, Integer code, String revertReason, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
        this.revertReason = revertReason;
    }
}
