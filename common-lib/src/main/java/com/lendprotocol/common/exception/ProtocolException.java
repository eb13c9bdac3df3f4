package com.lendprotocol.common.exception;

public class ProtocolException extends RuntimeException {
    private final ProtocolError error;

    public ProtocolException(ProtocolError error, String message) {
        super("[" + error + "] " + message);
        this.error = error;
    }

    public ProtocolException(ProtocolError error, String message, Throwable cause) {
        super("[" + error + "] " + message, cause);
        this.error = error;
    }

    public ProtocolError getError() {
        return error;
    }

    public static ProtocolException unauthorized(String message) {
        return new ProtocolException(ProtocolError.UNAUTHORIZED, message);
    }

    public static ProtocolException invalidAmount(String message) {
        return new ProtocolException(ProtocolError.INVALID_AMOUNT, message);
    }

    public static ProtocolException notFound(String message) {
        return new ProtocolException(ProtocolError.NOT_FOUND, message);
    }

    public static ProtocolException externalCallFailed(String message, Throwable cause) {
        return new ProtocolException(ProtocolError.EXTERNAL_CALL_FAILED, message, cause);
    }
}
