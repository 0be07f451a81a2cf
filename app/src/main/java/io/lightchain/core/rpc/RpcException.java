package io.lightchain.core.rpc;

/** Error reported by the server, or a request that never got an answer. */
public class RpcException extends RuntimeException {
    public static final int TIMEOUT = -1;
    public static final int DISCONNECTED = -2;

    private final int code;

    public RpcException(int code, String message) {
        super(message);
        this.code = code;
    }

    public RpcException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTimeout() {
        return code == TIMEOUT;
    }

    @Override
    public String toString() {
        return "RpcException{code=" + code + ", message=" + getMessage() + "}";
    }
}
