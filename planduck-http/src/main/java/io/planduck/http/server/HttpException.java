package io.planduck.http.server;

abstract public class HttpException extends RuntimeException {
    public final int errorCode;

    public HttpException(int errorCode, String msg) {
        super(msg);
        this.errorCode = errorCode;
    }

    public HttpException(int errorCode, String msg, Throwable cause) {
        super(msg, cause);
        this.errorCode = errorCode;
    }
}
