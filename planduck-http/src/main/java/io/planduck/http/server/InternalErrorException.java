package io.planduck.http.server;

public class InternalErrorException extends HttpException {
    public InternalErrorException(String msg, Throwable cause) {
        super(500, msg, cause);
    }
}
