package io.planduck.http.server;

public class BadRequestException extends HttpException {
    public BadRequestException(String msg, Throwable cause) {
        super(400, msg, cause);
    }
}
