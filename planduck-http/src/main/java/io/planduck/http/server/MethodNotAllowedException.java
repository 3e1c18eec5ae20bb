package io.planduck.http.server;

public class MethodNotAllowedException extends HttpException {
    public MethodNotAllowedException(String method) {
        super(405, "Method not allowed: " + method);
    }
}
