package io.planduck.commons.executor;

public class NoTableBuiltException extends RuntimeException {
    public NoTableBuiltException() {
        super("No table built: the plan never loaded a source");
    }
}
