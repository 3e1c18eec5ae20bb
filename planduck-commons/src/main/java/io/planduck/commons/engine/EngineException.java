package io.planduck.commons.engine;

public class EngineException extends RuntimeException {

    public enum Kind {
        /** The source file does not exist. */
        NOT_FOUND,
        /** The source file exists but cannot be read as a table. */
        CORRUPT,
        /** A filter or aggregate expression the engine does not understand. */
        UNSUPPORTED_EXPRESSION,
        EXECUTION
    }

    private final Kind kind;

    public EngineException(Kind kind, String msg) {
        super(msg);
        this.kind = kind;
    }

    public EngineException(Kind kind, String msg, Throwable cause) {
        super(msg, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
