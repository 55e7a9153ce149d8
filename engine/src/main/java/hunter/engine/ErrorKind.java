package hunter.engine;

public enum ErrorKind {
    TRANSIENT,
    PERMANENT,
    MALFORMED_INPUT,
    TIMEOUT
}
