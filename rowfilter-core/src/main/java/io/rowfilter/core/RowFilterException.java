package io.rowfilter.core;

public class RowFilterException extends RuntimeException {

    public RowFilterException(Throwable cause) {
        super(cause);
    }

    public RowFilterException(String message, Throwable cause) {
        super(message, cause);
    }

    public RowFilterException(String message) {
        super(message);
    }

}
