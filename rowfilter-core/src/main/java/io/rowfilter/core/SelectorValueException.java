package io.rowfilter.core;

/**
 * Raised when a rows selector has an acceptable shape but one of its values is out of
 * bounds or inconsistent with the frame being selected from.
 */
public class SelectorValueException extends RowFilterException {

    public SelectorValueException(String message) {
        super(message);
    }

    public SelectorValueException(String message, Throwable cause) {
        super(message, cause);
    }

}
