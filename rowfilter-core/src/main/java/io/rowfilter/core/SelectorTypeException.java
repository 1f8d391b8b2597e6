package io.rowfilter.core;

/**
 * Raised when a rows selector has a shape that cannot be used to select rows at all:
 * a boolean literal, a column of the wrong type, a multi-column frame or an
 * unrecognized object.
 */
public class SelectorTypeException extends RowFilterException {

    public SelectorTypeException(String message) {
        super(message);
    }

}
