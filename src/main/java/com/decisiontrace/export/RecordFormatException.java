package com.decisiontrace.export;

/**
 * A sink line cannot be decoded into a {@link com.decisiontrace.contract.DecisionRecord}.
 */
public class RecordFormatException extends RuntimeException {

    public RecordFormatException(String message) {
        super(message);
    }

    public RecordFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
