package io.trielite.exchange;

/**
 * Raised when exchanged data cannot be read or written: malformed JSON, an
 * unknown node type, a compound value where a scalar leaf was expected.
 */
public class ExchangeFormatException extends RuntimeException {

    public ExchangeFormatException(String message) {
        super(message);
    }

    public ExchangeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
