package org.calista.bullscows.code;

/**
 * Raised when a value is not exactly four distinct decimal digits.
 */
public final class InvalidNumberException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidNumberException(String message) {
        super(message);
    }
}
