package org.calista.bullscows.engine;

/** A best-guess search was asked to pick from an empty pool. */
public final class EmptyPoolException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public EmptyPoolException(String message) {
        super(message);
    }
}
