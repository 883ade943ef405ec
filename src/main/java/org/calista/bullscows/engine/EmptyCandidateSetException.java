package org.calista.bullscows.engine;

/**
 * No candidate is consistent with the recorded feedback any more.
 * Some earlier observation contradicted the others; the game cannot continue.
 */
public final class EmptyCandidateSetException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public EmptyCandidateSetException(String message) {
        super(message);
    }
}
