package org.calista.bullscows.game;

import org.calista.bullscows.code.Code;
import org.calista.bullscows.oracle.Feedback;

import java.util.Locale;

/**
 * One submitted guess and what it revealed.
 */
public final class RoundResult {
    public final int attempt;
    public final Code guess;
    public final Feedback feedback;

    public final int candidatesBefore;
    public final int candidatesAfter;

    /** uncertainty before minus uncertainty after, in bits. */
    public final double bitsGained;

    public RoundResult(int attempt, Code guess, Feedback feedback, int candidatesBefore, int candidatesAfter, double bitsGained) {
        this.attempt = attempt;
        this.guess = guess;
        this.feedback = feedback;
        this.candidatesBefore = candidatesBefore;
        this.candidatesAfter = candidatesAfter;
        this.bitsGained = bitsGained;
    }

    public boolean solved() {
        return feedback.isSolved();
    }

    @Override
    public String toString() {
        return "#" + attempt + " " + guess + " -> " + feedback
                + " (" + candidatesBefore + " -> " + candidatesAfter
                + ", +" + String.format(Locale.ROOT, "%.4f", bitsGained) + " bits)";
    }
}
