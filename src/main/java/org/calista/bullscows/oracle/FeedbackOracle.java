package org.calista.bullscows.oracle;

import org.calista.bullscows.code.Code;

import java.util.List;

/**
 * Scores a guess against a secret.
 *
 * Contract:
 *  - pure and deterministic
 *  - {@code bulls + cows <= 4}, and {@code bulls == 4} iff secret equals guess
 *  - a null argument raises {@link org.calista.bullscows.code.InvalidNumberException}
 */
public interface FeedbackOracle {

    Feedback evaluate(Code secret, Code guess);

    /**
     * Batch hook: feedback index ({@link Feedback#index()}) of {@code guess} against every
     * secret in {@code secrets}, in the same order.
     */
    default int[] evaluateIndices(List<Code> secrets, Code guess) {
        if (secrets == null || secrets.isEmpty()) return new int[0];
        int[] out = new int[secrets.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = evaluate(secrets.get(i), guess).index();
        }
        return out;
    }
}
