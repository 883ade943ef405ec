package org.calista.bullscows.oracle.impl;

import org.calista.bullscows.code.Code;
import org.calista.bullscows.code.InvalidNumberException;
import org.calista.bullscows.oracle.Feedback;
import org.calista.bullscows.oracle.FeedbackOracle;

import java.util.List;

/**
 * Default oracle.
 *
 * <p>Bulls are counted position by position; since digits are unique inside a code,
 * cows = |digits(secret) &cap; digits(guess)| - bulls, computed from the digit masks.
 */
public final class BullsCowsOracle implements FeedbackOracle {

    @Override
    public Feedback evaluate(Code secret, Code guess) {
        requireCode(secret, "secret");
        requireCode(guess, "guess");
        int bulls = bulls(secret, guess);
        return Feedback.of(bulls, common(secret, guess) - bulls);
    }

    @Override
    public int[] evaluateIndices(List<Code> secrets, Code guess) {
        requireCode(guess, "guess");
        if (secrets == null || secrets.isEmpty()) return new int[0];

        final int g0 = guess.digitAt(0), g1 = guess.digitAt(1), g2 = guess.digitAt(2), g3 = guess.digitAt(3);
        final int gm = guess.digitMask();

        int[] out = new int[secrets.size()];
        for (int i = 0; i < out.length; i++) {
            Code s = requireCode(secrets.get(i), "secret");
            int bulls = (s.digitAt(0) == g0 ? 1 : 0)
                    + (s.digitAt(1) == g1 ? 1 : 0)
                    + (s.digitAt(2) == g2 ? 1 : 0)
                    + (s.digitAt(3) == g3 ? 1 : 0);
            int cows = Integer.bitCount(s.digitMask() & gm) - bulls;
            out[i] = bulls * (Code.LENGTH + 1) + cows;
        }
        return out;
    }

    private static int bulls(Code secret, Code guess) {
        int n = 0;
        for (int i = 0; i < Code.LENGTH; i++) {
            if (secret.digitAt(i) == guess.digitAt(i)) n++;
        }
        return n;
    }

    private static int common(Code secret, Code guess) {
        return Integer.bitCount(secret.digitMask() & guess.digitMask());
    }

    private static Code requireCode(Code c, String name) {
        if (c == null) throw new InvalidNumberException(name + " is null");
        return c;
    }
}
