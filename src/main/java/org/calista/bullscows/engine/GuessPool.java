package org.calista.bullscows.engine;

import org.calista.bullscows.code.Code;
import org.calista.bullscows.code.CodeUniverse;

import java.util.List;

/**
 * Which codes the default best-guess search considers.
 */
public enum GuessPool {
    /** Only codes still consistent with the feedback. Cheaper, and the guess can win outright. */
    CANDIDATES,
    /** All 5,040 codes, so exploratory non-candidate guesses are allowed. */
    UNIVERSE;

    List<Code> resolve(CandidateEngine engine) {
        return (this == UNIVERSE) ? CodeUniverse.all() : engine.candidates();
    }
}
