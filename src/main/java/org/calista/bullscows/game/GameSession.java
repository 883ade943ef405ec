package org.calista.bullscows.game;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.bullscows.code.Code;
import org.calista.bullscows.code.CodeUniverse;
import org.calista.bullscows.engine.CandidateEngine;
import org.calista.bullscows.oracle.Feedback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * GameSession: one game against a hidden secret.
 *
 * <p>Holds the secret (the engine never sees it), scores guesses with the engine's oracle,
 * feeds the observed feedback back into the engine and keeps the round history.
 */
public final class GameSession {

    private static final Logger log = LogManager.getLogger(GameSession.class);

    private final CandidateEngine engine;
    private final Code secret;
    private final Code openingGuess; // nullable
    private final int maxAttempts;   // 0 => unlimited

    private final List<RoundResult> history = new ArrayList<>();
    private boolean solved = false;
    private boolean gaveUp = false;

    /**
     * @param openingGuess hint returned while nothing has been ruled out; null to always search
     * @param maxAttempts  0 for unlimited
     */
    public GameSession(CandidateEngine engine, Code secret, Code openingGuess, int maxAttempts) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.secret = Objects.requireNonNull(secret, "secret");
        this.openingGuess = openingGuess;
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        this.maxAttempts = maxAttempts;
    }

    /** Starts a game with a secret drawn uniformly from the universe. */
    public static GameSession start(CandidateEngine engine, Random random, Code openingGuess, int maxAttempts) {
        Objects.requireNonNull(random, "random");
        List<Code> all = CodeUniverse.all();
        Code secret = all.get(random.nextInt(all.size()));
        log.debug("new game started (secret hidden), maxAttempts={}", maxAttempts);
        return new GameSession(engine, secret, openingGuess, maxAttempts);
    }

    // ---------------------------------------------------------------------
    // Play
    // ---------------------------------------------------------------------

    /**
     * Scores {@code guess} against the secret and prunes the engine with the result.
     *
     * @throws IllegalStateException if the game is already over
     * @throws org.calista.bullscows.code.InvalidNumberException if guess is null
     * @throws org.calista.bullscows.engine.EmptyCandidateSetException if the feedback left no candidate
     */
    public RoundResult submit(Code guess) {
        requireInPlay();

        int countBefore = engine.size();
        double before = engine.uncertainty();

        Feedback feedback = engine.oracle().evaluate(secret, guess);
        engine.prune(guess, feedback);

        int attempt = history.size() + 1;
        double after = engine.uncertainty();
        RoundResult r = new RoundResult(attempt, guess, feedback, countBefore, engine.size(), before - after);
        history.add(r);

        if (feedback.isSolved()) {
            solved = true;
            log.info("solved in {} attempt(s)", attempt);
        } else if (attemptsExhausted()) {
            log.info("out of attempts after {} guess(es)", attempt);
        }
        return r;
    }

    /**
     * Suggested next guess: the opening guess while every code is still possible, otherwise the
     * engine's best guess from its default pool.
     */
    public Code hint() {
        requireInPlay();
        if (openingGuess != null && engine.size() == CodeUniverse.SIZE) return openingGuess;
        return engine.suggestBestGuess();
    }

    public void giveUp() {
        gaveUp = true;
    }

    // ---------------------------------------------------------------------
    // State
    // ---------------------------------------------------------------------

    public boolean isSolved() {
        return solved;
    }

    public boolean isOver() {
        return solved || gaveUp || attemptsExhausted();
    }

    public int attempts() {
        return history.size();
    }

    public List<RoundResult> history() {
        return Collections.unmodifiableList(history);
    }

    public double uncertainty() {
        return engine.uncertainty();
    }

    public int remaining() {
        return engine.size();
    }

    /**
     * @throws IllegalStateException while the game is still in play
     */
    public Code secret() {
        if (!isOver()) throw new IllegalStateException("secret is revealed only after the game is over");
        return secret;
    }

    private boolean attemptsExhausted() {
        return maxAttempts > 0 && history.size() >= maxAttempts;
    }

    private void requireInPlay() {
        if (solved) throw new IllegalStateException("game already solved");
        if (gaveUp) throw new IllegalStateException("game was abandoned");
        if (attemptsExhausted()) throw new IllegalStateException("no attempts left (max " + maxAttempts + ")");
    }
}
