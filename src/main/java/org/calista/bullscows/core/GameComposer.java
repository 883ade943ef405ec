package org.calista.bullscows.core;

import org.calista.bullscows.code.Code;
import org.calista.bullscows.engine.CandidateEngine;
import org.calista.bullscows.game.GameSession;
import org.calista.bullscows.oracle.FeedbackOracle;
import org.calista.bullscows.oracle.impl.BullsCowsOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * Wires a {@link GameConfig} into an engine and a session.
 */
public final class GameComposer {

    private static final Logger log = LoggerFactory.getLogger(GameComposer.class);

    private final GameConfig cfg;
    private final FeedbackOracle oracle;

    public GameComposer(GameConfig cfg) {
        this(cfg, new BullsCowsOracle());
    }

    public GameComposer(GameConfig cfg, FeedbackOracle oracle) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        cfg.validate();
    }

    public CandidateEngine.Config engineConfig() {
        CandidateEngine.Config ec = new CandidateEngine.Config();
        ec.defaultPool = cfg.hints.pool;
        if (cfg.engine.parallelism > 0) ec.parallelism = cfg.engine.parallelism;
        ec.parallelThreshold = cfg.engine.parallelThreshold;
        ec.queueCapacity = cfg.engine.queueCapacity;
        ec.threadNamePrefix = cfg.engine.threadNamePrefix;
        ec.shutdownTimeoutMs = cfg.engine.shutdownTimeoutMs;
        return ec;
    }

    /** Fresh engine; the caller owns it and must close it. */
    public CandidateEngine buildEngine() {
        log.info("Building candidate engine (pool={}, parallelism={})", cfg.hints.pool,
                cfg.engine.parallelism == 0 ? "auto" : cfg.engine.parallelism);
        return CandidateEngine.builder()
                .oracle(oracle)
                .config(engineConfig())
                .build();
    }

    /** New session over {@code engine}; the secret comes from {@code game.seed} when set. */
    public GameSession newSession(CandidateEngine engine) {
        Random random = (cfg.game.seed != null) ? new Random(cfg.game.seed) : new Random();
        return GameSession.start(engine, random, openingGuess(), cfg.game.maxAttempts);
    }

    /** Configured opening guess, or null when disabled. */
    public Code openingGuess() {
        String s = cfg.hints.openingGuess;
        return (s == null || s.isBlank()) ? null : Code.parse(s);
    }
}
