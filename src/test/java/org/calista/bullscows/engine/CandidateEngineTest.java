package org.calista.bullscows.engine;

import org.calista.bullscows.code.Code;
import org.calista.bullscows.code.CodeUniverse;
import org.calista.bullscows.code.InvalidNumberException;
import org.calista.bullscows.oracle.Feedback;
import org.calista.bullscows.oracle.FeedbackOracle;
import org.calista.bullscows.oracle.impl.BullsCowsOracle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class CandidateEngineTest {

    private final FeedbackOracle oracle = new BullsCowsOracle();
    private CandidateEngine engine;

    @BeforeEach
    void setUp() {
        engine = CandidateEngine.builder().sequential().build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static Code c(String s) {
        return Code.parse(s);
    }

    // ============ Initial state ============

    @Test
    @DisplayName("fresh engine holds the full universe with log2(5040) bits of uncertainty")
    void testInitialState() {
        assertEquals(5040, engine.size());
        assertEquals(CodeUniverse.all(), engine.candidates());
        assertEquals(Math.log(5040) / Math.log(2), engine.uncertainty(), 1e-12);
        assertEquals(12.2992, engine.uncertainty(), 1e-4);
        assertFalse(engine.isSolved());
    }

    // ============ Prune ============

    @Test
    @DisplayName("secret 1234: guess 5678 leaves the 360 codes without 5,6,7,8; guess 1234 leaves only 1234")
    void testConcreteScenario() {
        Code secret = c("1234");

        Feedback f1 = oracle.evaluate(secret, c("5678"));
        assertEquals(Feedback.of(0, 0), f1);
        engine.prune(c("5678"), f1);

        assertEquals(360, engine.size());
        for (Code x : engine.candidates()) {
            for (int d = 5; d <= 8; d++) assertFalse(x.containsDigit(d), x + " contains " + d);
        }
        assertTrue(engine.contains(secret));

        Feedback f2 = oracle.evaluate(secret, c("1234"));
        assertEquals(Feedback.of(4, 0), f2);
        engine.prune(c("1234"), f2);

        assertEquals(List.of(secret), engine.candidates());
        assertTrue(engine.isSolved());
        assertEquals(0.0, engine.uncertainty());
    }

    @ParameterizedTest
    @DisplayName("real feedback never removes the secret and never grows the set")
    @ValueSource(strings = {"0123", "9876", "5081", "3702", "4169"})
    void testSoundnessAndMonotonicity(String secretText) {
        Code secret = c(secretText);
        String[] guesses = {"0123", "4567", "8901", "2345", "6789", "1357", "2468"};

        int prev = engine.size();
        for (String g : guesses) {
            engine.prune(c(g), oracle.evaluate(secret, c(g)));
            assertTrue(engine.size() <= prev);
            assertTrue(engine.contains(secret));
            prev = engine.size();
        }
    }

    @Test
    @DisplayName("pruning twice with the same observation is idempotent")
    void testIdempotentPrune() {
        Code secret = c("2580");
        Code guess = c("0258");
        Feedback f = oracle.evaluate(secret, guess);

        engine.prune(guess, f);
        List<Code> once = engine.candidates();
        engine.prune(guess, f);

        assertEquals(once, engine.candidates());
    }

    @Test
    @DisplayName("candidate snapshot is read-only and survives a later prune unchanged")
    void testSnapshot() {
        List<Code> before = engine.candidates();
        engine.prune(c("0123"), Feedback.of(0, 0));

        assertEquals(5040, before.size());
        assertThrows(UnsupportedOperationException.class, () -> engine.candidates().clear());
    }

    // ============ Information gain ============

    @Test
    @DisplayName("gain is within [0, uncertainty]")
    void testGainBounds() {
        engine.prune(c("0123"), Feedback.of(1, 1));
        double h = engine.uncertainty();
        for (String g : new String[]{"0123", "4567", "1045", "9876", "3210"}) {
            double gain = engine.expectedInformationGain(c(g));
            assertTrue(gain >= 0.0, g + " -> " + gain);
            assertTrue(gain <= h + 1e-12, g + " -> " + gain);
        }
    }

    @Test
    @DisplayName("gain of a guess that cannot split the candidates is zero")
    void testZeroGain() {
        engine.prune(c("5678"), Feedback.of(0, 0));
        assertEquals(0.0, engine.expectedInformationGain(c("5678")));
        assertTrue(engine.expectedInformationGain(c("0123")) > 0.0);
    }

    @Test
    @DisplayName("gain equals uncertainty when every candidate lands in its own feedback bucket")
    void testPerfectSeparation() {
        engine.prune(c("0123"), Feedback.of(3, 0));
        engine.prune(c("4567"), Feedback.of(0, 0));
        engine.prune(c("0128"), Feedback.of(2, 1));
        assertEquals(List.of(c("0183"), c("0823"), c("8123")), engine.candidates());

        // 0234 answers 1B1C, 1B2C and 0B2C respectively
        assertEquals(engine.uncertainty(), engine.expectedInformationGain(c("0234")), 1e-12);
        // 4567 cannot tell them apart
        assertEquals(0.0, engine.expectedInformationGain(c("4567")));
        assertTrue(engine.expectedInformationGain(c("0128")) < engine.uncertainty());
    }

    @Test
    @DisplayName("guess need not be a candidate; null guess is an invalid number")
    void testGainArguments() {
        engine.prune(c("0123"), Feedback.of(0, 4));
        assertFalse(engine.contains(c("4567")));
        assertEquals(0.0, engine.expectedInformationGain(c("4567")));
        assertThrows(InvalidNumberException.class, () -> engine.expectedInformationGain(null));
    }

    // ============ Best guess ============

    @Test
    @DisplayName("best guess over the full universe is at least as informative as 0123")
    void testBestGuessFromUniverse() {
        Code best = engine.suggestBestGuess(engine.universe());
        assertTrue(engine.expectedInformationGain(best) >= engine.expectedInformationGain(c("0123")));
        // all opening guesses are equivalent up to relabelling, so the first one wins the tie
        assertEquals(c("0123"), best);
    }

    @Test
    @DisplayName("search compares alternatives instead of returning the first pool entry")
    void testBestGuessComparesAlternatives() {
        engine.prune(c("5678"), Feedback.of(0, 0));
        List<Code> pool = List.of(c("5678"), c("9876"), c("0123"));

        Scored<Code> best = engine.bestOf(pool);
        assertNotEquals(c("5678"), best.item);
        assertTrue(best.ordinal > 0);
        assertEquals(engine.expectedInformationGain(best.item), best.score);
    }

    @Test
    @DisplayName("ties resolve to the first code in pool order")
    void testTieBreak() {
        engine.prune(c("1234"), Feedback.of(4, 0));
        assertEquals(c("5678"), engine.suggestBestGuess(List.of(c("5678"), c("1234"))));
        assertEquals(c("1234"), engine.suggestBestGuess(List.of(c("1234"), c("5678"))));
    }

    @Test
    @DisplayName("default pool is the candidate set unless configured otherwise")
    void testDefaultPool() {
        engine.prune(c("0123"), Feedback.of(1, 2));
        Code best = engine.suggestBestGuess();
        assertTrue(engine.contains(best));

        CandidateEngine.Config cfg = CandidateEngine.Config.sequential();
        cfg.defaultPool = GuessPool.UNIVERSE;
        try (CandidateEngine wide = CandidateEngine.builder().config(cfg).build()) {
            wide.prune(c("0123"), Feedback.of(1, 2));
            Code wideBest = wide.suggestBestGuess();
            assertTrue(wide.expectedInformationGain(wideBest) >= wide.expectedInformationGain(best));
        }
    }

    @Test
    @DisplayName("rank returns the top k by gain, best first")
    void testRank() {
        engine.prune(c("0123"), Feedback.of(0, 2));
        List<Scored<Code>> top = engine.rank(engine.candidates(), 5);

        assertEquals(5, top.size());
        for (int i = 1; i < top.size(); i++) {
            assertTrue(top.get(i - 1).score >= top.get(i).score);
        }
        assertEquals(engine.suggestBestGuess(engine.candidates()), top.get(0).item);
        assertTrue(engine.rank(engine.candidates(), 0).isEmpty());
    }

    @Test
    @DisplayName("greedy play finds the secret")
    void testSolvesGames() {
        for (String s : new String[]{"1234", "9071", "5648"}) {
            Code secret = c(s);
            try (CandidateEngine e = CandidateEngine.builder().sequential().build()) {
                Code guess = c("0123");
                int turns = 0;
                while (true) {
                    turns++;
                    Feedback f = oracle.evaluate(secret, guess);
                    e.prune(guess, f);
                    if (f.isSolved()) break;
                    guess = e.suggestBestGuess();
                    assertTrue(turns < 10, "too many turns for " + s);
                }
                assertEquals(List.of(secret), e.candidates());
            }
        }
    }

    // ============ Errors ============

    @Test
    @DisplayName("contradictory feedback empties the set; queries then fail")
    void testEmptyCandidateSet() {
        engine.prune(c("1234"), Feedback.of(3, 1));

        assertEquals(0, engine.size());
        assertThrows(EmptyCandidateSetException.class, () -> engine.uncertainty());
        assertThrows(EmptyCandidateSetException.class, () -> engine.expectedInformationGain(c("1234")));
        assertThrows(EmptyCandidateSetException.class, () -> engine.suggestBestGuess(CodeUniverse.all()));
        // the default CANDIDATES pool is empty too, but the candidate set is checked first
        assertThrows(EmptyCandidateSetException.class, () -> engine.suggestBestGuess());
        assertThrows(EmptyCandidateSetException.class, () -> engine.suggestBestGuess(List.of()));
        assertThrows(EmptyCandidateSetException.class, () -> engine.rank(engine.candidates(), 3));
    }

    @Test
    @DisplayName("empty or null pool is rejected")
    void testEmptyPool() {
        assertThrows(EmptyPoolException.class, () -> engine.suggestBestGuess(List.of()));
        assertThrows(EmptyPoolException.class, () -> engine.suggestBestGuess(null));
        assertThrows(EmptyPoolException.class, () -> engine.rank(new ArrayList<>(), 3));
    }

    // ============ Parallel evaluation ============

    @Test
    @DisplayName("parallel search gives the same ranking as sequential search")
    void testParallelMatchesSequential() {
        CandidateEngine.Config cfg = new CandidateEngine.Config();
        cfg.parallelism = 4;
        cfg.parallelThreshold = 0;

        try (CandidateEngine par = CandidateEngine.builder().config(cfg).build()) {
            par.prune(c("0123"), Feedback.of(1, 1));
            engine.prune(c("0123"), Feedback.of(1, 1));

            List<Code> pool = CodeUniverse.all();
            assertEquals(engine.rank(pool, 10), par.rank(pool, 10));
            assertEquals(engine.suggestBestGuess(pool), par.suggestBestGuess(pool));
        }
    }

    @Test
    @DisplayName("an externally supplied pool is used but not shut down")
    void testExternalPool() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CandidateEngine.Config cfg = new CandidateEngine.Config();
            cfg.parallelThreshold = 0;
            CandidateEngine e = CandidateEngine.builder().config(cfg).evalPool(pool).build();
            e.prune(c("0123"), Feedback.of(0, 1));
            assertNotNull(e.suggestBestGuess());
            e.close();
            assertFalse(pool.isShutdown());
        } finally {
            pool.shutdownNow();
        }
    }
}
