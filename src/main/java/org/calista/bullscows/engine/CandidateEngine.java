package org.calista.bullscows.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.bullscows.code.Code;
import org.calista.bullscows.code.CodeUniverse;
import org.calista.bullscows.oracle.Feedback;
import org.calista.bullscows.oracle.FeedbackOracle;
import org.calista.bullscows.oracle.impl.BullsCowsOracle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CandidateEngine: tracks the codes still consistent with every observed feedback and
 * ranks guesses by expected information gain.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>build: candidate set = full 5,040-code universe</li>
 *   <li>query: {@link #uncertainty()}, {@link #expectedInformationGain(Code)}, {@link #suggestBestGuess(List)}</li>
 *   <li>{@link #prune(Code, Feedback)} after each real observation (monotonic, no undo)</li>
 *   <li>{@link #close()} releases the evaluation pool if this engine created it</li>
 * </ol>
 *
 * <p>Not thread-safe for concurrent callers. Internally the best-guess search may fan the pool out
 * over an executor; workers only read an immutable snapshot of the candidate set, and the winner is
 * picked sequentially in pool order afterwards.
 */
public final class CandidateEngine implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(CandidateEngine.class);

    private final Config config;
    private final FeedbackOracle oracle;

    private final ExecutorService evalPool; // null => inline evaluation only
    private final boolean ownsEvalPool;

    // immutable snapshot, replaced on every prune
    private List<Code> candidates;

    private CandidateEngine(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config").freezeAndValidate();
        this.oracle = (b.oracle != null) ? b.oracle : new BullsCowsOracle();
        this.candidates = CodeUniverse.all();

        this.ownsEvalPool = (b.evalPool == null);
        if (!ownsEvalPool) {
            this.evalPool = b.evalPool;
        } else {
            this.evalPool = (config.parallelism > 1) ? createEvalPool(config) : null;
        }

        logCreation();
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    /**
     * Remaining uncertainty, {@code log2(|candidates|)} bits.
     *
     * @throws EmptyCandidateSetException if no candidate is left
     */
    public double uncertainty() {
        return Entropy.uniformBits(requireCandidates().size());
    }

    /**
     * Shannon entropy of the feedback partition {@code guess} induces on the candidate set,
     * i.e. the expected information in bits if the secret is uniform over the candidates.
     * {@code guess} does not have to be a candidate.
     *
     * @throws EmptyCandidateSetException if no candidate is left
     */
    public double expectedInformationGain(Code guess) {
        List<Code> snapshot = requireCandidates();
        return gain(snapshot, guess, new int[Feedback.INDEX_SPACE]);
    }

    /**
     * Best guess from the configured default pool.
     *
     * @throws EmptyCandidateSetException if no candidate is left
     */
    public Code suggestBestGuess() {
        requireCandidates();
        return suggestBestGuess(config.defaultPool.resolve(this));
    }

    /**
     * Guess from {@code pool} with the strictly highest expected gain. Among ties the first one in
     * pool iteration order wins.
     *
     * @throws EmptyCandidateSetException if no candidate is left (checked first)
     * @throws EmptyPoolException         if pool is null or empty
     */
    public Code suggestBestGuess(List<Code> pool) {
        return bestOf(pool).item;
    }

    /** Same as {@link #suggestBestGuess(List)}, keeping the score and pool position. */
    public Scored<Code> bestOf(List<Code> pool) {
        List<Code> snapshot = requireCandidates();
        if (pool == null || pool.isEmpty()) throw new EmptyPoolException("guess pool is empty");

        double[] gains = evaluateAll(pool, snapshot);

        int best = 0;
        for (int i = 1; i < gains.length; i++) {
            if (gains[i] > gains[best]) best = i;
        }

        Scored<Code> out = Scored.of(pool.get(best), gains[best], best);
        log.debug("bestOf: pool={} candidates={} -> {} ({} bits)", pool.size(), snapshot.size(), out.item, out.score);
        return out;
    }

    /**
     * Top {@code k} guesses from {@code pool} by expected gain, best first, ties in pool order.
     *
     * @throws EmptyCandidateSetException if no candidate is left (checked first)
     * @throws EmptyPoolException         if pool is null or empty
     */
    public List<Scored<Code>> rank(List<Code> pool, int k) {
        List<Code> snapshot = requireCandidates();
        if (pool == null || pool.isEmpty()) throw new EmptyPoolException("guess pool is empty");
        if (k <= 0) return List.of();

        double[] gains = evaluateAll(pool, snapshot);
        ArrayList<Scored<Code>> all = new ArrayList<>(gains.length);
        for (int i = 0; i < gains.length; i++) all.add(Scored.of(pool.get(i), gains[i], i));
        Collections.sort(all);

        return Collections.unmodifiableList(new ArrayList<>(all.subList(0, Math.min(k, all.size()))));
    }

    /**
     * Keeps only candidates {@code c} with {@code evaluate(c, guess) == observed}. Irreversible.
     * Inconsistent feedback may empty the set; that surfaces on the next uncertainty/gain call.
     */
    public void prune(Code guess, Feedback observed) {
        Objects.requireNonNull(observed, "observed");

        List<Code> before = candidates;
        int[] idx = oracle.evaluateIndices(before, guess);
        int want = observed.index();

        ArrayList<Code> kept = new ArrayList<>();
        for (int i = 0; i < idx.length; i++) {
            if (idx[i] == want) kept.add(before.get(i));
        }
        kept.trimToSize();
        candidates = Collections.unmodifiableList(kept);

        log.debug("prune: guess={} feedback={} candidates {} -> {}", guess, observed, before.size(), kept.size());
        if (kept.isEmpty()) {
            log.warn("prune: no candidates left after guess={} feedback={}", guess, observed);
        }
    }

    public int size() {
        return candidates.size();
    }

    public boolean contains(Code code) {
        return code != null && candidates.contains(code);
    }

    /** Exactly one candidate remains. */
    public boolean isSolved() {
        return candidates.size() == 1;
    }

    /** Immutable snapshot, valid until the next {@link #prune}. */
    public List<Code> candidates() {
        return candidates;
    }

    public List<Code> universe() {
        return CodeUniverse.all();
    }

    public FeedbackOracle oracle() {
        return oracle;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (ownsEvalPool) {
            shutdownExecutor(evalPool, config.shutdownTimeoutMs);
        } else {
            log.debug("CandidateEngine.close(): evalPool is externally owned; skipping shutdown");
        }
    }

    // ---------------------------------------------------------------------
    // Builder / Config
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FeedbackOracle oracle;
        private Config config = Config.defaults();
        private ExecutorService evalPool;

        private Builder() {}

        public Builder oracle(FeedbackOracle oracle) {
            this.oracle = Objects.requireNonNull(oracle, "oracle");
            return this;
        }

        public Builder config(Config config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /** External pool; the engine will use it but never shut it down. */
        public Builder evalPool(ExecutorService pool) {
            this.evalPool = Objects.requireNonNull(pool, "evalPool");
            return this;
        }

        public Builder sequential() {
            this.config = Config.sequential();
            return this;
        }

        public CandidateEngine build() {
            return new CandidateEngine(this);
        }
    }

    public static final class Config {
        /** Pool searched by {@link #suggestBestGuess()}. */
        public GuessPool defaultPool = GuessPool.CANDIDATES;

        // owned evaluation executor
        public int parallelism = Math.max(1, Math.min(8, Runtime.getRuntime().availableProcessors()));
        /** Minimum pool x candidates oracle calls before the search fans out. */
        public long parallelThreshold = 200_000;
        public int queueCapacity = 1024;
        public String threadNamePrefix = "bulls-eval-";
        public long shutdownTimeoutMs = 2500;

        private boolean frozen = false;

        public static Config defaults() { return new Config(); }

        public static Config sequential() {
            Config c = new Config();
            c.parallelism = 1;
            return c;
        }

        public Config freezeAndValidate() {
            if (frozen) return this;

            if (defaultPool == null) defaultPool = GuessPool.CANDIDATES;
            parallelism = Math.max(1, parallelism);
            parallelThreshold = Math.max(0, parallelThreshold);
            queueCapacity = Math.max(32, queueCapacity);
            if (threadNamePrefix == null || threadNamePrefix.isBlank()) threadNamePrefix = "bulls-eval-";
            shutdownTimeoutMs = Math.max(250, shutdownTimeoutMs);

            frozen = true;
            return this;
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private List<Code> requireCandidates() {
        List<Code> snapshot = candidates;
        if (snapshot.isEmpty()) {
            throw new EmptyCandidateSetException("no candidates left: recorded feedback is contradictory");
        }
        return snapshot;
    }

    private double gain(List<Code> snapshot, Code guess, int[] histogram) {
        int[] idx = oracle.evaluateIndices(snapshot, guess);
        Arrays.fill(histogram, 0);
        for (int f : idx) histogram[f]++;
        return Entropy.ofHistogram(histogram, snapshot.size());
    }

    private double[] evaluateAll(List<Code> pool, List<Code> snapshot) {
        final double[] gains = new double[pool.size()];
        long work = (long) pool.size() * snapshot.size();

        if (evalPool == null || work < config.parallelThreshold || pool.size() < 2) {
            evaluateRange(pool, snapshot, gains, 0, gains.length);
            return gains;
        }

        int chunks = Math.min(config.parallelism, pool.size());
        int step = (pool.size() + chunks - 1) / chunks;

        ArrayList<Callable<Void>> tasks = new ArrayList<>(chunks);
        for (int from = 0; from < pool.size(); from += step) {
            final int lo = from;
            final int hi = Math.min(pool.size(), from + step);
            tasks.add(() -> {
                evaluateRange(pool, snapshot, gains, lo, hi);
                return null;
            });
        }

        try {
            for (Future<Void> f : evalPool.invokeAll(tasks)) f.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("guess evaluation interrupted", ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("guess evaluation failed", cause);
        }
        return gains;
    }

    private void evaluateRange(List<Code> pool, List<Code> snapshot, double[] gains, int from, int to) {
        int[] histogram = new int[Feedback.INDEX_SPACE];
        for (int i = from; i < to; i++) {
            gains[i] = gain(snapshot, pool.get(i), histogram);
        }
    }

    private static ExecutorService createEvalPool(Config cfg) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = cfg.parallelism;

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, cfg.threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        // bounded queue + CallerRunsPolicy => overflow runs on the calling thread
        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(cfg.queueCapacity),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    private static void shutdownExecutor(ExecutorService es, long timeoutMs) {
        if (es == null) return;

        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }

    private void logCreation() {
        log.debug("CandidateEngine initialized: oracle={} candidates={} defaultPool={} parallelism={} parallelThreshold={} queueCapacity={} evalPool={}",
                oracle.getClass().getSimpleName(), candidates.size(), config.defaultPool, config.parallelism,
                config.parallelThreshold, config.queueCapacity, ownsEvalPool ? (evalPool == null ? "inline" : "owned") : "external");
    }
}
