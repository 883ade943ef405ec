package org.calista.bullscows.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.bullscows.code.Code;
import org.calista.bullscows.code.InvalidNumberException;
import org.calista.bullscows.engine.GuessPool;
import org.calista.bullscows.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * GameConfig: settings as a plain POJO:
 * - defaults live in the field initializers
 * - loadOrCreate() writes the defaults when the file is missing or blank
 * - validate() normalizes values in place
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GameConfig {

    private static final Logger log = LoggerFactory.getLogger(GameConfig.class);

    public Engine engine = new Engine();
    public Hints hints = new Hints();
    public Game game = new Game();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Engine {
        /** Evaluation pool size. 0 => auto (available processors, at most 8). */
        public int parallelism = 0;

        /** Minimum pool x candidates oracle calls before the best-guess search fans out. */
        public long parallelThreshold = 200_000;

        /** Bounded queue capacity (overflow runs on the caller). */
        public int queueCapacity = 1024;

        public String threadNamePrefix = "bulls-eval-";

        public long shutdownTimeoutMs = 2500;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Hints {
        public GuessPool pool = GuessPool.CANDIDATES;

        /** Hint returned while nothing has been ruled out yet. Blank => always search. */
        public String openingGuess = "0123";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Game {
        /** Fixed seed for the secret; null => random per run. */
        public Long seed = null;

        /** 0 => unlimited. */
        public int maxAttempts = 0;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing or blank file is replaced by pretty-printed defaults.
     */
    public static GameConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            GameConfig created = new GameConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            GameConfig created = new GameConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        GameConfig cfg = mapper.readValue(json, GameConfig.class);
        if (cfg == null) cfg = new GameConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, GameConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, GameConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (engine == null) engine = new Engine();
        if (engine.parallelism < 0) engine.parallelism = 0;
        if (engine.parallelThreshold < 0) engine.parallelThreshold = 0;
        if (engine.queueCapacity < 32) engine.queueCapacity = 32;
        if (engine.threadNamePrefix == null || engine.threadNamePrefix.isBlank()) engine.threadNamePrefix = "bulls-eval-";
        if (engine.shutdownTimeoutMs < 250) engine.shutdownTimeoutMs = 250;

        if (hints == null) hints = new Hints();
        if (hints.pool == null) hints.pool = GuessPool.CANDIDATES;
        if (hints.openingGuess == null) hints.openingGuess = "";
        hints.openingGuess = hints.openingGuess.trim();
        if (!hints.openingGuess.isEmpty()) {
            try {
                Code.parse(hints.openingGuess);
            } catch (InvalidNumberException e) {
                log.warn("hints.openingGuess '{}' is not a valid code ({}); opening shortcut disabled", hints.openingGuess, e.getMessage());
                hints.openingGuess = "";
            }
        }

        if (game == null) game = new Game();
        if (game.maxAttempts < 0) game.maxAttempts = 0;
    }
}
