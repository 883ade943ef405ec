package org.calista.bullscows;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.bullscows.code.Code;
import org.calista.bullscows.code.InvalidNumberException;
import org.calista.bullscows.core.GameComposer;
import org.calista.bullscows.core.GameConfig;
import org.calista.bullscows.engine.CandidateEngine;
import org.calista.bullscows.engine.EmptyCandidateSetException;
import org.calista.bullscows.game.GameSession;
import org.calista.bullscows.game.RoundResult;
import org.calista.bullscows.io.FileIO;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

/**
 * BullsCowsApp: interactive console runner.
 *
 * Lifecycle:
 *  1) load (or create) config/bullscows.json
 *  2) compose engine + session
 *  3) run loop until solved, exit, out of attempts or contradiction
 *  4) close engine (owns eval pool)
 */
public final class BullsCowsApp {

    private static final Logger log = LogManager.getLogger(BullsCowsApp.class);

    private final Path configRoot;
    private final String configFile;

    public static void main(String[] args) throws Exception {
        new BullsCowsApp(Path.of("."), "config/bullscows.json").run(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public BullsCowsApp(Path configRoot, String configFile) {
        this.configRoot = configRoot;
        this.configFile = configFile;
    }

    public void run(BufferedReader in, PrintStream out) throws IOException {
        FileIO io = new FileIO(configRoot);
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        GameConfig cfg = GameConfig.loadOrCreate(io, io.resolve(configFile), mapper);

        GameComposer composer = new GameComposer(cfg);
        try (CandidateEngine engine = composer.buildEngine()) {
            GameSession session = composer.newSession(engine);
            play(session, in, out);
        }
    }

    void play(GameSession session, BufferedReader in, PrintStream out) throws IOException {
        out.println("=========================================");
        out.println("   BULLS AND COWS: ENTROPY EDITION");
        out.println("=========================================");
        out.println("Guess the 4-digit number (unique digits). Type 'exit' to quit.");

        while (!session.isOver()) {
            double uncertainty;
            try {
                uncertainty = session.uncertainty();
            } catch (EmptyCandidateSetException e) {
                out.println("Contradiction detected, aborting game.");
                return;
            }

            out.println();
            out.println("--- Turn " + (session.attempts() + 1) + " ---");
            out.println("Current uncertainty: " + fmt(uncertainty) + " bits");
            out.println("Remaining possible numbers: " + session.remaining());

            out.print("Would you like an entropy-based hint? (y/n): ");
            out.flush();
            String ask = in.readLine();
            if (ask == null || isExit(ask)) break;
            if (ask.trim().toLowerCase(Locale.ROOT).startsWith("y")) {
                out.println("Recommended guess (max entropy): " + session.hint());
            }

            out.print("Enter your guess: ");
            out.flush();
            String line = in.readLine();
            if (line == null || isExit(line)) break;

            Code guess;
            try {
                guess = Code.parse(line);
            } catch (InvalidNumberException e) {
                out.println("Invalid input! Must be 4 unique digits.");
                continue;
            }

            RoundResult r;
            try {
                r = session.submit(guess);
            } catch (EmptyCandidateSetException e) {
                log.warn("Contradiction after guess {}: {}", guess, e.getMessage());
                out.println("Contradiction detected, aborting game.");
                return;
            }

            out.println("Result: " + r.feedback.bulls + " Bulls, " + r.feedback.cows + " Cows");
            if (r.solved()) {
                out.println();
                out.println("CONGRATULATIONS! You found the secret " + session.secret() + ".");
                out.println("Total guesses: " + session.attempts());
                return;
            }
            out.println("Information gained: " + fmt(r.bitsGained) + " bits");
        }

        if (!session.isSolved()) {
            session.giveUp();
            out.println("Game over. The secret was " + session.secret() + ".");
        }
    }

    private static boolean isExit(String s) {
        return s.trim().equalsIgnoreCase("exit");
    }

    private static String fmt(double bits) {
        return String.format(Locale.ROOT, "%.4f", bits);
    }
}
