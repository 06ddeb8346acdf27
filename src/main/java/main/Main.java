// File: Main.java
package main;

import game.PgnFormatException;
import game.impl.GameTree;
import game.impl.PgnReader;
import game.records.PgnSettings;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads PGN from a file (or standard input) and prints every game back in normalised form.
 *
 * <pre>
 * Main [file.pgn] [--width N] [--no-comments] [--no-nags] [--no-variations]
 * </pre>
 *
 * Unset options fall back to the {@code pgn.*} system properties.
 */
public final class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        PgnSettings.Builder b = builderFrom(PgnSettings.fromSystemProperties());
        Path file = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--width" -> {
                    if (i + 1 >= args.length) return usage("--width needs a value");
                    int w = toInt(args[++i], -1);
                    if (w < 0) return usage("bad width '" + args[i] + "'");
                    b.maxWidth(w);
                }
                case "--no-comments"   -> b.includeComments(false);
                case "--no-nags"       -> b.includeNags(false);
                case "--no-variations" -> b.includeVariations(false);
                default -> {
                    if (args[i].startsWith("--") || file != null) return usage("unexpected '" + args[i] + "'");
                    file = Path.of(args[i]);
                }
            }
        }

        String text;
        try {
            text = file == null ? read(System.in) : Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("cannot read {}", file == null ? "standard input" : file, e);
            return 2;
        }

        List<GameTree> games;
        try {
            games = new PgnReader().readAll(text);
        } catch (PgnFormatException e) {
            LOGGER.error("unreadable PGN: {}", e.getMessage());
            return 1;
        }

        PgnSettings settings = b.build();
        for (int g = 0; g < games.size(); g++) {
            if (g > 0) System.out.println();
            for (String line : games.get(g).render(settings)) System.out.println(line);
        }
        return 0;
    }

    private static PgnSettings.Builder builderFrom(PgnSettings s) {
        return new PgnSettings.Builder()
                .maxWidth(s.maxWidth())
                .includeComments(s.includeComments())
                .includeNags(s.includeNags())
                .includeVariations(s.includeVariations());
    }

    private static String read(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static int usage(String problem) {
        LOGGER.error("{}", problem);
        LOGGER.error("usage: Main [file.pgn] [--width N] [--no-comments] [--no-nags] [--no-variations]");
        return 64;
    }

    private static int toInt(String s, int d) {
        try { return Integer.parseInt(s.trim()); } catch (NumberFormatException e) { return d; }
    }
}
