package cn.pianzi.holdem.app.config;

import cn.pianzi.holdem.core.config.BlindLevel;
import cn.pianzi.holdem.core.config.ResumePolicy;
import cn.pianzi.holdem.core.config.TournamentConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the {@code tournament} section of a JSON file. Missing or non-positive values fall
 * back to {@link TournamentConfig#defaults()}, as does a blind schedule that is not
 * strictly ascending.
 */
public final class TournamentConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(TournamentConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CLASSPATH_RESOURCE = "holdem.json";

    private TournamentConfigLoader() {
    }

    public static TournamentConfig load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            return TournamentConfig.defaults();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return fromJson(MAPPER.readTree(in));
        }
    }

    public static TournamentConfig loadClasspath() throws IOException {
        try (InputStream in = TournamentConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                return TournamentConfig.defaults();
            }
            return fromJson(MAPPER.readTree(in));
        }
    }

    public static TournamentConfig fromJson(JsonNode root) {
        TournamentConfig defaults = TournamentConfig.defaults();
        JsonNode node = root == null ? MissingNode.getInstance() : root.path("tournament");

        int startingStack = positive(node.path("starting-stack").asInt(defaults.startingStack()), defaults.startingStack());
        int minSeats = positive(node.path("min-seats").asInt(defaults.minSeats()), defaults.minSeats());
        int maxSeats = positive(node.path("max-seats").asInt(defaults.maxSeats()), defaults.maxSeats());
        int turnSeconds = positive(node.path("turn-seconds").asInt(defaults.turnSeconds()), defaults.turnSeconds());
        int handsPerLevel = positive(node.path("hands-per-level").asInt(defaults.handsPerLevel()), defaults.handsPerLevel());
        ResumePolicy resumePolicy = resumePolicy(node.path("resume-policy").asText(""), defaults.resumePolicy());
        List<BlindLevel> schedule = blindSchedule(node.path("blind-schedule"), defaults.blindSchedule());

        if (minSeats > maxSeats) {
            int swap = minSeats;
            minSeats = maxSeats;
            maxSeats = swap;
        }
        if (minSeats < 2) {
            minSeats = defaults.minSeats();
            maxSeats = Math.max(maxSeats, minSeats);
        }

        return new TournamentConfig(
                startingStack,
                minSeats,
                maxSeats,
                turnSeconds,
                handsPerLevel,
                schedule,
                resumePolicy
        );
    }

    private static List<BlindLevel> blindSchedule(JsonNode node, List<BlindLevel> fallback) {
        if (!node.isArray() || node.isEmpty()) {
            return fallback;
        }
        List<BlindLevel> levels = new ArrayList<>(node.size());
        BlindLevel previous = null;
        for (JsonNode entry : node) {
            int small = entry.path("small").asInt(0);
            int big = entry.path("big").asInt(0);
            if (small <= 0 || big < small) {
                log.warn("Ignoring blind schedule: invalid level {}/{}", small, big);
                return fallback;
            }
            BlindLevel level = new BlindLevel(small, big);
            if (previous != null && (level.smallBlind() <= previous.smallBlind() || level.bigBlind() <= previous.bigBlind())) {
                log.warn("Ignoring blind schedule: level {}/{} does not increase", small, big);
                return fallback;
            }
            levels.add(level);
            previous = level;
        }
        return levels;
    }

    private static ResumePolicy resumePolicy(String raw, ResumePolicy fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return ResumePolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown resume policy '{}', using {}", raw, fallback);
            return fallback;
        }
    }

    private static int positive(int candidate, int fallback) {
        return candidate > 0 ? candidate : fallback;
    }
}
