package cn.pianzi.holdem.app.config;

import cn.pianzi.holdem.core.config.BlindLevel;
import cn.pianzi.holdem.core.config.ResumePolicy;
import cn.pianzi.holdem.core.config.TournamentConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TournamentConfigLoaderTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void shouldUseDefaultsForEmptyDocument() throws Exception {
        assertEquals(TournamentConfig.defaults(), TournamentConfigLoader.fromJson(MAPPER.readTree("{}")));
        assertEquals(TournamentConfig.defaults(), TournamentConfigLoader.fromJson(null));
    }

    @Test
    void shouldReadOverridesAndFallBackOnNonPositiveValues() throws Exception {
        TournamentConfig config = TournamentConfigLoader.fromJson(MAPPER.readTree("""
                {"tournament": {
                  "starting-stack": 1500,
                  "turn-seconds": -4,
                  "hands-per-level": 0,
                  "min-seats": 6,
                  "max-seats": 3,
                  "resume-policy": "preserve-remaining"
                }}
                """));

        assertEquals(1500, config.startingStack());
        assertEquals(TournamentConfig.defaults().turnSeconds(), config.turnSeconds());
        assertEquals(TournamentConfig.defaults().handsPerLevel(), config.handsPerLevel());
        assertEquals(3, config.minSeats());
        assertEquals(6, config.maxSeats());
        assertEquals(ResumePolicy.PRESERVE_REMAINING, config.resumePolicy());
    }

    @Test
    void shouldKeepDefaultsForUnknownResumePolicyAndTooFewSeats() throws Exception {
        TournamentConfig config = TournamentConfigLoader.fromJson(MAPPER.readTree("""
                {"tournament": {"resume-policy": "sometimes", "min-seats": 1, "max-seats": 1}}
                """));

        assertEquals(ResumePolicy.RESTART_FULL, config.resumePolicy());
        assertEquals(2, config.minSeats());
        assertEquals(2, config.maxSeats());
    }

    @Test
    void shouldReadAscendingBlindSchedule() throws Exception {
        TournamentConfig config = TournamentConfigLoader.fromJson(MAPPER.readTree("""
                {"tournament": {"blind-schedule": [
                  {"small": 25, "big": 50},
                  {"small": 50, "big": 100}
                ]}}
                """));

        assertEquals(List.of(new BlindLevel(25, 50), new BlindLevel(50, 100)), config.blindSchedule());
    }

    @Test
    void shouldRejectScheduleThatDoesNotIncrease() throws Exception {
        TournamentConfig flat = TournamentConfigLoader.fromJson(MAPPER.readTree("""
                {"tournament": {"blind-schedule": [
                  {"small": 50, "big": 100},
                  {"small": 50, "big": 100}
                ]}}
                """));
        TournamentConfig inverted = TournamentConfigLoader.fromJson(MAPPER.readTree("""
                {"tournament": {"blind-schedule": [{"small": 100, "big": 50}]}}
                """));

        assertEquals(TournamentConfig.DEFAULT_BLIND_SCHEDULE, flat.blindSchedule());
        assertEquals(TournamentConfig.DEFAULT_BLIND_SCHEDULE, inverted.blindSchedule());
    }

    @Test
    void shouldLoadFilesAndFallBackWhenMissing(@TempDir Path dir) throws Exception {
        assertEquals(TournamentConfig.defaults(), TournamentConfigLoader.load(dir.resolve("missing.json")));

        Path file = dir.resolve("holdem.json");
        Files.writeString(file, "{\"tournament\": {\"starting-stack\": 2500}}", StandardCharsets.UTF_8);

        assertEquals(2500, TournamentConfigLoader.load(file).startingStack());
    }

    @Test
    void shouldShipClasspathConfigMatchingDefaults() throws Exception {
        assertEquals(TournamentConfig.defaults(), TournamentConfigLoader.loadClasspath());
    }
}
