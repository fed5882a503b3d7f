package cn.pianzi.holdem.app.history;

import cn.pianzi.holdem.core.port.PersistenceSink;
import cn.pianzi.holdem.core.snapshot.HandRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends every completed hand to {@code <gameId>.jsonl} in the history folder, one JSON
 * document per line. The records are complete enough to be replayed.
 */
public final class JsonHandHistoryStore implements PersistenceSink {
    private static final Logger log = LoggerFactory.getLogger(JsonHandHistoryStore.class);
    private static final String EXTENSION = ".jsonl";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonHandHistoryStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.mapper = new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public synchronized void handCompleted(HandRecord record) {
        Objects.requireNonNull(record, "record");
        Path file = fileFor(record.gameId());
        try {
            Files.createDirectories(directory);
            String line = mapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to append hand #" + record.handNumber() + " to " + file, ex);
        }
        log.debug("Archived hand #{} of {} to {}", record.handNumber(), record.gameId(), file);
    }

    public synchronized List<HandRecord> load(String gameId) throws IOException {
        Path file = fileFor(gameId);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<HandRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    records.add(mapper.readValue(line, HandRecord.class));
                }
            }
        }
        return List.copyOf(records);
    }

    public Path fileFor(String gameId) {
        Objects.requireNonNull(gameId, "gameId");
        return directory.resolve(gameId.replaceAll("[^A-Za-z0-9._-]", "_") + EXTENSION);
    }
}
