package dev.agentos.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.agentos.model.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Append-only record of permission checks, invocations and coordination decisions.
 * Entries are kept in memory and, when a sink file is configured, appended to it
 * as JSON lines.
 */
public final class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final List<AuditEntry> entries = new ArrayList<>();
    private final Path sink;   // nullable

    private AuditLog(Path sink) {
        this.sink = sink;
    }

    public static AuditLog inMemory() {
        return new AuditLog(null);
    }

    /**
     * Audit log that also appends every entry to {@code sink}, creating it if needed.
     */
    public static AuditLog appendingTo(Path sink) {
        return new AuditLog(sink);
    }

    public synchronized void append(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit {} {} {} {}", entry.actor(), entry.action(), entry.outcome(), entry.detail());
        if (sink != null) {
            writeLine(entry);
        }
    }

    public synchronized List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized List<AuditEntry> entries(Predicate<AuditEntry> filter) {
        return entries.stream().filter(filter).toList();
    }

    public synchronized int size() {
        return entries.size();
    }

    private void writeLine(AuditEntry entry) {
        try {
            String line = MAPPER.writeValueAsString(entry) + "\n";
            Files.writeString(sink, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append audit entry to " + sink, e);
        }
    }

    /**
     * Read a JSON-lines audit file written by {@link #appendingTo(Path)}.
     * Returns an empty list when the file does not exist.
     */
    public static List<AuditEntry> readEntries(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        var result = new ArrayList<AuditEntry>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                result.add(MAPPER.readValue(line, AuditEntry.class));
            } catch (JsonProcessingException e) {
                throw new IOException("Corrupt audit line in " + file + ": " + line, e);
            }
        }
        return result;
    }
}
