package com.trendline.execution.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only JSONL daily journal of live signals, fills, trades and errors.
 * Files: {baseDir}/journal/2026-02-08.jsonl, one per UTC day of the event timestamp.
 */
public class SignalJournal implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SignalJournal.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path journalDir;
    private final ObjectMapper mapper;
    private final List<Consumer<JournalEvent>> listeners = new CopyOnWriteArrayList<>();

    private LocalDate currentDate;
    private BufferedWriter currentWriter;

    public SignalJournal(Path baseDir) {
        this.journalDir = baseDir.resolve("journal");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        try {
            Files.createDirectories(journalDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create journal directory " + journalDir, e);
        }
    }

    /**
     * Append an event. A failed write is logged and does not stop live evaluation.
     */
    public synchronized void log(JournalEvent event) {
        try {
            ensureWriter(event.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate());
            currentWriter.write(mapper.writeValueAsString(event));
            currentWriter.newLine();
            currentWriter.flush();
        } catch (IOException e) {
            log.error("Failed to write journal event {}: {}", event.getSummary(), e.getMessage());
        }

        listeners.forEach(l -> {
            try { l.accept(event); } catch (Exception e) { log.warn("Journal listener error", e); }
        });
    }

    /**
     * Subscribe to journal events as they are written.
     */
    public void subscribe(Consumer<JournalEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Read the journal entries of one UTC day.
     */
    public List<JournalEvent> readDate(LocalDate date) throws IOException {
        Path file = fileFor(date);
        List<JournalEvent> events = new ArrayList<>();
        if (!Files.exists(file)) {
            return events;
        }
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                events.add(mapper.readValue(line, JournalEvent.class));
            }
        }
        return events;
    }

    public Path fileFor(LocalDate date) {
        return journalDir.resolve(date.format(DATE_FORMAT) + ".jsonl");
    }

    @Override
    public synchronized void close() {
        if (currentWriter != null) {
            try {
                currentWriter.close();
            } catch (IOException e) {
                log.error("Failed to close journal writer", e);
            }
            currentWriter = null;
            currentDate = null;
        }
    }

    private void ensureWriter(LocalDate date) throws IOException {
        if (!date.equals(currentDate)) {
            if (currentWriter != null) {
                currentWriter.close();
            }
            currentWriter = Files.newBufferedWriter(fileFor(date), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            currentDate = date;
        }
    }
}
