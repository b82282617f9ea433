/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.service.json.ObjectMappers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Reads events from JSON lines, one {@link EventDocument} per line.
 *
 * <p>Blank lines are ignored. Lines that are not valid JSON or do not convert to an
 * event are logged and skipped; the count is kept in {@link #skippedLines()}.
 */
public final class JsonLinesEventReader {

    private static final Logger logger = Logger.getLogger(JsonLinesEventReader.class.getName());

    private final ObjectMapper mapper;
    private final AtomicLong skipped = new AtomicLong();

    public JsonLinesEventReader() {
        this(ObjectMappers.create());
    }

    public JsonLinesEventReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Event> readAll(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readAll(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read events from " + path, e);
        }
    }

    public List<Event> readAll(BufferedReader reader) throws IOException {
        List<Event> events = new ArrayList<>();
        String line;
        long lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            parseLine(line, lineNumber).ifPresent(events::add);
        }
        logger.info(() -> "Read " + events.size() + " events (" + skipped.get() + " lines skipped)");
        return events;
    }

    /**
     * @return the event, or empty for blank and malformed lines
     */
    public Optional<Event> parseLine(String line, long lineNumber) {
        if (line.isBlank()) {
            return Optional.empty();
        }
        try {
            EventDocument document = mapper.readValue(line, EventDocument.class);
            return Optional.of(document.toEvent());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            skipped.incrementAndGet();
            logger.warning(() -> "Skipping malformed event on line " + lineNumber + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    public long skippedLines() {
        return skipped.get();
    }
}
