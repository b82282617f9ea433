/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.alerting.api.AlertSink;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.service.json.ObjectMappers;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Logger;

/**
 * Appends one JSON document per alert to a writer, flushing after each line.
 *
 * <p>Write failures surface as {@link UncheckedIOException}; the engine counts them
 * as sink failures.
 */
public final class JsonLinesAlertSink implements AlertSink, Closeable {

    private static final Logger logger = Logger.getLogger(JsonLinesAlertSink.class.getName());

    private final Writer writer;
    private final ObjectMapper mapper;

    public JsonLinesAlertSink(Writer writer) {
        this(writer, ObjectMappers.create());
    }

    public JsonLinesAlertSink(Writer writer, ObjectMapper mapper) {
        this.writer = writer;
        this.mapper = mapper;
    }

    /**
     * Opens (or creates) a file for appending.
     */
    public static JsonLinesAlertSink appendingTo(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        logger.info(() -> "Writing alerts to " + path.toAbsolutePath());
        return new JsonLinesAlertSink(Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND));
    }

    @Override
    public synchronized void publish(Alert alert) {
        try {
            writer.write(toJson(alert));
            writer.write(System.lineSeparator());
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write alert " + alert.alertId(), e);
        }
    }

    String toJson(Alert alert) throws JsonProcessingException {
        return mapper.writeValueAsString(AlertDocument.from(alert));
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
