package com.baskettecase.dsbroker.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends audit events as JSON lines to a local file, flushing after every event.
 */
@Slf4j
public class FileAuditSink implements AuditSink {

    private final Path path;
    private final ObjectMapper objectMapper;
    private BufferedWriter writer;

    public FileAuditSink(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(AuditEvent event) throws IOException {
        if (writer == null) {
            writer = open();
        }
        String line = objectMapper.writeValueAsString(event);
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            // The next append reopens the file
            discardWriter(e);
            throw e;
        }
    }

    @Override
    public String describe() {
        return "file:" + path;
    }

    @Override
    public synchronized void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }

    private void discardWriter(IOException cause) {
        log.warn("Audit file {} failed, reopening on next event: {}", path, cause.getMessage());
        try {
            writer.close();
        } catch (IOException closeError) {
            cause.addSuppressed(closeError);
        } finally {
            writer = null;
        }
    }

    BufferedWriter open() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        log.info("Writing audit events to {}", path.toAbsolutePath());
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }
}
