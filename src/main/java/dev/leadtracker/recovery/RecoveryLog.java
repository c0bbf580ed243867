package dev.leadtracker.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.leadtracker.model.Lead;
import dev.leadtracker.store.StorageException;
import dev.leadtracker.util.Timestamps;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only write-ahead log of per-query search results, one JSON record per line.
 * <p>
 * Appends are forced to disk before returning so a crashed run can be resumed.
 * Reading skips lines that fail to parse. The log is cleared only after a whole
 * batch has been committed.
 */
@Slf4j
public class RecoveryLog {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RecoveryLog(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path getFile() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    public void append(String queryText, List<Lead> leads) {
        append(queryText, leads, false);
    }

    /**
     * Append one entry stamped with the current time and flush it to disk.
     *
     * @param failed whether the search behind this entry failed rather than returning zero leads
     */
    public synchronized void append(String queryText, List<Lead> leads, boolean failed) {
        RecoveryEntry entry = new RecoveryEntry(queryText, Timestamps.format(clock.instant()), leads, failed);
        byte[] line;
        try {
            line = (objectMapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new StorageException("Could not serialize recovery entry for query: " + queryText, e);
        }

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            log.error("Storage failure: could not append to recovery log {}: {}", file, e.getMessage());
            throw new StorageException("Could not append to recovery log " + file, e);
        }
        log.debug("Recovery log: {} leads for '{}'", leads.size(), queryText);
    }

    /**
     * Every readable entry in write order. A missing file reads as empty.
     */
    public synchronized List<RecoveryEntry> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            log.error("Storage failure: could not read recovery log {}: {}", file, e.getMessage());
            throw new StorageException("Could not read recovery log " + file, e);
        }

        List<RecoveryEntry> entries = new ArrayList<>();
        int skipped = 0;
        int start = 0;
        while (start < content.length) {
            int end = start;
            while (end < content.length && content[end] != '\n') {
                end++;
            }
            if (!isBlank(content, start, end)) {
                // Each line is decoded on its own; invalid UTF-8 marks only that line corrupt.
                try {
                    RecoveryEntry entry = objectMapper.readValue(content, start, end - start, RecoveryEntry.class);
                    if (entry == null) {
                        skipped++;
                    } else {
                        entries.add(entry);
                    }
                } catch (IOException e) {
                    skipped++;
                    log.warn("Skipping corrupt recovery log line: {}", e.getMessage());
                }
            }
            start = end + 1;
        }
        if (skipped > 0) {
            log.warn("Recovery log {}: {} readable entries, {} corrupt lines skipped", file, entries.size(), skipped);
        }
        return entries;
    }

    private static boolean isBlank(byte[] content, int start, int end) {
        for (int i = start; i < end; i++) {
            byte b = content[i];
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }

    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("Storage failure: could not clear recovery log {}: {}", file, e.getMessage());
            throw new StorageException("Could not clear recovery log " + file, e);
        }
    }
}
