package io.github.byzatic.jobs.run_log;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.JsonMappers;
import io.github.byzatic.jobs.base_exceptions.StorageException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Durable run log stored as JSON lines, one entry per line in append order.
 */
@ThreadSafe
public class JsonFileRunLog extends InMemoryRunLog {
    private final static Logger logger = LoggerFactory.getLogger(JsonFileRunLog.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileRunLog(@NotNull Path file) {
        this(file, JsonMappers.newObjectMapper());
    }

    public JsonFileRunLog(@NotNull Path file, @NotNull ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        load(readAll());
    }

    public @NotNull Path getFile() {
        return file;
    }

    @Override
    protected void persist(@NotNull RunLogEntry entry) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(objectMapper.writeValueAsString(entry));
                w.newLine();
            }
        } catch (IOException e) {
            throw new StorageException("Failed to append to run log " + file, e);
        }
    }

    private List<RunLogEntry> readAll() {
        if (!Files.exists(file)) return List.of();
        try {
            terminateLastLine();
            List<RunLogEntry> out = new ArrayList<>();
            int lineNo = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    out.add(objectMapper.readValue(line, RunLogEntry.class));
                } catch (IOException e) {
                    // torn last line after a crash
                    logger.warn("Skipping unreadable run log line {} in {}: {}", lineNo, file, e.getMessage());
                }
            }
            logger.info("Loaded {} run log entr(ies) from {}", out.size(), file);
            return out;
        } catch (IOException e) {
            throw new StorageException("Failed to read run log " + file, e);
        }
    }

    /**
     * Ends an unterminated last line, so the next append starts on a line of its own.
     */
    private void terminateLastLine() throws IOException {
        try (SeekableByteChannel ch = Files.newByteChannel(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = ch.size();
            if (size == 0) return;
            ByteBuffer last = ByteBuffer.allocate(1);
            ch.position(size - 1);
            ch.read(last);
            if (last.get(0) == '\n') return;
            ch.position(size);
            ch.write(ByteBuffer.wrap(System.lineSeparator().getBytes(StandardCharsets.UTF_8)));
        }
        logger.warn("Run log {} did not end with a line separator, terminated its last line", file);
    }
}
