package io.github.byzatic.jobs.job_store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.JsonMappers;
import io.github.byzatic.jobs.base_exceptions.StorageException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Durable job store backed by a single JSON file.
 * <p>
 * The whole job set is rewritten on every change: written to a sibling temp file first and then
 * moved over the target, so a crash never leaves a half-written file behind.
 */
@ThreadSafe
public class JsonFileJobStore extends InMemoryJobStore {
    private final static Logger logger = LoggerFactory.getLogger(JsonFileJobStore.class);
    private static final TypeReference<List<JobDocument>> DOCUMENTS = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileJobStore(@NotNull Path file) {
        this(file, JsonMappers.newObjectMapper());
    }

    public JsonFileJobStore(@NotNull Path file, @NotNull ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        load(readAll());
    }

    public @NotNull Path getFile() {
        return file;
    }

    @Override
    protected void persist(@NotNull List<Job> snapshot) {
        List<JobDocument> docs = new ArrayList<>(snapshot.size());
        for (Job job : snapshot) docs.add(JobDocument.fromJob(job));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), docs);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to write job store " + file, e);
        }
    }

    private List<Job> readAll() {
        if (!Files.exists(file)) {
            logger.debug("Job store {} does not exist yet, starting empty", file);
            return List.of();
        }
        try {
            List<JobDocument> docs = objectMapper.readValue(file.toFile(), DOCUMENTS);
            List<Job> jobs = new ArrayList<>(docs.size());
            for (JobDocument doc : docs) jobs.add(doc.toJob());
            logger.info("Loaded {} job(s) from {}", jobs.size(), file);
            return jobs;
        } catch (IOException e) {
            throw new StorageException("Failed to read job store " + file, e);
        }
    }
}
