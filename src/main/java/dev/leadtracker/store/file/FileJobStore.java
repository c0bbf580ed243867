package dev.leadtracker.store.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.leadtracker.model.Job;
import dev.leadtracker.model.JobStatus;
import dev.leadtracker.store.AbstractJobStore;
import dev.leadtracker.store.JobField;
import dev.leadtracker.store.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job store backed by a single JSON document ({@code id -> job}) per user.
 * The whole document is rewritten, via a temp file and an atomic move, on every change.
 */
@Slf4j
public class FileJobStore extends AbstractJobStore {

    private static final TypeReference<LinkedHashMap<String, JobDocument>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, Job> jobs = new LinkedHashMap<>();

    public FileJobStore(Path file, String username, ObjectMapper objectMapper, Clock clock) {
        super(username, clock);
        this.file = file;
        this.objectMapper = objectMapper;
        load();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized Optional<Job> get(String id) {
        return Optional.ofNullable(jobs.get(id)).map(this::healPdfPath);
    }

    @Override
    public synchronized boolean hasLink(String link) {
        if (link == null || link.isBlank()) {
            return false;
        }
        return jobs.values().stream().anyMatch(job -> link.equals(job.getLink()));
    }

    @Override
    public synchronized List<Job> findAll() {
        List<Job> all = new ArrayList<>(jobs.size());
        jobs.values().forEach(job -> all.add(healPdfPath(job)));
        return all;
    }

    @Override
    public synchronized int countByStatus(JobStatus status) {
        return (int) jobs.values().stream().filter(job -> job.getStatus() == status).count();
    }

    @Override
    public synchronized int countTotal() {
        return jobs.size();
    }

    @Override
    protected void insert(Job job) {
        jobs.put(job.getId(), job);
        save();
    }

    @Override
    protected void persist(Job updated, JobField field) {
        jobs.put(updated.getId(), updated);
        save();
    }

    @Override
    protected void delete(String id) {
        jobs.remove(id);
        save();
    }

    private void load() {
        try {
            if (!Files.exists(file) || Files.size(file) == 0) {
                save();
                return;
            }
            Map<String, JobDocument> documents = objectMapper.readValue(file.toFile(), DOCUMENT_TYPE);
            if (documents != null) {
                documents.forEach((id, document) -> jobs.put(id, document.toJob(id)));
            }
            log.info("Loaded {} jobs for {} from {}", jobs.size(), username(), file);
        } catch (IOException e) {
            throw new StorageException("Could not read job file " + file, e);
        }
    }

    private void save() {
        Map<String, JobDocument> documents = new LinkedHashMap<>();
        jobs.forEach((id, job) -> documents.put(id, JobDocument.from(job)));
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), documents);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Could not write job file " + file, e);
        }
    }
}
