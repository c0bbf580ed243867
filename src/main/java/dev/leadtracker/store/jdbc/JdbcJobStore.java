package dev.leadtracker.store.jdbc;

import dev.leadtracker.model.CoverLetterTopic;
import dev.leadtracker.model.Job;
import dev.leadtracker.model.JobQuestion;
import dev.leadtracker.model.JobStatus;
import dev.leadtracker.store.AbstractJobStore;
import dev.leadtracker.store.DuplicateLinkException;
import dev.leadtracker.store.JobField;
import dev.leadtracker.store.StorageException;
import dev.leadtracker.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Job store over normalized tables keyed by (username, job_id): the core row,
 * status, cover letter, topics, questions, writing instructions and query ids.
 * Each change is a single UPDATE, or a delete-and-reinsert of one child list inside
 * a transaction.
 */
@Slf4j
public class JdbcJobStore extends AbstractJobStore {

    private static final String SCHEMA = "db/job-store-schema.sql";

    private static final Map<JobField, String> JOB_COLUMNS = new EnumMap<>(Map.of(
            JobField.COMPANY, "company",
            JobField.TITLE, "title",
            JobField.LOCATION, "location",
            JobField.DESCRIPTION, "description",
            JobField.FULL_DESCRIPTION, "full_description",
            JobField.ADDRESSEE, "addressee"));

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcJobStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactions, String username,
            Clock clock) {
        super(username, clock);
        this.jdbc = jdbc;
        this.transactions = transactions;
        initSchema();
    }

    private void initSchema() {
        DataSource dataSource = Objects.requireNonNull(jdbc.getJdbcTemplate().getDataSource(), "dataSource");
        storage("initialize job schema", () -> {
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA)).execute(dataSource);
            return null;
        });
    }

    @Override
    public Optional<Job> get(String id) {
        return storage("read job " + id, () -> load(id).stream().findFirst().map(this::healPdfPath));
    }

    @Override
    public boolean hasLink(String link) {
        if (link == null || link.isBlank()) {
            return false;
        }
        Integer count = storage("check link", () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM jobs WHERE username = :username AND link = :link",
                params().addValue("link", link),
                Integer.class));
        return count != null && count > 0;
    }

    @Override
    public List<Job> findAll() {
        return storage("read jobs", () -> load(null).stream().map(this::healPdfPath).toList());
    }

    @Override
    public int countByStatus(JobStatus status) {
        Integer count = storage("count jobs", () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM job_status WHERE username = :username AND status = :status",
                params().addValue("status", status.getValue()),
                Integer.class));
        return count == null ? 0 : count;
    }

    @Override
    public int countTotal() {
        Integer count = storage("count jobs", () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM jobs WHERE username = :username",
                params(),
                Integer.class));
        return count == null ? 0 : count;
    }

    @Override
    protected void insert(Job job) {
        try {
            storage("insert job " + job.getId(), () -> {
                transactions.executeWithoutResult(tx -> insertRows(job));
                return null;
            });
        } catch (StorageException e) {
            if (e.getCause() instanceof DataIntegrityViolationException) {
                throw new DuplicateLinkException(job.getLink());
            }
            throw e;
        }
    }

    private void insertRows(Job job) {
        MapSqlParameterSource row = jobParams(job.getId())
                .addValue("company", job.getCompany())
                .addValue("title", job.getTitle())
                .addValue("dateFound", Timestamps.format(job.getDateFound()))
                .addValue("link", job.getLink() == null ? "" : job.getLink())
                .addValue("location", job.getLocation())
                .addValue("description", job.getDescription())
                .addValue("fullDescription", job.getFullDescription())
                .addValue("addressee", job.getAddressee())
                .addValue("status", job.getStatus().getValue())
                .addValue("updatedAt", Timestamps.format(clock.instant()))
                .addValue("body", job.getCoverLetterBody())
                .addValue("pdfPath", pathString(job.getCoverLetterPdfPath()));

        jdbc.update("""
                INSERT INTO jobs (username, job_id, company, title, date_found, link,
                                  location, description, full_description, addressee)
                VALUES (:username, :jobId, :company, :title, :dateFound, :link,
                        :location, :description, :fullDescription, :addressee)
                """, row);
        jdbc.update("""
                INSERT INTO job_status (username, job_id, status, updated_at)
                VALUES (:username, :jobId, :status, :updatedAt)
                """, row);
        jdbc.update("""
                INSERT INTO job_cover_letters (username, job_id, cover_letter_body, cover_letter_pdf_path)
                VALUES (:username, :jobId, :body, :pdfPath)
                """, row);

        for (Integer queryId : job.getQueryIds().stream().distinct().toList()) {
            jdbc.update("""
                    INSERT INTO job_query_ids (username, job_id, query_id)
                    VALUES (:username, :jobId, :queryId)
                    """, jobParams(job.getId()).addValue("queryId", queryId));
        }
        insertTopics(job.getId(), job.getCoverLetterTopics());
        insertQuestions(job.getId(), job.getQuestions());
        insertInstructions(job.getId(), job.getWritingInstructions());
    }

    @Override
    protected void persist(Job updated, JobField field) {
        String id = updated.getId();
        storage("update " + field + " of job " + id, () -> {
            switch (field) {
                case STATUS -> jdbc.update("""
                        UPDATE job_status SET status = :status, updated_at = :updatedAt
                        WHERE username = :username AND job_id = :jobId
                        """, jobParams(id)
                        .addValue("status", updated.getStatus().getValue())
                        .addValue("updatedAt", Timestamps.format(clock.instant())));
                case COMPANY, TITLE, LOCATION, DESCRIPTION, FULL_DESCRIPTION, ADDRESSEE -> jdbc.update(
                        "UPDATE jobs SET " + JOB_COLUMNS.get(field)
                                + " = :value WHERE username = :username AND job_id = :jobId",
                        jobParams(id).addValue("value", jobColumnValue(updated, field)));
                case COVER_LETTER_BODY -> jdbc.update("""
                        UPDATE job_cover_letters SET cover_letter_body = :value
                        WHERE username = :username AND job_id = :jobId
                        """, jobParams(id).addValue("value", updated.getCoverLetterBody()));
                case COVER_LETTER_PDF_PATH -> jdbc.update("""
                        UPDATE job_cover_letters SET cover_letter_pdf_path = :value
                        WHERE username = :username AND job_id = :jobId
                        """, jobParams(id).addValue("value", pathString(updated.getCoverLetterPdfPath())));
                case COVER_LETTER_TOPICS -> transactions.executeWithoutResult(tx -> {
                    deleteChildren("cover_letter_topics", id);
                    insertTopics(id, updated.getCoverLetterTopics());
                });
                case QUESTIONS -> transactions.executeWithoutResult(tx -> {
                    deleteChildren("job_questions", id);
                    insertQuestions(id, updated.getQuestions());
                });
                case WRITING_INSTRUCTIONS -> transactions.executeWithoutResult(tx -> {
                    deleteChildren("job_writing_instructions", id);
                    insertInstructions(id, updated.getWritingInstructions());
                });
            }
            return null;
        });
    }

    @Override
    protected void delete(String id) {
        storage("delete job " + id, () -> {
            transactions.executeWithoutResult(tx -> {
                for (String table : List.of("cover_letter_topics", "job_query_ids", "job_questions",
                        "job_writing_instructions", "job_cover_letters", "job_status", "jobs")) {
                    deleteChildren(table, id);
                }
            });
            return null;
        });
    }

    private void deleteChildren(String table, String id) {
        jdbc.update("DELETE FROM " + table + " WHERE username = :username AND job_id = :jobId", jobParams(id));
    }

    private void insertTopics(String id, List<CoverLetterTopic> topics) {
        for (int position = 0; position < topics.size(); position++) {
            CoverLetterTopic topic = topics.get(position);
            jdbc.update("""
                    INSERT INTO cover_letter_topics (username, job_id, position, topic, relevant_experience)
                    VALUES (:username, :jobId, :position, :topic, :experience)
                    """, jobParams(id)
                    .addValue("position", position)
                    .addValue("topic", topic.topic())
                    .addValue("experience", topic.relevantExperience()));
        }
    }

    private void insertQuestions(String id, List<JobQuestion> questions) {
        for (int position = 0; position < questions.size(); position++) {
            JobQuestion question = questions.get(position);
            jdbc.update("""
                    INSERT INTO job_questions (username, job_id, question_id, question, answer)
                    VALUES (:username, :jobId, :questionId, :question, :answer)
                    """, jobParams(id)
                    .addValue("questionId", position + 1)
                    .addValue("question", question.question())
                    .addValue("answer", question.answer()));
        }
    }

    private void insertInstructions(String id, List<String> instructions) {
        for (int position = 0; position < instructions.size(); position++) {
            jdbc.update("""
                    INSERT INTO job_writing_instructions (username, job_id, position, instruction)
                    VALUES (:username, :jobId, :position, :instruction)
                    """, jobParams(id)
                    .addValue("position", position)
                    .addValue("instruction", instructions.get(position)));
        }
    }

    /**
     * Load one job ({@code id} set) or all of the user's jobs in insertion order.
     */
    private List<Job> load(String id) {
        String filter = id == null ? "" : " AND job_id = :jobId";
        String rowFilter = id == null ? "" : " AND j.job_id = :jobId";
        MapSqlParameterSource params = params().addValue("jobId", id);

        Map<String, Job.JobBuilder> builders = new LinkedHashMap<>();
        jdbc.query("""
                SELECT j.job_id, j.company, j.title, j.date_found, j.link, j.location,
                       j.description, j.full_description, j.addressee,
                       s.status, c.cover_letter_body, c.cover_letter_pdf_path
                FROM jobs j
                LEFT JOIN job_status s ON s.username = j.username AND s.job_id = j.job_id
                LEFT JOIN job_cover_letters c ON c.username = j.username AND c.job_id = j.job_id
                WHERE j.username = :username
                """ + rowFilter + " ORDER BY j.rowid",
                params,
                rs -> {
                    String status = rs.getString("status");
                    String pdfPath = rs.getString("cover_letter_pdf_path");
                    builders.put(rs.getString("job_id"), Job.builder()
                            .id(rs.getString("job_id"))
                            .company(orEmpty(rs.getString("company")))
                            .title(orEmpty(rs.getString("title")))
                            .dateFound(Timestamps.parse(rs.getString("date_found")).orElse(null))
                            .link(orEmpty(rs.getString("link")))
                            .location(orEmpty(rs.getString("location")))
                            .description(orEmpty(rs.getString("description")))
                            .fullDescription(orEmpty(rs.getString("full_description")))
                            .addressee(rs.getString("addressee"))
                            .status(status == null ? JobStatus.PENDING : JobStatus.fromValue(status))
                            .coverLetterBody(orEmpty(rs.getString("cover_letter_body")))
                            .coverLetterPdfPath(pdfPath == null || pdfPath.isBlank() ? null : Path.of(pdfPath)));
                });

        if (builders.isEmpty()) {
            return List.of();
        }

        Map<String, List<CoverLetterTopic>> topics = loadChildren(
                "SELECT job_id, topic, relevant_experience FROM cover_letter_topics WHERE username = :username"
                        + filter + " ORDER BY job_id, position",
                params,
                (rs, rowNum) -> new CoverLetterTopic(rs.getString("topic"), rs.getString("relevant_experience")));
        Map<String, List<JobQuestion>> questions = loadChildren(
                "SELECT job_id, question, answer FROM job_questions WHERE username = :username"
                        + filter + " ORDER BY job_id, question_id",
                params,
                (rs, rowNum) -> new JobQuestion(rs.getString("question"), rs.getString("answer")));
        Map<String, List<String>> instructions = loadChildren(
                "SELECT job_id, instruction FROM job_writing_instructions WHERE username = :username"
                        + filter + " ORDER BY job_id, position",
                params,
                (rs, rowNum) -> rs.getString("instruction"));
        Map<String, List<Integer>> queryIds = loadChildren(
                "SELECT job_id, query_id FROM job_query_ids WHERE username = :username"
                        + filter + " ORDER BY job_id, rowid",
                params,
                (rs, rowNum) -> rs.getInt("query_id"));

        List<Job> jobs = new ArrayList<>(builders.size());
        builders.forEach((jobId, builder) -> jobs.add(builder
                .coverLetterTopics(List.copyOf(topics.getOrDefault(jobId, List.of())))
                .questions(List.copyOf(questions.getOrDefault(jobId, List.of())))
                .writingInstructions(List.copyOf(instructions.getOrDefault(jobId, List.of())))
                .queryIds(List.copyOf(queryIds.getOrDefault(jobId, List.of())))
                .build()));
        return jobs;
    }

    private <T> Map<String, List<T>> loadChildren(String sql, MapSqlParameterSource params, RowMapper<T> mapper) {
        Map<String, List<T>> children = new LinkedHashMap<>();
        jdbc.query(sql, params, rs -> {
            children.computeIfAbsent(rs.getString("job_id"), key -> new ArrayList<>())
                    .add(mapper.mapRow(rs, rs.getRow()));
        });
        return children;
    }

    private MapSqlParameterSource params() {
        return new MapSqlParameterSource().addValue("username", username());
    }

    private MapSqlParameterSource jobParams(String id) {
        return params().addValue("jobId", id);
    }

    private <T> T storage(String action, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure: could not {} for {}: {}", action, username(), e.getMessage());
            throw new StorageException("Could not " + action, e);
        }
    }

    private static Object jobColumnValue(Job job, JobField field) {
        return switch (field) {
            case COMPANY -> job.getCompany();
            case TITLE -> job.getTitle();
            case LOCATION -> job.getLocation();
            case DESCRIPTION -> job.getDescription();
            case FULL_DESCRIPTION -> job.getFullDescription();
            case ADDRESSEE -> job.getAddressee();
            default -> throw new IllegalArgumentException("Not a jobs column: " + field);
        };
    }

    private static String pathString(Path path) {
        return path == null ? null : path.toString();
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
