package dev.leadtracker.store;

import dev.leadtracker.model.CoverLetterTopic;
import dev.leadtracker.model.Job;
import dev.leadtracker.model.JobQuestion;
import dev.leadtracker.model.JobStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A single-field change to a job, applied and persisted by {@link JobStore#update}.
 */
public final class JobUpdate {

    private final JobField field;
    private final Object value;

    private JobUpdate(JobField field, Object value) {
        this.field = field;
        this.value = value;
    }

    public static JobUpdate status(JobStatus status) {
        return new JobUpdate(JobField.STATUS, Objects.requireNonNull(status, "status"));
    }

    public static JobUpdate company(String company) {
        return new JobUpdate(JobField.COMPANY, nullToEmpty(company));
    }

    public static JobUpdate title(String title) {
        return new JobUpdate(JobField.TITLE, nullToEmpty(title));
    }

    public static JobUpdate location(String location) {
        return new JobUpdate(JobField.LOCATION, nullToEmpty(location));
    }

    public static JobUpdate description(String description) {
        return new JobUpdate(JobField.DESCRIPTION, nullToEmpty(description));
    }

    public static JobUpdate fullDescription(String fullDescription) {
        return new JobUpdate(JobField.FULL_DESCRIPTION, nullToEmpty(fullDescription));
    }

    public static JobUpdate addressee(String addressee) {
        return new JobUpdate(JobField.ADDRESSEE, addressee == null || addressee.isBlank() ? null : addressee);
    }

    public static JobUpdate coverLetterTopics(List<CoverLetterTopic> topics) {
        return new JobUpdate(JobField.COVER_LETTER_TOPICS, topics == null ? List.of() : List.copyOf(topics));
    }

    public static JobUpdate coverLetterBody(String body) {
        return new JobUpdate(JobField.COVER_LETTER_BODY, nullToEmpty(body));
    }

    public static JobUpdate coverLetterPdfPath(Path path) {
        return new JobUpdate(JobField.COVER_LETTER_PDF_PATH, path);
    }

    public static JobUpdate questions(List<JobQuestion> questions) {
        return new JobUpdate(JobField.QUESTIONS, questions == null ? List.of() : List.copyOf(questions));
    }

    public static JobUpdate writingInstructions(List<String> instructions) {
        return new JobUpdate(JobField.WRITING_INSTRUCTIONS,
                instructions == null ? List.of() : List.copyOf(instructions));
    }

    public JobField field() {
        return field;
    }

    public Object value() {
        return value;
    }

    /**
     * Return a copy of {@code job} with this change applied. Pure; persists nothing.
     */
    @SuppressWarnings("unchecked")
    public Job applyTo(Job job) {
        Job.JobBuilder builder = job.toBuilder();
        switch (field) {
            case STATUS -> builder.status((JobStatus) value);
            case COMPANY -> builder.company((String) value);
            case TITLE -> builder.title((String) value);
            case LOCATION -> builder.location((String) value);
            case DESCRIPTION -> builder.description((String) value);
            case FULL_DESCRIPTION -> builder.fullDescription((String) value);
            case ADDRESSEE -> builder.addressee((String) value);
            case COVER_LETTER_TOPICS -> builder.coverLetterTopics((List<CoverLetterTopic>) value);
            case COVER_LETTER_BODY -> builder.coverLetterBody((String) value);
            case COVER_LETTER_PDF_PATH -> builder.coverLetterPdfPath((Path) value);
            case QUESTIONS -> builder.questions((List<JobQuestion>) value);
            case WRITING_INSTRUCTIONS -> builder.writingInstructions((List<String>) value);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "JobUpdate[" + field + "]";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
