package dev.leadtracker.store.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.leadtracker.model.CoverLetterTopic;
import dev.leadtracker.model.Job;
import dev.leadtracker.model.JobQuestion;
import dev.leadtracker.model.JobStatus;
import dev.leadtracker.util.Timestamps;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of one job in the flat-file document. Missing fields read as empty,
 * and the older {@code applied} flag is understood when {@code status} is absent.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class JobDocument {

    private String company;
    private String title;

    @JsonProperty("date_found")
    private String dateFound;

    private String status;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean applied;

    private String link;
    private String location;
    private String description;

    @JsonProperty("full_description")
    private String fullDescription;

    private String addressee;

    @JsonProperty("cover_letter_topics")
    private List<CoverLetterTopic> coverLetterTopics;

    @JsonProperty("cover_letter_body")
    private String coverLetterBody;

    @JsonProperty("cover_letter_pdf_path")
    private String coverLetterPdfPath;

    private List<JobQuestion> questions;

    @JsonProperty("writing_instructions")
    private List<String> writingInstructions;

    @JsonProperty("query_ids")
    private List<Integer> queryIds;

    static JobDocument from(Job job) {
        JobDocument document = new JobDocument();
        document.setCompany(job.getCompany());
        document.setTitle(job.getTitle());
        document.setDateFound(Timestamps.format(job.getDateFound()));
        document.setStatus(job.getStatus().getValue());
        document.setLink(job.getLink());
        document.setLocation(job.getLocation());
        document.setDescription(job.getDescription());
        document.setFullDescription(job.getFullDescription());
        document.setAddressee(job.getAddressee());
        document.setCoverLetterTopics(new ArrayList<>(job.getCoverLetterTopics()));
        document.setCoverLetterBody(job.getCoverLetterBody());
        document.setCoverLetterPdfPath(job.getCoverLetterPdfPath() == null ? null : job.getCoverLetterPdfPath().toString());
        document.setQuestions(new ArrayList<>(job.getQuestions()));
        document.setWritingInstructions(new ArrayList<>(job.getWritingInstructions()));
        document.setQueryIds(new ArrayList<>(job.getQueryIds()));
        return document;
    }

    Job toJob(String id) {
        return Job.builder()
                .id(id)
                .company(orEmpty(company))
                .title(orEmpty(title))
                .dateFound(Timestamps.parse(dateFound).orElse(null))
                .status(resolveStatus())
                .link(orEmpty(link))
                .location(orEmpty(location))
                .description(orEmpty(description))
                .fullDescription(orEmpty(fullDescription))
                .addressee(addressee == null || addressee.isBlank() ? null : addressee)
                .coverLetterTopics(coverLetterTopics == null ? List.of() : List.copyOf(coverLetterTopics))
                .coverLetterBody(orEmpty(coverLetterBody))
                .coverLetterPdfPath(coverLetterPdfPath == null || coverLetterPdfPath.isBlank()
                        ? null : Path.of(coverLetterPdfPath))
                .questions(questions == null ? List.of() : List.copyOf(questions))
                .writingInstructions(writingInstructions == null ? List.of() : List.copyOf(writingInstructions))
                .queryIds(queryIds == null ? List.of() : List.copyOf(queryIds))
                .build();
    }

    private JobStatus resolveStatus() {
        if (status != null && !status.isBlank()) {
            return JobStatus.fromValue(status);
        }
        return Boolean.TRUE.equals(applied) ? JobStatus.APPLIED : JobStatus.PENDING;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
