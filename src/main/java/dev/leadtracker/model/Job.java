package dev.leadtracker.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * A discovered job posting tracked through to application.
 * <p>
 * Instances are immutable snapshots. Changes go through
 * {@link dev.leadtracker.store.JobStore#update}, which persists the change and
 * returns the new snapshot.
 */
@Value
@Builder(toBuilder = true)
public class Job {

    String id;
    String company;
    String title;
    String location;

    /** Dedup key. Unique per user when non-empty. */
    String link;

    /** Short cleaned summary from the search result. */
    @Builder.Default
    String description = "";

    /** Complete posting text, empty when it was never fetched. */
    @Builder.Default
    String fullDescription = "";

    @Builder.Default
    JobStatus status = JobStatus.PENDING;

    Instant dateFound;

    /** Hiring contact, null when unknown. */
    String addressee;

    @Builder.Default
    List<CoverLetterTopic> coverLetterTopics = List.of();

    @Builder.Default
    String coverLetterBody = "";

    /** Exported letter, null when absent or when the file no longer exists. */
    Path coverLetterPdfPath;

    @Builder.Default
    List<JobQuestion> questions = List.of();

    @Builder.Default
    List<String> writingInstructions = List.of();

    /** Ids of the search queries that produced this job. */
    @Builder.Default
    List<Integer> queryIds = List.of();

    public boolean isApplied() {
        return status == JobStatus.APPLIED;
    }

    public boolean hasFullDescription() {
        return fullDescription != null && !fullDescription.isBlank();
    }

    public boolean hasCoverLetterPdf() {
        return coverLetterPdfPath != null;
    }

    /**
     * Plain-text cover letter without letterhead.
     *
     * @param signatureName name used under the sign-off
     * @return the letter, or null when no body has been written yet
     */
    public String coverLetterFullText(String signatureName) {
        if (coverLetterBody == null || coverLetterBody.isBlank()) {
            return null;
        }
        boolean named = addressee != null && !addressee.isBlank();
        String salutation = named ? addressee : "hiring team";
        String signOff = named ? "sincerely" : "faithfully";
        return String.join("\n",
                "Dear " + salutation + ",",
                "",
                coverLetterBody,
                "",
                "Yours " + signOff + ",",
                "",
                signatureName);
    }
}
