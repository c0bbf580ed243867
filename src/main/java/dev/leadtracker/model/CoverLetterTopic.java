package dev.leadtracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A job requirement paired with the candidate experience that answers it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CoverLetterTopic(
        String topic,
        @JsonProperty("relevant_experience") String relevantExperience) {

    public CoverLetterTopic {
        topic = topic == null ? "" : topic;
        relevantExperience = relevantExperience == null ? "" : relevantExperience;
    }
}
