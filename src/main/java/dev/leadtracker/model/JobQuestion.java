package dev.leadtracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An application-form question and the answer drafted for it (empty until answered).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobQuestion(String question, String answer) {

    public JobQuestion {
        question = question == null ? "" : question;
        answer = answer == null ? "" : answer;
    }

    public static JobQuestion unanswered(String question) {
        return new JobQuestion(question, "");
    }

    public JobQuestion withAnswer(String newAnswer) {
        return new JobQuestion(question, newAnswer);
    }
}
