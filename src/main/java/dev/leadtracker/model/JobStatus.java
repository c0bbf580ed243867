package dev.leadtracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a tracked job.
 * <p>
 * Allowed moves: PENDING and IN_PROGRESS switch freely, both can be marked APPLIED,
 * APPLIED can be reopened to IN_PROGRESS, anything can be DISCARDED and a discarded
 * job can only come back as PENDING. There is no terminal state.
 */
public enum JobStatus {

    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    APPLIED("applied"),
    DISCARDED("discarded");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + value));
    }

    public Set<JobStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, APPLIED, DISCARDED);
            case IN_PROGRESS -> EnumSet.of(PENDING, APPLIED, DISCARDED);
            case APPLIED -> EnumSet.of(IN_PROGRESS, DISCARDED);
            case DISCARDED -> EnumSet.of(PENDING);
        };
    }

    public boolean canTransitionTo(JobStatus target) {
        return allowedTargets().contains(target);
    }
}
