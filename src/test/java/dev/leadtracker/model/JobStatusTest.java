package dev.leadtracker.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTest {

    @ParameterizedTest(name = "{0} -> {1} allowed: {2}")
    @CsvSource({
            "PENDING, IN_PROGRESS, true",
            "PENDING, APPLIED, true",
            "PENDING, DISCARDED, true",
            "IN_PROGRESS, PENDING, true",
            "IN_PROGRESS, APPLIED, true",
            "IN_PROGRESS, DISCARDED, true",
            "APPLIED, IN_PROGRESS, true",
            "APPLIED, DISCARDED, true",
            "APPLIED, PENDING, false",
            "DISCARDED, PENDING, true",
            "DISCARDED, APPLIED, false",
            "DISCARDED, IN_PROGRESS, false"
    })
    void shouldFollowLifecycleGraph(JobStatus from, JobStatus to, boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }

    @Test
    @DisplayName("Should allow a move out of every state")
    void shouldHaveNoTerminalState() {
        for (JobStatus status : JobStatus.values()) {
            assertThat(status.allowedTargets()).isNotEmpty();
        }
    }

    @Test
    @DisplayName("Should read stored values and enum names")
    void shouldParseValues() {
        assertThat(JobStatus.fromValue("in_progress")).isEqualTo(JobStatus.IN_PROGRESS);
        assertThat(JobStatus.fromValue("APPLIED")).isEqualTo(JobStatus.APPLIED);
        assertThatThrownBy(() -> JobStatus.fromValue("hired")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should serialize as the lowercase value")
    void shouldSerializeAsValue() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();

        assertThat(objectMapper.writeValueAsString(JobStatus.IN_PROGRESS)).isEqualTo("\"in_progress\"");
        assertThat(objectMapper.readValue("\"discarded\"", JobStatus.class)).isEqualTo(JobStatus.DISCARDED);
    }
}
