package dev.leadtracker.recovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.leadtracker.model.Lead;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryLogTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private Path file;
    private RecoveryLog recoveryLog;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("alice").resolve("search_temp.jsonl");
        recoveryLog = new RecoveryLog(file, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Lead lead(String link, int queryId) {
        return Lead.builder().company("Acme").title("Dev").link(link).queryIds(List.of(queryId)).build();
    }

    @Test
    @DisplayName("Should read back appended entries in order")
    void shouldAppendAndRead() {
        recoveryLog.append("java remote", List.of(lead("https://x/1", 1), lead("https://x/2", 1)));
        recoveryLog.append("kotlin berlin", List.of(), true);

        List<RecoveryEntry> entries = recoveryLog.readAll();

        assertThat(entries).extracting(RecoveryEntry::queryText).containsExactly("java remote", "kotlin berlin");
        assertThat(entries.get(0).jobs()).extracting(Lead::getLink).containsExactly("https://x/1", "https://x/2");
        assertThat(entries.get(0).jobs().get(0).getQueryIds()).containsExactly(1);
        assertThat(entries.get(0).failed()).isFalse();
        assertThat(entries.get(1).failed()).isTrue();
        assertThat(entries.get(1).timestamp()).isEqualTo("2026-03-01T10:00:00Z");
    }

    @Test
    @DisplayName("Should write one JSON record per line")
    void shouldWriteLines() throws IOException {
        recoveryLog.append("java remote", List.of(lead("https://x/1", 1)));
        recoveryLog.append("go remote", List.of());

        List<String> lines = Files.readAllLines(file);

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("{").contains("\"query_str\":\"java remote\"");
    }

    @Test
    @DisplayName("Should skip corrupt lines and keep the rest")
    void shouldSkipCorruptLines() throws IOException {
        recoveryLog.append("first", List.of(lead("https://x/1", 1)));
        Files.writeString(file, "{\"query_str\": \"trunc\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        Files.writeString(file, "null\n\n42\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        recoveryLog.append("second", List.of(lead("https://x/2", 2)));

        List<RecoveryEntry> entries = recoveryLog.readAll();

        assertThat(entries).extracting(RecoveryEntry::queryText).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Should skip a line torn inside a multi-byte character and keep the rest")
    void shouldSkipLineWithTornCharacter() throws IOException {
        recoveryLog.append("first", List.of(lead("https://x/1", 1)));
        byte[] prefix = "{\"query_str\": \"M".getBytes(StandardCharsets.UTF_8);
        byte[] torn = new byte[prefix.length + 2];
        System.arraycopy(prefix, 0, torn, 0, prefix.length);
        torn[prefix.length] = (byte) 0xC3;
        torn[prefix.length + 1] = '\n';
        Files.write(file, torn, StandardOpenOption.APPEND);
        recoveryLog.append("zürich", List.of(lead("https://x/2", 2)));

        List<RecoveryEntry> entries = recoveryLog.readAll();

        assertThat(entries).extracting(RecoveryEntry::queryText).containsExactly("first", "zürich");
        assertThat(entries.get(1).jobs()).extracting(Lead::getLink).containsExactly("https://x/2");
    }

    @Test
    @DisplayName("Should read a missing log as empty and clear an existing one")
    void shouldClear() {
        assertThat(recoveryLog.readAll()).isEmpty();
        assertThat(recoveryLog.exists()).isFalse();

        recoveryLog.append("first", List.of());
        assertThat(recoveryLog.exists()).isTrue();

        recoveryLog.clear();
        assertThat(recoveryLog.exists()).isFalse();
        assertThat(recoveryLog.readAll()).isEmpty();
    }

    @Test
    @DisplayName("Should judge recency against the threshold")
    void shouldJudgeRecency() {
        Duration twelveHours = Duration.ofHours(12);
        RecoveryEntry oneHourOld = new RecoveryEntry("q", "2026-03-01T09:00:00Z", List.of(), false);
        RecoveryEntry thirteenHoursOld = new RecoveryEntry("q", "2026-02-28T21:00:00Z", List.of(), false);
        RecoveryEntry unreadable = new RecoveryEntry("q", "not a time", List.of(), false);

        assertThat(oneHourOld.isRecent(NOW, twelveHours)).isTrue();
        assertThat(thirteenHoursOld.isRecent(NOW, twelveHours)).isFalse();
        assertThat(unreadable.isRecent(NOW, twelveHours)).isFalse();
    }

    @Test
    @DisplayName("Should never treat a timestamp without a zone as recent")
    void shouldRejectZonelessTimestamp() {
        RecoveryEntry zoneless = new RecoveryEntry("q", "2026-03-01T09:59:00", List.of(), false);

        assertThat(zoneless.isRecent(NOW, Duration.ofHours(12))).isFalse();
    }
}
