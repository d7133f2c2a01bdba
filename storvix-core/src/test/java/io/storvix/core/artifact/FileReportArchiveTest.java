package io.storvix.core.artifact;

import static org.assertj.core.api.Assertions.assertThat;

import io.storvix.core.schedule.Frequency;
import io.storvix.core.schedule.ScheduleFixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileReportArchiveTest {
    private static final Instant NOW = Instant.parse("2024-05-20T12:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldStoreBytesAndIndexEntry() throws Exception {
        FileReportArchive archive = new FileReportArchive(tempDir.resolve("reports"));
        Artifact artifact = new Artifact(new byte[] {37, 80, 68, 70}, "host-1-report.pdf", "application/pdf");

        ArchivedReport entry = archive.store(ScheduleFixtures.reportJob("r-1", Frequency.DAILY, null, NOW), artifact, NOW);

        assertThat(entry.scheduleId()).isEqualTo("r-1");
        assertThat(entry.ownerId()).isEqualTo("u-1");
        assertThat(entry.company()).isEqualTo("Acme");
        assertThat(entry.target()).isEqualTo("host-1");
        assertThat(entry.size()).isEqualTo(4);
        assertThat(Files.readAllBytes(tempDir.resolve("reports").resolve(entry.file()))).isEqualTo(artifact.content());

        FileReportArchive reopened = new FileReportArchive(tempDir.resolve("reports"));
        assertThat(reopened.list()).containsExactly(entry);
    }

    @Test
    void shouldKeepEveryRunOfSameSchedule() throws Exception {
        FileReportArchive archive = new FileReportArchive(tempDir.resolve("reports"));
        Artifact artifact = new Artifact(new byte[] {1}, "report.xlsx", "application/octet-stream");

        archive.store(ScheduleFixtures.reportJob("r-1", Frequency.HOURLY, null, NOW), artifact, NOW);
        archive.store(ScheduleFixtures.reportJob("r-1", Frequency.HOURLY, null, NOW), artifact, NOW.plusSeconds(3600));

        assertThat(archive.list()).extracting(ArchivedReport::createdAt).containsExactly(NOW, NOW.plusSeconds(3600));
    }

    @Test
    void shouldListNothingBeforeFirstReport() throws Exception {
        assertThat(new FileReportArchive(tempDir.resolve("reports")).list()).isEmpty();
    }
}
