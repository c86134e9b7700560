package com.scriptvideo.api.service.storage;

import com.scriptvideo.api.config.StorageProperties;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.entity.StorageRecord;
import com.scriptvideo.api.service.job.JobStore;
import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.enums.StorageArea;
import com.scriptvideo.common.exception.ConsistencyException;
import com.scriptvideo.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StorageManagerTest {

    @TempDir
    Path tempDir;

    @Mock
    private JobStore jobStore;

    private StorageProperties properties;
    private StorageManager storageManager;

    @BeforeEach
    void setUp() {
        properties = new StorageProperties();
        properties.setBasePath(tempDir.toString());
        properties.setMinFreeSpaceMb(0);
        storageManager = new StorageManager(properties, jobStore);
        storageManager.init();
    }

    @Test
    void initCreatesEveryArea() {
        for (StorageArea area : StorageArea.values()) {
            assertThat(storageManager.areaDirectory(area)).isDirectory();
        }
    }

    @Test
    void writeAtomicallyLeavesNoPartialFile() throws Exception {
        Path target = storageManager.allocate("job-1", StorageArea.IMAGES, "png");

        storageManager.writeAtomically(target, "image".getBytes(StandardCharsets.UTF_8));

        assertThat(target).usingCharset(StandardCharsets.UTF_8).hasContent("image");
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void writeIsRejectedWhenFreeSpaceIsBelowMinimum() throws Exception {
        properties.setMinFreeSpaceMb(Long.MAX_VALUE / (2L * 1024 * 1024));
        Path target = storageManager.allocate("job-1", StorageArea.IMAGES, "png");

        assertThatThrownBy(() -> storageManager.writeAtomically(target, new byte[16]))
                .isInstanceOf(StorageException.class)
                .extracting(e -> ((StorageException) e).getErrorCode())
                .isEqualTo(ErrorCode.STORAGE_QUOTA_EXCEEDED);
        assertThat(target).doesNotExist();
    }

    @Test
    void completedCleanupRemovesOnlyTemporaryFiles() throws Exception {
        Path image = write("job-1", StorageArea.IMAGES, "png");
        Path video = write("job-1", StorageArea.VIDEOS, "mp4");
        Path temp = write("job-1", StorageArea.TEMP, "mp4");

        int deleted = storageManager.cleanup("job-1", JobStatus.COMPLETED);

        assertThat(deleted).isEqualTo(1);
        assertThat(temp).doesNotExist();
        assertThat(image).exists();
        assertThat(video).exists();
    }

    @Test
    void failedCleanupRemovesAllJobFilesAndIsIdempotent() throws Exception {
        Path image = write("job-1", StorageArea.IMAGES, "png");
        Path audio = write("job-1", StorageArea.AUDIO, "wav");
        Path temp = write("job-1", StorageArea.TEMP, "mp4");
        Path otherJob = write("job-2", StorageArea.IMAGES, "png");

        assertThat(storageManager.cleanup("job-1", JobStatus.FAILED)).isEqualTo(3);
        assertThat(storageManager.cleanup("job-1", JobStatus.FAILED)).isZero();

        assertThat(image).doesNotExist();
        assertThat(audio).doesNotExist();
        assertThat(temp).doesNotExist();
        assertThat(storageManager.jobDirectory("job-1", StorageArea.IMAGES)).doesNotExist();
        assertThat(otherJob).exists();
    }

    @Test
    void cleanupOfRunningJobIsRejected() {
        assertThatThrownBy(() -> storageManager.cleanup("job-1", JobStatus.GENERATING_ASSETS))
                .isInstanceOf(ConsistencyException.class);
    }

    @Test
    void retentionDeletesExpiredFilesButKeepsRunningJobs() throws Exception {
        Path stale = write("job-old", StorageArea.IMAGES, "png");
        Path running = write("job-running", StorageArea.IMAGES, "png");
        Path fresh = write("job-fresh", StorageArea.IMAGES, "png");
        age(stale.getParent(), Duration.ofDays(30));
        age(running.getParent(), Duration.ofDays(30));
        when(jobStore.find(anyString())).thenAnswer(inv -> "job-running".equals(inv.getArgument(0))
                ? Optional.of(job("job-running", JobStatus.GENERATING_ASSETS))
                : Optional.empty());

        int deleted = storageManager.enforceQuota();

        assertThat(deleted).isEqualTo(1);
        assertThat(stale).doesNotExist();
        assertThat(running).exists();
        assertThat(fresh).exists();
    }

    @Test
    void completedVideosArePreservedPastMaxAge() throws Exception {
        Path video = write("job-done", StorageArea.VIDEOS, "mp4");
        age(video.getParent(), Duration.ofDays(400));
        when(jobStore.find("job-done")).thenReturn(Optional.of(job("job-done", JobStatus.COMPLETED)));

        storageManager.enforceQuota();

        assertThat(video).exists();
    }

    @Test
    void sizeLimitDeletesOldestEntriesFirst() throws Exception {
        properties.getRetention().put("clips",
                new StorageProperties.Retention(Duration.ofDays(7), 0L, false));
        Path older = write("job-a", StorageArea.CLIPS, "mp4");
        Path newer = write("job-b", StorageArea.CLIPS, "mp4");
        age(older.getParent(), Duration.ofHours(2));
        age(newer.getParent(), Duration.ofHours(1));

        int deleted = storageManager.enforceQuota();

        assertThat(deleted).isEqualTo(2);
        assertThat(older).doesNotExist();
        assertThat(newer).doesNotExist();
    }

    @Test
    void partialRetentionOverrideKeepsOtherDefaults() throws Exception {
        StorageProperties.Retention ageOnly = new StorageProperties.Retention();
        ageOnly.setMaxAge(Duration.ofDays(14));
        properties.getRetention().put("images", ageOnly);
        Path fresh = write("job-done", StorageArea.IMAGES, "png");
        when(jobStore.find(anyString())).thenReturn(Optional.of(job("job-done", JobStatus.COMPLETED)));

        int deleted = storageManager.enforceQuota();

        assertThat(deleted).isZero();
        assertThat(fresh).exists();
        StorageProperties.Retention merged = properties.retentionFor(StorageArea.IMAGES);
        assertThat(merged.getMaxAge()).isEqualTo(Duration.ofDays(14));
        assertThat(merged.getMaxSizeMb()).isEqualTo(2_048L);
        assertThat(merged.getPreserveCompletedVideos()).isFalse();
    }

    @Test
    void sizeOnlyOverrideStillAppliesDefaultAge() throws Exception {
        StorageProperties.Retention sizeOnly = new StorageProperties.Retention();
        sizeOnly.setMaxSizeMb(100L);
        properties.getRetention().put("audio", sizeOnly);
        Path stale = write("job-old", StorageArea.AUDIO, "wav");
        Path fresh = write("job-new", StorageArea.AUDIO, "wav");
        age(stale.getParent(), Duration.ofDays(8));

        int deleted = storageManager.enforceQuota();

        assertThat(deleted).isEqualTo(1);
        assertThat(stale).doesNotExist();
        assertThat(fresh).exists();
        assertThat(properties.retentionFor(StorageArea.AUDIO).getMaxAge()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void scanUsageReportsEveryAreaWithPolicy() throws Exception {
        write("job-1", StorageArea.IMAGES, "png");
        write("job-1", StorageArea.IMAGES, "png");

        List<StorageRecord> records = storageManager.scanUsage();

        assertThat(records).hasSize(StorageArea.values().length);
        StorageRecord images = records.stream().filter(r -> r.getArea() == StorageArea.IMAGES).findFirst().orElseThrow();
        assertThat(images.getFileCount()).isEqualTo(2);
        assertThat(images.getTotalSizeBytes()).isEqualTo(2L * "data".length());
        assertThat(images.getDirectory()).isEqualTo("assets/images");
        assertThat(images.getRetentionPolicy().getMaxAgeSeconds()).isEqualTo(Duration.ofDays(7).toSeconds());
    }

    private Path write(String jobId, StorageArea area, String extension) throws Exception {
        Path target = storageManager.allocate(jobId, area, extension);
        return storageManager.writeAtomically(target, "data".getBytes(StandardCharsets.UTF_8));
    }

    private static void age(Path directory, Duration age) throws IOException {
        FileTime time = FileTime.from(Instant.now().minus(age));
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.toList()) {
                Files.setLastModifiedTime(path, time);
            }
        }
    }

    private static Job job(String jobId, JobStatus status) {
        return Job.builder().jobId(jobId).status(status).build();
    }
}
