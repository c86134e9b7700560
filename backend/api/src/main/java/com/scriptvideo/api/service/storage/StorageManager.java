package com.scriptvideo.api.service.storage;

import com.scriptvideo.api.config.StorageProperties;
import com.scriptvideo.api.config.StorageProperties.Retention;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.api.entity.StorageRecord;
import com.scriptvideo.api.service.job.JobStore;
import com.scriptvideo.api.util.PathValidator;
import com.scriptvideo.common.enums.JobStatus;
import com.scriptvideo.common.enums.StorageArea;
import com.scriptvideo.common.exception.ConsistencyException;
import com.scriptvideo.common.exception.ErrorCode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * 로컬 파일 저장소
 *
 * 디렉토리 구조: {base}/{area}/{jobId}/파일
 * - videos/, assets/images/, assets/audio/, assets/clips/, assets/temp/, stock/
 * - 파일은 임시 파일에 쓴 뒤 원자적으로 이동
 * - 종료된 작업만 정리, 실행 중인 작업의 파일은 보존 정책 정리에서도 제외
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageManager {

    // 실패/취소 시 함께 지우는 영역 (temp 는 모든 종료 상태에서 삭제)
    private static final Set<StorageArea> JOB_ASSET_AREAS =
            EnumSet.of(StorageArea.IMAGES, StorageArea.AUDIO, StorageArea.CLIPS, StorageArea.VIDEOS);

    private final StorageProperties properties;
    private final JobStore jobStore;

    private Path basePath;

    @PostConstruct
    public void init() {
        basePath = Paths.get(properties.getBasePath()).toAbsolutePath().normalize();
        try {
            for (StorageArea area : StorageArea.values()) {
                Files.createDirectories(basePath.resolve(area.getRelativePath()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create storage directories under " + basePath, e);
        }
        PathValidator.registerAllowedDirectory(basePath);
        log.info("[Storage] Initialized - path: {}", basePath);
    }

    public Path getBasePath() {
        return basePath;
    }

    public Path areaDirectory(StorageArea area) {
        return basePath.resolve(area.getRelativePath());
    }

    public Path jobDirectory(String jobId, StorageArea area) {
        return areaDirectory(area).resolve(jobId);
    }

    /**
     * 작업 파일 경로 할당 (디렉토리 생성)
     * @param extension 확장자 (점 제외)
     */
    public Path allocate(String jobId, StorageArea area, String extension) throws StorageException {
        Path dir = jobDirectory(jobId, area);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_IO_FAILED, "디렉토리 생성 실패: " + dir, e);
        }
        return dir.resolve(UUID.randomUUID() + "." + extension);
    }

    /**
     * 임시 파일에 쓰고 target 으로 원자적 이동
     */
    public Path writeAtomically(Path target, byte[] data) throws StorageException {
        ensureCapacity(data.length);
        Path tmp = target.resolveSibling(target.getFileName() + ".part");
        try {
            Files.createDirectories(target.getParent());
            Files.write(tmp, data);
            move(tmp, target);
            log.debug("[Storage] Written {} ({} bytes)", target, data.length);
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException(ErrorCode.STORAGE_IO_FAILED, "파일 저장 실패: " + target.getFileName(), e);
        }
    }

    /**
     * 같은 파일 시스템 내 원자적 이동 (최종 영상 temp → videos)
     */
    public Path moveAtomically(Path source, Path target) throws StorageException {
        try {
            Files.createDirectories(target.getParent());
            move(source, target);
            return target;
        } catch (IOException e) {
            throw new StorageException(ErrorCode.STORAGE_IO_FAILED, "파일 이동 실패: " + source.getFileName(), e);
        }
    }

    /**
     * 종료된 작업 파일 정리 (멱등)
     * - temp 는 항상 삭제
     * - FAILED/CANCELLED 는 에셋과 미완성 영상까지 삭제
     * @return 삭제한 파일 수
     */
    public int cleanup(String jobId, JobStatus terminalStatus) {
        if (!terminalStatus.isTerminal()) {
            throw new ConsistencyException(ErrorCode.ILLEGAL_STATE_TRANSITION,
                    "Cleanup requested for non-terminal job " + jobId + " (" + terminalStatus + ")");
        }
        int deleted = deleteTree(jobDirectory(jobId, StorageArea.TEMP));
        if (terminalStatus != JobStatus.COMPLETED) {
            for (StorageArea area : JOB_ASSET_AREAS) {
                deleted += deleteTree(jobDirectory(jobId, area));
            }
        }
        log.info("[Storage] Cleanup - jobId: {}, status: {}, deleted files: {}", jobId, terminalStatus, deleted);
        return deleted;
    }

    /**
     * 보존 정책 적용 (영역별: 기간 초과 삭제 → 용량 초과 시 오래된 것부터 삭제)
     * 실행 중인 작업과 보존 대상(완료 영상, stock)은 건드리지 않는다.
     * @return 삭제한 파일 수
     */
    public int enforceQuota() {
        int deleted = 0;
        for (StorageArea area : StorageArea.values()) {
            deleted += enforceArea(area);
        }
        if (deleted > 0) {
            log.info("[Storage] Retention sweep deleted {} files", deleted);
        }
        return deleted;
    }

    public List<StorageRecord> scanUsage() {
        List<StorageRecord> records = new ArrayList<>();
        for (StorageArea area : StorageArea.values()) {
            Path dir = areaDirectory(area);
            long[] totals = sizeAndCount(dir);
            Retention retention = properties.retentionFor(area);
            records.add(StorageRecord.builder()
                    .area(area)
                    .directory(area.getRelativePath())
                    .totalSizeBytes(totals[0])
                    .fileCount(totals[1])
                    .retentionPolicy(StorageRecord.RetentionPolicy.builder()
                            .maxAgeSeconds(retention.getMaxAge().toSeconds())
                            .maxSizeBytes(retention.getMaxSizeMb() * 1024 * 1024)
                            .preserveCompletedVideos(retention.getPreserveCompletedVideos())
                            .build())
                    .build());
        }
        return records;
    }

    /**
     * 디스크 공간 (total, usable, used)
     */
    public Map<String, Long> diskSpace() {
        Map<String, Long> space = new LinkedHashMap<>();
        try {
            var store = Files.getFileStore(basePath);
            space.put("totalBytes", store.getTotalSpace());
            space.put("usableBytes", store.getUsableSpace());
            space.put("usedBytes", store.getTotalSpace() - store.getUnallocatedSpace());
        } catch (IOException e) {
            log.warn("[Storage] Failed to read disk space: {}", e.getMessage());
        }
        return space;
    }

    // ========== 내부 ==========

    private int enforceArea(StorageArea area) {
        Retention retention = properties.retentionFor(area);
        Path dir = areaDirectory(area);
        List<Entry> entries = listEntries(dir);
        Instant cutoff = Instant.now().minus(retention.getMaxAge());
        int deleted = 0;

        List<Entry> remaining = new ArrayList<>();
        for (Entry entry : entries) {
            if (isProtected(area, entry, retention)) {
                continue;
            }
            if (entry.lastModified().toInstant().isBefore(cutoff)) {
                log.info("[Storage] Retention (age) - {}/{}", area.key(), entry.path().getFileName());
                deleted += deleteTree(entry.path());
            } else {
                remaining.add(entry);
            }
        }

        long maxBytes = retention.getMaxSizeMb() * 1024 * 1024;
        long total = sizeAndCount(dir)[0];
        remaining.sort(Comparator.comparing(Entry::lastModified));
        for (Entry entry : remaining) {
            if (total <= maxBytes) {
                break;
            }
            log.info("[Storage] Retention (size) - {}/{}", area.key(), entry.path().getFileName());
            total -= entry.size();
            deleted += deleteTree(entry.path());
        }
        return deleted;
    }

    /**
     * 항목 이름이 작업 ID 인 디렉토리면 작업 상태로 보호 여부 판단
     */
    private boolean isProtected(StorageArea area, Entry entry, Retention retention) {
        if (area == StorageArea.STOCK && retention.getPreserveCompletedVideos()) {
            return true;
        }
        if (!Files.isDirectory(entry.path())) {
            return false;
        }
        Optional<Job> job = jobStore.find(entry.path().getFileName().toString());
        if (job.isEmpty()) {
            return false;
        }
        JobStatus status = job.get().getStatus();
        if (!status.isTerminal()) {
            return true;
        }
        return area == StorageArea.VIDEOS && status == JobStatus.COMPLETED && retention.getPreserveCompletedVideos();
    }

    private List<Entry> listEntries(Path dir) {
        List<Entry> entries = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return entries;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                long[] totals = sizeAndCount(path);
                entries.add(new Entry(path, lastModified(path), totals[0]));
            }
        } catch (IOException e) {
            log.warn("[Storage] Failed to list {}: {}", dir, e.getMessage());
        }
        return entries;
    }

    private void ensureCapacity(long bytes) throws StorageException {
        long usable = basePath.toFile().getUsableSpace();
        long minFree = properties.getMinFreeSpaceMb() * 1024 * 1024;
        if (usable > 0 && usable - bytes < minFree) {
            throw new StorageException(ErrorCode.STORAGE_QUOTA_EXCEEDED,
                    "디스크 여유 공간 부족 (usable: " + usable / (1024 * 1024) + "MB, 필요: "
                            + bytes / (1024 * 1024) + "MB + 여유 " + properties.getMinFreeSpaceMb() + "MB)");
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * 파일 또는 디렉토리 전체 삭제 (best-effort)
     * @return 삭제한 파일 수
     */
    private static int deleteTree(Path root) {
        if (!Files.exists(root)) {
            return 0;
        }
        int deleted = 0;
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                boolean regular = Files.isRegularFile(path);
                if (deleteQuietly(path) && regular) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            log.warn("[Storage] Failed to walk {}: {}", root, e.getMessage());
        }
        return deleted;
    }

    private static boolean deleteQuietly(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("[Storage] Failed to delete {}: {}", path, e.getMessage());
            return false;
        }
    }

    private static long[] sizeAndCount(Path root) {
        long[] totals = new long[2];
        if (!Files.exists(root)) {
            return totals;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile).forEach(p -> {
                try {
                    totals[0] += Files.size(p);
                    totals[1]++;
                } catch (IOException e) {
                    log.debug("[Storage] Skipped {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("[Storage] Failed to scan {}: {}", root, e.getMessage());
        }
        return totals;
    }

    private static FileTime lastModified(Path root) {
        FileTime latest = FileTime.fromMillis(0);
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.toList()) {
                FileTime time = Files.getLastModifiedTime(p);
                if (time.compareTo(latest) > 0) {
                    latest = time;
                }
            }
        } catch (IOException e) {
            log.debug("[Storage] Failed to read mtime of {}: {}", root, e.getMessage());
        }
        return latest;
    }

    private record Entry(Path path, FileTime lastModified, long size) {}
}
