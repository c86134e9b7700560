package com.scriptvideo.api.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * 파일 경로 보안 검증 유틸리티
 * - Path Traversal 공격 방지
 * - Command Injection 방지
 * - 허용된 디렉토리(저장소 루트) 내에서만 파일 접근 허용
 */
@Slf4j
public class PathValidator {

    // 허용된 작업 디렉토리 목록 (StorageManager 가 초기화 시 등록)
    private static final Set<Path> ALLOWED_DIRECTORIES = new CopyOnWriteArraySet<>();

    static {
        ALLOWED_DIRECTORIES.add(Paths.get(System.getProperty("java.io.tmpdir")).toAbsolutePath().normalize());
    }

    // 금지된 경로 패턴
    private static final String[] FORBIDDEN_PATTERNS = {
            "..",           // Path traversal
            "//",           // Double slash
            "\0",           // Null byte
            "\n",           // Newline
            "\r",           // Carriage return
            ";",            // Command separator
            "|",            // Pipe
            "&",            // Background/AND
            "$(",           // Command substitution
            "`"             // Backtick command substitution
    };

    private PathValidator() {
    }

    public static void registerAllowedDirectory(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        if (ALLOWED_DIRECTORIES.add(normalized)) {
            log.info("[PathValidator] Allowed directory registered: {}", normalized);
        }
    }

    /**
     * 경로가 안전한지 검증
     */
    public static boolean isSafe(String path) {
        if (path == null || path.trim().isEmpty()) {
            return false;
        }

        for (String pattern : FORBIDDEN_PATTERNS) {
            if (path.contains(pattern)) {
                log.warn("[PathValidator] Forbidden pattern '{}' in path: {}",
                        pattern, Diagnostics.truncate(path, 100));
                return false;
            }
        }

        return true;
    }

    /**
     * 경로가 허용된 디렉토리 내에 있는지 검증 (심볼릭 링크는 실제 경로로 재검증)
     */
    public static boolean isWithinAllowedDirectory(Path path) {
        if (path == null) {
            return false;
        }

        Path normalizedPath = path.toAbsolutePath().normalize();

        if (Files.exists(normalizedPath)) {
            try {
                Path realPath = normalizedPath.toRealPath();
                if (!startsWithAllowed(realPath)) {
                    log.warn("[PathValidator] Symlink traversal detected! normalized: {}, real: {}",
                            Diagnostics.truncate(normalizedPath.toString(), 100),
                            Diagnostics.truncate(realPath.toString(), 100));
                    return false;
                }
            } catch (IOException e) {
                log.warn("[PathValidator] Failed to resolve real path: {}",
                        Diagnostics.truncate(normalizedPath.toString(), 100));
                return false;
            }
        }

        if (startsWithAllowed(normalizedPath)) {
            return true;
        }

        log.warn("[PathValidator] Path outside allowed directories: {}",
                Diagnostics.truncate(normalizedPath.toString(), 100));
        return false;
    }

    /**
     * 경로 검증 후 Path 객체 반환, 실패 시 예외
     * @throws SecurityException 검증 실패 시
     */
    public static Path validateAndGet(String pathStr) {
        if (!isSafe(pathStr)) {
            throw new SecurityException("Unsafe path detected: " + Diagnostics.truncate(pathStr, 50));
        }

        Path path = Paths.get(pathStr).toAbsolutePath().normalize();

        if (!isWithinAllowedDirectory(path)) {
            throw new SecurityException("Path outside allowed directory: " + Diagnostics.truncate(pathStr, 50));
        }

        return path;
    }

    /**
     * FFmpeg 명령어 인자 목록 검증 (실행 파일 경로는 제외하고 전달)
     * - 절대경로 (/로 시작): 허용된 디렉토리 내 검증
     * - 상대경로 (../ 포함): 거부
     * - FFmpeg 옵션 (-로 시작): 통과
     * @throws SecurityException 위험한 경로 발견 시
     */
    public static void validateCommandArgs(List<String> args) {
        if (args == null) return;

        for (String arg : args) {
            if (arg == null || arg.isEmpty()) continue;

            // FFmpeg 옵션은 건너뜀 (-i, -c:v, -filter_complex 등)
            if (arg.startsWith("-")) continue;

            // 숫자만 있는 인자 건너뜀 (해상도, 비트레이트 등)
            if (arg.matches("^[0-9:x]+$")) continue;

            // 코덱/포맷 이름 건너뜀 (aac, libx264, mp4 등)
            if (arg.matches("^[a-z0-9_]+$")) continue;

            if (arg.contains("..")) {
                log.error("[PathValidator] 상대경로 탐색 시도 차단: {}", Diagnostics.truncate(arg, 50));
                throw new SecurityException("상대경로 접근 거부: " + Diagnostics.truncate(arg, 50));
            }

            if (arg.startsWith("/") && !arg.equals("/dev/null")) {
                validateAndGet(arg);
            }
        }
    }

    private static boolean startsWithAllowed(Path path) {
        for (Path allowed : ALLOWED_DIRECTORIES) {
            if (path.startsWith(allowed)) {
                return true;
            }
        }
        return false;
    }
}
