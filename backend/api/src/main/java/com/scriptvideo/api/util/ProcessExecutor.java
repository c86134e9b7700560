package com.scriptvideo.api.util;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 외부 프로세스 실행 유틸리티
 * - 출력은 별도 스레드에서 읽고 마지막 N줄만 보관 (FFmpeg 에러는 출력 끝에 찍힘)
 * - 타임아웃 시 강제 종료
 * - 보안 검증 (PathValidator 연동)
 */
@Slf4j
public class ProcessExecutor {

    private static final int MAX_OUTPUT_LINES = 400;

    private ProcessExecutor() {
    }

    /**
     * 명령어 실행 결과
     */
    public static class Result {
        private final int exitCode;
        private final String output;

        public Result(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }

        public int getExitCode() {
            return exitCode;
        }

        public String getOutput() {
            return output;
        }

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    /**
     * 명령어 실행 (타임아웃 지정)
     * @param command 실행할 명령어 리스트 (첫 번째 요소는 실행 파일)
     * @param taskName 작업 이름 (로깅용)
     * @return 실행 결과 (종료 코드 + 출력 마지막 부분)
     */
    public static Result execute(List<String> command, String taskName, long timeout, TimeUnit unit)
            throws IOException, InterruptedException, TimeoutException {

        String joined = String.join(" ", command);
        log.debug("[ProcessExecutor] Starting {}: {}", taskName, joined.substring(0, Math.min(300, joined.length())));

        PathValidator.validateCommandArgs(command.subList(1, command.size()));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        Deque<String> tail = new ArrayDeque<>();
        Thread reader = new Thread(() -> drain(process, tail, taskName), "proc-out-" + taskName);
        reader.setDaemon(true);
        reader.start();

        boolean completed = process.waitFor(timeout, unit);

        if (!completed) {
            process.destroyForcibly();
            log.error("[ProcessExecutor] {} TIMEOUT after {} {}", taskName, timeout, unit);
            throw new TimeoutException("Process timeout: " + taskName + " (" + timeout + " " + unit + ")");
        }

        reader.join(TimeUnit.SECONDS.toMillis(5));
        String output;
        synchronized (tail) {
            output = String.join("\n", tail);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.warn("[ProcessExecutor] {} failed with exit code {}", taskName, exitCode);
            log.debug("[ProcessExecutor] {} output: {}", taskName, Diagnostics.forLog(output));
        } else {
            log.debug("[ProcessExecutor] {} completed successfully", taskName);
        }

        return new Result(exitCode, output);
    }

    private static void drain(Process process, Deque<String> tail, String taskName) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (tail) {
                    if (tail.size() == MAX_OUTPUT_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                }
                log.trace("[ProcessExecutor] {}: {}", taskName, line);
            }
        } catch (IOException e) {
            log.debug("[ProcessExecutor] {} output stream closed: {}", taskName, e.getMessage());
        }
    }
}
