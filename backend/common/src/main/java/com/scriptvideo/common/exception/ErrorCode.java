package com.scriptvideo.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "잘못된 요청입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C005", "리소스를 찾을 수 없습니다."),

    // Validation (제출 시점, 동기)
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "J001", "작업 요청 검증에 실패했습니다."),
    UNKNOWN_MODEL(HttpStatus.BAD_REQUEST, "J002", "알 수 없는 모델입니다."),
    UNSUPPORTED_ASSET_TYPE(HttpStatus.BAD_REQUEST, "J003", "모델이 지원하지 않는 에셋 유형입니다."),
    SCRIPT_NOT_FOUND(HttpStatus.BAD_REQUEST, "J004", "스크립트를 찾을 수 없습니다."),

    // Job
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "J010", "작업을 찾을 수 없습니다."),
    JOB_ALREADY_FINISHED(HttpStatus.CONFLICT, "J011", "이미 종료된 작업입니다."),
    JOB_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "J012", "작업 최대 실행 시간을 초과했습니다."),
    JOB_INTERRUPTED(HttpStatus.INTERNAL_SERVER_ERROR, "J013", "서버 재시작으로 작업이 중단되었습니다."),
    ASSET_COUNT_MISMATCH(HttpStatus.INTERNAL_SERVER_ERROR, "J014", "생성된 에셋 수가 요청과 다릅니다."),

    // AI Model
    MODEL_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "A001", "AI 서비스를 사용할 수 없습니다."),
    MODEL_RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "A002", "AI 서비스 요청 한도를 초과했습니다."),
    MODEL_CONTENT_POLICY(HttpStatus.BAD_REQUEST, "A005", "콘텐츠 안전 정책에 의해 요청이 거부되었습니다."),
    MODEL_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "A004", "AI 서비스 응답 시간이 초과되었습니다."),
    MODEL_MALFORMED_RESPONSE(HttpStatus.BAD_GATEWAY, "A006", "AI 서비스 응답 형식이 올바르지 않습니다."),

    // Composition
    VIDEO_COMPOSITION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "V005", "영상 합성에 실패했습니다."),
    VIDEO_COMPOSITION_NO_SCENES(HttpStatus.BAD_REQUEST, "V051", "합성할 장면이 없습니다."),
    VIDEO_FFMPEG_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "V052", "FFmpeg 처리에 실패했습니다."),
    VIDEO_UNSUPPORTED_CODEC(HttpStatus.INTERNAL_SERVER_ERROR, "V054", "지원하지 않는 코덱입니다."),
    VIDEO_DURATION_MISMATCH(HttpStatus.INTERNAL_SERVER_ERROR, "V055", "합성 결과 길이가 목표 길이와 다릅니다."),
    VIDEO_NOT_FOUND(HttpStatus.NOT_FOUND, "V006", "영상을 찾을 수 없습니다."),

    // Storage
    STORAGE_QUOTA_EXCEEDED(HttpStatus.INSUFFICIENT_STORAGE, "S001", "저장 공간 할당량을 초과했습니다."),
    STORAGE_IO_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "S002", "파일 저장에 실패했습니다."),

    // Consistency (내부 결함)
    ILLEGAL_STATE_TRANSITION(HttpStatus.INTERNAL_SERVER_ERROR, "X001", "허용되지 않은 상태 전이입니다."),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, "X002", "작업이 동시에 수정되었습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
