package com.scriptvideo.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * 영상 생성 작업 상태
 *
 * PENDING → ANALYZING_SCRIPT → GENERATING_ASSETS → COMPOSING_VIDEO → COMPLETED
 * 비종료 상태에서는 언제든 FAILED / CANCELLED 로 전이 가능
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    PENDING("대기중", false),
    ANALYZING_SCRIPT("스크립트 분석중", false),
    GENERATING_ASSETS("에셋 생성중", false),
    COMPOSING_VIDEO("영상 합성중", false),
    COMPLETED("완료", true),
    FAILED("실패", true),
    CANCELLED("취소됨", true);

    private final String description;
    private final boolean terminal;

    /**
     * 다음 상태로 전이 가능한지 확인
     */
    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    public Set<JobStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(ANALYZING_SCRIPT, FAILED, CANCELLED);
            case ANALYZING_SCRIPT -> EnumSet.of(GENERATING_ASSETS, FAILED, CANCELLED);
            case GENERATING_ASSETS -> EnumSet.of(COMPOSING_VIDEO, FAILED, CANCELLED);
            case COMPOSING_VIDEO -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    /**
     * 파이프라인 단계 여부 (작업 중 상태)
     */
    public boolean isRunning() {
        return this == ANALYZING_SCRIPT || this == GENERATING_ASSETS || this == COMPOSING_VIDEO;
    }
}
