package com.scriptvideo.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * AI 모델 호출 실패 분류
 * TIMEOUT, RATE_LIMITED 만 일시적 오류로 보고 재시도한다.
 */
@Getter
@RequiredArgsConstructor
public enum ModelErrorKind {

    UNAVAILABLE(false),
    RATE_LIMITED(true),
    CONTENT_POLICY_REJECTED(false),
    TIMEOUT(true),
    MALFORMED_RESPONSE(false);

    private final boolean retryable;
}
