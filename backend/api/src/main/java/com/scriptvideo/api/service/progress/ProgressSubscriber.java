package com.scriptvideo.api.service.progress;

import com.scriptvideo.api.entity.ProgressEvent;

/**
 * 진행 이벤트 수신자 (구독자 전용 전달 작업에서 순서대로 호출됨)
 */
@FunctionalInterface
public interface ProgressSubscriber {

    void onEvent(ProgressEvent event);
}
