package com.scriptvideo.api.service.compose;

import java.nio.file.Path;
import java.util.List;

/**
 * 외부 인코더 경계
 */
public interface MediaEncoder {

    /**
     * 인코더 실행 (실행 파일 이름 제외 인자, 마지막 인자가 출력 파일)
     * @param taskName 로그/진단용 작업 이름
     */
    void encode(List<String> args, String taskName) throws CompositionException;

    /**
     * 미디어 길이 (초)
     */
    double probeDuration(Path media) throws CompositionException;
}
