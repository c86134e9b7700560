package com.scriptvideo.api.service.ai;

/**
 * AI 모델 호출 경계
 * 모든 메서드는 호출 스레드에서 블로킹하며, 실패는 ModelException 으로 분류해서 던진다.
 * endpoint 는 카탈로그가 고정한 실제 모델명이며 구현체가 다른 모델로 바꿔 호출하지 않는다.
 */
public interface ModelProvider {

    /**
     * 텍스트 생성
     * @param json true 면 JSON 응답을 요청
     */
    ModelResponse<String> generateText(String endpoint, String prompt, boolean json) throws ModelException;

    /**
     * 이미지 생성 (PNG/JPEG 바이트)
     */
    ModelResponse<byte[]> generateImage(String endpoint, String prompt, String aspectRatio) throws ModelException;

    /**
     * 음성 합성 (16-bit PCM 24kHz mono)
     */
    ModelResponse<byte[]> synthesizeSpeech(String endpoint, String text, String voice) throws ModelException;

    /**
     * 영상 클립 생성 (MP4 바이트, 완료될 때까지 대기)
     */
    ModelResponse<byte[]> generateVideoClip(String endpoint, String prompt, int seconds, String aspectRatio)
            throws ModelException;
}
