package com.scriptvideo.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 스크립트 분석 결과 장면
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SceneDescription {
    private int index;              // 0부터 시작하는 장면 순서
    private String theme;
    private String visual;          // 화면 연출 제안 (이미지/클립 프롬프트)
    private String narration;       // 장면에 해당하는 스크립트 구간
    private double durationWeight;  // 장면 길이 가중치 (> 0)
}
