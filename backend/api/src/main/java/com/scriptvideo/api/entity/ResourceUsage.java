package com.scriptvideo.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUsage {
    private int modelRequestCount;
    private long unitsConsumed;
    private int retryCount;
    private long analysisMillis;
    private long assetMillis;
    private long composeMillis;
}
