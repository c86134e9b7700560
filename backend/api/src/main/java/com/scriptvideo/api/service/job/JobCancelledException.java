package com.scriptvideo.api.service.job;

import com.scriptvideo.common.enums.JobStatus;
import lombok.Getter;

/**
 * 취소 요청이 확인된 지점에서 워커가 단계를 빠져나오기 위한 예외
 */
@Getter
public class JobCancelledException extends Exception {

    private final String jobId;
    private final JobStatus stage;

    public JobCancelledException(String jobId, JobStatus stage) {
        super("Job " + jobId + " cancelled at " + stage);
        this.jobId = jobId;
        this.stage = stage;
    }
}
