package com.scriptvideo.api.mapper;

import com.scriptvideo.api.entity.Job;
import com.scriptvideo.common.enums.JobStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface JobMapper {

    void insert(Job job);

    Optional<Job> findById(String jobId);

    List<Job> findByStatuses(@Param("statuses") List<JobStatus> statuses);

    /**
     * 낙관적 잠금 갱신: job.version 이 현재 버전과 같을 때만 갱신하고 version 을 1 올린다.
     * @return 갱신된 행 수 (0이면 다른 스레드가 먼저 수정함)
     */
    int updateWithVersion(Job job);

    /**
     * 취소 요청 플래그 (종료 상태가 아닌 작업만)
     */
    int markCancelRequested(String jobId);
}
