package com.scriptvideo.api.mapper;

import com.scriptvideo.api.entity.GeneratedVideo;
import org.apache.ibatis.annotations.Mapper;

import java.util.Optional;

@Mapper
public interface GeneratedVideoMapper {

    void insert(GeneratedVideo video);

    Optional<GeneratedVideo> findById(String videoId);

    Optional<GeneratedVideo> findByJobId(String jobId);
}
