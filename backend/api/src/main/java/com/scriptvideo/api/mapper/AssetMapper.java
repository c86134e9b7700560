package com.scriptvideo.api.mapper;

import com.scriptvideo.api.entity.Asset;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;
import java.util.Optional;

@Mapper
public interface AssetMapper {

    void insert(Asset asset);

    Optional<Asset> findById(String assetId);

    /**
     * 장면 순서, 생성 순서로 정렬
     */
    List<Asset> findByJobId(String jobId);

    int countByJobId(String jobId);
}
