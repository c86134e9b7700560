package com.scriptvideo.api.controller;

import com.scriptvideo.api.dto.VideoDto;
import com.scriptvideo.api.entity.GeneratedVideo;
import com.scriptvideo.api.service.job.JobStore;
import com.scriptvideo.api.util.PathValidator;
import com.scriptvideo.common.dto.ApiResponse;
import com.scriptvideo.common.exception.ApiException;
import com.scriptvideo.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/videos")
@Tag(name = "Video", description = "생성 영상 조회 및 스트리밍 API")
public class VideoController {

    private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

    private final JobStore jobStore;

    @GetMapping("/{videoId}")
    @Operation(summary = "영상 정보", description = "생성된 영상의 길이, 해상도, 크기를 조회합니다.")
    public ApiResponse<VideoDto.VideoResponse> getVideo(@PathVariable String videoId) {
        return ApiResponse.success(VideoDto.VideoResponse.from(findVideo(videoId)));
    }

    /**
     * Range 요청은 Spring MVC 가 206 Partial Content 로 응답한다.
     */
    @GetMapping("/{videoId}/stream")
    @Operation(summary = "영상 스트리밍", description = "MP4 파일을 바이트 범위(Range) 요청으로 내려받습니다.")
    public ResponseEntity<Resource> stream(@PathVariable String videoId) {
        GeneratedVideo video = findVideo(videoId);
        Path path;
        try {
            path = PathValidator.validateAndGet(video.getFilePath());
        } catch (SecurityException e) {
            log.error("[Video] Rejected file path - videoId: {}, reason: {}", videoId, e.getMessage());
            throw new ApiException(ErrorCode.VIDEO_NOT_FOUND, "영상 파일에 접근할 수 없습니다: " + videoId);
        }
        if (!Files.isRegularFile(path)) {
            throw new ApiException(ErrorCode.VIDEO_NOT_FOUND, "영상 파일이 삭제되었습니다: " + videoId);
        }

        return ResponseEntity.ok()
                .contentType(VIDEO_MP4)
                .header(HttpHeaders.ACCEPT_RANGES, "bytes")
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + videoId + ".mp4\"")
                .body(new FileSystemResource(path));
    }

    private GeneratedVideo findVideo(String videoId) {
        return jobStore.findVideo(videoId)
                .orElseThrow(() -> new ApiException(ErrorCode.VIDEO_NOT_FOUND, "영상을 찾을 수 없습니다: " + videoId));
    }
}
