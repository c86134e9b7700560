package com.scriptvideo.api.controller;

import com.jayway.jsonpath.JsonPath;
import com.scriptvideo.api.IntegrationTestSupport;
import com.scriptvideo.api.entity.GeneratedVideo;
import com.scriptvideo.api.entity.Job;
import com.scriptvideo.common.enums.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class JobControllerTest extends IntegrationTestSupport {

    private static final String VALID_REQUEST = """
            {
              "script_content": "새벽 시장의 하루",
              "asset_types": ["IMAGE"],
              "num_assets": 2,
              "model": "model-a",
              "resolution": "640x360",
              "duration_seconds": 10,
              "quality": "draft"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void submittedJobCanBeFollowedToItsVideo() throws Exception {
        when(modelProvider.generateText(eq("text-a"), anyString(), eq(true))).thenReturn(text(scenesJson(2)));
        when(modelProvider.generateImage(eq("image-a"), anyString(), anyString())).thenReturn(image());

        MvcResult result = mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_REQUEST))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andReturn();
        String jobId = JsonPath.read(result.getResponse().getContentAsString(), "$.data.jobId");

        Job job = awaitTerminal(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        GeneratedVideo video = jobStore.findVideoByJob(jobId).orElseThrow();

        mockMvc.perform(get("/api/jobs/{jobId}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("COMPLETED"))
                .andExpect(jsonPath("$.data.progressPercentage").value(100))
                .andExpect(jsonPath("$.data.videoId").value(video.getVideoId()))
                .andExpect(jsonPath("$.data.compositionSettings.resolution").value("640x360"));

        mockMvc.perform(get("/api/jobs/{jobId}/assets", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].sceneIndex").value(0));

        mockMvc.perform(get("/api/jobs/{jobId}/events", jobId).param("afterSequence", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].sequenceNumber").value(2))
                .andExpect(jsonPath("$.data[*].stage", hasItem("COMPLETED")));

        // 종료된 작업의 스트림은 보관 이벤트를 재전송하고 바로 닫힌다
        String stream = mockMvc.perform(get("/api/jobs/{jobId}/events/stream", jobId)
                        .header("Last-Event-ID", "1"))
                .andReturn().getResponse().getContentAsString();
        assertThat(stream).contains("event:progress").contains("id:2").doesNotContain("id:1\n")
                .contains("\"stage\":\"COMPLETED\"");

        mockMvc.perform(get("/api/videos/{videoId}", video.getVideoId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.streamUrl").value("/api/videos/" + video.getVideoId() + "/stream"));

        mockMvc.perform(get("/api/videos/{videoId}/stream", video.getVideoId()))
                .andExpect(status().isOk())
                .andExpect(content().contentType("video/mp4"));

        mockMvc.perform(post("/api/jobs/{jobId}/cancel", jobId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("J011"));
    }

    @Test
    void missingFieldsAreListed() throws Exception {
        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"script_content\": \"내용\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("J001"))
                .andExpect(jsonPath("$.data", not(empty())));
    }

    @Test
    void unknownModelIsRejected() throws Exception {
        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_REQUEST.replace("model-a", "no-such-model")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("J002"));
    }

    @Test
    void unreadableBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C002"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/jobs/{jobId}", "no-such-job"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("J010"));

        mockMvc.perform(post("/api/jobs/{jobId}/cancel", "no-such-job"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/videos/{videoId}", "no-such-video"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("V006"));
    }

    @Test
    void modelsAreListed() throws Exception {
        mockMvc.perform(get("/api/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].modelId", hasItem("model-a")))
                .andExpect(jsonPath("$.data[*].modelId", hasItem("model-text-only")));
    }

    @Test
    void storageUsageIsReported() throws Exception {
        mockMvc.perform(get("/api/storage/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.basePath").isNotEmpty())
                .andExpect(jsonPath("$.data.areas").isArray());
    }
}
