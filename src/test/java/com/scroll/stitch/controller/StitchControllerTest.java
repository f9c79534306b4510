package com.scroll.stitch.controller;

import com.scroll.stitch.config.StitchProperties;
import com.scroll.stitch.core.image.ImageDecodeException;
import com.scroll.stitch.core.stitcher.StitchResult;
import com.scroll.stitch.service.HashService;
import com.scroll.stitch.service.StitchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 拼接接口的响应格式与错误码
 */
@WebMvcTest(StitchController.class)
public class StitchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StitchService stitchService;

    @MockBean
    private HashService hashService;

    @MockBean
    private StitchProperties properties;

    @Test
    @DisplayName("Should wrap a successful stitch in the success envelope")
    void stitch_Success_Returns200() throws Exception {
        StitchResult result = new StitchResult.Builder().strategy("smart").message("Stitched").build();
        when(stitchService.stitch(any())).thenReturn(result);
        when(stitchService.describe(result)).thenReturn(Map.of("strategy", "smart", "height", 140));

        mockMvc.perform(post("/api/stitch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image1\":\"AAAA\",\"image2\":\"BBBB\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data.height").value(140));
    }

    @Test
    @DisplayName("Should return 400 when an image cannot be decoded")
    void stitch_FailureResult_Returns400() throws Exception {
        when(stitchService.stitch(any()))
                .thenReturn(StitchResult.failure("direct", "Failed to load image 2: empty buffer"));

        mockMvc.perform(post("/api/stitch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image1\":\"AAAA\",\"image2\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Failed to load image 2: empty buffer"));
    }

    @Test
    @DisplayName("Should map request errors to 400 and unexpected errors to 500")
    void stitch_Exceptions_MappedToStatus() throws Exception {
        doThrow(new IllegalArgumentException("Invalid strategy: x")).when(stitchService).stitch(any());
        mockMvc.perform(post("/api/stitch").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid strategy: x"));

        doThrow(new ImageDecodeException("Failed to load image1: invalid Base64 content")).when(stitchService).stitch(any());
        mockMvc.perform(post("/api/stitch").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());

        doThrow(new IllegalStateException("OpenCV native library unavailable")).when(stitchService).stitch(any());
        mockMvc.perform(post("/api/stitch").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    @DisplayName("Should match sequences through the match endpoint")
    void match_ReturnsRun() throws Exception {
        when(stitchService.match(any())).thenReturn(Map.of("found", true));

        mockMvc.perform(post("/api/stitch/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"seq1\":[1,2,3,4,5],\"seq2\":[4,5,6,7]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.found").value(true));
    }

    @Test
    @DisplayName("Should expose the configured defaults")
    void getConfig_ReturnsDefaults() throws Exception {
        when(properties.getStitching()).thenReturn(new StitchProperties.StitchingConfig());
        when(stitchService.getDefaultStrategy()).thenReturn("smart");

        mockMvc.perform(get("/api/stitch/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.currentStrategy").value("smart"))
                .andExpect(jsonPath("$.data.ignoreRightPixels").value(20))
                .andExpect(jsonPath("$.data.topK").value(5))
                .andExpect(jsonPath("$.data.availableStrategies[1]").value("smart"));
    }
}
