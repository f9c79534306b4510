package com.scroll.stitch.controller;

import com.scroll.stitch.config.StitchProperties;
import com.scroll.stitch.core.image.ImageDecodeException;
import com.scroll.stitch.core.stitcher.StitchResult;
import com.scroll.stitch.dto.SequenceMatchRequest;
import com.scroll.stitch.dto.StitchRequest;
import com.scroll.stitch.service.StitchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 长截图拼接控制器
 * <p>
 * 两张图一次调用，服务端不保存会话；多张截图由调用方逐张累积调用
 */
@RestController
@RequestMapping("/api/stitch")
@Tag(name = "长截图拼接", description = "基于逐行指纹的滚动截图重叠检测与拼接（direct / smart）")
public class StitchController {
    private static final Logger logger = LoggerFactory.getLogger(StitchController.class);

    @Autowired
    private StitchService stitchService;

    @Autowired
    private StitchProperties properties;

    /**
     * 拼接两张图
     */
    @PostMapping
    @Operation(
            summary = "拼接两张滚动截图",
            description = """
                    image1 在上，image2 在下。宽度不同时 image1 缩放到 image2 的宽度。

                    **返回字段说明**：
                    | 字段 | 类型 | 说明 |
                    |------|------|------|
                    | image | string | 结果 PNG 的 Base64 |
                    | overlapFound | boolean | false 表示未找到重叠，结果为直接上下拼接 |
                    | overlap | object | image1 上为绝对行号的重叠区间 |
                    | keptFromImage1 | number | 保留 image1 的行数 |
                    | skippedFromImage2 | number | 跳过 image2 顶部的行数 |
                    | shrunk | boolean | smart 策略下所有候选都会让结果变矮、已退而采用最长候选 |
                    | candidates | array | smart 策略的候选评估明细 |
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "拼接成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "strategy": "smart",
                                                "image": "iVBORw0KGgo...",
                                                "width": 1280,
                                                "height": 1860,
                                                "overlapFound": true,
                                                "overlap": {"startInSeq1": 640, "startInSeq2": 0, "length": 480},
                                                "keptFromImage1": 1120,
                                                "skippedFromImage2": 480,
                                                "shrunk": false
                                              }
                                            }
                                            """
                            )
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "图片无法解码或参数非法",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "error",
                                              "message": "Failed to load image 2: unrecognised or corrupt image data"
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> stitch(@RequestBody StitchRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            StitchResult result = stitchService.stitch(request);
            if (!result.isSuccess()) {
                response.put("status", "error");
                response.put("message", result.getMessage());
                return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
            }
            response.put("status", "success");
            response.put("data", stitchService.describe(result));
            if (!result.isOverlapFound()) {
                response.put("message", result.getMessage());
            }
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException | ImageDecodeException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
        } catch (Exception e) {
            logger.error("Failed to stitch images", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 指纹序列匹配
     */
    @PostMapping("/match")
    @Operation(
            summary = "匹配两个指纹序列",
            description = """
                    不传 topK：返回单一最长公共区间（未达到 max(1, floor(min(len1,len2)*minRatio)) 时 found=false）。
                    传 topK：返回最多 topK 个互不显著重叠的候选区间，按长度降序。
                    """
    )
    public ResponseEntity<Map<String, Object>> match(@RequestBody SequenceMatchRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", stitchService.match(request));
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            response.remove("data");
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
        } catch (Exception e) {
            logger.error("Failed to match sequences", e);
            response.remove("data");
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 当前默认参数
     */
    @GetMapping("/config")
    @Operation(summary = "获取拼接默认参数", description = "返回 application.yml 中配置的默认策略和参数")
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> response = new HashMap<>();
        StitchProperties.StitchingConfig config = properties.getStitching();

        Map<String, Object> data = new HashMap<>();
        data.put("currentStrategy", stitchService.getDefaultStrategy());
        data.put("availableStrategies", List.of("direct", "smart"));
        data.put("ignoreRightPixels", config.getIgnoreRightPixels());
        data.put("minOverlapRatio", config.getMinOverlapRatio());
        data.put("smartMinOverlapRatio", config.getSmartMinOverlapRatio());
        data.put("topK", config.getTopK());

        response.put("status", "success");
        response.put("data", data);
        return ResponseEntity.ok(response);
    }
}
