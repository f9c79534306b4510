package com.scroll.stitch.controller;

import com.scroll.stitch.core.image.ImageDecodeException;
import com.scroll.stitch.dto.HashCompareRequest;
import com.scroll.stitch.dto.HashRequest;
import com.scroll.stitch.dto.RowHashRequest;
import com.scroll.stitch.service.HashService;
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
import java.util.Map;
import java.util.function.Supplier;

/**
 * 图像指纹控制器
 * <p>
 * 提供整图感知哈希、指纹比较和逐行指纹接口
 */
@RestController
@RequestMapping("/api/hash")
@Tag(name = "图像指纹", description = "dHash / aHash / pHash 整图哈希、汉明距离比较、逐行指纹")
public class HashController {
    private static final Logger logger = LoggerFactory.getLogger(HashController.class);

    @Autowired
    private HashService hashService;

    /**
     * 单张图片整图哈希
     */
    @PostMapping("/image")
    @Operation(
            summary = "计算整图哈希",
            description = """
                    对单张图片计算 64 位感知哈希。

                    | 字段 | 类型 | 说明 |
                    |------|------|------|
                    | image | string | Base64 图片内容 |
                    | algorithm | string | dhash / ahash / phash，默认取配置 |
                    | hashSize | number | 默认 8；dhash/ahash 取 1-8，phash 取 2-32 |
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "计算成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "algorithm": "dhash",
                                                "hashSize": 8,
                                                "hash": "0f0f3c3c71e1c387",
                                                "value": 1085152265525904263
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> hashImage(@RequestBody HashRequest request) {
        return respond("hash image", () -> hashService.hashImage(request));
    }

    /**
     * 批量整图哈希
     */
    @PostMapping("/batch")
    @Operation(
            summary = "批量计算整图哈希",
            description = """
                    并行计算多张图片的哈希，结果顺序与输入一致。

                    **policy 说明**：
                    | 值 | 行为 |
                    |----|------|
                    | strict | 任一图片无法解码时整体返回 400（报告下标最小的错误）|
                    | lenient | 逐张返回结果，失败项 success=false，hash 为占位值 0000000000000000 |
                    """
    )
    public ResponseEntity<Map<String, Object>> batchHash(@RequestBody HashRequest request) {
        return respond("batch hash", () -> hashService.batchHash(request));
    }

    /**
     * 比较两个指纹
     */
    @PostMapping("/compare")
    @Operation(summary = "比较两个指纹", description = "返回汉明距离和相似度 1 - 距离 / (hashSize²)")
    public ResponseEntity<Map<String, Object>> compare(@RequestBody HashCompareRequest request) {
        return respond("compare hashes", () -> hashService.compare(request));
    }

    /**
     * 逐行指纹
     */
    @PostMapping("/rows")
    @Operation(
            summary = "计算逐行指纹",
            description = "每行 RGB 均值量化到 8 的倍数后组合成 64 位值；右侧 ignoreRightPixels 像素（滚动条）不参与，默认 20"
    )
    public ResponseEntity<Map<String, Object>> rowHashes(@RequestBody RowHashRequest request) {
        return respond("row hashes", () -> hashService.rowHashes(request));
    }

    private ResponseEntity<Map<String, Object>> respond(String action, Supplier<Map<String, Object>> work) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", work.get());
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException | ImageDecodeException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            response.remove("data");
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
        } catch (Exception e) {
            logger.error("Failed to {}", action, e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            response.remove("data");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }
}
