package com.scroll.stitch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI scrollStitchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Scroll Stitch API")
                        .description("""
                                滚动长截图指纹与拼接服务 API 文档

                                ## 功能概述

                                不依赖特征点，只用像素统计得到的粗粒度指纹判断两张滚动截图是否重叠，并无缝拼接。

                                ### 核心功能
                                - **整图哈希**：dHash / aHash / pHash，支持批量并行
                                - **行指纹**：逐行颜色均值量化，可排除右侧滚动条
                                - **序列匹配**：最长公共区间 / 多候选区间
                                - **拼接**：direct（最长重叠）与 smart（多候选纠错，结果不缩短）

                                ### 拼接策略说明
                                | 策略 | 说明 | 默认最小重叠比例 |
                                |------|------|------------------|
                                | `direct` | 取底部窗口内最长的公共区间 | 0.1 |
                                | `smart` | 前 5 个候选中取第一个不会让结果变矮的 | 0.01 |

                                ### 图像传输
                                请求中的图片均为 Base64 编码的图片文件内容（PNG/JPEG/BMP...），结果固定为 PNG。

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Scroll Stitch Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有 POST 接口补充统一的响应格式
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> {
            if (openApi.getPaths() == null) {
                return;
            }
            openApi.getPaths().forEach((path, pathItem) -> {
                if (pathItem.getPost() != null) {
                    pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
                }
            });
        };
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("Failed to load image 1: unrecognised or corrupt image data")
        ));

        return new ApiResponse()
                .description("请求错误（参数非法或图片无法解码）")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
