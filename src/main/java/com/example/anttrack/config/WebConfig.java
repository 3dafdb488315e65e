package com.example.anttrack.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.nio.file.Path;
import java.util.Arrays;

import static org.springframework.web.reactive.function.server.RequestPredicates.GET;
import static org.springframework.web.reactive.function.server.RouterFunctions.route;

@Configuration
@RequiredArgsConstructor
public class WebConfig {

    private final FileStorageConfig storageConfig;

    @Bean
    public CorsWebFilter corsWebFilter() {
        CorsConfiguration corsConfig = new CorsConfiguration();
        corsConfig.setAllowedOrigins(Arrays.asList(
                "http://localhost:3000",
                "http://localhost:8080",
                "http://127.0.0.1:8080",
                "http://localhost:5173"
        ));
        corsConfig.setAllowedMethods(Arrays.asList("GET", "POST", "OPTIONS", "HEAD"));
        corsConfig.setAllowedHeaders(Arrays.asList("Content-Type", "Accept", "Origin", "X-Requested-With"));
        corsConfig.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", corsConfig);
        return new CorsWebFilter(source);
    }

    /**
     * 分析输出（CSV、背景模型）的静态访问
     */
    @Bean
    public RouterFunction<ServerResponse> outputRouter() {
        return route(GET("/outputs/**"), request -> {
            String relative = request.path().substring("/outputs/".length());
            Path root = storageConfig.getOutputPath().toAbsolutePath().normalize();
            Path file = root.resolve(relative).normalize();
            if (!file.startsWith(root)) {
                return ServerResponse.badRequest().build();
            }

            Resource resource = new FileSystemResource(file);
            if (resource.exists() && resource.isReadable()) {
                return ServerResponse.ok()
                        .contentType(getMediaType(relative))
                        .header("Cache-Control", "no-cache")
                        .bodyValue(resource);
            }
            return ServerResponse.notFound().build();
        });
    }

    // 根据文件扩展名确定MIME类型
    private MediaType getMediaType(String fileName) {
        String extension = fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase();
        switch (extension) {
            case "csv":
                return MediaType.parseMediaType("text/csv");
            case "json":
                return MediaType.APPLICATION_JSON;
            case "png":
                return MediaType.IMAGE_PNG;
            case "jpg":
            case "jpeg":
                return MediaType.IMAGE_JPEG;
            default:
                return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
