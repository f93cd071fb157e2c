package com.example.reportcard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

/**
 * 分析接口跨域配置（前端页面直接上传成绩单）
 */
@Configuration
public class CorsConfig {

    /**
     * 允许的来源，逗号分隔
     */
    @Value("${report.cors.allowed-origins:*}")
    private String allowedOrigins;

    @Bean
    public CorsFilter corsFilter() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        CorsConfiguration config = new CorsConfiguration();

        for (String origin : allowedOrigins.split(",")) {
            if (!origin.trim().isEmpty()) {
                config.addAllowedOrigin(origin.trim());
            }
        }

        // 分析接口只有 POST
        config.addAllowedMethod("POST");
        config.addAllowedMethod("OPTIONS");
        config.addAllowedHeader("*");
        config.setAllowCredentials(false);
        config.setMaxAge(3600L);

        source.registerCorsConfiguration("/api/report/**", config);
        return new CorsFilter(source);
    }
}
