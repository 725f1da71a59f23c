package com.server.skillsync.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 用户服务与项目服务的访问配置
 * 每次调用都带连接超时和读取超时，超时视为协作服务不可用
 */
@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "collaborator")
public class CollaboratorConfig {

    private static final Logger logger = LoggerFactory.getLogger(CollaboratorConfig.class);

    private String userServiceUrl = "http://localhost:3002";

    private String projectServiceUrl = "http://localhost:3003";

    private Duration connectTimeout = Duration.ofSeconds(2);

    private Duration readTimeout = Duration.ofSeconds(5);

    @Bean
    public RestTemplate collaboratorRestTemplate(RestTemplateBuilder builder) {
        RestTemplate restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .additionalInterceptors(loggingInterceptor())
                .build();
        logger.info("协作服务 HTTP 客户端已创建，连接超时: {}, 读取超时: {}", connectTimeout, readTimeout);
        return restTemplate;
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            logger.debug("协作服务调用: {} {} - 状态: {} - 耗时: {}ms",
                    request.getMethod(), request.getURI(), response.getStatusCode(),
                    System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
