package com.server.skillsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.server.skillsync.collaborator.UserProfileClient;
import com.server.skillsync.match.exception.CollaboratorUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 用真实的 socket 验证协作服务客户端的超时设置生效
 * 服务端只完成 TCP 握手，从不返回响应
 */
@DisplayName("协作服务 HTTP 客户端超时")
class CollaboratorConfigTest {

    private ServerSocket silentServer;

    @BeforeEach
    void setUp() throws IOException {
        silentServer = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown() throws IOException {
        silentServer.close();
    }

    @Test
    @DisplayName("服务端不响应时在读取超时后失败，而不是一直阻塞")
    void readTimeoutIsApplied() {
        CollaboratorConfig config = new CollaboratorConfig();
        config.setConnectTimeout(Duration.ofMillis(500));
        config.setReadTimeout(Duration.ofMillis(300));
        config.setUserServiceUrl("http://127.0.0.1:" + silentServer.getLocalPort());
        RestTemplate restTemplate = config.collaboratorRestTemplate(new RestTemplateBuilder());
        UserProfileClient client = new UserProfileClient(restTemplate, new ObjectMapper(), config);

        long startTime = System.currentTimeMillis();
        assertThatThrownBy(() -> client.getUser("u1"))
                .isInstanceOf(CollaboratorUnavailableException.class);
        long elapsed = System.currentTimeMillis() - startTime;

        assertThat(elapsed).isGreaterThanOrEqualTo(250).isLessThan(4000);
    }
}
