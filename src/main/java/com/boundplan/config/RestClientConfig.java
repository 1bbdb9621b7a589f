package com.boundplan.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // BufferingClientHttpRequestFactory allows multiple reads of the response body
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    @Bean
    public RestClient profileDirectoryRestClient(RestClient.Builder restClientBuilder, BoundPlanProperties properties) {
        return restClientBuilder
                .baseUrl(properties.getProfiles().getBaseUrl())
                .build();
    }

    /**
     * Profile payloads carry personal data, so bodies are only written at TRACE.
     */
    private static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.boundplan.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            httpLogger.debug("HTTP {} {}", request.getMethod(), request.getURI());
            if (httpLogger.isTraceEnabled() && body.length > 0) {
                httpLogger.trace("Request body: {}", new String(body, StandardCharsets.UTF_8));
            }
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(request, response);
            return response;
        }

        private void logResponse(HttpRequest request, ClientHttpResponse response) throws IOException {
            try {
                httpLogger.debug("HTTP {} {} -> {}", request.getMethod(), request.getURI(), response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("HTTP {} {} -> status unknown", request.getMethod(), request.getURI());
            }
            if (httpLogger.isTraceEnabled()) {
                byte[] body = StreamUtils.copyToByteArray(response.getBody());
                if (body.length > 0) {
                    httpLogger.trace("Response body: {}", new String(body, StandardCharsets.UTF_8));
                }
            }
        }
    }
}
