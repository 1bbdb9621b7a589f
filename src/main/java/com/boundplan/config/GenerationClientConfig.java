package com.boundplan.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class GenerationClientConfig {

    @Bean
    @Primary
    public ChatClient chatClient(GoogleGenAiChatModel googleGenAiChatModel) {
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    /**
     * Only present when the OpenAI starter produced a model, i.e. an API key or base URL is set.
     */
    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        OpenAiChatModel openAiChatModel = openAiChatModelProvider.getIfAvailable();
        if (openAiChatModel == null) {
            log.info("No OpenAI chat model configured; the OPENAI provider is unavailable.");
            return null;
        }
        return ChatClient.builder(openAiChatModel).build();
    }

    /**
     * Runs generation calls when a timeout is configured, so the caller can stop waiting.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService generationExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public Retry generationRetry(BoundPlanProperties properties) {
        BoundPlanProperties.GenerationPolicy policy = properties.getGeneration();
        Duration backoff = policy.getBackoff().isNegative() ? Duration.ZERO : policy.getBackoff();
        Retry retry = Retry.of("generation", RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .waitDuration(backoff)
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("Generation attempt {}/{} failed: {}",
                event.getNumberOfRetryAttempts(), policy.getMaxAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    /**
     * Bounds a single generation attempt. Only consulted when a positive timeout is configured.
     */
    @Bean
    public TimeLimiter generationTimeLimiter(BoundPlanProperties properties) {
        BoundPlanProperties.GenerationPolicy policy = properties.getGeneration();
        Duration timeout = policy.hasTimeout()
                ? policy.getTimeout()
                : TimeLimiterConfig.ofDefaults().getTimeoutDuration();
        return TimeLimiter.of("generation", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }
}
