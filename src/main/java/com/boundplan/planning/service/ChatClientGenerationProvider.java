package com.boundplan.planning.service;

import com.boundplan.config.BoundPlanProperties;
import com.boundplan.planning.api.GenerationException;
import com.boundplan.planning.api.GenerationProvider;
import com.boundplan.planning.model.GenerationSettings;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * {@link GenerationProvider} over Spring AI chat clients. Each attempt runs under the resilience4j
 * {@link TimeLimiter} when a timeout is configured, attempts are repeated by {@link Retry}, and the
 * last failure surfaces as {@link GenerationException}.
 */
@Service
public class ChatClientGenerationProvider implements GenerationProvider {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final BoundPlanProperties properties;
    private final ExecutorService generationExecutor;
    private final Retry generationRetry;
    private final TimeLimiter generationTimeLimiter;

    public ChatClientGenerationProvider(
            ChatClient chatClient,
            @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
            BoundPlanProperties properties,
            ExecutorService generationExecutor,
            Retry generationRetry,
            TimeLimiter generationTimeLimiter) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
        this.generationExecutor = generationExecutor;
        this.generationRetry = generationRetry;
        this.generationTimeLimiter = generationTimeLimiter;
    }

    @Override
    public String generate(String prompt, String instructions, GenerationSettings settings) {
        Supplier<String> attempt = () -> callOnce(prompt, instructions, settings);
        try {
            return Retry.decorateSupplier(generationRetry, attempt).get();
        } catch (GenerationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new GenerationException("Generation failed after "
                    + generationRetry.getRetryConfig().getMaxAttempts() + " attempt(s)", ex);
        }
    }

    private String callOnce(String prompt, String instructions, GenerationSettings settings) {
        if (!properties.getGeneration().hasTimeout()) {
            return invoke(prompt, instructions, settings);
        }
        Callable<String> timed = TimeLimiter.decorateFutureSupplier(generationTimeLimiter,
                () -> CompletableFuture.supplyAsync(() -> invoke(prompt, instructions, settings), generationExecutor));
        try {
            return timed.call();
        } catch (TimeoutException ex) {
            throw new GenerationException("Generation timed out after " + properties.getGeneration().getTimeout(), ex);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting for generation", ex);
        } catch (Exception ex) {
            throw new GenerationException("Generation failed", ex);
        }
    }

    private String invoke(String prompt, String instructions, GenerationSettings settings) {
        String content = getChatRequestSpec(settings)
                .system(instructions)
                .user(prompt)
                .call()
                .content();
        return content != null ? content : "";
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec(GenerationSettings settings) {
        if (properties.getAiProvider() == BoundPlanProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new IllegalStateException("OpenAI provider is not properly configured. " +
                        "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            String model = properties.getOpenai().getModel();
            var options = OpenAiChatOptions.builder()
                    .temperature(settings.temperature())
                    .maxTokens(settings.maxOutputTokens())
                    .topP(settings.topP());
            if (StringUtils.hasText(model)) {
                options.model(model);
            }
            return openAiChatClient.prompt().options(options.build());
        }
        return chatClient.prompt().options(ChatOptions.builder()
                .temperature(settings.temperature())
                .maxTokens(settings.maxOutputTokens())
                .topP(settings.topP())
                .topK(settings.topK())
                .build());
    }
}
