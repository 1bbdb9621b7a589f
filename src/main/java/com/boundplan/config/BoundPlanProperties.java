package com.boundplan.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "boundplan")
public class BoundPlanProperties {

    private String module = "workflow";
    private String domain = "eligibility";
    private String defaultStrategy = "TABULA_RASA";
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();
    private GenerationPolicy generation = new GenerationPolicy();
    private ProfileDirectoryConfig profiles = new ProfileDirectoryConfig();
    private List<ToolConfig> tools = new ArrayList<>();
    private List<PromptConfig> prompts = new ArrayList<>();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class OpenAIConfig {
        private String model;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    /**
     * Retry and timeout policy around a single generation call. The defaults make one attempt
     * and wait indefinitely.
     */
    public static class GenerationPolicy {
        private int maxAttempts = 1;
        private Duration backoff = Duration.ofMillis(500);
        private Duration timeout = Duration.ZERO;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = Math.max(1, maxAttempts); }
        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff != null ? backoff : Duration.ZERO; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout != null ? timeout : Duration.ZERO; }

        public boolean hasTimeout() {
            return !timeout.isZero() && !timeout.isNegative();
        }
    }

    public static class ProfileDirectoryConfig {
        private boolean enrichmentEnabled = true;
        private String baseUrl = "http://localhost:8000/api/user-profiles";

        public boolean isEnrichmentEnabled() { return enrichmentEnabled; }
        public void setEnrichmentEnabled(boolean enrichmentEnabled) { this.enrichmentEnabled = enrichmentEnabled; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    /**
     * A statically configured tool. {@code inputSchema} is a JSON schema document, read the same
     * way as the schemas MCP servers publish.
     */
    public static class ToolConfig {
        private String name;
        private String description;
        private String inputSchema;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getInputSchema() { return inputSchema; }
        public void setInputSchema(String inputSchema) { this.inputSchema = inputSchema; }
    }

    /**
     * A generation template bound to one {@code module:domain:mode:step} key.
     */
    public static class PromptConfig {
        private String module = "workflow";
        private String domain = "eligibility";
        private String mode = "TABULA_RASA";
        private String step;
        private boolean active = true;
        private String role;
        private String context;
        private String analysis;
        private List<String> constraints = new ArrayList<>();
        private String outputFormat;
        private Double temperature;
        private Integer maxOutputTokens;
        private Double topP;
        private Integer topK;

        public String getModule() { return module; }
        public void setModule(String module) { this.module = module; }
        public String getDomain() { return domain; }
        public void setDomain(String domain) { this.domain = domain; }
        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public String getStep() { return step; }
        public void setStep(String step) { this.step = step; }
        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }
        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getContext() { return context; }
        public void setContext(String context) { this.context = context; }
        public String getAnalysis() { return analysis; }
        public void setAnalysis(String analysis) { this.analysis = analysis; }
        public List<String> getConstraints() { return constraints; }
        public void setConstraints(List<String> constraints) {
            this.constraints = constraints != null ? constraints : new ArrayList<>();
        }
        public String getOutputFormat() { return outputFormat; }
        public void setOutputFormat(String outputFormat) { this.outputFormat = outputFormat; }
        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }
        public Integer getMaxOutputTokens() { return maxOutputTokens; }
        public void setMaxOutputTokens(Integer maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }
        public Double getTopP() { return topP; }
        public void setTopP(Double topP) { this.topP = topP; }
        public Integer getTopK() { return topK; }
        public void setTopK(Integer topK) { this.topK = topK; }
    }

    public String getModule() {
        return module;
    }

    public void setModule(String module) {
        this.module = module;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public String getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(String defaultStrategy) {
        if (defaultStrategy == null || defaultStrategy.isBlank()) {
            return;
        }
        this.defaultStrategy = defaultStrategy;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai != null ? openai : new OpenAIConfig();
    }

    public GenerationPolicy getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationPolicy generation) {
        this.generation = generation != null ? generation : new GenerationPolicy();
    }

    public ProfileDirectoryConfig getProfiles() {
        return profiles;
    }

    public void setProfiles(ProfileDirectoryConfig profiles) {
        this.profiles = profiles != null ? profiles : new ProfileDirectoryConfig();
    }

    public List<ToolConfig> getTools() {
        return tools;
    }

    public void setTools(List<ToolConfig> tools) {
        this.tools = tools != null ? new ArrayList<>(tools) : new ArrayList<>();
    }

    public List<PromptConfig> getPrompts() {
        return prompts;
    }

    public void setPrompts(List<PromptConfig> prompts) {
        this.prompts = prompts != null ? new ArrayList<>(prompts) : new ArrayList<>();
    }
}
