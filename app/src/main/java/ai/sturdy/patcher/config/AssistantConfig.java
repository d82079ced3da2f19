package ai.sturdy.patcher.config;

import ai.sturdy.patcher.repair.AssistTask;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the optional model-backed repair assistant.
 */
public record AssistantConfig(String baseUrl, Optional<String> modelName, Map<AssistTask, String> systemPrompts) {

    public AssistantConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        modelName = modelName == null ? Optional.empty() : modelName.filter(value -> !value.isBlank());
        Map<AssistTask, String> prompts = new EnumMap<>(AssistTask.class);
        for (AssistTask task : AssistTask.values()) {
            String override = systemPrompts == null ? null : systemPrompts.get(task);
            prompts.put(task, override == null || override.isBlank() ? task.defaultSystemPrompt() : override);
        }
        systemPrompts = Map.copyOf(prompts);
    }

    public String systemPrompt(AssistTask task) {
        return systemPrompts.get(Objects.requireNonNull(task, "task"));
    }

    public String requireModelName() {
        return modelName.orElseThrow(() -> new IllegalStateException(
                "LLM_MODEL or --model must be provided to use the repair assistant"));
    }
}
