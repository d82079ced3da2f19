package ai.sturdy.patcher.repair;

import ai.sturdy.patcher.config.AssistantConfig;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks a LangChain4j {@link ChatModel} to clean up patch JSON or re-indent code before patching.
 * The assistant only produces text; its output goes through the regular parsing path.
 */
public class PatchRepairService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatchRepairService.class);
    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:\\w+)?\\s(.*?)```", Pattern.DOTALL);

    private final ChatModel model;
    private final AssistantConfig config;

    public PatchRepairService(ChatModel model, AssistantConfig config) {
        this.model = Objects.requireNonNull(model, "model");
        this.config = Objects.requireNonNull(config, "config");
    }

    public String repairPatch(String rawPatch) {
        return run(AssistTask.FIX_PATCH, rawPatch);
    }

    public String fixIndentation(String code) {
        return run(AssistTask.FIX_INDENT, code);
    }

    String run(AssistTask task, String input) {
        if (input == null || input.isBlank()) {
            throw new PatchRepairException(task + " input is empty");
        }
        String modelName = config.modelName().orElse("(unknown)");
        LOGGER.info("Running {} with model '{}'", task, modelName);
        List<ChatMessage> messages = List.of(
                SystemMessage.from(config.systemPrompt(task)),
                UserMessage.from(input));
        ChatResponse response;
        try {
            response = model.chat(ChatRequest.builder().messages(messages).build());
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new PatchRepairException("Model '%s' is not available.".formatted(modelName), ex);
            }
            throw new PatchRepairException(task + " request failed", ex);
        }
        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new PatchRepairException(task + " returned an empty response");
        }
        LOGGER.info("{} done", task);
        return extractFencedBody(text);
    }

    /**
     * Returns the stripped body of the first markdown code fence, or the text unchanged when it has none.
     */
    static String extractFencedBody(String text) {
        if (!text.contains("```")) {
            return text;
        }
        Matcher matcher = FENCED_BLOCK.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).strip();
        }
        return text;
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
