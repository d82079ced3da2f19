package ai.sturdy.patcher.repair;

/**
 * Text tasks the repair assistant can run, each with its default system prompt.
 */
public enum AssistTask {
    FIX_PATCH("""
            You are a strict JSON formatting tool. \
            The user will provide a code patch that might be malformed, contain comments, or be wrapped in markdown. \
            Output ONLY valid JSON matching this schema:
            { 'hunks': [ { 'description': '...', 'search_block': '...', 'replace_block': '...' } ] }
            Do not output markdown backticks. Do not output explanations. Output ONLY the raw JSON string."""),
    FIX_INDENT("""
            You are an indentation repair tool. \
            The user will provide code with broken or mixed indentation. \
            Return the exact same code logic, but fix the indentation to use consistent 4 spaces. \
            Do not change variable names or logic. Return ONLY the code.""");

    private final String defaultSystemPrompt;

    AssistTask(String defaultSystemPrompt) {
        this.defaultSystemPrompt = defaultSystemPrompt;
    }

    public String defaultSystemPrompt() {
        return defaultSystemPrompt;
    }
}
