package ai.sturdy.patcher.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.sturdy.patcher.config.AssistantConfig;
import ai.sturdy.patcher.config.ConfigLoader;
import ai.sturdy.patcher.writer.SessionLogWriter;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String RENAME_PATCH = """
            {"hunks": [{"description": "Rename", "search_block": "bar", "replace_block": "baz"}]}
            """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void writesPatchedFileNextToSourceWithVersionSuffix() throws IOException {
        Path source = write("sample.txt", "foo\nbar\n");
        Path patch = write("patch.json", RENAME_PATCH);

        int exitCode = application(unusedModel()).run(new String[] {"--file", source.toString(), "--patch", patch.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(tempDir.resolve("sample_v0.0.txt"))).isEqualTo("foo\nbaz\n");
        assertThat(Files.readString(source)).isEqualTo("foo\nbar\n");
    }

    @Test
    void secondRunCreatesNextVersion() throws IOException {
        Path source = write("sample.txt", "foo\nbar\n");
        Path patch = write("patch.json", RENAME_PATCH);
        String[] args = {"--file", source.toString(), "--patch", patch.toString()};

        application(unusedModel()).run(args);
        int exitCode = application(unusedModel()).run(args);

        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("sample_v0.1.txt")).exists();
    }

    @Test
    void printsPatchedTextToStdout() throws IOException {
        Path source = write("sample.txt", "foo\r\nbar\r\n");
        Path patch = write("patch.json", RENAME_PATCH);

        int exitCode = application(unusedModel()).run(new String[] {
                "--file", source.toString(), "--patch", patch.toString(), "--stdout"});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("foo\r\nbaz\r\n");
        assertThat(tempDir.resolve("sample_v0.0.txt")).doesNotExist();
    }

    @Test
    void failsWithoutOutputWhenHunkIsAmbiguous() throws IOException {
        Path source = write("sample.txt", "bar\nbar\n");
        Path patch = write("patch.json", RENAME_PATCH);

        int exitCode = application(unusedModel()).run(new String[] {"--file", source.toString(), "--patch", patch.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILED);
        assertThat(err.toString()).contains("Ambiguous strict match for hunk 1.");
        assertThat(tempDir.resolve("sample_v0.0.txt")).doesNotExist();
    }

    @Test
    void reportsMalformedPatch() throws IOException {
        Path source = write("sample.txt", "bar\n");
        Path patch = write("patch.json", "{\"changes\": []}");

        int exitCode = application(unusedModel()).run(new String[] {"--file", source.toString(), "--patch", patch.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILED);
        assertThat(err.toString()).contains("Patch JSON must contain a 'hunks' array.");
    }

    @Test
    void savesNarrationLogWhenRequested() throws IOException {
        Path source = write("sample.txt", "foo\nbar\n");
        Path patch = write("patch.json", RENAME_PATCH);
        Path logDir = tempDir.resolve("logs");

        int exitCode = application(unusedModel()).run(new String[] {
                "--file", source.toString(), "--patch", patch.toString(), "--stdout",
                "--save-log", "--log-dir", logDir.toString()});

        assertThat(exitCode).isZero();
        Path log = logDir.resolve("sturdy_patcher_log_2024-01-02_03-04-05.txt");
        assertThat(Files.readAllLines(log)).contains(
                "--- BEGIN PATCH ---",
                "Hunk 1: Rename",
                "Hunk 1: strict match at lines 2-2",
                "Patch Applied",
                "--- PATCH COMPLETE ---");
    }

    @Test
    void repairsPatchWithModelBeforeApplying() throws IOException {
        Path source = write("sample.txt", "foo\nbar\n");
        Path patch = write("patch.json", "hunks: bar -> baz, please");
        ChatModel model = respondingModel(request -> "```json\n" + RENAME_PATCH + "```");

        int exitCode = application(model).run(new String[] {
                "--file", source.toString(), "--patch", patch.toString(), "--stdout", "--repair", "--model", "coder"});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("foo\nbaz\n");
    }

    @Test
    void fixesIndentationWithoutPatch() throws IOException {
        Path source = write("sample.py", "def f():\n  return 1\n");
        ChatModel model = respondingModel(request -> "def f():\n    return 1\n");

        int exitCode = application(model).run(new String[] {
                "--file", source.toString(), "--stdout", "--fix-indent", "--model", "coder"});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("def f():\n    return 1\n");
    }

    @Test
    void fixIndentOnBlankFileFailsWithMessage() throws IOException {
        Path source = write("blank.py", "   \n");
        ChatModel model = respondingModel(request -> {
            throw new AssertionError("Blank input must not reach the model");
        });

        int exitCode = application(model).run(new String[] {
                "--file", source.toString(), "--stdout", "--fix-indent", "--model", "coder"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILED);
        assertThat(err.toString()).contains("AI Error: FIX_INDENT input is empty");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void reportsUnwritableLogDirectoryAfterPatching() throws IOException {
        Path source = write("sample.txt", "foo\nbar\n");
        Path patch = write("patch.json", RENAME_PATCH);
        Path notADirectory = write("logs", "occupied");

        int exitCode = application(unusedModel()).run(new String[] {
                "--file", source.toString(), "--patch", patch.toString(), "--stdout",
                "--save-log", "--log-dir", notADirectory.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILED);
        assertThat(out.toString()).isEqualTo("foo\nbaz\n");
        assertThat(err.toString()).contains("Failed to save debug log: ");
    }

    @Test
    void printsSchemaWithoutOtherOptions() {
        int exitCode = application(unusedModel()).run(new String[] {"--print-schema"});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"search_block\"").contains("\"replace_block\"");
    }

    @Test
    void rejectsMissingFileOption() {
        int exitCode = application(unusedModel()).run(new String[] {"--patch", "patch.json"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--file");
    }

    @Test
    void rejectsRepairWithoutModel() throws IOException {
        Path source = write("sample.txt", "bar\n");
        Path patch = write("patch.json", RENAME_PATCH);

        int exitCode = application(unusedModel()).run(new String[] {
                "--file", source.toString(), "--patch", patch.toString(), "--repair"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("LLM_MODEL");
    }

    @Test
    void reportsUnreadableFile() {
        int exitCode = application(unusedModel()).run(new String[] {
                "--file", tempDir.resolve("missing.txt").toString(), "--patch", "patch.json"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILED);
        assertThat(err.toString()).contains("Failed to load file");
    }

    private CliApplication application(Function<AssistantConfig, ChatModel> modelFactory) {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), modelFactory,
                new PrintWriter(out, true), new PrintWriter(err, true),
                new SessionLogWriter(Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC)));
    }

    private CliApplication application(ChatModel model) {
        return application(config -> model);
    }

    private static Function<AssistantConfig, ChatModel> unusedModel() {
        return config -> {
            throw new AssertionError("Model must not be created");
        };
    }

    private static ChatModel respondingModel(Function<ChatRequest, String> responder) {
        return new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest request) {
                return ChatResponse.builder().aiMessage(new AiMessage(responder.apply(request))).build();
            }
        };
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }
}
