package ai.sturdy.patcher.cli;

import ai.sturdy.patcher.config.AssistantConfig;
import ai.sturdy.patcher.config.Config;
import ai.sturdy.patcher.config.ConfigLoader;
import ai.sturdy.patcher.config.SystemEnvironmentReader;
import ai.sturdy.patcher.logging.LoggingConfigurator;
import ai.sturdy.patcher.patch.HunkSet;
import ai.sturdy.patcher.patch.PatchEngine;
import ai.sturdy.patcher.patch.PatchException;
import ai.sturdy.patcher.patch.PatchJsonReader;
import ai.sturdy.patcher.patch.PatchSchema;
import ai.sturdy.patcher.repair.PatchRepairException;
import ai.sturdy.patcher.repair.PatchRepairService;
import ai.sturdy.patcher.writer.PatchedFileWriter;
import ai.sturdy.patcher.writer.SessionLog;
import ai.sturdy.patcher.writer.SessionLogWriter;
import ai.sturdy.patcher.writer.VersionedOutputResolver;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and patch engine.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private final ConfigLoader configLoader;
    private final Function<AssistantConfig, ChatModel> chatModelFactory;
    private final PrintWriter out;
    private final PrintWriter err;
    private final PatchJsonReader patchReader = new PatchJsonReader();
    private final PatchEngine engine = new PatchEngine();
    private final VersionedOutputResolver outputResolver = new VersionedOutputResolver();
    private final PatchedFileWriter fileWriter = new PatchedFileWriter();
    private final SessionLogWriter sessionLogWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createOllamaChatModel,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8),
                new SessionLogWriter());
    }

    CliApplication(ConfigLoader configLoader, Function<AssistantConfig, ChatModel> chatModelFactory,
                   PrintWriter out, PrintWriter err, SessionLogWriter sessionLogWriter) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.chatModelFactory = Objects.requireNonNull(chatModelFactory, "chatModelFactory");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.sessionLogWriter = Objects.requireNonNull(sessionLogWriter, "sessionLogWriter");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }
        if (cliArguments.printSchema()) {
            out.println(PatchSchema.TEMPLATE);
            out.flush();
            return EXIT_OK;
        }
        if (cliArguments.file() == null) {
            err.println("Missing required option: '--file=FILE'");
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        if (cliArguments.patch() == null && !cliArguments.fixIndent()) {
            err.println("Missing required option: '--patch=FILE'");
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            err.println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        SessionLog sessionLog = new SessionLog();
        int exitCode;
        try {
            exitCode = execute(cliArguments, config, sessionLog);
        } catch (PatchException ex) {
            exitCode = fail(sessionLog, ex.getMessage(), ex);
        } catch (PatchRepairException ex) {
            exitCode = fail(sessionLog, "AI Error: " + ex.getMessage(), ex);
        } catch (UncheckedIOException ex) {
            exitCode = fail(sessionLog, ex.getMessage(), ex);
        }
        if (cliArguments.saveLog()) {
            exitCode = saveSessionLog(config, sessionLog, exitCode);
        }
        err.flush();
        return exitCode;
    }

    private int saveSessionLog(Config config, SessionLog sessionLog, int exitCode) {
        try {
            sessionLogWriter.save(config.logDirectory(), sessionLog)
                    .ifPresent(path -> err.println("Debug log saved as " + path));
            return exitCode;
        } catch (UncheckedIOException ex) {
            return fail(sessionLog, ex.getMessage(), ex);
        }
    }

    private int execute(CliArguments arguments, Config config, SessionLog sessionLog) {
        Path file = arguments.file();
        String fileText = readText(file, "Failed to load file");
        sessionLog.onProgress("Loaded: " + file);

        if (arguments.fixIndent()) {
            fileText = repairService(config).fixIndentation(fileText);
            sessionLog.onProgress("AI (fix_indent) done.");
        }
        if (arguments.patch() == null) {
            emit(arguments, config, fileText, sessionLog);
            return EXIT_OK;
        }

        String patchText = readText(arguments.patch(), "Failed to load patch");
        if (fileText.isBlank() || patchText.isBlank()) {
            return fail(sessionLog, "Both file content and patch JSON must be provided.", null);
        }
        if (arguments.repair()) {
            patchText = repairService(config).repairPatch(patchText);
            sessionLog.onProgress("AI (fix_patch) done.");
        }

        sessionLog.onProgress("--- BEGIN PATCH ---");
        HunkSet patch = patchReader.read(patchText);
        String patched = engine.apply(fileText, patch, sessionLog);
        sessionLog.onProgress("Patch Applied");
        emit(arguments, config, patched, sessionLog);
        sessionLog.onProgress("--- PATCH COMPLETE ---");
        return EXIT_OK;
    }

    private void emit(CliArguments arguments, Config config, String text, SessionLog sessionLog) {
        if (arguments.stdout()) {
            out.print(text);
            out.flush();
            return;
        }
        Path target = outputResolver.resolve(Optional.of(arguments.file()), config);
        fileWriter.write(target, text);
        LOGGER.info("Patched file saved as: {}", target);
        sessionLog.onProgress("Patched file saved as: " + target);
    }

    private int fail(SessionLog sessionLog, String message, Exception cause) {
        sessionLog.error(message);
        if (cause != null) {
            LOGGER.debug("Patch run failed", cause);
        }
        LOGGER.error(message);
        err.println(message);
        return EXIT_FAILED;
    }

    private PatchRepairService repairService(Config config) {
        ChatModel model = chatModelFactory.apply(config.assistantConfig());
        return new PatchRepairService(model, config.assistantConfig());
    }

    private static String readText(Path path, String failureMessage) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(failureMessage + ": " + path, ex);
        }
    }

    private static ChatModel createOllamaChatModel(AssistantConfig assistantConfig) {
        String modelName = assistantConfig.requireModelName();
        try {
            LOGGER.info("Using Ollama model '{}' via {}", modelName, assistantConfig.baseUrl());
            return OllamaChatModel.builder()
                    .baseUrl(assistantConfig.baseUrl())
                    .modelName(modelName)
                    .temperature(0.0)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new PatchRepairException("Failed to initialize Ollama chat model", ex);
        }
    }
}
