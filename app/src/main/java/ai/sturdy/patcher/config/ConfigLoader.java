package ai.sturdy.patcher.config;

import ai.sturdy.patcher.cli.CliArguments;
import ai.sturdy.patcher.repair.AssistTask;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT_DIR = "PATCHER_OUTPUT_DIR";
    static final String ENV_LOG_DIR = "PATCHER_LOG_DIR";
    static final String ENV_OUTPUT_NAME = "PATCHER_OUTPUT_NAME";
    static final String ENV_VERSIONING = "PATCHER_VERSIONING";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_FIX_PATCH_PROMPT = "PATCHER_FIX_PATCH_PROMPT";
    static final String ENV_FIX_INDENT_PROMPT = "PATCHER_FIX_INDENT_PROMPT";

    private static final String DEFAULT_OUTPUT_DIR = ".";
    private static final String DEFAULT_LOG_DIR = "logs";
    private static final String DEFAULT_OUTPUT_NAME = "patched_output.txt";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path outputDirectory = resolvePath(arguments.outputDirectory(), ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR);
        Path logDirectory = resolvePath(arguments.logDirectory(), ENV_LOG_DIR, DEFAULT_LOG_DIR);
        String outputName = firstNonBlank(arguments.outputName(), ENV_OUTPUT_NAME, DEFAULT_OUTPUT_NAME);
        boolean versioning = resolveVersioning(arguments);
        Optional<String> versionSuffix = Optional.ofNullable(arguments.versionSuffix())
                .filter(ConfigLoader::isNotBlank);
        if (!versioning && versionSuffix.isPresent()) {
            throw new IllegalArgumentException("--version-suffix cannot be combined with --no-version");
        }
        LogFormat logFormat = resolveLogFormat(arguments);

        String baseUrl = environmentReader.get(ENV_OLLAMA_BASE_URL)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .orElse(DEFAULT_OLLAMA_BASE_URL);
        Optional<String> modelName = Optional.ofNullable(arguments.modelName())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.get(ENV_LLM_MODEL).filter(ConfigLoader::isNotBlank))
                .map(String::trim);

        Map<AssistTask, String> prompts = new EnumMap<>(AssistTask.class);
        environmentReader.get(ENV_FIX_PATCH_PROMPT)
                .filter(ConfigLoader::isNotBlank)
                .ifPresent(value -> prompts.put(AssistTask.FIX_PATCH, value.strip()));
        environmentReader.get(ENV_FIX_INDENT_PROMPT)
                .filter(ConfigLoader::isNotBlank)
                .ifPresent(value -> prompts.put(AssistTask.FIX_INDENT, value.strip()));

        if ((arguments.repair() || arguments.fixIndent()) && modelName.isEmpty()) {
            throw new IllegalStateException("LLM_MODEL or --model must be provided when --repair or --fix-indent is used");
        }

        AssistantConfig assistantConfig = new AssistantConfig(baseUrl, modelName, prompts);
        return new Config(outputDirectory, logDirectory, outputName, versioning, versionSuffix, logFormat, assistantConfig);
    }

    private boolean resolveVersioning(CliArguments arguments) {
        if (arguments.noVersion()) {
            return false;
        }
        return environmentReader.get(ENV_VERSIONING)
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseBoolean)
                .orElse(true);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Path resolvePath(Path cliValue, String envKey, String defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return Path.of(environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .orElse(defaultValue));
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalArgumentException(ENV_VERSIONING + " must be true or false: " + raw);
        };
    }
}
