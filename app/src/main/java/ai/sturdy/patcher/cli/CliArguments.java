package ai.sturdy.patcher.cli;

import ai.sturdy.patcher.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "sturdy-patcher", mixinStandardHelpOptions = true, version = "sturdy-patcher 0.1.0",
        description = "Applies search/replace hunks from a patch JSON file to a text file")
public class CliArguments {

    @CommandLine.Option(names = {"-f", "--file"}, description = "Text file to patch", paramLabel = "FILE")
    private Path file;

    @CommandLine.Option(names = {"-p", "--patch"}, description = "Patch JSON file with a 'hunks' array", paramLabel = "FILE")
    private Path patch;

    @CommandLine.Option(names = "--stdout", description = "Print the patched text instead of writing a file")
    private boolean stdout;

    @CommandLine.Option(names = "--save-log", description = "Save the patch narration to the log directory")
    private boolean saveLog;

    @CommandLine.Option(names = "--print-schema", description = "Print the patch JSON template and exit")
    private boolean printSchema;

    @CommandLine.Option(names = "--repair", description = "Ask the model to repair the patch JSON before applying it")
    private boolean repair;

    @CommandLine.Option(names = "--fix-indent", description = "Ask the model to normalize the file's indentation before patching")
    private boolean fixIndent;

    @CommandLine.Option(names = "--model", description = "Ollama model used by --repair and --fix-indent", paramLabel = "NAME")
    private String modelName;

    @CommandLine.Option(names = "--output-dir", description = "Directory for output when no source path applies", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--output-name", description = "Default output file name", paramLabel = "NAME")
    private String outputName;

    @CommandLine.Option(names = "--log-dir", description = "Directory for saved narration logs", paramLabel = "DIR")
    private Path logDirectory;

    @CommandLine.Option(names = "--no-version", description = "Write the output without a version suffix")
    private boolean noVersion;

    @CommandLine.Option(names = "--version-suffix", description = "Explicit version suffix, e.g. _v2.1", paramLabel = "SUFFIX")
    private String versionSuffix;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path file() {
        return file;
    }

    public Path patch() {
        return patch;
    }

    public boolean stdout() {
        return stdout;
    }

    public boolean saveLog() {
        return saveLog;
    }

    public boolean printSchema() {
        return printSchema;
    }

    public boolean repair() {
        return repair;
    }

    public boolean fixIndent() {
        return fixIndent;
    }

    public String modelName() {
        return modelName;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public String outputName() {
        return outputName;
    }

    public Path logDirectory() {
        return logDirectory;
    }

    public boolean noVersion() {
        return noVersion;
    }

    public String versionSuffix() {
        return versionSuffix;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
