package ai.sturdy.patcher.patch;

import ai.sturdy.patcher.line.Line;
import ai.sturdy.patcher.line.LineTokenizer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single search/replace instruction.
 */
public record Hunk(Optional<String> description, String searchBlock, String replaceBlock) {

    static final String NO_DESCRIPTION = "(no description)";

    public Hunk {
        description = description == null ? Optional.empty() : description;
        Objects.requireNonNull(searchBlock, "searchBlock");
        Objects.requireNonNull(replaceBlock, "replaceBlock");
    }

    public Hunk(String searchBlock, String replaceBlock) {
        this(Optional.empty(), searchBlock, replaceBlock);
    }

    /**
     * Tokenized search lines. An empty search block has no lines and therefore never matches.
     */
    public List<Line> searchLines() {
        if (searchBlock.isEmpty()) {
            return List.of();
        }
        return LineTokenizer.tokenizeBlock(searchBlock);
    }

    public List<Line> replaceLines() {
        return LineTokenizer.tokenizeBlock(replaceBlock);
    }

    public String describe() {
        return description.filter(value -> !value.isBlank()).orElse(NO_DESCRIPTION);
    }
}
