package ai.sturdy.patcher.patch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates patch JSON into a typed {@link HunkSet}. Any shape violation is reported as
 * {@link PatchFailureKind#MALFORMED_PATCH} before matching starts.
 */
public class PatchJsonReader {

    static final String FIELD_HUNKS = "hunks";
    static final String FIELD_DESCRIPTION = "description";
    static final String FIELD_SEARCH_BLOCK = "search_block";
    static final String FIELD_REPLACE_BLOCK = "replace_block";

    private final ObjectMapper objectMapper;

    public PatchJsonReader() {
        this(new ObjectMapper());
    }

    public PatchJsonReader(ObjectMapper objectMapper) {
        ObjectMapper base = objectMapper != null ? objectMapper.copy() : new ObjectMapper();
        // Anything after the patch object is rejected instead of silently dropped.
        this.objectMapper = base.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public HunkSet read(String json) {
        if (json == null || json.isBlank()) {
            throw PatchException.malformed("Patch JSON is empty.");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new PatchException(PatchFailureKind.MALFORMED_PATCH, null,
                    "Invalid JSON: " + ex.getOriginalMessage(), ex);
        }
        return read(root);
    }

    public HunkSet read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw PatchException.malformed("Patch JSON must contain a 'hunks' array.");
        }
        JsonNode hunksNode = root.get(FIELD_HUNKS);
        if (hunksNode == null || !hunksNode.isArray()) {
            throw PatchException.malformed("Patch JSON must contain a 'hunks' array.");
        }
        List<Hunk> hunks = new ArrayList<>(hunksNode.size());
        for (int index = 0; index < hunksNode.size(); index++) {
            hunks.add(readHunk(index + 1, hunksNode.get(index)));
        }
        return new HunkSet(hunks);
    }

    private Hunk readHunk(int number, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw PatchException.incompleteHunk(number);
        }
        JsonNode search = node.get(FIELD_SEARCH_BLOCK);
        JsonNode replace = node.get(FIELD_REPLACE_BLOCK);
        if (search == null || !search.isTextual() || replace == null || !replace.isTextual()) {
            throw PatchException.incompleteHunk(number);
        }
        JsonNode descriptionNode = node.get(FIELD_DESCRIPTION);
        Optional<String> description = descriptionNode != null && descriptionNode.isTextual()
                ? Optional.of(descriptionNode.asText())
                : Optional.empty();
        return new Hunk(description, search.asText(), replace.asText());
    }
}
