package ai.sturdy.patcher.patch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

class PatchJsonReaderTest {

    private final PatchJsonReader reader = new PatchJsonReader();

    @Test
    void readsHunksInOrder() {
        HunkSet patch = reader.read("""
                {
                  "hunks": [
                    {"description": "first", "search_block": "a\\nb", "replace_block": "c"},
                    {"search_block": "x", "replace_block": ""}
                  ]
                }
                """);

        assertThat(patch.size()).isEqualTo(2);
        assertThat(patch.hunks().get(0).describe()).isEqualTo("first");
        assertThat(patch.hunks().get(0).searchBlock()).isEqualTo("a\nb");
        assertThat(patch.hunks().get(1).description()).isEmpty();
        assertThat(patch.hunks().get(1).replaceBlock()).isEmpty();
    }

    @Test
    void ignoresUnknownFields() {
        HunkSet patch = reader.read("{\"version\": 2, \"hunks\": [{\"search_block\": \"a\", \"replace_block\": \"b\", \"note\": 1}]}");

        assertThat(patch.size()).isEqualTo(1);
    }

    @Test
    void rejectsMissingHunksArray() {
        Throwable thrown = catchThrowable(() -> reader.read("{\"hunks\": {}}"));

        assertThat(thrown).isInstanceOf(PatchException.class)
                .hasMessage("Patch JSON must contain a 'hunks' array.");
        assertThat(((PatchException) thrown).kind()).isEqualTo(PatchFailureKind.MALFORMED_PATCH);
    }

    @Test
    void rejectsNonObjectRoot() {
        Throwable thrown = catchThrowable(() -> reader.read("[1, 2]"));

        assertThat(((PatchException) thrown).kind()).isEqualTo(PatchFailureKind.MALFORMED_PATCH);
    }

    @Test
    void rejectsHunkWithoutReplaceBlock() {
        Throwable thrown = catchThrowable(() -> reader.read(
                "{\"hunks\": [{\"search_block\": \"a\", \"replace_block\": \"b\"}, {\"search_block\": \"c\"}]}"));

        assertThat(thrown).hasMessage("Hunk 2 is missing search_block or replace_block.");
        assertThat(((PatchException) thrown).hunkNumber()).hasValue(2);
    }

    @Test
    void rejectsNonTextualBlocks() {
        Throwable thrown = catchThrowable(() -> reader.read(
                "{\"hunks\": [{\"search_block\": 3, \"replace_block\": \"b\"}]}"));

        assertThat(thrown).hasMessage("Hunk 1 is missing search_block or replace_block.");
    }

    @Test
    void wrapsSyntaxErrors() {
        Throwable thrown = catchThrowable(() -> reader.read("{\"hunks\": ["));

        assertThat(thrown).isInstanceOf(PatchException.class)
                .hasCauseInstanceOf(JsonProcessingException.class);
        assertThat(thrown.getMessage()).startsWith("Invalid JSON: ");
    }

    @Test
    void rejectsTrailingContentAfterPatchObject() {
        Throwable thrown = catchThrowable(() -> reader.read("{\"hunks\": []} junk"));

        assertThat(thrown).isInstanceOf(PatchException.class)
                .hasCauseInstanceOf(JsonProcessingException.class);
        assertThat(((PatchException) thrown).kind()).isEqualTo(PatchFailureKind.MALFORMED_PATCH);
        assertThat(thrown.getMessage()).startsWith("Invalid JSON: ");
    }

    @Test
    void rejectsSecondJsonValue() {
        Throwable thrown = catchThrowable(() -> reader.read("{\"hunks\": []}\n{\"hunks\": []}"));

        assertThat(((PatchException) thrown).kind()).isEqualTo(PatchFailureKind.MALFORMED_PATCH);
    }

    @Test
    void rejectsBlankInput() {
        Throwable thrown = catchThrowable(() -> reader.read("  \n"));

        assertThat(thrown).hasMessage("Patch JSON is empty.");
    }

    @Test
    void schemaTemplateIsAcceptedByReader() {
        HunkSet patch = reader.read(PatchSchema.TEMPLATE);

        assertThat(patch.hunks()).singleElement()
                .satisfies(hunk -> assertThat(hunk.searchBlock()).isEqualTo("exact text to find\n(can span multiple lines)"));
    }
}
