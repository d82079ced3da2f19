package ai.sturdy.patcher.patch;

/**
 * Template of the patch JSON accepted by {@link PatchJsonReader}.
 */
public final class PatchSchema {

    public static final String TEMPLATE = """
            {
              "hunks": [
                {
                  "description": "Short human description",
                  "search_block": "exact text to find\\n(can span multiple lines)",
                  "replace_block": "replacement text\\n(same or different length)"
                }
              ]
            }""";

    private PatchSchema() {
    }
}
