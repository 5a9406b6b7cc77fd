package com.jdocs.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-tool table of canonical argument names and the alias spellings models use instead.
 * Immutable once built and shared by every turn.
 */
public final class ArgumentAliasTable {

    public static final String EDIT_DOCUMENT = "edit_document";

    private static final ArgumentAliasTable DEFAULTS = builder()
            .alias(EDIT_DOCUMENT, "old_str", "old_string", "old")
            .alias(EDIT_DOCUMENT, "new_str", "new_string", "new_striing", "new")
            .build();

    private final Map<String, Map<String, List<String>>> aliasesByTool;

    private ArgumentAliasTable(Map<String, Map<String, List<String>>> aliasesByTool) {
        this.aliasesByTool = aliasesByTool;
    }

    /** Aliases for the document-editing tool family. */
    public static ArgumentAliasTable defaults() {
        return DEFAULTS;
    }

    public static ArgumentAliasTable empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Canonical name to ordered aliases for a tool; empty when the tool has no entry. */
    public Map<String, List<String>> aliasesFor(String toolName) {
        return aliasesByTool.getOrDefault(toolName, Map.of());
    }

    /**
     * Rename alias keys to their canonical names. A canonical key already present wins;
     * otherwise the first alias present, in priority order, is moved onto it. No alias key
     * of the tool is left in the result.
     *
     * @return a new map; the input is not modified
     */
    public Map<String, Object> normalize(String toolName, Map<String, Object> arguments) {
        Map<String, Object> normalized = new LinkedHashMap<>(arguments);
        for (Map.Entry<String, List<String>> entry : aliasesFor(toolName).entrySet()) {
            String canonical = entry.getKey();
            for (String alias : entry.getValue()) {
                if (!normalized.containsKey(alias)) continue;

                Object value = normalized.remove(alias);
                if (!normalized.containsKey(canonical)) {
                    normalized.put(canonical, value);
                }
            }
        }
        return normalized;
    }

    public static final class Builder {
        private final Map<String, Map<String, List<String>>> table = new LinkedHashMap<>();

        private Builder() {}

        public Builder alias(String toolName, String canonical, String... aliases) {
            table.computeIfAbsent(toolName, k -> new LinkedHashMap<>())
                    .put(canonical, List.of(aliases));
            return this;
        }

        public ArgumentAliasTable build() {
            Map<String, Map<String, List<String>>> copy = new LinkedHashMap<>();
            table.forEach((tool, aliases) ->
                    copy.put(tool, Collections.unmodifiableMap(new LinkedHashMap<>(aliases))));
            return new ArgumentAliasTable(Collections.unmodifiableMap(copy));
        }
    }
}
