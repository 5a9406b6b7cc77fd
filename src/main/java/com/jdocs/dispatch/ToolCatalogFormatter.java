package com.jdocs.dispatch;

import com.jdocs.model.ToolDescriptor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the tool catalog for the system instruction, one {@code - name: description} line per tool.
 */
public final class ToolCatalogFormatter {

    private ToolCatalogFormatter() {}

    public static String format(List<ToolDescriptor> tools) {
        return tools.stream()
                .map(t -> "- %s: %s".formatted(t.name(), t.description() != null ? t.description() : ""))
                .collect(Collectors.joining("\n"));
    }
}
