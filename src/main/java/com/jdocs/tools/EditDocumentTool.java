package com.jdocs.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Find-and-replace on a document. Every occurrence of {@code old_str} is replaced.
 */
public class EditDocumentTool implements DocumentTool {

    @Override
    public String name() {
        return "edit_document";
    }

    @Override
    public String description() {
        return "Edit a document by replacing a string in the document's content with a new string.";
    }

    @Override
    public Map<String, Object> parameterSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("required", List.of("doc_id", "old_str", "new_str"));
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("doc_id", Map.of("type", "string", "description", "Id of the document that will be edited"));
        props.put("old_str", Map.of("type", "string",
                "description", "The exact text to replace (case and whitespace must match)."));
        props.put("new_str", Map.of("type", "string",
                "description", "The new text to insert in place of the old text."));
        schema.put("properties", props);
        return schema;
    }

    @Override
    public String execute(JsonNode args, DocumentStore store) {
        String docId = DocumentTool.requireText(args, "doc_id");
        String oldStr = DocumentTool.requireText(args, "old_str");
        String newStr = DocumentTool.requireText(args, "new_str");

        String content = store.get(docId).orElseThrow(() -> new DocumentNotFoundException(docId));
        // String.replace("") would interleave newStr between every character
        String edited = oldStr.isEmpty() ? content : content.replace(oldStr, newStr);
        store.put(docId, edited);
        return edited;
    }
}
