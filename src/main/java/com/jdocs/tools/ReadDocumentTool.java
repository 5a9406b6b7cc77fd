package com.jdocs.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ReadDocumentTool implements DocumentTool {

    @Override
    public String name() {
        return "read_doc_contents";
    }

    @Override
    public String description() {
        return "Read the contents of a document and return it as a string.";
    }

    @Override
    public Map<String, Object> parameterSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("required", List.of("doc_id"));
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("doc_id", Map.of("type", "string", "description", "Id of the document to read"));
        schema.put("properties", props);
        return schema;
    }

    @Override
    public String execute(JsonNode args, DocumentStore store) {
        String docId = DocumentTool.requireText(args, "doc_id");
        return store.get(docId).orElseThrow(() -> new DocumentNotFoundException(docId));
    }
}
