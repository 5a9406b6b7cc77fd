package com.jdocs.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, String> docs = new LinkedHashMap<>();

    public InMemoryDocumentStore() {}

    public InMemoryDocumentStore(Map<String, String> initial) {
        docs.putAll(initial);
    }

    /** A store pre-filled with the demo documents. */
    public static InMemoryDocumentStore withSampleDocuments() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.put("deposition.md", "This deposition covers the testimony of Angela Smith, P.E.");
        store.put("report.pdf", "The report details the state of a 20m condenser tower.");
        store.put("financials.docx", "These financials outline the project's budget and expenditures.");
        store.put("outlook.pdf", "This document presents the projected future performance of the system.");
        store.put("plan.md", "The plan outlines the steps for the project's implementation.");
        store.put("spec.txt", "These specifications define the technical requirements for the equipment.");
        return store;
    }

    @Override
    public synchronized Optional<String> get(String id) {
        return Optional.ofNullable(docs.get(id));
    }

    @Override
    public synchronized void put(String id, String content) {
        docs.put(id, content);
    }

    @Override
    public synchronized List<String> list() {
        return new ArrayList<>(docs.keySet());
    }
}
