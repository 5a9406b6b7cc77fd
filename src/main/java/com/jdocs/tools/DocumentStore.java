package com.jdocs.tools;

import java.util.List;
import java.util.Optional;

/**
 * Keyed text documents edited by the document tools.
 */
public interface DocumentStore {

    Optional<String> get(String id);

    void put(String id, String content);

    /** Document ids in insertion order. */
    List<String> list();
}
