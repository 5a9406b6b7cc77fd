package com.jdocs.tools;

import java.util.List;

/**
 * Prompt templates over a single document. Each renders one user message with the
 * document content embedded.
 */
public enum DocumentPrompt {

    REWRITE_MARKDOWN("rewrite_markdown", "Rewrite a document using clear, well-structured Markdown.") {
        @Override
        String render(String content) {
            return "You are an expert technical writer. Rewrite the following document "
                    + "using clear, well-structured Markdown. Keep the meaning but improve "
                    + "organization and readability. Use headings, bullet points, and tables "
                    + "when appropriate.\n\n"
                    + "DOCUMENT CONTENT:\n" + content;
        }
    },

    SUMMARIZE("summarize", "Summarize a document in a concise way.") {
        @Override
        String render(String content) {
            return "Summarize the following document in a concise paragraph, "
                    + "highlighting the most important technical and business points:\n\n"
                    + "DOCUMENT CONTENT:\n" + content;
        }
    },

    FORMAT("format", "Rewrites the contents of the document in Markdown format.") {
        @Override
        String render(String content) {
            return """
                    Your goal is to reformat a document using clean, professional Markdown syntax.

                    Instructions:
                    - Add clear headings and subheadings with '#', '##', etc.
                    - Use bullet lists and numbered lists where they make sense.
                    - Use code blocks for technical snippets.
                    - Keep the meaning of the document, but improve structure and clarity.

                    Here is the document you must reformat:

                    """ + content;
        }
    };

    public static final String DOC_ID = "doc_id";

    private final String promptName;
    private final String description;

    DocumentPrompt(String promptName, String description) {
        this.promptName = promptName;
        this.description = description;
    }

    public String promptName() {
        return promptName;
    }

    public String description() {
        return description;
    }

    public List<String> arguments() {
        return List.of(DOC_ID);
    }

    abstract String render(String content);

    public static DocumentPrompt byName(String name) {
        for (DocumentPrompt prompt : values()) {
            if (prompt.promptName.equals(name)) return prompt;
        }
        return null;
    }
}
