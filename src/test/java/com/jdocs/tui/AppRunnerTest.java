package com.jdocs.tui;

import com.jdocs.AgentSession;
import com.jdocs.dispatch.TurnListener;
import com.jdocs.dispatch.TurnOutcome;
import com.jdocs.model.ConversationTurn;
import com.jdocs.model.ToolDescriptor;
import com.jdocs.tools.DocumentToolProvider;
import com.jdocs.tools.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AppRunnerTest {

    private AgentSession session;
    private StringWriter buffer;
    private AppRunner runner;

    @BeforeEach
    void setUp() {
        session = mock(AgentSession.class);
        buffer = new StringWriter();
        runner = new AppRunner(session, new DocumentToolProvider(InMemoryDocumentStore.withSampleDocuments()),
                new PrintWriter(buffer, true));
    }

    @ParameterizedTest
    @ValueSource(strings = {"exit", "quit", "salir", "/exit", "/quit", "  EXIT  ", "Quit"})
    void recognizesExitPhrases(String input) {
        assertTrue(AppRunner.isExitPhrase(input));
    }

    @Test
    void ordinaryInputIsNotAnExitPhrase() {
        assertFalse(AppRunner.isExitPhrase("exit the document"));
        assertFalse(AppRunner.isExitPhrase("/tools"));
    }

    @Test
    void answerIsPrintedVerbatim() {
        runner.printOutcome(new TurnOutcome(TurnOutcome.Kind.SYNTHESIZED, "The plan has five steps.", "read_doc_contents"));

        assertEquals("The plan has five steps." + System.lineSeparator(), buffer.toString());
    }

    @Test
    void malformedReplyIsLabelledAndShownRaw() {
        runner.printOutcome(new TurnOutcome(TurnOutcome.Kind.MALFORMED, "I cannot help with that.", null));

        String printed = buffer.toString();
        assertTrue(printed.contains("[Model reply was not valid JSON. Raw reply:]"));
        assertTrue(printed.contains("I cannot help with that."));
    }

    @Test
    void unrecognizedReplyIsLabelled() {
        runner.printOutcome(new TurnOutcome(TurnOutcome.Kind.UNRECOGNIZED, "{\"status\":\"thinking\"}", null));

        assertTrue(buffer.toString().contains("[Model returned JSON without 'answer' or 'tool':]"));
    }

    @Test
    void modelFailureIsReported() {
        runner.printOutcome(new TurnOutcome(TurnOutcome.Kind.MODEL_UNAVAILABLE, "connection refused", null));

        assertTrue(buffer.toString().contains("Model unavailable: connection refused"));
    }

    @Test
    void runTurnDelegatesToSession() {
        TurnOutcome outcome = new TurnOutcome(TurnOutcome.Kind.TOOL_FAILED,
                "Error calling tool unknown_tool: Unknown tool: unknown_tool", "unknown_tool");
        when(session.chat(eq("do it"), any(TurnListener.class))).thenReturn(outcome);

        assertSame(outcome, runner.runTurn("do it"));
        assertTrue(buffer.toString().contains("Error calling tool unknown_tool"));
    }

    @Test
    void docsCommandListsDocumentIds() {
        runner.handleCommand("/docs");

        String printed = buffer.toString();
        assertTrue(printed.contains("  - deposition.md"));
        assertTrue(printed.contains("  - spec.txt"));
    }

    @Test
    void toolsCommandListsSessionTools() {
        when(session.getTools()).thenReturn(List.of(new ToolDescriptor("read_doc_contents", "Read a document")));

        runner.handleCommand("/tools");

        assertTrue(buffer.toString().contains("read_doc_contents"));
    }

    @Test
    void promptCommandSendsRenderedPromptToModel() throws Exception {
        when(session.complete(anyList())).thenReturn("A short summary.");

        runner.handleCommand("/summarize plan.md");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ConversationTurn>> messages = ArgumentCaptor.forClass(List.class);
        verify(session).complete(messages.capture());
        assertTrue(messages.getValue().get(0).text().contains("The plan outlines the steps"));
        assertTrue(buffer.toString().contains("A short summary."));
    }

    @Test
    void promptCommandWithoutDocumentShowsUsage() throws Exception {
        runner.handleCommand("/summarize");

        assertTrue(buffer.toString().contains("Usage: /summarize <doc_id>"));
        verify(session, never()).complete(anyList());
    }

    @Test
    void unknownCommandReportsError() {
        runner.handleCommand("/bogus plan.md");

        assertTrue(buffer.toString().contains("Error: Unknown prompt: bogus"));
    }

    @Test
    void previewTruncatesLongResults() {
        String preview = AppRunner.formatPreview("a\nb\nc\nd", 2);

        assertTrue(preview.contains("  a"));
        assertTrue(preview.contains("  b"));
        assertFalse(preview.contains("  c"));
        assertTrue(preview.contains("(4 lines total)"));
    }

    @Test
    void previewOfBlankResult() {
        assertTrue(AppRunner.formatPreview("  ", 10).contains("(empty)"));
    }
}
