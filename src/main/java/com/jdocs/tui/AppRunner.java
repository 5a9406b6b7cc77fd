package com.jdocs.tui;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdocs.AgentSession;
import com.jdocs.dispatch.DispatchState;
import com.jdocs.dispatch.TurnListener;
import com.jdocs.dispatch.TurnOutcome;
import com.jdocs.model.ConversationTurn;
import com.jdocs.model.PromptDescriptor;
import com.jdocs.model.ResourceContent;
import com.jdocs.model.ToolDescriptor;
import com.jdocs.tools.DocumentPrompt;
import com.jdocs.tools.DocumentToolProvider;
import com.jdocs.tools.ToolProvider;
import org.jline.reader.*;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Terminal UI application runner - supports interactive REPL and one-shot print mode.
 */
public class AppRunner {

    private static final String PROMPT = "\u001b[1;36mjdocs>\u001b[0m ";
    private static final String DIM = "\u001b[2m";
    private static final String YELLOW = "\u001b[33m";
    private static final String RED = "\u001b[31m";
    private static final String BOLD = "\u001b[1m";
    private static final String RESET = "\u001b[0m";

    private static final int RESULT_PREVIEW_LINES = 10;
    private static final int PREVIEW_MAX_LINE_LEN = 120;

    static final Set<String> EXIT_PHRASES = Set.of("exit", "quit", "salir", "/exit", "/quit");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AgentSession session;
    private final ToolProvider provider;
    private final PrintWriter out;

    AppRunner(AgentSession session, ToolProvider provider, PrintWriter out) {
        this.session = session;
        this.provider = provider;
        this.out = out;
    }

    /**
     * Run the app in either interactive or one-shot print mode.
     *
     * @return process exit code
     */
    public static int run(AgentSession session, ToolProvider provider, String printPrompt) throws Exception {
        if (printPrompt != null) {
            PrintWriter out = new PrintWriter(System.out, true);
            TurnOutcome outcome = new AppRunner(session, provider, out).runTurn(printPrompt);
            return outcome.isFailure() ? 1 : 0;
        }

        try (Terminal terminal = TerminalBuilder.builder()
                .system(true)
                .build()) {
            new AppRunner(session, provider, terminal.writer()).runInteractive(terminal);
        }
        return 0;
    }

    static boolean isExitPhrase(String input) {
        return EXIT_PHRASES.contains(input.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Interactive REPL mode with JLine.
     */
    private void runInteractive(Terminal terminal) {
        out.println();
        out.println("  " + BOLD + "jdocs" + RESET + DIM + " - document assistant" + RESET);
        out.println("  " + DIM + "Model: " + session.getModel().id() + RESET);
        out.println("  " + DIM + "Tools: " + session.getTools().stream().map(ToolDescriptor::name).toList() + RESET);
        out.println("  " + DIM + "Ask a question. Type /help for commands, 'exit' to quit." + RESET);
        out.println();
        out.flush();

        List<String[]> commands = new ArrayList<>(List.of(
                new String[]{"/help", "Show available commands"},
                new String[]{"/tools", "List the tools the model can call"},
                new String[]{"/docs", "List available documents"},
                new String[]{"/prompts", "List prompt templates"},
                new String[]{"/exit", "Exit jdocs"}));
        for (PromptDescriptor prompt : promptsOrEmpty()) {
            commands.add(new String[]{"/" + prompt.name(), prompt.description()});
        }

        Completer slashCompleter = (reader, line, candidates) -> {
            String buf = line.line();
            if (buf.startsWith("/")) {
                String prefix = buf.trim();
                for (String[] entry : commands) {
                    if (entry[0].startsWith(prefix)) {
                        candidates.add(new Candidate(entry[0], entry[0], null, entry[1], null, null, true));
                    }
                }
            }
        };

        LineReader lineReader = LineReaderBuilder.builder()
                .terminal(terminal)
                .completer(slashCompleter)
                .option(LineReader.Option.AUTO_LIST, true)
                .option(LineReader.Option.AUTO_MENU, true)
                .build();

        while (true) {
            String input;
            try {
                input = lineReader.readLine(PROMPT);
            } catch (UserInterruptException e) {
                continue;
            } catch (EndOfFileException e) {
                break;
            }

            if (input == null || input.isBlank()) continue;
            String trimmed = input.trim();

            if (isExitPhrase(trimmed)) {
                out.println("  Goodbye!");
                out.flush();
                break;
            }

            out.println();
            if (trimmed.startsWith("/")) {
                handleCommand(trimmed);
            } else {
                runTurn(trimmed);
            }
            out.println();
            out.flush();
        }
    }

    /**
     * Send one question through the dispatch loop and print how it ended.
     */
    TurnOutcome runTurn(String question) {
        Spinner spinner = new Spinner(out);
        TurnOutcome outcome;
        try {
            outcome = session.chat(question, new ConsoleListener(spinner));
        } finally {
            spinner.stop();
        }
        printOutcome(outcome);
        return outcome;
    }

    void printOutcome(TurnOutcome outcome) {
        switch (outcome.kind()) {
            case ANSWER, SYNTHESIZED -> out.println(outcome.text());
            case MALFORMED -> {
                out.println(YELLOW + "[Model reply was not valid JSON. Raw reply:]" + RESET);
                out.println(outcome.text());
            }
            case UNRECOGNIZED -> {
                out.println(YELLOW + "[Model returned JSON without 'answer' or 'tool':]" + RESET);
                out.println(outcome.text());
            }
            case TOOL_FAILED -> out.println(RED + outcome.text() + RESET);
            case MODEL_UNAVAILABLE -> out.println(RED + "Model unavailable: " + outcome.text() + RESET);
        }
        out.flush();
    }

    void handleCommand(String command) {
        String[] parts = command.substring(1).trim().split("\\s+", 2);
        String name = parts[0];
        String argument = parts.length > 1 ? parts[1].trim() : "";

        try {
            switch (name) {
                case "help" -> printHelp();
                case "tools" -> session.getTools().forEach(t ->
                        out.println("  " + BOLD + t.name() + RESET + DIM + "  " + t.description() + RESET));
                case "docs" -> printDocuments();
                case "prompts" -> promptsOrEmpty().forEach(p ->
                        out.println("  " + BOLD + "/" + p.name() + RESET + " <" + String.join("> <", p.arguments())
                                + ">" + DIM + "  " + p.description() + RESET));
                default -> runPrompt(name, argument);
            }
        } catch (Exception e) {
            out.println(RED + "Error: " + e.getMessage() + RESET);
        }
        out.flush();
    }

    private void printHelp() {
        out.println("  " + BOLD + "Commands:" + RESET);
        out.println("    /tools             - List the tools the model can call");
        out.println("    /docs              - List available documents");
        out.println("    /prompts           - List prompt templates");
        out.println("    /<prompt> <doc_id> - Run a prompt template on a document");
        out.println("    /help              - Show this help");
        out.println("    exit               - Exit jdocs");
    }

    private void printDocuments() throws Exception {
        ResourceContent content = provider.readResource(DocumentToolProvider.DOCUMENTS_URI);
        if (content.isJson()) {
            List<String> ids = MAPPER.readValue(content.text(), new TypeReference<List<String>>() {
            });
            ids.forEach(id -> out.println("  - " + id));
        } else {
            out.println(content.text());
        }
    }

    private void runPrompt(String promptName, String docId) throws Exception {
        if (docId.isEmpty()) {
            out.println(YELLOW + "Usage: /" + promptName + " <doc_id>" + RESET);
            return;
        }
        List<ConversationTurn> messages = provider.getPrompt(promptName, Map.of(DocumentPrompt.DOC_ID, docId));

        Spinner spinner = new Spinner(out);
        spinner.start("Running " + promptName);
        String reply;
        try {
            reply = session.complete(messages);
        } finally {
            spinner.stop();
        }
        out.println(reply);
    }

    private List<PromptDescriptor> promptsOrEmpty() {
        try {
            return provider.listPrompts();
        } catch (Exception e) {
            return List.of();
        }
    }

    static String formatPreview(String result, int maxLines) {
        if (result.isBlank()) {
            return DIM + "  (empty)" + RESET;
        }

        String[] lines = result.stripTrailing().split("\n", -1);
        StringBuilder sb = new StringBuilder();
        int showCount = Math.min(lines.length, maxLines);
        for (int i = 0; i < showCount; i++) {
            String line = lines[i];
            if (line.length() > PREVIEW_MAX_LINE_LEN) {
                line = line.substring(0, PREVIEW_MAX_LINE_LEN) + "…";
            }
            sb.append(DIM).append("  ").append(line).append(RESET).append("\n");
        }
        if (lines.length > maxLines) {
            sb.append(DIM).append("  … (").append(lines.length).append(" lines total)").append(RESET);
        }
        return sb.toString().stripTrailing();
    }

    private class ConsoleListener implements TurnListener {
        private final Spinner spinner;

        ConsoleListener(Spinner spinner) {
            this.spinner = spinner;
        }

        @Override
        public void onStateChange(DispatchState state) {
            switch (state) {
                case DECIDING -> spinner.start("Deciding");
                case EXECUTING -> spinner.start("Running tool");
                case SYNTHESIZING -> spinner.start("Composing answer");
                default -> spinner.stop();
            }
        }

        @Override
        public void onToolCall(String toolName, Map<String, Object> arguments) {
            spinner.stop();
            out.println(YELLOW + "[" + toolName + "]" + RESET + DIM + " " + arguments + RESET);
            out.flush();
            spinner.start("Running " + toolName);
        }

        @Override
        public void onToolResult(String toolName, String resultText) {
            spinner.stop();
            out.println(formatPreview(resultText, RESULT_PREVIEW_LINES));
            out.println();
            out.flush();
        }
    }
}
