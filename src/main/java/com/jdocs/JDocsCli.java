package com.jdocs;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdocs.dispatch.ArgumentAliasTable;
import com.jdocs.dispatch.ToolExecutionBridge;
import com.jdocs.llm.ModelGateway;
import com.jdocs.mcp.McpStdioClient;
import com.jdocs.mcp.McpStdioServer;
import com.jdocs.model.JDocsConfig;
import com.jdocs.model.Model;
import com.jdocs.tools.DocumentToolProvider;
import com.jdocs.tools.InMemoryDocumentStore;
import com.jdocs.tools.ToolExecutionException;
import com.jdocs.tools.ToolProvider;
import com.jdocs.tui.AppRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "jdocs",
        description = "Ask a local LLM about your documents; it answers directly or calls a document tool",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        subcommands = {JDocsCli.ServeCommand.class}
)
public class JDocsCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(JDocsCli.class);

    @Option(names = {"-m", "--model"}, description = "Model name/ID (default: first model loaded at the endpoint)")
    private String modelOpt;

    @Option(names = {"-u", "--url"}, description = "Chat-completions base URL (default: " + Config.DEFAULT_BASE_URL + ")")
    private String urlOpt;

    @Option(names = {"-k", "--api-key"}, description = "API key sent as a bearer token")
    private String apiKeyOpt;

    @Option(names = {"-s", "--server"},
            description = "Command line of an external MCP tool server (default: built-in document tools)")
    private String serverOpt;

    @Option(names = {"--timeout"}, description = "Per-request completion timeout in seconds")
    private Integer timeoutOpt;

    @Option(names = {"-p", "--print"}, description = "One-shot mode: answer one question and exit")
    private String printPrompt;

    @Option(names = {"-v", "--verbose"}, description = "Log debug output to stderr")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }
        try {
            JDocsConfig config = Config.loadConfig();
            Map<String, String> env = System.getenv();

            String baseUrl = Config.resolve(urlOpt, env, Config.ENV_BASE_URL, config.getBaseUrl(),
                    Config.DEFAULT_BASE_URL);
            String apiKey = Config.resolve(apiKeyOpt, env, Config.ENV_API_KEY, config.getApiKey(),
                    Model.NO_API_KEY);
            String modelId = Config.resolve(modelOpt, env, Config.ENV_MODEL, config.getModel(), null);
            int timeout = timeoutOpt != null ? timeoutOpt
                    : (config.getRequestTimeoutSeconds() != null ? config.getRequestTimeoutSeconds()
                    : Model.DEFAULT_TIMEOUT_SECONDS);
            List<String> serverCommand = serverCommand(
                    Config.resolve(serverOpt, env, Config.ENV_SERVER_COMMAND, null, null), config);

            Model model = ModelResolver.resolveModel(modelId, baseUrl, apiKey, timeout);

            try (ToolProvider provider = openToolProvider(serverCommand)) {
                Runtime.getRuntime().addShutdownHook(new Thread(provider::close, "jdocs-shutdown"));

                AgentSession session = new AgentSession(
                        new ModelGateway(model),
                        new ToolExecutionBridge(provider),
                        provider.listTools(),
                        ArgumentAliasTable.defaults());
                return AppRunner.run(session, provider, printPrompt);
            }
        } catch (Exception e) {
            log.debug("Startup failed", e);
            System.err.println("\n  \u001b[31mError: " + e.getMessage() + "\u001b[0m\n");
            return 1;
        }
    }

    static List<String> serverCommand(String commandLine, JDocsConfig config) {
        if (commandLine != null && !commandLine.isBlank()) {
            return Arrays.asList(commandLine.trim().split("\\s+"));
        }
        return config.getServerCommand();
    }

    static ToolProvider openToolProvider(List<String> serverCommand) throws IOException, ToolExecutionException {
        if (serverCommand.isEmpty()) {
            return new DocumentToolProvider(InMemoryDocumentStore.withSampleDocuments());
        }
        return McpStdioClient.launch(serverCommand, null, new ObjectMapper());
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }

    @Command(name = "serve", description = "Serve the built-in document tools as an MCP server on stdin/stdout")
    static class ServeCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            try (DocumentToolProvider provider =
                         new DocumentToolProvider(InMemoryDocumentStore.withSampleDocuments())) {
                new McpStdioServer(provider, new ObjectMapper(), "DocumentMCP").serve(System.in, System.out);
                return 0;
            } catch (IOException e) {
                System.err.println("\n  \u001b[31mError: " + e.getMessage() + "\u001b[0m\n");
                return 1;
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JDocsCli()).execute(args);
        System.exit(exitCode);
    }
}
