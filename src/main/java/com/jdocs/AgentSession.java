package com.jdocs;

import com.jdocs.dispatch.*;
import com.jdocs.llm.ModelGateway;
import com.jdocs.llm.ModelGatewayException;
import com.jdocs.llm.ModelReply;
import com.jdocs.model.ConversationTurn;
import com.jdocs.model.Model;
import com.jdocs.model.ToolDescriptor;
import com.jdocs.tools.ToolExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Core agent session: runs one user turn through decide, optional tool execution and
 * synthesis. Exactly one tool call per turn and nothing is remembered between turns.
 */
public class AgentSession {

    private static final Logger log = LoggerFactory.getLogger(AgentSession.class);

    private static final String DECISION_PROMPT = """
            You are an assistant that can call external tools through JSON.

            You have access to these tools:

            %s

            MANDATORY response protocol:
            - To use a tool, reply ONLY with JSON of this form:
              {"tool": "<tool_name>", "arguments": { ... }}

              Example:
              {"tool": "read_doc_contents", "arguments": {"doc_id": "report.pdf"}}

            - If you already have the final answer for the user, reply ONLY with:
              {"answer": "<your answer for the user>"}

            - Do NOT mix text outside the JSON.
            - Do NOT explain the JSON.
            - Do NOT add comments.
            - Do NOT use code fences such as ```json```; reply with plain JSON only.
            Valid JSON only.""";

    private static final String SYNTHESIS_PROMPT =
            "You are an assistant that answers the user clearly and directly.";

    private static final String SYNTHESIS_REQUEST = """
            Original user question:
            %s

            Result of the tool '%s':
            %s

            Use this result to answer the user. Do not use tools again. \
            Reply ONLY with natural-language text, without JSON.""";

    private final ModelGateway gateway;
    private final ToolExecutionBridge bridge;
    private final ResponseInterpreter interpreter;
    private final List<ToolDescriptor> tools;
    private final Set<String> toolNames;
    private final String decisionPrompt;

    private DispatchState state = DispatchState.AWAITING_INPUT;

    public AgentSession(ModelGateway gateway, ToolExecutionBridge bridge, List<ToolDescriptor> tools,
                        ArgumentAliasTable aliases) {
        this(gateway, bridge, tools, new ResponseInterpreter(aliases));
    }

    public AgentSession(ModelGateway gateway, ToolExecutionBridge bridge, List<ToolDescriptor> tools,
                        ResponseInterpreter interpreter) {
        this.gateway = gateway;
        this.bridge = bridge;
        this.interpreter = interpreter;
        this.tools = List.copyOf(tools);
        this.toolNames = new LinkedHashSet<>();
        this.tools.forEach(t -> toolNames.add(t.name()));
        this.decisionPrompt = DECISION_PROMPT.formatted(ToolCatalogFormatter.format(this.tools));
    }

    public Model getModel() {
        return gateway.getModel();
    }

    public List<ToolDescriptor> getTools() {
        return tools;
    }

    public DispatchState getState() {
        return state;
    }

    String getDecisionPrompt() {
        return decisionPrompt;
    }

    /**
     * Process one user turn to completion.
     *
     * @param userInput the user's question
     * @param listener  progress callbacks
     * @return how the turn ended; never throws for model or tool failures
     */
    public TurnOutcome chat(String userInput, TurnListener listener) {
        try {
            return dispatch(userInput, listener);
        } catch (ModelGatewayException e) {
            log.info("Model call failed: {}", e.getMessage());
            return new TurnOutcome(TurnOutcome.Kind.MODEL_UNAVAILABLE, e.getMessage(), null);
        } finally {
            transition(DispatchState.AWAITING_INPUT, listener);
        }
    }

    private TurnOutcome dispatch(String userInput, TurnListener listener) throws ModelGatewayException {
        transition(DispatchState.DECIDING, listener);
        ModelReply decision = gateway.chat(List.of(ConversationTurn.user(userInput)), decisionPrompt, 0.0);
        Directive directive = interpreter.interpret(decision.text(), toolNames);
        log.debug("Directive: {}", directive);

        if (directive instanceof Directive.Malformed malformed) {
            log.debug("Model reply is not valid JSON");
            return new TurnOutcome(TurnOutcome.Kind.MALFORMED, malformed.rawText(), null);
        }
        if (directive instanceof Directive.Unrecognized unrecognized) {
            log.debug("Model reply has neither 'tool' nor 'answer': {}", unrecognized.value());
            return new TurnOutcome(TurnOutcome.Kind.UNRECOGNIZED, unrecognized.value().toString(), null);
        }
        if (directive instanceof Directive.Answer answer) {
            transition(DispatchState.ANSWERING, listener);
            return new TurnOutcome(TurnOutcome.Kind.ANSWER, answer.text(), null);
        }

        Directive.ToolCall call = (Directive.ToolCall) directive;
        transition(DispatchState.EXECUTING, listener);
        listener.onToolCall(call.name(), call.arguments());

        String toolText;
        try {
            toolText = bridge.execute(call.name(), call.arguments());
        } catch (ToolExecutionException e) {
            log.debug("Tool {} failed: {}", call.name(), e.getMessage());
            return toolFailed(call.name(), e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Tool {} failed", call.name(), e);
            return toolFailed(call.name(), String.valueOf(e.getMessage()));
        }
        listener.onToolResult(call.name(), toolText);

        transition(DispatchState.SYNTHESIZING, listener);
        String request = SYNTHESIS_REQUEST.formatted(userInput, call.name(), toolText);
        ModelReply answer = gateway.chat(List.of(ConversationTurn.user(request)), SYNTHESIS_PROMPT, 0.0);
        return new TurnOutcome(TurnOutcome.Kind.SYNTHESIZED, answer.text(), call.name());
    }

    private static TurnOutcome toolFailed(String toolName, String reason) {
        return new TurnOutcome(TurnOutcome.Kind.TOOL_FAILED,
                "Error calling tool %s: %s".formatted(toolName, reason), toolName);
    }

    /**
     * Send prompt messages to the model as a plain completion, without the tool protocol.
     */
    public String complete(List<ConversationTurn> messages) throws ModelGatewayException {
        return gateway.chat(messages, null, 0.0).text();
    }

    private void transition(DispatchState next, TurnListener listener) {
        log.debug("{} -> {}", state, next);
        state = next;
        listener.onStateChange(next);
    }
}
