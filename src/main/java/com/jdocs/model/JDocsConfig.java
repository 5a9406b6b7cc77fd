package com.jdocs.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Application configuration stored in ~/.jdocs/config.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JDocsConfig {
    private String baseUrl;
    private String model;
    private String apiKey;
    private List<String> serverCommand;
    private Integer requestTimeoutSeconds;

    public JDocsConfig() {
        this.serverCommand = new ArrayList<>();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    /**
     * Command line of an external MCP server. Empty means the built-in document tools.
     */
    public List<String> getServerCommand() {
        return serverCommand;
    }

    public void setServerCommand(List<String> serverCommand) {
        this.serverCommand = serverCommand != null ? serverCommand : new ArrayList<>();
    }

    public Integer getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(Integer requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }
}
