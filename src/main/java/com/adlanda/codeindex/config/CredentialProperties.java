package com.adlanda.codeindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * GitHub access tokens per caller, prefixed with 'codeindex.credentials'.
 *
 * Tokens normally come from the environment, e.g.
 * CODEINDEX_CREDENTIALS_DEFAULT_TOKEN=ghp_...
 */
@Component
@ConfigurationProperties(prefix = "codeindex.credentials")
public class CredentialProperties {

    /**
     * Token used for callers without an entry in {@link #tokens}.
     */
    private String defaultToken = "";

    private Map<String, String> tokens = new HashMap<>();

    public String getDefaultToken() {
        return defaultToken;
    }

    public void setDefaultToken(String defaultToken) {
        this.defaultToken = defaultToken;
    }

    public Map<String, String> getTokens() {
        return tokens;
    }

    public void setTokens(Map<String, String> tokens) {
        this.tokens = tokens;
    }
}
