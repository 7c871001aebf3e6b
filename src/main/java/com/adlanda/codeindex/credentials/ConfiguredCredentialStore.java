package com.adlanda.codeindex.credentials;

import com.adlanda.codeindex.config.CredentialProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Reads tokens from configuration: a per-user entry first, then the default token.
 */
@Component
public class ConfiguredCredentialStore implements CredentialStore {

    private final CredentialProperties properties;

    public ConfiguredCredentialStore(CredentialProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> tokenFor(String user) {
        String token = user != null ? properties.getTokens().get(user) : null;
        if (!StringUtils.hasText(token)) {
            token = properties.getDefaultToken();
        }
        return StringUtils.hasText(token) ? Optional.of(token.trim()) : Optional.empty();
    }
}
