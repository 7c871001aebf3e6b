package com.adlanda.codeindex.credentials;

import java.util.Optional;

/**
 * Source of remote-host access tokens for a caller.
 */
public interface CredentialStore {

    /**
     * @return The caller's token, or empty when the caller has not connected an account
     */
    Optional<String> tokenFor(String user);
}
