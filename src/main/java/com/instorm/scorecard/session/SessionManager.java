package com.instorm.scorecard.session;

import com.instorm.scorecard.client.ScorecardApiClient;
import com.instorm.scorecard.exception.AuthException;
import com.instorm.scorecard.model.domain.Credential;
import com.instorm.scorecard.model.domain.User;
import com.instorm.scorecard.model.dto.LoginResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Owns the authentication lifecycle: obtaining a credential, persisting it,
 * restoring it after a restart and dropping it again.
 *
 * Callers must not start a second login while one is still running for the same
 * form; the last one to finish wins.
 */
@Slf4j
@Service
public class SessionManager {

    private final ScorecardApiClient apiClient;
    private final CredentialStore credentialStore;
    private final SessionState sessionState;
    private final Counter loginFailedCounter;

    public SessionManager(ScorecardApiClient apiClient,
                          CredentialStore credentialStore,
                          SessionState sessionState,
                          MeterRegistry meterRegistry) {
        this.apiClient = apiClient;
        this.credentialStore = credentialStore;
        this.sessionState = sessionState;
        this.loginFailedCounter = meterRegistry.counter("scorecard.login.failed");
    }

    /**
     * Authenticates and, only once the response is complete, persists and publishes
     * the credential.
     *
     * @throws AuthException when the credentials are rejected, the response is
     *                       unusable, or the call or the write fails
     */
    public User login(String identifier, String secret) {
        log.info("🔐 Login requested for '{}'", identifier);
        try {
            LoginResponse response = apiClient.authenticate(identifier, secret);
            Credential credential = toCredential(response);
            credentialStore.save(credential);
            sessionState.publish(credential);
            log.info("✅ Logged in as '{}' with role {} (token expires in {}s)",
                    credential.user().displayName(), credential.user().role(),
                    response.expiresIn() != null ? response.expiresIn() : "?");
            return credential.user();
        } catch (AuthException e) {
            loginFailedCounter.increment();
            log.warn("Login failed for '{}': {}", identifier, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            loginFailedCounter.increment();
            log.error("Login failed for '{}'", identifier, e);
            throw new AuthException("Login failed: " + e.getMessage(), e);
        }
    }

    /**
     * Ends the session. The in-memory session is always cleared, even when the stored
     * credential cannot be removed.
     */
    public void logout() {
        try {
            credentialStore.clear();
        } catch (RuntimeException e) {
            log.error("Failed to remove stored session", e);
        }
        if (sessionState.clear()) {
            log.info("👋 Logged out");
        } else {
            log.debug("Logout requested with no active session");
        }
    }

    /**
     * Ends the session after the API rejected its token.
     */
    public void invalidate(String reason) {
        log.warn("Session invalidated: {}", reason);
        logout();
    }

    /**
     * Brings back a persisted session without calling the API. An expired token
     * is only noticed on the first authorized call.
     */
    public Optional<User> restoreSession() {
        Optional<Credential> stored;
        try {
            stored = credentialStore.load();
        } catch (RuntimeException e) {
            log.error("Failed to read stored session", e);
            return Optional.empty();
        }
        if (stored.isEmpty()) {
            log.info("No stored session to restore");
            return Optional.empty();
        }
        Credential credential = stored.get();
        sessionState.publish(credential);
        log.info("Restored session for '{}' with role {}", credential.user().displayName(), credential.user().role());
        return Optional.of(credential.user());
    }

    public Optional<User> currentUser() {
        return sessionState.currentUser();
    }

    public Optional<String> currentToken() {
        return sessionState.currentToken();
    }

    public boolean isAuthenticated() {
        return sessionState.isAuthenticated();
    }

    private static Credential toCredential(LoginResponse response) {
        if (response == null || response.token() == null || response.token().isBlank()) {
            throw new AuthException("No token received from server");
        }
        if (response.user() == null || !response.user().isComplete()) {
            throw new AuthException("No user received from server");
        }
        return new Credential(response.token(), response.user());
    }
}
