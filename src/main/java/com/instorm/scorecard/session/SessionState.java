package com.instorm.scorecard.session;

import com.instorm.scorecard.model.domain.Credential;
import com.instorm.scorecard.model.domain.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory holder of the active credential and the "current user" signal that the
 * rest of the client observes. Only {@link SessionManager} writes to it.
 */
@Slf4j
@Component
public class SessionState {

    private final AtomicReference<Credential> credential = new AtomicReference<>();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    public Optional<User> currentUser() {
        return Optional.ofNullable(credential.get()).map(Credential::user);
    }

    public Optional<String> currentToken() {
        return Optional.ofNullable(credential.get()).map(Credential::token);
    }

    public boolean isAuthenticated() {
        return credential.get() != null;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    void publish(Credential next) {
        credential.set(next);
        notifyListeners(Optional.of(next.user()));
    }

    /**
     * @return {@code false} when there was no session to clear
     */
    boolean clear() {
        if (credential.getAndSet(null) == null) {
            return false;
        }
        notifyListeners(Optional.empty());
        return true;
    }

    private void notifyListeners(Optional<User> user) {
        for (SessionListener listener : listeners) {
            try {
                listener.onSessionChanged(user);
            } catch (RuntimeException e) {
                log.error("Session listener {} failed", listener, e);
            }
        }
    }
}
