package com.instorm.scorecard.service.bootstrap;

import com.instorm.scorecard.session.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Restores the persisted session once the application context is ready, so the
 * dashboard starts loading without a new login.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionBootstrapService {

    private final SessionManager sessionManager;

    @EventListener(ApplicationReadyEvent.class)
    public void restoreOnStartup() {
        log.info("--- RESTORING SESSION ---");
        sessionManager.restoreSession()
                .ifPresentOrElse(
                        user -> log.info("Session active for '{}'", user.displayName()),
                        () -> log.info("No active session, login required"));
    }
}
