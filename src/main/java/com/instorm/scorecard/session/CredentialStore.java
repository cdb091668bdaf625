package com.instorm.scorecard.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.instorm.scorecard.model.domain.Credential;
import com.instorm.scorecard.storage.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Persists the single {@link Credential} snapshot as JSON under one key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialStore {

    static final String SESSION_KEY = "scorecard.session";

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;

    public void save(Credential credential) {
        String json;
        try {
            json = objectMapper.writeValueAsString(credential);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize credential for " + credential.user().id(), e);
        }
        keyValueStore.put(SESSION_KEY, json);
    }

    /**
     * Reads the stored credential. A value that cannot be parsed, or that lacks a
     * token or a usable user, is removed and reported as no session.
     */
    public Optional<Credential> load() {
        Optional<String> raw = keyValueStore.get(SESSION_KEY);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            Credential credential = objectMapper.readValue(raw.get(), Credential.class);
            if (credential != null && credential.isStructurallyValid()) {
                return Optional.of(credential);
            }
            log.warn("Stored session is incomplete, discarding it");
        } catch (JsonProcessingException e) {
            log.warn("Stored session could not be parsed, discarding it: {}", e.getOriginalMessage());
        }
        discard();
        return Optional.empty();
    }

    public void clear() {
        keyValueStore.remove(SESSION_KEY);
    }

    private void discard() {
        try {
            clear();
        } catch (RuntimeException e) {
            log.warn("Could not remove unusable stored session: {}", e.getMessage());
        }
    }
}
