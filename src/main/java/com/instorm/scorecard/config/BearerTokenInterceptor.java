package com.instorm.scorecard.config;

import com.instorm.scorecard.session.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.lang.NonNull;

import java.io.IOException;

/**
 * Attaches the session's bearer token to every outgoing Scorecard API request.
 * Requests made without a session go out unauthenticated.
 */
@Slf4j
public class BearerTokenInterceptor implements ClientHttpRequestInterceptor {

    private final SessionState sessionState;

    public BearerTokenInterceptor(SessionState sessionState) {
        this.sessionState = sessionState;
    }

    @Override
    @NonNull
    public ClientHttpResponse intercept(@NonNull HttpRequest request,
                                        @NonNull byte[] body,
                                        @NonNull ClientHttpRequestExecution execution) throws IOException {
        sessionState.currentToken().ifPresent(token -> request.getHeaders().setBearerAuth(token));
        log.debug("Making Scorecard API request: {} {}", request.getMethod(), request.getURI());
        ClientHttpResponse response = execution.execute(request, body);
        log.debug("Scorecard API response status: {}", response.getStatusCode());
        return response;
    }
}
