package com.instorm.scorecard.session;

import com.instorm.scorecard.model.domain.User;

import java.util.Optional;

/**
 * Observer of the current user. Called with the new user on login or restore and
 * with an empty value on logout.
 */
@FunctionalInterface
public interface SessionListener {

    void onSessionChanged(Optional<User> user);
}
