package com.parkezy.booking.identity;

import com.parkezy.common.exception.NotAuthenticatedException;

import java.util.Optional;

/**
 * Supplies the stable identifier of the user making the current call.
 */
public interface CurrentUserProvider {

    Optional<String> currentUserId();

    default String requireCurrentUserId() {
        return currentUserId().orElseThrow(NotAuthenticatedException::new);
    }
}
