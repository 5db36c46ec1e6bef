package com.parkezy.booking.domain.service;

import com.parkezy.booking.api.dto.RegisterUserRequest;
import com.parkezy.booking.domain.model.UserCapability;
import com.parkezy.booking.domain.model.UserProfile;
import com.parkezy.booking.domain.repository.UserProfileRepository;
import com.parkezy.common.exception.AccessDeniedException;
import com.parkezy.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * User profiles consumed by the booking core: capability checks and cumulative stats.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileStore {

    private static final String RESOURCE = "User";

    private final UserProfileRepository userProfileRepository;

    /**
     * Creates the profile, or refreshes contact details if it already exists.
     * Stats and capabilities of an existing profile are kept.
     */
    @Transactional
    public UserProfile register(String userId, RegisterUserRequest request) {
        UserProfile profile = userProfileRepository.findById(userId)
                .orElseGet(() -> UserProfile.builder().id(userId).build());
        profile.setEmail(request.email());
        profile.setName(request.name());
        profile.setPhoneNumber(request.phoneNumber());
        UserProfile saved = userProfileRepository.save(profile);
        log.info("Registered profile for user {}", userId);
        return saved;
    }

    @Transactional(readOnly = true)
    public UserProfile getProfile(String userId) {
        return userProfileRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, userId));
    }

    /**
     * Best-effort load used when the current identity changes. A store failure is logged
     * and reported as an absent profile rather than failing the caller.
     */
    @Transactional(readOnly = true)
    public Optional<UserProfile> findProfile(String userId) {
        try {
            return userProfileRepository.findById(userId);
        } catch (DataAccessException e) {
            log.warn("Failed to load profile for user {}, continuing without it", userId, e);
            return Optional.empty();
        }
    }

    /**
     * @throws ResourceNotFoundException if the user has no profile
     * @throws AccessDeniedException if the profile lacks the capability
     */
    @Transactional(readOnly = true)
    public UserProfile requireCapability(String userId, UserCapability capability) {
        UserProfile profile = getProfile(userId);
        if (!profile.has(capability)) {
            throw new AccessDeniedException("User " + userId + " lacks capability " + capability);
        }
        return profile;
    }

    @Transactional
    public void enableCapability(String userId, UserCapability capability) {
        UserProfile profile = getProfile(userId);
        if (!profile.has(capability)) {
            profile.enable(capability);
            userProfileRepository.save(profile);
            log.info("Enabled {} for user {}", capability, userId);
        }
    }

    @Transactional
    public void incrementDriverBookingCount(String userId) {
        if (userProfileRepository.incrementDriverBookingCount(userId) == 0) {
            throw new ResourceNotFoundException(RESOURCE, userId);
        }
    }

    @Transactional
    public void creditHostEarnings(String userId, BigDecimal amount) {
        if (userProfileRepository.addHostEarnings(userId, amount) == 0) {
            throw new ResourceNotFoundException(RESOURCE, userId);
        }
        log.debug("Credited {} to host {}", amount, userId);
    }
}
