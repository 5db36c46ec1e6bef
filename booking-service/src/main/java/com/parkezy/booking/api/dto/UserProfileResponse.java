package com.parkezy.booking.api.dto;

import com.parkezy.booking.domain.model.UserProfile;

import java.math.BigDecimal;

public record UserProfileResponse(
        String id,
        String email,
        String name,
        String phoneNumber,
        boolean canDrive,
        boolean canHostPrivate,
        boolean canHostCommercial,
        int totalBookingsAsDriver,
        Double hostRating,
        BigDecimal totalEarnings
) {
    public static UserProfileResponse from(UserProfile profile) {
        return new UserProfileResponse(
                profile.getId(),
                profile.getEmail(),
                profile.getName(),
                profile.getPhoneNumber(),
                profile.isCanDrive(),
                profile.isCanHostPrivate(),
                profile.isCanHostCommercial(),
                profile.getTotalBookingsAsDriver(),
                profile.getHostRating(),
                profile.getTotalEarnings()
        );
    }
}
