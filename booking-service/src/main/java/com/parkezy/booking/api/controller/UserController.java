package com.parkezy.booking.api.controller;

import com.parkezy.booking.api.dto.RegisterUserRequest;
import com.parkezy.booking.api.dto.UserProfileResponse;
import com.parkezy.booking.domain.service.UserProfileStore;
import com.parkezy.booking.identity.CurrentUserProvider;
import com.parkezy.common.dto.BaseResponse;
import com.parkezy.common.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserProfileStore userProfileStore;
    private final CurrentUserProvider currentUserProvider;

    @PostMapping("/me")
    public ResponseEntity<BaseResponse<UserProfileResponse>> register(
            @Valid @RequestBody RegisterUserRequest request) {
        String userId = currentUserProvider.requireCurrentUserId();
        UserProfileResponse response = UserProfileResponse.from(userProfileStore.register(userId, request));
        return ResponseEntity.ok(BaseResponse.success("Profile saved", response));
    }

    @GetMapping("/me")
    public ResponseEntity<BaseResponse<UserProfileResponse>> me() {
        String userId = currentUserProvider.requireCurrentUserId();
        UserProfileResponse response = userProfileStore.findProfile(userId)
                .map(UserProfileResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        return ResponseEntity.ok(BaseResponse.success(response));
    }
}
