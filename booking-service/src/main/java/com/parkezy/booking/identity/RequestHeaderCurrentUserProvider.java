package com.parkezy.booking.identity;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

/**
 * Reads the user id that the gateway put on the request after authenticating it.
 * Outside a request (scheduled jobs) there is no current user.
 */
@Component
public class RequestHeaderCurrentUserProvider implements CurrentUserProvider {

    private final String headerName;

    public RequestHeaderCurrentUserProvider(@Value("${parking.identity.header:X-User-Id}") String headerName) {
        this.headerName = headerName;
    }

    @Override
    public Optional<String> currentUserId() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            return Optional.empty();
        }
        HttpServletRequest request = servletAttributes.getRequest();
        String value = request.getHeader(headerName);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
