package com.authplatform.authsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of the forgot-password and send-verification endpoints.
 */
public record EmailRequest(
        @NotBlank(message = "Email is required")
        String email
) {}
