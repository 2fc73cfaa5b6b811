package com.orgscope.backend.modules.member.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdateMemberRequest(
        @Size(max = 255, message = "fullName must be at most 255 characters")
        String fullName,
        @Email(message = "email must be a valid address")
        @Size(max = 320, message = "email must be at most 320 characters")
        String email
) {
}
