package com.schoolmate.backend.modules.school.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyEditTokenRequest(@NotBlank String token) {
}
