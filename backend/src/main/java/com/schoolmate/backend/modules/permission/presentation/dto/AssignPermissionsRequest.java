package com.schoolmate.backend.modules.permission.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record AssignPermissionsRequest(
        @NotNull List<@NotNull UUID> permissionIds
) {
}
