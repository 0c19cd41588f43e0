package com.schoolmate.backend.modules.permission.application;

public record MigrationResult(int migrated, int skipped) {
}
