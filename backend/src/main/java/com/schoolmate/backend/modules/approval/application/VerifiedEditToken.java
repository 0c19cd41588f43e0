package com.schoolmate.backend.modules.approval.application;

import com.schoolmate.backend.modules.school.domain.SchoolProfileChanges;
import com.schoolmate.backend.modules.school.domain.SchoolSnapshot;

public record VerifiedEditToken(SchoolProfileChanges proposedChanges, SchoolSnapshot currentSnapshot) {
}
