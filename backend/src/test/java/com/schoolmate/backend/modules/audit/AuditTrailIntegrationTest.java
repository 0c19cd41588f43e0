package com.schoolmate.backend.modules.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.UUID;

import com.schoolmate.backend.modules.audit.application.AuditLogService;
import com.schoolmate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.schoolmate.backend.modules.school.domain.School;
import com.schoolmate.backend.support.AbstractPostgresIntegrationTest;
import com.schoolmate.backend.support.TestSchools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ExtendWith(OutputCaptureExtension.class)
class AuditTrailIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private AuditLogService auditLogService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private TestSchools testSchools;

    @Test
    void committedEntryIsLogged(CapturedOutput output) {
        School school = testSchools.createSchool("Oak Hill", "oakhill");
        String resourceKey = "committed-" + UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> auditLogService.record(command(school, resourceKey)));

        assertThat(output.getOut()).contains(resourceKey);
        assertThat(countFor(resourceKey)).isEqualTo(1);
    }

    @Test
    void rolledBackEntryLeavesNoTrace(CapturedOutput output) {
        School school = testSchools.createSchool("Oak Hill", "oakhill");
        String resourceKey = "rolled-back-" + UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> {
            auditLogService.record(command(school, resourceKey));
            status.setRollbackOnly();
        });

        assertThat(output.getOut()).doesNotContain(resourceKey);
        assertThat(countFor(resourceKey)).isZero();
    }

    private int countFor(String resourceKey) {
        return jdbcTemplate.queryForObject(
                "select count(*) from audit_log where resource_key = ?", Integer.class, resourceKey);
    }

    private static AuditLogCommand command(School school, String resourceKey) {
        return new AuditLogCommand(
                school.getId(),
                "SCHOOL_PROFILE_UPDATE",
                "SCHOOL",
                resourceKey,
                null,
                null,
                Map.of("address", "2 Orchard Lane")
        );
    }
}
