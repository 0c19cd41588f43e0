package com.schoolmate.backend.modules.approval.presentation;

import java.util.Map;

import com.schoolmate.backend.global.security.SecurityUtils;
import com.schoolmate.backend.global.web.ClientRequestInfo;
import com.schoolmate.backend.modules.approval.application.EditTokenService;
import com.schoolmate.backend.modules.permission.application.CallerContext;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/super-admin/edit-tokens")
public class EditTokenMaintenanceController {

    private final EditTokenService editTokenService;

    public EditTokenMaintenanceController(EditTokenService editTokenService) {
        this.editTokenService = editTokenService;
    }

    @DeleteMapping("/expired")
    public ResponseEntity<Map<String, Integer>> purgeExpired(HttpServletRequest request) {
        CallerContext caller = CallerContext.of(
                SecurityUtils.getCurrentPrincipal(), ClientRequestInfo.from(request).ipAddress());
        return ResponseEntity.ok(Map.of("deleted", editTokenService.cleanupExpired(caller)));
    }
}
