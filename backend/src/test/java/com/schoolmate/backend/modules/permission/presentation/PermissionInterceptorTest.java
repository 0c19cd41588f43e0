package com.schoolmate.backend.modules.permission.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.UUID;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.global.error.ProblemKind;
import com.schoolmate.backend.modules.permission.application.PermissionGrantService;
import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;
import com.schoolmate.backend.modules.tenant.presentation.SchoolContextRequestResolver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

@ExtendWith(MockitoExtension.class)
class PermissionInterceptorTest {

    private static final UUID SCHOOL_ID = UUID.randomUUID();
    private static final UUID ADMIN_ID = UUID.randomUUID();

    @Mock
    private SchoolContextRequestResolver schoolContextRequestResolver;

    @Mock
    private PermissionGrantService permissionGrantService;

    @InjectMocks
    private PermissionInterceptor interceptor;

    private final MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/schools/x/admins/y/permissions");
    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @Test
    void unannotatedHandlerIsNotGated() throws Exception {
        assertThat(interceptor.preHandle(request, response, handler("open"))).isTrue();
        verifyNoInteractions(schoolContextRequestResolver, permissionGrantService);
    }

    @Test
    void grantedAdminPasses() throws Exception {
        when(schoolContextRequestResolver.resolve(request)).thenReturn(adminContext());
        when(permissionGrantService.hasPermission(SCHOOL_ID, ADMIN_ID, PermissionResource.STAFF, PermissionType.ADMIN))
                .thenReturn(true);

        assertThat(interceptor.preHandle(request, response, handler("manageStaff"))).isTrue();
    }

    @Test
    void deniedAdminGetsForbiddenNamingTheRequirement() throws Exception {
        when(schoolContextRequestResolver.resolve(request)).thenReturn(adminContext());
        when(permissionGrantService.hasPermission(SCHOOL_ID, ADMIN_ID, PermissionResource.STAFF, PermissionType.ADMIN))
                .thenReturn(false);

        assertThatThrownBy(() -> interceptor.preHandle(request, response, handler("manageStaff")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("permission.denied");
                    assertThat(ex.getDetailMessage()).contains("STAFF:ADMIN");
                });
    }

    @Test
    void classLevelRequirementAppliesToMethodsWithoutOwnAnnotation() throws Exception {
        when(schoolContextRequestResolver.resolve(request)).thenReturn(adminContext());
        when(permissionGrantService.hasPermission(SCHOOL_ID, ADMIN_ID, PermissionResource.GRADES, PermissionType.READ))
                .thenReturn(true);

        HandlerMethod handler = new HandlerMethod(new GradesEndpoints(), GradesEndpoints.class.getMethod("list"));

        assertThat(interceptor.preHandle(request, response, handler)).isTrue();
    }

    @Test
    void platformScopeSkipsGrantLookup() throws Exception {
        when(schoolContextRequestResolver.resolve(request))
                .thenReturn(new SchoolContext(SCHOOL_ID, UUID.randomUUID(), true, null));

        assertThat(interceptor.preHandle(request, response, handler("manageStaff"))).isTrue();
        verifyNoInteractions(permissionGrantService);
    }

    private static SchoolContext adminContext() {
        return new SchoolContext(SCHOOL_ID, UUID.randomUUID(), false, ADMIN_ID);
    }

    private static HandlerMethod handler(String name) throws NoSuchMethodException {
        return new HandlerMethod(new StaffEndpoints(), StaffEndpoints.class.getMethod(name));
    }

    static class StaffEndpoints {

        public void open() {
        }

        @RequirePermission(resource = PermissionResource.STAFF, type = PermissionType.ADMIN)
        public void manageStaff() {
        }
    }

    @RequirePermission(resource = PermissionResource.GRADES, type = PermissionType.READ)
    static class GradesEndpoints {

        public void list() {
        }
    }
}
