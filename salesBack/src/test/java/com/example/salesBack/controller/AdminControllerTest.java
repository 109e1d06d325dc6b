package com.example.salesBack.controller;

import com.example.salesBack.config.SecurityConfig;
import com.example.salesBack.exception.GlobalExceptionHandler;
import com.example.salesBack.filters.JwtAuthenticationFilter;
import com.example.salesBack.model.AccountStatus;
import com.example.salesBack.model.AuthenticatedUser;
import com.example.salesBack.model.Role;
import com.example.salesBack.model.User;
import com.example.salesBack.service.AccountLockoutService;
import com.example.salesBack.service.AuthorizationService;
import com.example.salesBack.service.UserDetailsServiceImpl;
import com.example.salesBack.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AdminController.class)
@Import({SecurityConfig.class, JwtAuthenticationFilter.class, GlobalExceptionHandler.class})
@DisplayName("AdminController Web Tests")
class AdminControllerTest {

    private static final String BEARER = "Bearer admin-token";

    @Autowired
    private MockMvc mockMvc;

    @MockBean(name = "authorizationService")
    private AuthorizationService authorizationService;

    @MockBean
    private UserDetailsServiceImpl userDetailsService;

    @MockBean
    private UserService userService;

    @MockBean
    private AccountLockoutService accountLockoutService;

    private final AuthenticatedUser admin = new AuthenticatedUser("a1", "admin@sales.local", "Admin", "System");
    private User employee;

    @BeforeEach
    void setUp() {
        employee = new User();
        employee.setId("u1");
        employee.setFirstName("Jane");
        employee.setLastName("Doe");
        employee.setEmail("jane@example.com");
        when(authorizationService.authenticate(BEARER)).thenReturn(admin);
    }

    @Test
    @DisplayName("Should list users for admins and managers")
    void shouldListUsers() throws Exception {
        when(authorizationService.hasAnyRole(admin, "admin", "manager")).thenReturn(true);
        when(userService.findAll(Role.MANAGER)).thenReturn(List.of(employee));

        mockMvc.perform(get("/admin/users").param("role", "manager").header(HttpHeaders.AUTHORIZATION, BEARER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].email").value("jane@example.com"));
    }

    @Test
    @DisplayName("Should reject an unknown role filter")
    void shouldRejectUnknownRoleFilter() throws Exception {
        when(authorizationService.hasAnyRole(admin, "admin", "manager")).thenReturn(true);

        mockMvc.perform(get("/admin/users").param("role", "ceo").header(HttpHeaders.AUTHORIZATION, BEARER))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0].field").value("role"));
    }

    @Test
    @DisplayName("Should refuse administration to other roles")
    void shouldRefuseRegularUsers() throws Exception {
        when(authorizationService.hasAnyRole(any(), any(String[].class))).thenReturn(false);

        mockMvc.perform(put("/admin/users/u1/unlock").header(HttpHeaders.AUTHORIZATION, BEARER))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.message").value("Access denied: insufficient role"));

        verifyNoInteractions(accountLockoutService);
    }

    @Test
    @DisplayName("Should unlock a blocked account")
    void shouldUnlock() throws Exception {
        when(authorizationService.hasAnyRole(admin, "admin")).thenReturn(true);
        when(accountLockoutService.unlock("u1")).thenReturn(employee);

        mockMvc.perform(put("/admin/users/u1/unlock").header(HttpHeaders.AUTHORIZATION, BEARER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Account unlocked successfully"))
            .andExpect(jsonPath("$.data.blocked").value(false));
    }

    @Test
    @DisplayName("Should change the account status")
    void shouldUpdateStatus() throws Exception {
        employee.setStatus(AccountStatus.INACTIVE);
        when(authorizationService.hasAnyRole(admin, "admin")).thenReturn(true);
        when(userService.updateStatus("u1", AccountStatus.INACTIVE)).thenReturn(employee);

        mockMvc.perform(put("/admin/users/u1/status")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"inactive\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("inactive"));
    }

    @Test
    @DisplayName("Should require a role in the role update body")
    void shouldValidateRoleUpdate() throws Exception {
        when(authorizationService.hasAnyRole(admin, "admin")).thenReturn(true);

        mockMvc.perform(put("/admin/users/u1/role")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0].field").value("role"));

        verify(userService, never()).updateRole(anyString(), any());
    }
}
