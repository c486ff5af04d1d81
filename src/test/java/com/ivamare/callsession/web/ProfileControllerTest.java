package com.ivamare.callsession.web;

import com.ivamare.callsession.api.IdentityService;
import com.ivamare.callsession.exception.InsufficientRoleException;
import com.ivamare.callsession.exception.UserNotFoundException;
import com.ivamare.callsession.model.User;
import com.ivamare.callsession.model.UserPrincipal;
import com.ivamare.callsession.model.UserRole;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProfileController")
class ProfileControllerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private IdentityService identityService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.mockMvc(new ProfileController(identityService));
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("should return the caller's own profile")
    void shouldReturnProfile() throws Exception {
        User user = new User(UUID.randomUUID(), "a@example.com", "hash", UserRole.USER, NOW, NOW);
        MockMvcSupport.authenticate(user.toPrincipal());
        when(identityService.getUser(user.id())).thenReturn(user);

        mockMvc.perform(get("/api/profile"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.email").value("a@example.com"))
            .andExpect(jsonPath("$.role").value("user"));
    }

    @Test
    @DisplayName("admin lookup should return any user to admins")
    void adminShouldLookUpUsers() throws Exception {
        UserPrincipal admin = new UserPrincipal(UUID.randomUUID(), "root@example.com", UserRole.ADMIN);
        User other = new User(UUID.randomUUID(), "b@example.com", "hash", UserRole.USER, NOW, NOW);
        MockMvcSupport.authenticate(admin);
        when(identityService.getUser(other.id())).thenReturn(other);

        mockMvc.perform(get("/api/admin/users/{id}", other.id()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.email").value("b@example.com"));

        verify(identityService).authorize(admin, UserRole.ADMIN);
    }

    @Test
    @DisplayName("admin lookup should return 403 to regular users")
    void regularUserShouldBeForbidden() throws Exception {
        UserPrincipal user = new UserPrincipal(UUID.randomUUID(), "a@example.com", UserRole.USER);
        MockMvcSupport.authenticate(user);
        doThrow(new InsufficientRoleException(UserRole.ADMIN)).when(identityService).authorize(user, UserRole.ADMIN);

        mockMvc.perform(get("/api/admin/users/{id}", UUID.randomUUID()))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("insufficient permissions: required role admin"));

        verify(identityService, never()).getUser(any());
    }

    @Test
    @DisplayName("admin lookup should return 404 for unknown users")
    void shouldMapUnknownUser() throws Exception {
        UserPrincipal admin = new UserPrincipal(UUID.randomUUID(), "root@example.com", UserRole.ADMIN);
        UUID missing = UUID.randomUUID();
        MockMvcSupport.authenticate(admin);
        when(identityService.getUser(missing)).thenThrow(new UserNotFoundException(missing));

        mockMvc.perform(get("/api/admin/users/{id}", missing))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("user not found"));
    }
}
