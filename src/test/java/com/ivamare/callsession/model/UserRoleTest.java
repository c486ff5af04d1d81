package com.ivamare.callsession.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UserRoleTest {

    @Test
    void adminSatisfiesEveryRole() {
        assertTrue(UserRole.ADMIN.satisfies(UserRole.ADMIN));
        assertTrue(UserRole.ADMIN.satisfies(UserRole.USER));
    }

    @Test
    void userSatisfiesOnlyUser() {
        assertTrue(UserRole.USER.satisfies(UserRole.USER));
        assertFalse(UserRole.USER.satisfies(UserRole.ADMIN));
    }

    @Test
    void shouldParseWireValues() {
        assertEquals(UserRole.USER, UserRole.fromValue("user"));
        assertEquals(UserRole.ADMIN, UserRole.fromValue("admin"));
        assertThrows(IllegalArgumentException.class, () -> UserRole.fromValue("root"));
    }
}
