package com.ivamare.callsession;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallSessionPropertiesTest {

    @Test
    void shouldHaveDefaults() {
        CallSessionProperties props = new CallSessionProperties();

        assertTrue(props.isEnabled());
        assertNull(props.getJwt().getSecret());
        assertEquals("call-session-management", props.getJwt().getIssuer());
        assertEquals(Duration.ofHours(24), props.getJwt().getTtl());
        assertEquals(500, props.getListing().getMaxLimit());
        assertEquals(List.of("*"), props.getCors().getAllowedOrigins());
        assertEquals(Duration.ofHours(12), props.getCors().getMaxAge());
    }

    @Test
    void shouldAllowOverrides() {
        CallSessionProperties props = new CallSessionProperties();
        props.setEnabled(false);
        props.getJwt().setSecret("s3cret");
        props.getListing().setMaxLimit(25);

        assertFalse(props.isEnabled());
        assertEquals("s3cret", props.getJwt().getSecret());
        assertEquals(25, props.getListing().getMaxLimit());
    }
}
