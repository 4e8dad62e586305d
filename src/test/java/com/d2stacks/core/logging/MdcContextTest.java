package com.d2stacks.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
        MDC.remove("unrelated");
    }

    @Test
    @DisplayName("setEndpoint puts endpointId in MDC")
    void setEndpoint() {
        MdcContext.setEndpoint(7);
        assertEquals("7", MDC.get("endpointId"));
    }

    @Test
    @DisplayName("setOperation puts operation and endpointId in MDC")
    void setOperation() {
        MdcContext.setOperation("delete", 3);
        assertEquals("delete", MDC.get("operation"));
        assertEquals("3", MDC.get("endpointId"));
    }

    @Test
    @DisplayName("clear removes d2stacks MDC keys only")
    void clear() {
        MDC.put("unrelated", "kept");
        MdcContext.setOperation("login", 1);
        MdcContext.clear();
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("endpointId"));
        assertEquals("kept", MDC.get("unrelated"));
    }
}
