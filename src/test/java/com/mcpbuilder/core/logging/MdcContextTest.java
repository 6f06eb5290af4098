package com.mcpbuilder.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setConnection puts connectionId and userId in MDC")
    void setConnection() {
        MdcContext.setConnection("conn_1", "alice");
        assertEquals("conn_1", MDC.get("connectionId"));
        assertEquals("alice", MDC.get("userId"));
    }

    @Test
    @DisplayName("setProject puts projectId in MDC")
    void setProject() {
        MdcContext.setProject("proj-1");
        assertEquals("proj-1", MDC.get("projectId"));
    }

    @Test
    @DisplayName("clear removes all realtime MDC keys and leaves others alone")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setConnection("conn_1", "alice");
        MdcContext.setProject("proj-1");

        MdcContext.clear();

        assertNull(MDC.get("connectionId"));
        assertNull(MDC.get("userId"));
        assertNull(MDC.get("projectId"));
        assertEquals("r-1", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
