package com.session.pooling.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forAcquire should set target, operation and affinity key")
    void forAcquireSetsMDC() {
        try (LogContext ctx = LogContext.forAcquire("weather", "client-1")) {
            assertEquals("weather", MDC.get("target"));
            assertEquals("acquire", MDC.get("operation"));
            assertEquals("client-1", MDC.get("affinityKey"));
        }
    }

    @Test
    @DisplayName("forAcquire without key should not set affinityKey")
    void forAcquireWithoutKey() {
        try (LogContext ctx = LogContext.forAcquire("weather", null)) {
            assertNull(MDC.get("affinityKey"));
        }
    }

    @Test
    @DisplayName("forControl should add a correlation id")
    void forControlSetsCorrelationId() {
        try (LogContext ctx = LogContext.forControl("weather", "drain")) {
            assertEquals("drain", MDC.get("operation"));
            assertNotNull(MDC.get("correlationId"));
        }
    }

    @Test
    @DisplayName("close should remove every key it added")
    void closeRemovesKeys() {
        try (LogContext ctx = LogContext.forMaintenance("weather", "health-check").with("cycle", "7")) {
            assertEquals("7", MDC.get("cycle"));
        }
        assertNull(MDC.get("target"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("cycle"));
    }

    @Test
    @DisplayName("Correlation ids should be unique")
    void uniqueCorrelationIds() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
