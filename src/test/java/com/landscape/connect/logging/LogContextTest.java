package com.landscape.connect.logging;

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
    @DisplayName("forSession should set sessionId and both endpoints in MDC")
    void forSessionSetsMDC() {
        try (LogContext ctx = LogContext.forSession("session-1", "4", "5")) {
            assertEquals("session-1", MDC.get("sessionId"));
            assertEquals("4", MDC.get("startMinimumId"));
            assertEquals("5", MDC.get("endMinimumId"));
        }
        assertNull(MDC.get("sessionId"));
    }

    @Test
    @DisplayName("forAdmission should set minimumId and operation in MDC")
    void forAdmissionSetsMDC() {
        try (LogContext ctx = LogContext.forAdmission("42")) {
            assertEquals("42", MDC.get("minimumId"));
            assertEquals("admit", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMerge should set correlationId, keep and drop ids, and operation in MDC")
    void forMergeSetsMDC() {
        try (LogContext ctx = LogContext.forMerge("corr-789", "1", "2")) {
            assertEquals("corr-789", MDC.get("correlationId"));
            assertEquals("1", MDC.get("keepMinimumId"));
            assertEquals("2", MDC.get("dropMinimumId"));
            assertEquals("merge", MDC.get("operation"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Nested contexts restore the outer values on close")
    void nestedContextsRestore() {
        try (LogContext session = LogContext.forSession("session-1", "1", "2")) {
            try (LogContext check = LogContext.forConsistencyCheck()) {
                assertEquals("checkConsistency", MDC.get("operation"));
                try (LogContext admit = LogContext.forAdmission("7")) {
                    assertEquals("admit", MDC.get("operation"));
                }
                assertEquals("checkConsistency", MDC.get("operation"));
                assertNull(MDC.get("minimumId"));
            }
            assertNull(MDC.get("operation"));
            assertEquals("session-1", MDC.get("sessionId"));
        }
    }

    @Test
    @DisplayName("with should add extra keys that are removed on close")
    void withAddsKeys() {
        LogContext ctx = LogContext.forConsistencyCheck().with("pass", "3");
        assertEquals("3", MDC.get("pass"));

        ctx.close();

        assertNull(MDC.get("pass"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique ids")
    void uniqueCorrelationIds() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
