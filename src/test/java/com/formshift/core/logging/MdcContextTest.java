package com.formshift.core.logging;

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
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("FSR-2026-0001");
        assertEquals("FSR-2026-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("setForm puts runId and form in MDC")
    void setForm() {
        MdcContext.setForm("FSR-2026-0001", "MainForm");
        assertEquals("FSR-2026-0001", MDC.get("runId"));
        assertEquals("MainForm", MDC.get("form"));
    }

    @Test
    @DisplayName("clearForm keeps the runId")
    void clearForm() {
        MdcContext.setForm("FSR-2026-0001", "MainForm");
        MdcContext.clearForm();
        assertEquals("FSR-2026-0001", MDC.get("runId"));
        assertNull(MDC.get("form"));
    }

    @Test
    @DisplayName("clear removes all formshift MDC keys")
    void clear() {
        MdcContext.setForm("FSR-2026-0001", "MainForm");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("form"));
    }
}
