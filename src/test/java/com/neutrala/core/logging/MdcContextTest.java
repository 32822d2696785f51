package com.neutrala.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void stageCarriesSession() {
        MdcContext.setStage("s-42", "parse");

        assertEquals("s-42", MDC.get(MdcContext.SESSION_ID));
        assertEquals("parse", MDC.get(MdcContext.STAGE));
    }

    @Test
    void clearLeavesUnrelatedKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setStage("s-1", "compile");
        MdcContext.clear();

        assertNull(MDC.get(MdcContext.SESSION_ID));
        assertNull(MDC.get(MdcContext.STAGE));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
