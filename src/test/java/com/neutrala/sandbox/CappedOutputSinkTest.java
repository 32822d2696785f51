package com.neutrala.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CappedOutputSinkTest {

    @Test
    @DisplayName("Writes within the cap are kept whole")
    void withinCap() {
        var sink = new CappedOutputSink(10);
        assertTrue(sink.write("hello".getBytes(StandardCharsets.UTF_8), 5));
        assertTrue(sink.write("world".getBytes(StandardCharsets.UTF_8), 5));
        assertEquals("helloworld", sink.asString());
    }

    @Test
    @DisplayName("The chunk that crosses the cap is cut and reported")
    void crossingCap() {
        var sink = new CappedOutputSink(8);
        assertTrue(sink.write("hello".getBytes(StandardCharsets.UTF_8), 5));
        assertFalse(sink.write("world".getBytes(StandardCharsets.UTF_8), 5));
        assertEquals("hellowor", sink.asString());
        assertEquals(10, sink.totalSeen());
        assertFalse(sink.write("!".getBytes(StandardCharsets.UTF_8), 1));
        assertEquals("hellowor", sink.asString());
    }

    @Test
    @DisplayName("Signal numbers map to names")
    void signalNames() {
        assertEquals("SIGSEGV", ProcessSupervisor.signalName(11));
        assertEquals("SIGKILL", ProcessSupervisor.signalName(9));
        assertEquals("SIG42", ProcessSupervisor.signalName(42));
    }
}
