package com.neutrala.compile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LanguageTest {

    @Test
    @DisplayName("fromName accepts common spellings")
    void fromName() {
        assertEquals(Language.C, Language.fromName("c"));
        assertEquals(Language.C, Language.fromName(" C "));
        assertEquals(Language.CPP, Language.fromName("cpp"));
        assertEquals(Language.CPP, Language.fromName("C++"));
        assertEquals(Language.CPP, Language.fromName("cxx"));
    }

    @Test
    @DisplayName("Unknown languages are rejected")
    void unknownRejected() {
        assertThrows(IllegalArgumentException.class, () -> Language.fromName("rust"));
        assertThrows(IllegalArgumentException.class, () -> Language.fromName(null));
    }

    @Test
    @DisplayName("Driver and extension follow the language")
    void driverAndExtension() {
        assertEquals("clang", Language.C.driver());
        assertEquals("clang++", Language.CPP.driver());
        assertEquals("c", Language.C.extension());
        assertEquals("cpp", Language.CPP.extension());
    }
}
