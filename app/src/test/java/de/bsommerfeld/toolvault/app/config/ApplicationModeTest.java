package de.bsommerfeld.toolvault.app.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    @Test
    void get_shouldResolveFromSystemProperty() {
        String original = System.getProperty("app.mode");
        try {
            System.setProperty("app.mode", "TEST");
            assertEquals(ApplicationMode.TEST, ApplicationMode.get());
        } finally {
            if (original != null)
                System.setProperty("app.mode", original);
            else
                System.clearProperty("app.mode");
        }
    }

    @Test
    void parse_shouldBeCaseInsensitive() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.parse("test"));
        assertEquals(ApplicationMode.TEST, ApplicationMode.parse(" Test "));
    }

    @Test
    void parse_shouldDefaultToProdForInvalidValue() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse("INVALID_GARBAGE"));
    }

    @Test
    void parse_shouldDefaultToProdForMissingValue() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse(null));
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse(""));
    }

    @Test
    void isTest_shouldOnlyHoldForTestMode() {
        assertTrue(ApplicationMode.TEST.isTest());
        assertFalse(ApplicationMode.PROD.isTest());
    }
}
