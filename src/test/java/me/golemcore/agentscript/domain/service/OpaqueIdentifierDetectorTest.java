package me.golemcore.agentscript.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpaqueIdentifierDetectorTest {

    private final OpaqueIdentifierDetector detector = new OpaqueIdentifierDetector();

    @ParameterizedTest
    @ValueSource(strings = {
            "0XxKj000000ABCD",
            "0XxKj000000ABCDEFG",
            "abcKj000000ABCD"
    })
    void shouldDetectFifteenAndEighteenCharacterRecordIds(String token) {
        assertTrue(detector.isOpaque(token));
    }

    @Test
    void shouldNotTreatOtherLengthsOrShapesAsOpaque() {
        assertFalse(detector.isOpaque("0XxKj000000ABC"));
        assertFalse(detector.isOpaque("GetOrderStatusXY"));
        assertFalse(detector.isOpaque("abcdefghijklmno"));
        assertFalse(detector.isOpaque("Get_Order_12345"));
        assertFalse(detector.isOpaque(null));
    }

    @Test
    void shouldTreatUnderscoreOrSpaceAsReadable() {
        assertTrue(detector.isReadable("Get_Order_Status"));
        assertTrue(detector.isReadable("Get Order"));
        assertFalse(detector.isReadable("GetOrderStatus"));
    }

    @Test
    void shouldPublishOnlyReadableNonOpaqueSources() {
        assertTrue(detector.isPublishableSource("Get_Order_Status"));
        assertFalse(detector.isPublishableSource("0XxKj000000ABCD"));
        assertFalse(detector.isPublishableSource(null));
    }
}
