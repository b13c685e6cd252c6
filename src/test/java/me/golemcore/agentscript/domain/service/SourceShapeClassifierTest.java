package me.golemcore.agentscript.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentscript.domain.exception.ConversionException;
import me.golemcore.agentscript.domain.model.SourceShape;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SourceShapeClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SourceShapeClassifier classifier = new SourceShapeClassifier();

    @Test
    void shouldClassifyVendorExport() throws Exception {
        assertEquals(SourceShape.VENDOR_EXPORT,
                classifier.classify(objectMapper.readTree("{\"plugins\":[{}],\"topics\":[{}]}")).shape());
    }

    @Test
    void shouldClassifySimplifiedExport() throws Exception {
        assertEquals(SourceShape.SIMPLIFIED_EXPORT,
                classifier.classify(objectMapper.readTree("{\"plugins\":[],\"topics\":[{}]}")).shape());
    }

    @Test
    void shouldClassifyGenericExport() throws Exception {
        assertEquals(SourceShape.GENERIC_EXPORT, classifier.classify(objectMapper.readTree("{\"name\":\"x\"}")).shape());
    }

    @Test
    void shouldRejectNonObjectRoot() throws Exception {
        ConversionException ex = assertThrows(ConversionException.class,
                () -> classifier.classify(objectMapper.readTree("[1,2]")));

        assertEquals("$", ex.getPath());
    }

    @Test
    void shouldRejectNonArrayPlugins() throws Exception {
        ConversionException ex = assertThrows(ConversionException.class,
                () -> classifier.classify(objectMapper.readTree("{\"plugins\":\"nope\"}")));

        assertEquals("$.plugins", ex.getPath());
    }
}
