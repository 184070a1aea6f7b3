package org.pragmatica.jstransform.config;

import org.junit.jupiter.api.Test;
import org.pragmatica.jstransform.error.TransformError;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.visit.TransformVisitor;

import static org.junit.jupiter.api.Assertions.*;

class TransformConfigTest {

    @Test
    void defaults_comeFromReferenceConf() throws TransformException {
        assertEquals(TransformConfig.DEFAULT, TransformConfig.defaults());
        assertEquals(TransformVisitor.NAME, TransformConfig.defaults().visitorClassName());
    }

    @Test
    void fromJson_emptyObject_usesDefaults() throws TransformException {
        assertEquals(TransformConfig.DEFAULT, TransformConfig.fromJson("{}"));
    }

    @Test
    void fromJson_visitorName_isRead() throws TransformException {
        var config = TransformConfig.fromJson("{\"visitorClassName\": \"AuditVisitor\"}");

        assertEquals("AuditVisitor", config.visitorClassName());
    }

    @Test
    void fromJson_unknownKeys_areIgnored() throws TransformException {
        var config = TransformConfig.fromJson("{\"visitorClassName\": \"TransformVisitor\", \"verbose\": true}");

        assertEquals(TransformConfig.DEFAULT, config);
    }

    @Test
    void fromJson_notJson_isInvalidConfig() {
        var exception = assertThrows(TransformException.class, () -> TransformConfig.fromJson("visitorClassName ="));

        assertInstanceOf(TransformError.InvalidConfig.class, exception.error());
    }

    @Test
    void fromJson_wrongValueType_isInvalidConfig() {
        var exception = assertThrows(TransformException.class,
                                     () -> TransformConfig.fromJson("{\"visitorClassName\": {\"nested\": 1}}"));

        assertInstanceOf(TransformError.InvalidConfig.class, exception.error());
    }
}
