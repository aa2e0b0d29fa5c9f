package com.moreremesas.sdk.xml;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForceListRegistryTest {

    @Test
    void defaultsCoverVendorContainers() {
        ForceListRegistry registry = ForceListRegistry.defaults();

        assertEquals(Set.of("Branch", "BranchItem"), registry.childrenOf("Branches"));
        assertTrue(registry.isForced("Options", "Option"));
        assertTrue(registry.isForced("Messages", "Message"));
        assertTrue(registry.isForced("Attributes", "Attribute"));
        assertFalse(registry.isForced("Response", "Option"));
        assertTrue(registry.childrenOf("Unknown").isEmpty());
    }

    @Test
    void builderExtendsExistingRules() {
        ForceListRegistry registry = ForceListRegistry.defaults().toBuilder()
            .force("Banks", "Bank")
            .force("Options", "Alternative")
            .build();

        assertTrue(registry.isForced("Banks", "Bank"));
        assertEquals(Set.of("Option", "Alternative"), registry.childrenOf("Options"));
        assertFalse(ForceListRegistry.defaults().isForced("Banks", "Bank"));
    }

    @Test
    void readsRulesFromJson() throws Exception {
        String json = "{\"Payers\": [\"Payer\", \" \"], \"Cities\": null}";

        ForceListRegistry registry = ForceListRegistry.fromJson(
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(Set.of("Payer"), registry.childrenOf("Payers"));
        assertTrue(registry.rules().containsKey("Cities"));
        assertTrue(registry.childrenOf("Cities").isEmpty());
    }
}
