package com.provider.linkage.identity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrgIdGeneratorTest {

    @Test
    @DisplayName("Identifier-keyed ids should prefix the identifier")
    void testForPrimaryIdentifier() {
        assertEquals("org_1234567890", OrgIdGenerator.forPrimaryIdentifier("1234567890"));
        assertThrows(IllegalArgumentException.class, () -> OrgIdGenerator.forPrimaryIdentifier(" "));
    }

    @Test
    @DisplayName("Stable hash should be the first 16 hex characters of SHA-256")
    void testStableHash() {
        // SHA-256("abc") = ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad
        assertEquals("ba7816bf8f01cfea", OrgIdGenerator.stableHash("abc"));
    }

    @Test
    @DisplayName("Name-keyed ids should be deterministic and depend on name and state")
    void testForNameAndState() {
        String id = OrgIdGenerator.forNameAndState("sunrise clinic", "TX");

        assertEquals(id, OrgIdGenerator.forNameAndState("sunrise clinic", "TX"));
        assertEquals("org_" + OrgIdGenerator.stableHash("sunrise clinic|TX"), id);
        assertNotEquals(id, OrgIdGenerator.forNameAndState("sunrise clinic", "OK"));
        assertEquals(4 + 16, id.length());
    }
}
