package com.provider.linkage.identity;

import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.audit.AuditEntry;
import com.provider.linkage.audit.AuditLedger;
import com.provider.linkage.audit.ShardAuditLog;
import com.provider.linkage.cache.CacheConfig;
import com.provider.linkage.cache.NormalizationCache;
import com.provider.linkage.core.model.EntityType;
import com.provider.linkage.core.model.IdentityRecord;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.core.model.SourceRecordRef;
import com.provider.linkage.rules.NameNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IdentityResolverTest {

    private IdentityResolver resolver;
    private AuditLedger ledger;
    private ShardAuditLog audit;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(new NormalizationCache(new NameNormalizer(), CacheConfig.defaults()));
        ledger = new AuditLedger();
        audit = ledger.shard("spine");
    }

    private static IdentityRecord.Builder record(long order, String primaryIdentifier, String name, String state) {
        return IdentityRecord.builder()
                .sourceName("nppes")
                .recordKey("r" + order)
                .sourceOrder(order)
                .primaryIdentifier(primaryIdentifier)
                .legalName(name)
                .stateCode(state);
    }

    private List<AuditEntry> entries(AuditAction action) {
        return audit.getEntries().stream().filter(e -> e.action() == action).toList();
    }

    @Nested
    @DisplayName("Spine pass")
    class SpinePass {

        @Test
        @DisplayName("Should create one organization per primary identifier with a stable id")
        void testCreatesOrganization() {
            SpineResult result = resolver.resolve(List.of(
                    record(1, "1234567890", "Sunrise Family Health Center, Inc.", "TX")
                            .zip("78701-1234").phone("(512) 555-0100").address("1 Main St").build()), audit);

            assertEquals(1, result.spine().size());
            Organization org = result.spine().findByPrimaryIdentifier("1234567890").orElseThrow();
            assertEquals("org_1234567890", org.getOrgId());
            assertEquals("sunrise family health center", org.getNormalizedName());
            assertEquals("78701", org.getZip());
            assertEquals("78701-1234", org.getDisplayZip());
            assertEquals("5125550100", org.getPhone());
            assertEquals(List.of(new SourceRecordRef("nppes", "r1")), new ArrayList<>(org.getLinkedRecords()));
        }

        @Test
        @DisplayName("First-seen record should win and later conflicting records should be collisions")
        void testIdentifierCollision() {
            SpineResult result = resolver.resolve(List.of(
                    record(2, "1234567890", "Northside Clinic", "OK").build(),
                    record(1, "1234567890", "Sunrise Clinic", "TX").build()), audit);

            Organization org = result.spine().findByPrimaryIdentifier("1234567890").orElseThrow();
            assertEquals("sunrise clinic", org.getNormalizedName());
            assertEquals("TX", org.getStateCode());
            assertEquals(2, org.getLinkedRecordCount());
            assertEquals(1, result.collisions());

            List<AuditEntry> collisions = entries(AuditAction.IDENTIFIER_COLLISION);
            assertEquals(1, collisions.size());
            assertEquals("r2", collisions.get(0).recordKey());
            assertEquals("org_1234567890", collisions.get(0).orgId());
            assertTrue(collisions.get(0).detail().contains("state TX vs OK"));
        }

        @Test
        @DisplayName("Duplicates differing only in casing and punctuation should fold silently")
        void testSilentFold() {
            SpineResult result = resolver.resolve(List.of(
                    record(1, "1234567890", "Sunrise Clinic, LLC", "TX").zip("78701").build(),
                    record(2, "1234567890", "SUNRISE CLINIC", "tx").zip("78701-0001").build()), audit);

            assertEquals(0, result.collisions());
            assertTrue(entries(AuditAction.IDENTIFIER_COLLISION).isEmpty());
            assertEquals(2, result.spine().findByPrimaryIdentifier("1234567890").orElseThrow().getLinkedRecordCount());
        }

        @Test
        @DisplayName("Blank attributes on a later record should not count as a conflict")
        void testBlankAttributesAreNotConflicts() {
            SpineResult result = resolver.resolve(List.of(
                    record(1, "1234567890", "Sunrise Clinic", "TX").zip("78701").build(),
                    record(2, "1234567890", "Sunrise Clinic", "TX").build()), audit);

            assertEquals(0, result.collisions());
        }

        @Test
        @DisplayName("Individual records should be discarded and audited")
        void testIndividualsDiscarded() {
            SpineResult result = resolver.resolve(List.of(
                    record(1, "1111111111", "Jane Doe MD", "TX").entityType(EntityType.INDIVIDUAL).build(),
                    record(2, "2222222222", "Sunrise Clinic", "TX").build()), audit);

            assertEquals(1, result.spine().size());
            assertEquals(1, result.discardedIndividuals());
            assertEquals(1, entries(AuditAction.DISCARDED_INDIVIDUAL).size());
        }

        @Test
        @DisplayName("Records without a primary identifier should be parked, not dropped")
        void testParking() {
            SpineResult result = resolver.resolve(List.of(
                    record(1, null, "Sunrise Clinic", "TX").build(),
                    record(2, "  ", "Northside Clinic", "OK").build()), audit);

            assertEquals(0, result.spine().size());
            assertEquals(2, result.parked().size());
            assertEquals("sunrise clinic", result.parked().get(0).normalizedName());
            assertEquals("OK", result.parked().get(1).stateCode());
        }

        @Test
        @DisplayName("Malformed records should be rejected and never create an organization")
        void testMalformedRejected() {
            SpineResult result = resolver.resolve(List.of(
                    record(1, null, "  ,. ", "TX").build(),
                    record(2, "12345", "Short Identifier Clinic", "TX").build(),
                    record(3, "12345678AB", "Letters Clinic", "TX").build()), audit);

            assertEquals(0, result.spine().size());
            assertTrue(result.parked().isEmpty());
            assertEquals(3, result.rejected());
            assertEquals(3, entries(AuditAction.REJECTED_MALFORMED).size());
        }

        @Test
        @DisplayName("A missing name is acceptable when the identifier is present")
        void testNamelessWithIdentifier() {
            SpineResult result = resolver.resolve(List.of(record(1, "1234567890", null, "TX").build()), audit);

            Organization org = result.spine().get("org_1234567890").orElseThrow();
            assertEquals("", org.getNormalizedName());
        }

        @Test
        @DisplayName("Result should not depend on the input list order")
        void testOrderIndependence() {
            List<IdentityRecord> records = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                records.add(record(i, String.format("%010d", i % 10), "Clinic " + (i % 7), i % 2 == 0 ? "TX" : "OK")
                        .build());
            }
            List<IdentityRecord> shuffled = new ArrayList<>(records);
            Collections.shuffle(shuffled, new Random(42));

            SpineResult ordered = resolver.resolve(records, new AuditLedger().shard("a"));
            SpineResult reversed = resolver.resolve(shuffled, new AuditLedger().shard("b"));

            assertEquals(ordered.spine().orgIds(), reversed.spine().orgIds());
            for (Organization org : ordered.spine().organizations()) {
                Organization other = reversed.spine().get(org.getOrgId()).orElseThrow();
                assertEquals(org.getNormalizedName(), other.getNormalizedName());
                assertEquals(org.getStateCode(), other.getStateCode());
                assertEquals(org.getLinkedRecords(), other.getLinkedRecords());
            }
            assertEquals(ordered.collisions(), reversed.collisions());
        }
    }

    @Nested
    @DisplayName("Name-keyed organizations")
    class NameKeyed {

        @Test
        @DisplayName("Parked records sharing name and state should fold into one organization")
        void testFolding() {
            SpineResult result = resolver.resolve(List.of(
                    record(1, null, "Sunrise Clinic", "TX").build(),
                    record(2, null, "Sunrise Clinic, Inc.", "TX").build(),
                    record(3, null, "Sunrise Clinic", "OK").build()), audit);

            List<Organization> created = resolver.createNameKeyed(result.parked(), result.spine(), audit);

            assertEquals(2, created.size());
            String texasId = OrgIdGenerator.forNameAndState("sunrise clinic", "TX");
            Organization texas = result.spine().get(texasId).orElseThrow();
            assertEquals(2, texas.getLinkedRecordCount());
            assertFalse(texas.hasPrimaryIdentifier());
            assertEquals(2, entries(AuditAction.CREATED_FROM_NAME).size());
        }
    }
}
