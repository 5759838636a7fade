package com.provider.linkage.identity;

import com.provider.linkage.audit.AuditAction;
import com.provider.linkage.audit.ShardAuditLog;
import com.provider.linkage.cache.NormalizationCache;
import com.provider.linkage.core.MalformedRecordException;
import com.provider.linkage.core.model.EntityType;
import com.provider.linkage.core.model.IdentityRecord;
import com.provider.linkage.core.model.Organization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds the organization spine from registry records.
 *
 * <p>Records are processed in ascending source order. The first record seen for a primary
 * identifier sets the organization's canonical attributes; later records for the same
 * identifier only add a linked-record reference, and are reported as collisions when their
 * normalized name, state or 5-digit zip differ. Records without an identifier are parked for
 * the fuzzy matcher and turned into name-keyed organizations by
 * {@link #createNameKeyed(List, OrganizationSpine, ShardAuditLog)} if nothing matches them.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private static final Pattern PRIMARY_IDENTIFIER = Pattern.compile("\\d{10}");

    private final NormalizationCache names;

    public IdentityResolver(NormalizationCache names) {
        this.names = Objects.requireNonNull(names, "names is required");
    }

    /**
     * Runs the sequential spine pass.
     *
     * @param records identity records from every registry snapshot
     * @param audit   log receiving rejections, discards and collisions
     */
    public SpineResult resolve(List<IdentityRecord> records, ShardAuditLog audit) {
        List<IdentityRecord> ordered = new ArrayList<>(records);
        // List.sort is stable, so records sharing a sourceOrder keep their input order
        ordered.sort(Comparator.comparingLong(IdentityRecord::sourceOrder));

        OrganizationSpine spine = new OrganizationSpine();
        List<ParkedRecord> parked = new ArrayList<>();
        int individuals = 0;
        int rejected = 0;
        int collisions = 0;

        for (IdentityRecord record : ordered) {
            if (record.entityType() == EntityType.INDIVIDUAL) {
                individuals++;
                audit.record(AuditAction.DISCARDED_INDIVIDUAL, record.sourceName(), record.recordKey(), null,
                        "individual provider record");
                continue;
            }

            String normalizedName;
            try {
                normalizedName = validate(record);
            } catch (MalformedRecordException e) {
                rejected++;
                log.debug("identity.rejected source={} key={} reason={}",
                        e.getSourceName(), e.getRecordKey(), e.getMessage());
                audit.record(AuditAction.REJECTED_MALFORMED, e.getSourceName(), e.getRecordKey(), null, e.getMessage());
                continue;
            }

            if (!record.hasPrimaryIdentifier()) {
                parked.add(new ParkedRecord(record, normalizedName));
                continue;
            }

            Optional<Organization> existing = spine.findByPrimaryIdentifier(record.primaryIdentifier());
            if (existing.isEmpty()) {
                Organization org = newOrganization(OrgIdGenerator.forPrimaryIdentifier(record.primaryIdentifier()),
                        record, normalizedName);
                org.link(record.recordRef());
                spine.add(org);
                continue;
            }

            Organization org = existing.get();
            String conflict = describeConflict(org, record, normalizedName);
            if (conflict != null) {
                collisions++;
                log.warn("identity.collision primaryIdentifier={} orgId={} source={} key={} conflict={}",
                        record.primaryIdentifier(), org.getOrgId(), record.sourceName(), record.recordKey(), conflict);
                audit.record(AuditAction.IDENTIFIER_COLLISION, record.sourceName(), record.recordKey(),
                        org.getOrgId(), conflict);
            }
            org.link(record.recordRef());
        }

        log.info("identity.spine organizations={} parked={} individuals={} rejected={} collisions={}",
                spine.size(), parked.size(), individuals, rejected, collisions);
        return new SpineResult(spine, parked, individuals, rejected, collisions);
    }

    /**
     * Turns parked records the fuzzy matcher could not attach into name-keyed organizations.
     * Records sharing a normalized name and state fold into one organization.
     *
     * @return the organizations created, in creation order
     */
    public List<Organization> createNameKeyed(List<ParkedRecord> unmatched, OrganizationSpine spine,
                                              ShardAuditLog audit) {
        List<Organization> created = new ArrayList<>();
        for (ParkedRecord parked : unmatched) {
            IdentityRecord record = parked.record();
            String orgId = OrgIdGenerator.forNameAndState(parked.normalizedName(), record.stateCode());
            Organization org = spine.get(orgId).orElse(null);
            if (org == null) {
                org = newOrganization(orgId, record, parked.normalizedName());
                spine.add(org);
                created.add(org);
                audit.record(AuditAction.CREATED_FROM_NAME, record.sourceName(), record.recordKey(), orgId,
                        "no registry match for '" + parked.normalizedName() + "' in " + record.stateCode());
            }
            org.link(record.recordRef());
        }
        log.debug("identity.nameKeyed parked={} created={}", unmatched.size(), created.size());
        return created;
    }

    /**
     * Checks record shape and returns the normalized name.
     *
     * @throws MalformedRecordException if the identifier is not 10 digits, or the record has
     *                                  neither an identifier nor a usable name
     */
    String validate(IdentityRecord record) {
        if (record.hasPrimaryIdentifier() && !PRIMARY_IDENTIFIER.matcher(record.primaryIdentifier()).matches()) {
            throw new MalformedRecordException(record.sourceName(), record.recordKey(),
                    "primary identifier must be exactly 10 digits: " + record.primaryIdentifier());
        }
        String normalizedName = names.normalizeName(record.legalName());
        if (!record.hasPrimaryIdentifier() && normalizedName.isEmpty()) {
            throw new MalformedRecordException(record.sourceName(), record.recordKey(),
                    "record has neither a primary identifier nor a usable name");
        }
        return normalizedName;
    }

    private Organization newOrganization(String orgId, IdentityRecord record, String normalizedName) {
        return Organization.builder()
                .orgId(orgId)
                .primaryIdentifier(record.primaryIdentifier())
                .legalName(record.legalName() != null ? record.legalName().trim() : "")
                .normalizedName(normalizedName)
                .stateCode(record.stateCode())
                .address(record.address())
                .zip(names.getNormalizer().normalizeZip(record.zip()))
                .displayZip(record.zip())
                .phone(names.getNormalizer().normalizePhone(record.phone()))
                .taxonomyCode(record.taxonomyCode())
                .build();
    }

    /**
     * Returns a description of the material differences between an organization and a later
     * record carrying the same identifier, or {@code null} if they agree. Blank values on
     * either side never count as a difference.
     */
    private String describeConflict(Organization org, IdentityRecord record, String normalizedName) {
        List<String> diffs = new ArrayList<>();
        if (differs(org.getNormalizedName(), normalizedName)) {
            diffs.add("name '" + org.getNormalizedName() + "' vs '" + normalizedName + "'");
        }
        if (differs(org.getStateCode(), record.stateCode())) {
            diffs.add("state " + org.getStateCode() + " vs " + record.stateCode());
        }
        String zip = names.getNormalizer().normalizeZip(record.zip());
        if (differs(org.getZip(), zip)) {
            diffs.add("zip " + org.getZip() + " vs " + zip);
        }
        return diffs.isEmpty() ? null : String.join("; ", diffs);
    }

    private static boolean differs(String first, String later) {
        return !first.isEmpty() && !later.isEmpty() && !first.equals(later);
    }
}
