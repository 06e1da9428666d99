package com.afttsync.domain.merge;

import com.afttsync.domain.model.EntityKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.OrganizationRecord;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Derives an organization's region from the prefix of its code. The longest matching prefix wins,
 * so {@code Lx123} is Luxembourg and not Liège.
 */
public class RegionDerivation implements AttributeDerivation {

    private static final Map<String, String> REGIONS_BY_PREFIX = new LinkedHashMap<>();

    static {
        REGIONS_BY_PREFIX.put("A", "Antwerpen");
        REGIONS_BY_PREFIX.put("BBW", "Brabant Wallon / Bruxelles");
        REGIONS_BY_PREFIX.put("H", "Hainaut");
        REGIONS_BY_PREFIX.put("L", "Liège");
        REGIONS_BY_PREFIX.put("Lx", "Luxembourg");
        REGIONS_BY_PREFIX.put("N", "Namur");
        REGIONS_BY_PREFIX.put("OVL", "Oost-Vlaanderen");
        REGIONS_BY_PREFIX.put("Vl-B", "Vlaams-Brabant");
        REGIONS_BY_PREFIX.put("WVL", "West-Vlaanderen");
        REGIONS_BY_PREFIX.put("VTTL", "VTTL (Fédération Flamande)");
        REGIONS_BY_PREFIX.put("AFTT", "AFTT (Fédération Francophone)");
        REGIONS_BY_PREFIX.put("FR", "France (mutation)");
    }

    @Override
    public EntityKind kind() {
        return EntityKind.ORGANIZATION;
    }

    @Override
    public String attribute() {
        return OrganizationRecord.REGION;
    }

    @Override
    public Optional<Object> derive(ExtractedRecord record) {
        if (!(record instanceof OrganizationRecord organization)) {
            return Optional.empty();
        }
        return regionOf(organization.code()).map(Object.class::cast);
    }

    public static Optional<String> regionOf(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String upper = code.trim().toUpperCase(Locale.ROOT);
        return REGIONS_BY_PREFIX.entrySet().stream()
            .sorted(Comparator.comparingInt((Map.Entry<String, String> entry) -> entry.getKey().length()).reversed())
            .filter(entry -> upper.startsWith(entry.getKey().toUpperCase(Locale.ROOT)))
            .map(Map.Entry::getValue)
            .findFirst();
    }
}
