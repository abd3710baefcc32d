package com.kgraph.resolution.rules;

import com.kgraph.resolution.core.model.EntityType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatch table from entity type to its {@link NormalizationProfile}.
 * Types without a dedicated profile use the identity profile.
 */
public final class NormalizationProfiles {

    private final Map<EntityType, NormalizationProfile> profiles;

    private NormalizationProfiles(Map<EntityType, NormalizationProfile> profiles) {
        this.profiles = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            this.profiles.put(type, profiles.getOrDefault(type,
                    NormalizationProfile.identity(type.name().toLowerCase())));
        }
    }

    /**
     * Organization and person profiles; identity for every other type.
     */
    public static NormalizationProfiles defaults() {
        Map<EntityType, NormalizationProfile> map = new EnumMap<>(EntityType.class);
        map.put(EntityType.ORGANIZATION, organizationProfile());
        map.put(EntityType.PERSON, personProfile());
        return new NormalizationProfiles(map);
    }

    /**
     * Returns a copy of this table with the profile for {@code type} replaced.
     */
    public NormalizationProfiles with(EntityType type, NormalizationProfile profile) {
        Map<EntityType, NormalizationProfile> map = new EnumMap<>(profiles);
        map.put(type, profile);
        return new NormalizationProfiles(map);
    }

    public NormalizationProfile forType(EntityType type) {
        return profiles.get(type);
    }

    /**
     * Legal-form suffixes, a leading article and the word "and". Keys are already folded, so "Inc."
     * arrives as "inc", "S.A." as "s a", and "&" as a plain space.
     */
    public static NormalizationProfile organizationProfile() {
        return new NormalizationProfile("organization", List.of(
                NormalizationRule.leading("org-leading-the", 5, "the"),
                NormalizationRule.trailing("org-inc", 10, "inc", "incorporated"),
                NormalizationRule.trailing("org-corp", 10, "corp", "corporation"),
                NormalizationRule.trailing("org-co", 10, "co", "company"),
                NormalizationRule.trailing("org-ltd", 10, "ltd", "limited"),
                NormalizationRule.trailing("org-llc", 10, "llc", "l l c"),
                NormalizationRule.trailing("org-plc", 10, "plc", "p l c"),
                NormalizationRule.trailing("org-gmbh", 10, "gmbh", "ag"),
                NormalizationRule.trailing("org-sa", 10, "sas", "s a s", "sarl", "s a r l", "sa", "s a"),
                NormalizationRule.trailing("org-nv-bv", 10, "nv", "n v", "bv", "b v"),
                NormalizationRule.anywhere("org-and", 20, "and")
        ));
    }

    /**
     * Leading honorifics and generational suffixes.
     */
    public static NormalizationProfile personProfile() {
        return new NormalizationProfile("person", List.of(
                NormalizationRule.leading("person-honorific", 10, "mr", "mrs", "ms", "miss", "dr", "prof", "sir"),
                NormalizationRule.trailing("person-generational", 10, "jr", "sr")
        ));
    }
}
