package org.politia.warehouse.merge;

import org.politia.warehouse.entity.Person;
import org.politia.warehouse.resolve.SpeakerResolution;
import org.politia.warehouse.source.ProfileRecord;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds unsaved Person candidates from source records.
 */
public final class CandidateMapper {

    private CandidateMapper() {
    }

    public static Person fromProfile(ProfileRecord profile) {
        Map<String, String> sourceIds = new LinkedHashMap<>();
        sourceIds.put(CanonicalIds.OPENPARLAMENTO_SOURCE, CanonicalIds.openParlamentoSourceId(profile.getNativeId()));
        if (StringUtils.hasText(profile.getSlug())) {
            sourceIds.put(CanonicalIds.SLUG_SOURCE, profile.getSlug());
        }
        String familyName = Objects.toString(profile.getFamilyName(), "");
        String givenName = Objects.toString(profile.getGivenName(), "");

        return Person.builder()
            .personId(CanonicalIds.profilePersonId(profile.getNativeId()))
            .fullName((familyName + " " + givenName).strip())
            .familyName(familyName)
            .givenName(givenName)
            .party(profile.getParty())
            .roles(new ArrayList<>(profile.getRoles()))
            .sourceIds(sourceIds)
            .placeholder(false)
            .slug(profile.getSlug())
            .url(profile.getUrl())
            .birthDate(profile.getBirthDate())
            .birthPlace(profile.getBirthPlace())
            .imageUrl(profile.getImageUrl())
            .rawData(profile.getRawJson())
            .build();
    }

    public static Person placeholder(SpeakerResolution resolution) {
        return Person.builder()
            .personId(resolution.getPersonId())
            .fullName(resolution.getPlaceholderFullName())
            .familyName(resolution.getPlaceholderFamilyName())
            .givenName(resolution.getPlaceholderGivenName())
            .placeholder(true)
            .build();
    }
}
