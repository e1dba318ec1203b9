package org.politia.warehouse.source;

import lombok.Builder;
import lombok.Value;
import org.politia.warehouse.entity.RoleDescriptor;

import java.util.List;

/**
 * One person profile as delivered by the profile source, with missing fields defaulted to empty.
 */
@Value
@Builder
public class ProfileRecord {
    String nativeId;
    String familyName;
    String givenName;
    String party;
    @Builder.Default
    List<RoleDescriptor> roles = List.of();
    String slug;
    String url;
    String birthDate;
    String birthPlace;
    String imageUrl;
    String rawJson;
}
