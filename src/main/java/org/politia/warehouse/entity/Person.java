package org.politia.warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.Length;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JPA Entity for the persons table.
 * Represents a politician from the profile source, or a placeholder
 * standing in for a transcript speaker that could not be resolved.
 */
@Entity
@Table(name = "persons", indexes = {
    @Index(name = "idx_persons_full_name", columnList = "full_name"),
    @Index(name = "idx_persons_family_name", columnList = "family_name"),
    @Index(name = "idx_persons_party", columnList = "party"),
    @Index(name = "idx_persons_placeholder", columnList = "placeholder"),
    @Index(name = "idx_persons_slug", columnList = "slug")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Person {

    public static final int NAME_LENGTH = 255;

    @Id
    @Column(name = "person_id", length = 64)
    private String personId;

    @Column(name = "full_name", nullable = false, length = NAME_LENGTH)
    private String fullName;

    @Column(name = "family_name", length = NAME_LENGTH)
    private String familyName;

    @Column(name = "given_name", length = NAME_LENGTH)
    private String givenName;

    @Column(length = 100)
    private String party;

    @ElementCollection
    @CollectionTable(name = "person_roles", joinColumns = @JoinColumn(name = "person_id"))
    @OrderColumn(name = "role_order")
    @Builder.Default
    private List<RoleDescriptor> roles = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "person_source_ids", joinColumns = @JoinColumn(name = "person_id"))
    @MapKeyColumn(name = "source_name", length = 50)
    @Column(name = "native_id", length = 200)
    @Builder.Default
    private Map<String, String> sourceIds = new LinkedHashMap<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean placeholder = false;

    @Column(name = "birth_date", length = 20)
    private String birthDate;

    @Column(name = "birth_place")
    private String birthPlace;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(length = 200)
    private String slug;

    @Column(length = 500)
    private String url;

    @Column(name = "raw_data", length = Length.LONG32)
    private String rawData;
}
