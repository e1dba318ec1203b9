package org.politia.warehouse.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.politia.warehouse.entity.RoleDescriptor;
import org.politia.warehouse.error.MalformedRecordException;
import org.politia.warehouse.error.UnitProcessingException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads OpenParlamento person detail files.
 *
 * <p>Party and roles are taken from the flat {@code party}/{@code roles} fields when present, otherwise
 * from the {@code current_roles.parl} block of the API payload.</p>
 */
@Component
public class ProfileSourceReader extends AbstractJsonSourceReader {

    public ProfileSourceReader(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    public ProfileRecord read(Path file) throws MalformedRecordException {
        return parse(readTree(file), unitId(file));
    }

    ProfileRecord parse(JsonNode root, String unitId) throws MalformedRecordException {
        if (root == null || !root.isObject()) {
            throw new MalformedRecordException("Profile " + unitId + " is not a JSON object");
        }
        String nativeId = text(root, "id");
        if (nativeId.isEmpty()) {
            throw new MalformedRecordException("Profile " + unitId + " has no native id");
        }

        JsonNode parliamentRole = root.path("current_roles").path("parl");
        String party = text(root, "party");
        if (party.isEmpty()) {
            party = groupOf(parliamentRole);
        }

        return ProfileRecord.builder()
            .nativeId(nativeId)
            .familyName(text(root, "family_name"))
            .givenName(text(root, "given_name"))
            .party(party)
            .roles(rolesOf(root, parliamentRole, party))
            .slug(text(root, "slug"))
            .url(text(root, "url"))
            .birthDate(text(root, "birth_date"))
            .birthPlace(text(root, "birth_place"))
            .imageUrl(text(root, "image"))
            .rawJson(compact(root, unitId))
            .build();
    }

    private static String groupOf(JsonNode parliamentRole) {
        JsonNode group = parliamentRole.path("latest_group");
        if (!group.isObject()) {
            return "";
        }
        String acronym = text(group, "acronym");
        return acronym.isEmpty() ? text(group, "name") : acronym;
    }

    private static List<RoleDescriptor> rolesOf(JsonNode root, JsonNode parliamentRole, String party) {
        List<RoleDescriptor> roles = new ArrayList<>();
        JsonNode declared = root.get("roles");
        if (declared != null && declared.isArray()) {
            for (JsonNode entry : declared) {
                if (entry.isObject()) {
                    roles.add(RoleDescriptor.builder()
                        .role(text(entry, "role"))
                        .startDate(text(entry, "start_date"))
                        .endDate(text(entry, "end_date"))
                        .party(text(entry, "party"))
                        .build());
                } else if (entry.isTextual() && !entry.asText().isBlank()) {
                    roles.add(RoleDescriptor.builder().role(entry.asText().strip()).build());
                }
            }
            return roles;
        }
        if (parliamentRole.isObject()) {
            roles.add(RoleDescriptor.builder()
                .role(text(parliamentRole, "role"))
                .startDate(text(parliamentRole, "start_date"))
                .endDate(text(parliamentRole, "end_date"))
                .party(party)
                .build());
        }
        return roles;
    }

    private String compact(JsonNode root, String unitId) {
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UnitProcessingException(unitId, "Could not serialize raw profile " + unitId, e);
        }
    }

    @Override
    protected String sourceName() {
        return "OpenParlamento";
    }
}
