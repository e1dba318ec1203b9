package org.politia.warehouse.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.politia.warehouse.config.IngestProperties;
import org.politia.warehouse.entity.Chamber;
import org.politia.warehouse.error.EmptyContentException;
import org.politia.warehouse.error.MalformedRecordException;
import org.politia.warehouse.error.UnitProcessingException;
import org.politia.warehouse.normalize.TextNormalizer;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads Camera WebTV transcript files.
 *
 * <p>The session identity comes from the file name, either {@code 19__347.json} (chamber taken from
 * configuration) or {@code 19__S__347.json}. The body maps topic titles to intervention lists, under
 * {@code contents} or at the root.</p>
 */
@Component
public class TranscriptSourceReader extends AbstractJsonSourceReader {

    static final String UNKNOWN_SPEAKER = "Unknown";

    private static final String KEY_SEPARATOR = "__";
    private static final Set<String> METADATA_FIELDS = Set.of("legislature", "session_number", "date");

    private final IngestProperties properties;

    public TranscriptSourceReader(ObjectMapper objectMapper, IngestProperties properties) {
        super(objectMapper);
        this.properties = properties;
    }

    public TranscriptUnit read(Path file) {
        String unitId = unitId(file);
        TranscriptUnit.TranscriptUnitBuilder unit = sessionKey(unitId);

        JsonNode root = readTree(file);
        if (root == null || !root.isObject()) {
            throw new UnitProcessingException(unitId, "Transcript " + file + " is not a JSON object");
        }
        JsonNode contents = root.has("contents") ? root.get("contents") : root;
        if (!contents.isObject()) {
            throw new UnitProcessingException(unitId, "Transcript " + file + " has no topic mapping");
        }

        List<TranscriptTopic> topics = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = contents.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (contents == root && METADATA_FIELDS.contains(field.getKey())) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isArray()) {
                List<JsonNode> interventions = new ArrayList<>(value.size());
                value.forEach(interventions::add);
                topics.add(TranscriptTopic.of(field.getKey(), interventions));
            } else {
                topics.add(TranscriptTopic.malformed(field.getKey(), "interventions are not a list"));
            }
        }

        return unit
            .sourceReference(file.toString())
            .date(TextNormalizer.parseDate(text(root, "date")))
            .topics(topics)
            .build();
    }

    /**
     * Validates one raw intervention. A missing speaker becomes {@value #UNKNOWN_SPEAKER} so the
     * text is kept and attributed to a placeholder.
     */
    public Intervention toIntervention(JsonNode raw, int ordinal) throws MalformedRecordException, EmptyContentException {
        if (raw == null || !raw.isObject()) {
            throw new MalformedRecordException("Intervention #" + ordinal + " is not an object");
        }
        JsonNode speakerNode = raw.get("speaker");
        JsonNode textNode = raw.get("text");
        if (speakerNode != null && !speakerNode.isNull() && !speakerNode.isTextual()) {
            throw new MalformedRecordException("Intervention #" + ordinal + " has a non-text speaker");
        }
        if (textNode != null && !textNode.isNull() && !textNode.isTextual()) {
            throw new MalformedRecordException("Intervention #" + ordinal + " has a non-text body");
        }

        String text = TextNormalizer.normalizeText(textNode == null ? null : textNode.textValue());
        if (text.isEmpty()) {
            throw new EmptyContentException("Intervention #" + ordinal + " has no text");
        }
        String speaker = TextNormalizer.normalizeText(speakerNode == null ? null : speakerNode.textValue());
        return new Intervention(ordinal, speaker.isEmpty() ? UNKNOWN_SPEAKER : speaker, text);
    }

    private TranscriptUnit.TranscriptUnitBuilder sessionKey(String unitId) {
        String[] parts = unitId.split(KEY_SEPARATOR);
        try {
            if (parts.length == 2) {
                return TranscriptUnit.builder()
                    .unitId(unitId)
                    .legislature(Integer.parseInt(parts[0].strip()))
                    .chamber(properties.getDefaultChamber())
                    .sessionNumber(Integer.parseInt(parts[1].strip()));
            }
            if (parts.length == 3) {
                return TranscriptUnit.builder()
                    .unitId(unitId)
                    .legislature(Integer.parseInt(parts[0].strip()))
                    .chamber(Chamber.fromCode(parts[1]))
                    .sessionNumber(Integer.parseInt(parts[2].strip()));
            }
        } catch (IllegalArgumentException e) {
            throw new UnitProcessingException(unitId, "Cannot derive session identity from '" + unitId + "'", e);
        }
        throw new UnitProcessingException(unitId, "Cannot derive session identity from '" + unitId + "'");
    }

    @Override
    protected String sourceName() {
        return "WebTV";
    }
}
