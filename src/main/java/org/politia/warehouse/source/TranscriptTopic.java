package org.politia.warehouse.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import org.politia.warehouse.error.MalformedRecordException;

import java.util.List;

/**
 * A topic title with its interventions still in raw form. Each intervention is validated on its own
 * so one bad entry does not cost the rest of the topic.
 */
@Value
public class TranscriptTopic {
    String title;
    List<JsonNode> rawInterventions;
    String shapeError;

    public static TranscriptTopic of(String title, List<JsonNode> rawInterventions) {
        return new TranscriptTopic(title, List.copyOf(rawInterventions), null);
    }

    public static TranscriptTopic malformed(String title, String shapeError) {
        return new TranscriptTopic(title, List.of(), shapeError);
    }

    public void requireStructured() throws MalformedRecordException {
        if (shapeError != null) {
            throw new MalformedRecordException("Topic '" + title + "': " + shapeError);
        }
    }
}
