package org.politia.warehouse.merge;

import lombok.Builder;
import lombok.Value;
import org.politia.warehouse.entity.Session;
import org.politia.warehouse.entity.Topic;

/**
 * A validated intervention ready to be written, attached to its already stored session and topic.
 */
@Value
@Builder
public class SpeechCandidate {
    Session session;
    Topic topic;
    int ordinal;
    String speakerName;
    String text;
    String sourceReference;
}
