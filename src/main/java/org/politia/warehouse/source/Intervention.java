package org.politia.warehouse.source;

import lombok.Value;

/**
 * A validated intervention: who spoke, what they said, and its position in the topic.
 */
@Value
public class Intervention {
    int ordinal;
    String speaker;
    String text;
}
