package org.politia.warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.Length;

import java.time.LocalDate;

/**
 * JPA Entity for the speech_segments table.
 * One intervention of a speaker within a topic.
 */
@Entity
@Table(name = "speech_segments", indexes = {
    @Index(name = "idx_speech_segments_session_id", columnList = "session_id"),
    @Index(name = "idx_speech_segments_topic_id", columnList = "topic_id"),
    @Index(name = "idx_speech_segments_speaker_id", columnList = "speaker_id"),
    @Index(name = "idx_speech_segments_date", columnList = "speech_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpeechSegment {

    @Id
    @Column(name = "speech_id", length = 160)
    private String speechId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Session session;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "topic_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Topic topic;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "speaker_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Person speaker;

    @Column(name = "speech_text", nullable = false, length = Length.LONG32)
    private String text;

    @Column(name = "speech_date", nullable = false)
    private LocalDate date;

    @Column(name = "order_in_topic")
    private Integer orderInTopic;

    @Column(name = "source_reference", length = 1024)
    private String sourceReference;
}
