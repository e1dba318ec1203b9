package org.politia.warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.Length;

/**
 * JPA Entity for the topics table.
 * A debate within a session, identified by the hash of its title.
 */
@Entity
@Table(name = "topics", indexes = {
    @Index(name = "idx_topics_session_id", columnList = "session_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Topic {

    @Id
    @Column(name = "topic_id", length = 128)
    private String topicId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Session session;

    @Column(nullable = false, length = Length.LONG32)
    private String title;
}
