package org.politia.warehouse.repository;

import org.politia.warehouse.entity.SpeechSegment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for SpeechSegment entities.
 */
@Repository
public interface SpeechSegmentRepository extends JpaRepository<SpeechSegment, String> {

    /**
     * Speeches of a topic in transcript order
     */
    @Query("SELECT s FROM SpeechSegment s WHERE s.topic.topicId = :topicId ORDER BY s.orderInTopic")
    List<SpeechSegment> findByTopicIdOrdered(@Param("topicId") String topicId);

    long countBySpeakerPersonId(String personId);

    /**
     * Speeches whose speaker row is missing; always empty when referential integrity holds
     */
    @Query("SELECT COUNT(s) FROM SpeechSegment s WHERE NOT EXISTS "
        + "(SELECT p FROM Person p WHERE p.personId = s.speaker.personId)")
    long countWithMissingSpeaker();
}
