package org.politia.warehouse.repository;

import org.politia.warehouse.entity.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Topic entities.
 */
@Repository
public interface TopicRepository extends JpaRepository<Topic, String> {

    @Query("SELECT t FROM Topic t WHERE t.session.sessionId = :sessionId ORDER BY t.topicId")
    List<Topic> findBySessionId(@Param("sessionId") String sessionId);

    long countBySessionSessionId(String sessionId);
}
