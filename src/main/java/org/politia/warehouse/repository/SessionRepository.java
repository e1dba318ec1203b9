package org.politia.warehouse.repository;

import org.politia.warehouse.entity.Chamber;
import org.politia.warehouse.entity.Session;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Session entities.
 */
@Repository
public interface SessionRepository extends JpaRepository<Session, String> {

    Optional<Session> findByLegislatureAndChamberAndSessionNumber(
        Integer legislature,
        Chamber chamber,
        Integer sessionNumber
    );
}
