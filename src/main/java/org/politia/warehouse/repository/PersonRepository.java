package org.politia.warehouse.repository;

import org.politia.warehouse.entity.Person;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Person entities.
 */
@Repository
public interface PersonRepository extends JpaRepository<Person, String> {

    /**
     * Names of every person that came from a profile source, placeholders excluded
     */
    @Query("SELECT new org.politia.warehouse.repository.KnownPerson(p.personId, p.fullName, p.familyName, p.givenName) "
        + "FROM Person p WHERE p.placeholder = false ORDER BY p.personId")
    List<KnownPerson> findKnownPersons();

    /**
     * Placeholder persons awaiting manual re-linking
     */
    List<Person> findByPlaceholderTrueOrderByPersonId();

    long countByPlaceholderTrue();
}
