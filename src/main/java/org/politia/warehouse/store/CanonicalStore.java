package org.politia.warehouse.store;

import org.politia.warehouse.entity.Person;
import org.politia.warehouse.entity.Session;
import org.politia.warehouse.entity.SpeechSegment;
import org.politia.warehouse.entity.Topic;
import org.politia.warehouse.repository.KnownPerson;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The system of record the pipeline writes into: point lookups by identity key, saves, and a
 * transaction boundary. Entities returned inside {@link #inTransaction} may be modified in place;
 * changes are written when the transaction commits.
 */
public interface CanonicalStore {

    Optional<Person> findPerson(String personId);

    Person savePerson(Person person);

    Optional<Session> findSession(String sessionId);

    Session saveSession(Session session);

    Optional<Topic> findTopic(String topicId);

    Topic saveTopic(Topic topic);

    boolean speechExists(String speechId);

    SpeechSegment saveSpeech(SpeechSegment speech);

    /**
     * Source-originated persons; placeholders are never part of the roster.
     */
    List<KnownPerson> knownPersons();

    /**
     * Runs {@code work} in its own transaction. Commits when it returns, rolls back everything it
     * wrote when it throws, and rethrows.
     */
    <T> T inTransaction(Supplier<T> work);
}
