package org.politia.warehouse.store;

import org.politia.warehouse.entity.Person;
import org.politia.warehouse.entity.Session;
import org.politia.warehouse.entity.SpeechSegment;
import org.politia.warehouse.entity.Topic;
import org.politia.warehouse.repository.KnownPerson;
import org.politia.warehouse.repository.PersonRepository;
import org.politia.warehouse.repository.SessionRepository;
import org.politia.warehouse.repository.SpeechSegmentRepository;
import org.politia.warehouse.repository.TopicRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link CanonicalStore} backed by the Spring Data repositories. Each unit gets a fresh
 * {@code REQUIRES_NEW} transaction, so a unit never joins whatever transaction its caller holds.
 */
@Component
public class JpaCanonicalStore implements CanonicalStore {

    private final PersonRepository personRepository;
    private final SessionRepository sessionRepository;
    private final TopicRepository topicRepository;
    private final SpeechSegmentRepository speechSegmentRepository;
    private final TransactionTemplate unitTransaction;

    public JpaCanonicalStore(
        PersonRepository personRepository,
        SessionRepository sessionRepository,
        TopicRepository topicRepository,
        SpeechSegmentRepository speechSegmentRepository,
        PlatformTransactionManager transactionManager
    ) {
        this.personRepository = personRepository;
        this.sessionRepository = sessionRepository;
        this.topicRepository = topicRepository;
        this.speechSegmentRepository = speechSegmentRepository;
        this.unitTransaction = new TransactionTemplate(transactionManager);
        this.unitTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Optional<Person> findPerson(String personId) {
        return personRepository.findById(personId);
    }

    @Override
    public Person savePerson(Person person) {
        return personRepository.save(person);
    }

    @Override
    public Optional<Session> findSession(String sessionId) {
        return sessionRepository.findById(sessionId);
    }

    @Override
    public Session saveSession(Session session) {
        return sessionRepository.save(session);
    }

    @Override
    public Optional<Topic> findTopic(String topicId) {
        return topicRepository.findById(topicId);
    }

    @Override
    public Topic saveTopic(Topic topic) {
        return topicRepository.save(topic);
    }

    @Override
    public boolean speechExists(String speechId) {
        return speechSegmentRepository.existsById(speechId);
    }

    @Override
    public SpeechSegment saveSpeech(SpeechSegment speech) {
        return speechSegmentRepository.save(speech);
    }

    @Override
    public List<KnownPerson> knownPersons() {
        return personRepository.findKnownPersons();
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return unitTransaction.execute(status -> work.get());
    }
}
