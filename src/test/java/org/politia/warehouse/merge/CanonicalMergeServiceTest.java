package org.politia.warehouse.merge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.politia.warehouse.entity.Chamber;
import org.politia.warehouse.entity.Person;
import org.politia.warehouse.entity.RoleDescriptor;
import org.politia.warehouse.entity.Session;
import org.politia.warehouse.entity.SpeechSegment;
import org.politia.warehouse.entity.Topic;
import org.politia.warehouse.resolve.SpeakerResolver;
import org.politia.warehouse.resolve.SpeakerRoster;
import org.politia.warehouse.source.ProfileRecord;
import org.politia.warehouse.store.InMemoryCanonicalStore;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CanonicalMergeService Unit Tests")
class CanonicalMergeServiceTest {

    private InMemoryCanonicalStore store;
    private CanonicalMergeService mergeService;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
        mergeService = new CanonicalMergeService(store);
    }

    @Test
    @DisplayName("Should create a person on first sight")
    void shouldCreatePerson() {
        // When
        UpsertResult<Person> result = mergeService.upsertPerson(profile("1002", "Rossi", "Mario", "FDI"));

        // Then
        assertThat(result.getAction()).isEqualTo(UpsertAction.CREATED);
        assertThat(store.findPerson("op_1002")).isPresent();
        assertThat(result.getEntity().getFullName()).isEqualTo("Rossi Mario");
        assertThat(result.getEntity().getSourceIds())
            .containsEntry(CanonicalIds.OPENPARLAMENTO_SOURCE, "p1002")
            .containsEntry(CanonicalIds.SLUG_SOURCE, "rossi-mario");
    }

    @Test
    @DisplayName("Should update party but keep the stored full name")
    void shouldUpdatePartyAndKeepFullName() {
        // Given
        mergeService.upsertPerson(profile("1002", "Rossi", "Mario", "FDI"));
        store.findPerson("op_1002").orElseThrow().setFullName("On. Mario Rossi");

        // When
        UpsertResult<Person> result = mergeService.upsertPerson(profile("1002", "Rossi", "Mario", "LEGA"));

        // Then
        assertThat(result.getAction()).isEqualTo(UpsertAction.UPDATED);
        Person stored = store.findPerson("op_1002").orElseThrow();
        assertThat(stored.getParty()).isEqualTo("LEGA");
        assertThat(stored.getFullName()).isEqualTo("On. Mario Rossi");
    }

    @Test
    @DisplayName("Should keep the stored party when the incoming one is blank")
    void shouldKeepPartyWhenIncomingIsBlank() {
        // Given
        mergeService.upsertPerson(profile("1002", "Rossi", "Mario", "FDI"));

        // When
        UpsertResult<Person> result = mergeService.upsertPerson(profile("1002", "Rossi", "Mario", ""));

        // Then
        assertThat(result.getAction()).isEqualTo(UpsertAction.SKIPPED);
        assertThat(store.findPerson("op_1002").orElseThrow().getParty()).isEqualTo("FDI");
    }

    @Test
    @DisplayName("Should skip an identical person and never touch roles")
    void shouldSkipIdenticalPerson() {
        // Given
        mergeService.upsertPerson(profile("1002", "Rossi", "Mario", "FDI"));
        Person withOtherRoles = profile("1002", "Rossi", "Mario", "FDI");
        withOtherRoles.setRoles(List.of(RoleDescriptor.builder().role("Ministro").build()));

        // When
        UpsertResult<Person> result = mergeService.upsertPerson(withOtherRoles);

        // Then
        assertThat(result.getAction()).isEqualTo(UpsertAction.SKIPPED);
        assertThat(store.findPerson("op_1002").orElseThrow().getRoles())
            .extracting(RoleDescriptor::getRole)
            .containsExactly("Deputato");
    }

    @Test
    @DisplayName("Should fill empty supplementary fields without overwriting set ones")
    void shouldFillOnlyEmptyFields() {
        // Given
        Person first = profile("1002", "Rossi", "Mario", "FDI");
        first.setBirthPlace("Napoli");
        mergeService.upsertPerson(first);

        Person second = profile("1002", "Rossi", "Mario", "FDI");
        second.setBirthPlace("Milano");
        second.setImageUrl("https://openparlamento.it/img/1002.jpg");

        // When
        UpsertResult<Person> result = mergeService.upsertPerson(second);

        // Then
        assertThat(result.getAction()).isEqualTo(UpsertAction.UPDATED);
        Person stored = store.findPerson("op_1002").orElseThrow();
        assertThat(stored.getBirthPlace()).isEqualTo("Napoli");
        assertThat(stored.getImageUrl()).isEqualTo("https://openparlamento.it/img/1002.jpg");
    }

    @Test
    @DisplayName("Should skip sessions and topics that already exist")
    void shouldSkipExistingSessionAndTopic() {
        // Given
        Session session = session();
        mergeService.upsertSession(session);
        Topic topic = topic(session, "Votazione finale");
        mergeService.upsertTopic(topic);

        // When
        UpsertResult<Session> sessionAgain = mergeService.upsertSession(session());
        UpsertResult<Topic> topicAgain = mergeService.upsertTopic(topic(session, "Votazione finale"));

        // Then
        assertThat(sessionAgain.getAction()).isEqualTo(UpsertAction.SKIPPED);
        assertThat(sessionAgain.getEntity()).isSameAs(session);
        assertThat(topicAgain.getAction()).isEqualTo(UpsertAction.SKIPPED);
        assertThat(store.topics()).hasSize(1);
    }

    @Test
    @DisplayName("Should attribute a speech to a resolved person and date it with the session")
    void shouldWriteSpeechForResolvedSpeaker() {
        // Given
        mergeService.upsertPerson(profile("1002", "Rossi", "Mario", "FDI"));
        Session session = mergeService.upsertSession(session()).getEntity();
        Topic topic = mergeService.upsertTopic(topic(session, "Votazione finale")).getEntity();
        SpeakerResolver resolver = new SpeakerResolver(SpeakerRoster.of(store.knownPersons()));

        // When
        SpeechUpsert result = mergeService.upsertSpeech(speech(session, topic, 0, "On. Mario Rossi"), resolver);

        // Then
        assertThat(result.getAction()).isEqualTo(UpsertAction.CREATED);
        assertThat(result.isUnresolvedSpeaker()).isFalse();
        SpeechSegment stored = store.speeches().iterator().next();
        assertThat(stored.getSpeaker().getPersonId()).isEqualTo("op_1002");
        assertThat(stored.getDate()).isEqualTo(LocalDate.of(2023, 5, 10));
        assertThat(stored.getOrderInTopic()).isZero();
    }

    @Test
    @DisplayName("Should create a placeholder once and reuse it for later speeches")
    void shouldReusePlaceholder() {
        // Given
        Session session = mergeService.upsertSession(session()).getEntity();
        Topic topic = mergeService.upsertTopic(topic(session, "Votazione finale")).getEntity();
        SpeakerResolver resolver = new SpeakerResolver(SpeakerRoster.of(List.of()));

        // When
        SpeechUpsert first = mergeService.upsertSpeech(speech(session, topic, 0, "Carlo Verdi"), resolver);
        SpeechUpsert second = mergeService.upsertSpeech(speech(session, topic, 1, "CARLO VERDI"), resolver);

        // Then
        assertThat(first.isPlaceholderCreated()).isTrue();
        assertThat(second.isPlaceholderCreated()).isFalse();
        assertThat(second.isUnresolvedSpeaker()).isTrue();
        assertThat(store.placeholders()).hasSize(1);
        assertThat(store.placeholders().get(0).getFullName()).isEqualTo("Carlo Verdi");
        assertThat(store.speeches()).hasSize(2);
    }

    @Test
    @DisplayName("Should skip an existing speech without resolving its speaker again")
    void shouldSkipExistingSpeech() {
        // Given
        Session session = mergeService.upsertSession(session()).getEntity();
        Topic topic = mergeService.upsertTopic(topic(session, "Votazione finale")).getEntity();
        SpeakerResolver resolver = new SpeakerResolver(SpeakerRoster.of(List.of()));
        SpeechUpsert first = mergeService.upsertSpeech(speech(session, topic, 0, "Carlo Verdi"), resolver);

        // When
        SpeechUpsert again = mergeService.upsertSpeech(speech(session, topic, 0, "On. Carlo Verdi"), resolver);

        // Then
        assertThat(again.getAction()).isEqualTo(UpsertAction.SKIPPED);
        assertThat(again.getSpeechId()).isEqualTo(first.getSpeechId());
        assertThat(again.getResolution()).isNull();
        assertThat(store.speeches()).hasSize(1);
    }

    private static Person profile(String id, String family, String given, String party) {
        return CandidateMapper.fromProfile(ProfileRecord.builder()
            .nativeId(id)
            .familyName(family)
            .givenName(given)
            .party(party)
            .slug((family + "-" + given).toLowerCase())
            .roles(List.of(RoleDescriptor.builder().role("Deputato").build()))
            .rawJson("{\"id\":\"" + id + "\"}")
            .build());
    }

    private static Session session() {
        return Session.builder()
            .sessionId(CanonicalIds.sessionId(19, Chamber.CAMERA, 347))
            .date(LocalDate.of(2023, 5, 10))
            .chamber(Chamber.CAMERA)
            .legislature(19)
            .sessionNumber(347)
            .sourceReference("19__347.json")
            .build();
    }

    private static Topic topic(Session session, String title) {
        return Topic.builder()
            .topicId(CanonicalIds.topicId(session.getSessionId(), title))
            .session(session)
            .title(title)
            .build();
    }

    private static SpeechCandidate speech(Session session, Topic topic, int ordinal, String speaker) {
        return SpeechCandidate.builder()
            .session(session)
            .topic(topic)
            .ordinal(ordinal)
            .speakerName(speaker)
            .text("Annuncio il voto favorevole.")
            .sourceReference("19__347.json")
            .build();
    }
}
