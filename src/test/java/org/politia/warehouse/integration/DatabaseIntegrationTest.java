package org.politia.warehouse.integration;

import org.politia.warehouse.entity.Person;
import org.politia.warehouse.entity.RoleDescriptor;
import org.politia.warehouse.pipeline.IngestionOrchestrator;
import org.politia.warehouse.pipeline.IngestionSummary;
import org.politia.warehouse.repository.KnownPerson;
import org.politia.warehouse.repository.PersonRepository;
import org.politia.warehouse.repository.SpeechSegmentRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests using Testcontainers with a real PostgreSQL database.
 * These tests verify that the schema and the ingestion run work against the production database.
 */
@SpringBootTest(properties = "spring.batch.job.enabled=false")
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PostgreSQL Integration Tests with Testcontainers")
class DatabaseIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
        .withDatabaseName("testdb")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private PersonRepository personRepository;

    @Autowired
    private SpeechSegmentRepository speechSegmentRepository;

    @Autowired
    private IngestionOrchestrator orchestrator;

    @Test
    @DisplayName("Should persist a person with roles, source ids and a large raw payload to PostgreSQL")
    void shouldPersistPersonWithCollections() {
        // Given
        Person person = Person.builder()
            .personId("op_9001")
            .fullName("Neri Marco Antonio")
            .familyName("Neri")
            .givenName("Marco Antonio")
            .party("AVS")
            .roles(List.of(RoleDescriptor.builder().role("Deputato").startDate("2022-10-13").build()))
            .sourceIds(Map.of("openparlamento", "p9001"))
            .rawData("{\"bio\":\"" + "x".repeat(20_000) + "\"}")
            .build();

        // When
        personRepository.saveAndFlush(person);

        // Then
        Optional<Person> found = personRepository.findById("op_9001");
        assertThat(found).isPresent();
        assertThat(found.get().getRawData()).hasSize(20_010);
        assertThat(personRepository.findKnownPersons())
            .extracting(KnownPerson::getPersonId)
            .contains("op_9001");
    }

    @Test
    @DisplayName("Should ingest the fixtures twice without duplicating rows")
    void shouldIngestFixturesIdempotently() throws Exception {
        // Given
        Path profiles = Path.of(getClass().getResource("/fixtures/openparlamento").toURI());
        Path transcripts = Path.of(getClass().getResource("/fixtures/camera").toURI());
        orchestrator.run(profiles, transcripts);
        long speeches = speechSegmentRepository.count();

        // When
        List<IngestionSummary> rerun = orchestrator.run(profiles, transcripts);

        // Then
        assertThat(rerun).allSatisfy(summary -> assertThat(summary.getCreated()).isZero());
        assertThat(speechSegmentRepository.count()).isEqualTo(speeches).isEqualTo(5);
        assertThat(speechSegmentRepository.countWithMissingSpeaker()).isZero();
    }
}
