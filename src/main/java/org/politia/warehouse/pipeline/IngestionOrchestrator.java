package org.politia.warehouse.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.politia.warehouse.entity.Person;
import org.politia.warehouse.entity.Session;
import org.politia.warehouse.entity.Topic;
import org.politia.warehouse.error.EmptyContentException;
import org.politia.warehouse.error.RecordValidationException;
import org.politia.warehouse.error.UnitProcessingException;
import org.politia.warehouse.merge.CandidateMapper;
import org.politia.warehouse.merge.CanonicalIds;
import org.politia.warehouse.merge.CanonicalMergeService;
import org.politia.warehouse.merge.SpeechCandidate;
import org.politia.warehouse.merge.SpeechUpsert;
import org.politia.warehouse.merge.UpsertAction;
import org.politia.warehouse.merge.UpsertResult;
import org.politia.warehouse.normalize.TextNormalizer;
import org.politia.warehouse.pipeline.event.UnitProcessedEvent;
import org.politia.warehouse.pipeline.event.UnresolvedSpeakerEvent;
import org.politia.warehouse.repository.KnownPerson;
import org.politia.warehouse.resolve.SpeakerResolution;
import org.politia.warehouse.resolve.SpeakerResolver;
import org.politia.warehouse.resolve.SpeakerRoster;
import org.politia.warehouse.source.Intervention;
import org.politia.warehouse.source.ProfileRecord;
import org.politia.warehouse.source.ProfileSourceReader;
import org.politia.warehouse.source.TranscriptSourceReader;
import org.politia.warehouse.source.TranscriptTopic;
import org.politia.warehouse.source.TranscriptUnit;
import org.politia.warehouse.store.CanonicalStore;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives an ingestion run unit by unit.
 *
 * <p>Profiles are always processed before transcripts, and inside a transcript the session is written
 * before its topics and each topic before its speeches, so every reference points at a row that
 * already exists. Each unit runs in its own transaction: a failure rolls back that unit only and the
 * run continues with the next one. Rejected sub-records are skipped without touching the rest of the
 * unit.</p>
 */
@Slf4j
@Service
public class IngestionOrchestrator {

    private final CanonicalStore store;
    private final CanonicalMergeService mergeService;
    private final ProfileSourceReader profileReader;
    private final TranscriptSourceReader transcriptReader;
    private final ApplicationEventPublisher eventPublisher;

    public IngestionOrchestrator(
        CanonicalStore store,
        CanonicalMergeService mergeService,
        ProfileSourceReader profileReader,
        TranscriptSourceReader transcriptReader,
        ApplicationEventPublisher eventPublisher
    ) {
        this.store = store;
        this.mergeService = mergeService;
        this.profileReader = profileReader;
        this.transcriptReader = transcriptReader;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Full run: profiles first, then transcripts resolved against the persons just loaded.
     */
    public List<IngestionSummary> run(Path profilesDirectory, Path transcriptsDirectory) {
        List<IngestionSummary> summaries = new ArrayList<>();
        summaries.add(ingestProfiles(profilesDirectory));
        summaries.add(ingestTranscripts(transcriptsDirectory));
        return summaries;
    }

    public IngestionSummary ingestProfiles(Path directory) {
        List<Path> files = profileReader.discover(directory);
        log.info("Found {} profile units in {}", files.size(), directory);

        IngestionSummary summary = new IngestionSummary(UnitKind.PROFILE);
        for (Path file : files) {
            summary.add(processUnit(UnitKind.PROFILE, profileReader.unitId(file), file,
                counters -> ingestProfile(file, counters)));
        }
        log.info("Profile phase finished: {}", summary);
        return summary;
    }

    public IngestionSummary ingestTranscripts(Path directory) {
        List<Path> files = transcriptReader.discover(directory);
        log.info("Found {} transcript units in {}", files.size(), directory);

        IngestionSummary summary = new IngestionSummary(UnitKind.TRANSCRIPT);
        if (files.isEmpty()) {
            return summary;
        }
        List<KnownPerson> knownPersons = store.inTransaction(store::knownPersons);
        SpeakerRoster roster = SpeakerRoster.of(knownPersons);
        SpeakerResolver resolver = new SpeakerResolver(roster);
        log.info("Speaker roster loaded with {} known persons", roster.size());

        for (Path file : files) {
            summary.add(processUnit(UnitKind.TRANSCRIPT, transcriptReader.unitId(file), file,
                counters -> ingestTranscript(file, resolver, counters)));
        }
        log.info("Transcript phase finished: {}", summary);
        return summary;
    }

    private UnitReport processUnit(UnitKind kind, String unitId, Path file, Consumer<UnitCounters> work) {
        UnitExecution execution = new UnitExecution(unitId, kind);
        execution.start();
        try {
            store.inTransaction(() -> {
                work.accept(execution.getCounters());
                return null;
            });
            execution.commit();
        } catch (RuntimeException e) {
            UnitProcessingException failure = e instanceof UnitProcessingException
                ? (UnitProcessingException) e
                : new UnitProcessingException(unitId, e.getMessage(), e);
            execution.rollBack(failure);
            log.error("Rolled back {} unit {} ({}): {}", kind, unitId, file, failure.getMessage(), e);
        }

        UnitReport report = execution.report();
        if (report.isCommitted()) {
            for (SpeakerResolution speaker : execution.getCounters().unresolvedSpeakers()) {
                eventPublisher.publishEvent(new UnresolvedSpeakerEvent(unitId, speaker.getRawName(),
                    speaker.getNormalizedName(), speaker.getPersonId(), speaker.isAmbiguous()));
            }
        }
        eventPublisher.publishEvent(new UnitProcessedEvent(report));
        return report;
    }

    private void ingestProfile(Path file, UnitCounters counters) {
        ProfileRecord profile;
        try {
            profile = profileReader.read(file);
        } catch (RecordValidationException e) {
            counters.reject();
            log.warn("Skipping profile record in {}: {}", file, e.getMessage());
            return;
        }
        UpsertResult<Person> result = mergeService.upsertPerson(CandidateMapper.fromProfile(profile));
        counters.record(result.getAction());
    }

    private void ingestTranscript(Path file, SpeakerResolver resolver, UnitCounters counters) {
        TranscriptUnit unit = transcriptReader.read(file);
        if (TextNormalizer.isUnknownDate(unit.getDate())) {
            log.warn("Transcript {} has no usable date, storing {}", unit.getUnitId(), TextNormalizer.UNKNOWN_DATE);
        }

        UpsertResult<Session> session = mergeService.upsertSession(Session.builder()
            .sessionId(CanonicalIds.sessionId(unit.getLegislature(), unit.getChamber(), unit.getSessionNumber()))
            .date(unit.getDate())
            .chamber(unit.getChamber())
            .legislature(unit.getLegislature())
            .sessionNumber(unit.getSessionNumber())
            .sourceReference(unit.getSourceReference())
            .build());
        counters.record(session.getAction());

        for (TranscriptTopic topic : unit.getTopics()) {
            try {
                ingestTopic(unit, session.getEntity(), topic, resolver, counters);
            } catch (RecordValidationException e) {
                counters.reject();
                log.warn("Skipping topic in {}: {}", unit.getUnitId(), e.getMessage());
            }
        }
    }

    private void ingestTopic(TranscriptUnit unit, Session session, TranscriptTopic topic,
                             SpeakerResolver resolver, UnitCounters counters) throws RecordValidationException {
        topic.requireStructured();
        String title = TextNormalizer.normalizeText(topic.getTitle());
        if (title.isEmpty()) {
            throw new EmptyContentException("Topic with an empty title in session " + session.getSessionId());
        }

        List<Intervention> interventions = new ArrayList<>();
        List<JsonNode> raw = topic.getRawInterventions();
        for (int ordinal = 0; ordinal < raw.size(); ordinal++) {
            try {
                interventions.add(transcriptReader.toIntervention(raw.get(ordinal), ordinal));
            } catch (RecordValidationException e) {
                counters.reject();
                log.warn("Skipping intervention in {} / '{}': {}", unit.getUnitId(), title, e.getMessage());
            }
        }
        if (interventions.isEmpty()) {
            throw new EmptyContentException("Topic '" + title + "' has no usable interventions");
        }

        UpsertResult<Topic> stored = mergeService.upsertTopic(Topic.builder()
            .topicId(CanonicalIds.topicId(session.getSessionId(), title))
            .session(session)
            .title(title)
            .build());
        counters.record(stored.getAction());

        for (Intervention intervention : interventions) {
            SpeechUpsert speech = mergeService.upsertSpeech(SpeechCandidate.builder()
                .session(session)
                .topic(stored.getEntity())
                .ordinal(intervention.getOrdinal())
                .speakerName(intervention.getSpeaker())
                .text(intervention.getText())
                .sourceReference(unit.getSourceReference())
                .build(), resolver);
            counters.record(speech.getAction());
            if (speech.isPlaceholderCreated()) {
                counters.placeholderCreated();
                counters.record(UpsertAction.CREATED);
            }
            if (speech.isUnresolvedSpeaker()) {
                counters.unresolved(speech.getResolution());
            }
        }
    }
}
