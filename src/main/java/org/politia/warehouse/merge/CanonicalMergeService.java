package org.politia.warehouse.merge;

import lombok.extern.slf4j.Slf4j;
import org.politia.warehouse.entity.Person;
import org.politia.warehouse.entity.Session;
import org.politia.warehouse.entity.SpeechSegment;
import org.politia.warehouse.entity.Topic;
import org.politia.warehouse.normalize.TextNormalizer;
import org.politia.warehouse.resolve.SpeakerResolution;
import org.politia.warehouse.resolve.SpeakerResolver;
import org.politia.warehouse.store.CanonicalStore;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Decides, per entity kind, whether an incoming candidate creates a row, updates one or is skipped.
 *
 * <p>Persons accrete metadata over repeated fetches: party, source ids and the raw payload follow the
 * latest fetch, names are only filled when still empty, roles are fixed at creation. Sessions, topics
 * and speeches come from published transcripts and are written once; an existing row always wins.</p>
 *
 * <p>Must be called inside {@link CanonicalStore#inTransaction}.</p>
 */
@Slf4j
@Service
public class CanonicalMergeService {

    private final CanonicalStore store;

    public CanonicalMergeService(CanonicalStore store) {
        this.store = store;
    }

    public UpsertResult<Person> upsertPerson(Person candidate) {
        Person existing = store.findPerson(candidate.getPersonId()).orElse(null);
        if (existing == null) {
            log.debug("Creating person {}", candidate.getPersonId());
            return UpsertResult.created(store.savePerson(candidate));
        }

        boolean changed = false;
        if (StringUtils.hasText(candidate.getParty()) && !candidate.getParty().equals(existing.getParty())) {
            existing.setParty(candidate.getParty());
            changed = true;
        }
        if (candidate.getSourceIds() != null) {
            for (Map.Entry<String, String> sourceId : candidate.getSourceIds().entrySet()) {
                if (!Objects.equals(existing.getSourceIds().get(sourceId.getKey()), sourceId.getValue())) {
                    existing.getSourceIds().put(sourceId.getKey(), sourceId.getValue());
                    changed = true;
                }
            }
        }
        if (candidate.getRawData() != null && !candidate.getRawData().equals(existing.getRawData())) {
            existing.setRawData(candidate.getRawData());
            changed = true;
        }

        changed |= fillIfEmpty(existing::getFullName, existing::setFullName, candidate.getFullName());
        changed |= fillIfEmpty(existing::getFamilyName, existing::setFamilyName, candidate.getFamilyName());
        changed |= fillIfEmpty(existing::getGivenName, existing::setGivenName, candidate.getGivenName());
        changed |= fillIfEmpty(existing::getSlug, existing::setSlug, candidate.getSlug());
        changed |= fillIfEmpty(existing::getUrl, existing::setUrl, candidate.getUrl());
        changed |= fillIfEmpty(existing::getBirthDate, existing::setBirthDate, candidate.getBirthDate());
        changed |= fillIfEmpty(existing::getBirthPlace, existing::setBirthPlace, candidate.getBirthPlace());
        changed |= fillIfEmpty(existing::getImageUrl, existing::setImageUrl, candidate.getImageUrl());

        if (!changed) {
            return UpsertResult.skipped(existing);
        }
        log.debug("Updating person {}", existing.getPersonId());
        return UpsertResult.updated(store.savePerson(existing));
    }

    public UpsertResult<Session> upsertSession(Session candidate) {
        return store.findSession(candidate.getSessionId())
            .map(UpsertResult::skipped)
            .orElseGet(() -> UpsertResult.created(store.saveSession(candidate)));
    }

    public UpsertResult<Topic> upsertTopic(Topic candidate) {
        return store.findTopic(candidate.getTopicId())
            .map(UpsertResult::skipped)
            .orElseGet(() -> UpsertResult.created(store.saveTopic(candidate)));
    }

    /**
     * Writes a speech unless one with the same deterministic id exists. The speaker is resolved only
     * for new speeches; a placeholder speaker is upserted before the speech that references it.
     */
    public SpeechUpsert upsertSpeech(SpeechCandidate candidate, SpeakerResolver resolver) {
        String normalizedSpeaker = TextNormalizer.normalizeName(candidate.getSpeakerName());
        String speechId = CanonicalIds.speechId(candidate.getTopic().getTopicId(), candidate.getOrdinal(), normalizedSpeaker);
        if (store.speechExists(speechId)) {
            return new SpeechUpsert(speechId, UpsertAction.SKIPPED, null, false);
        }

        SpeakerResolution resolution = resolver.resolve(candidate.getSpeakerName());
        Person speaker;
        boolean placeholderCreated = false;
        if (resolution.isPlaceholder()) {
            UpsertResult<Person> placeholder = upsertPerson(CandidateMapper.placeholder(resolution));
            speaker = placeholder.getEntity();
            placeholderCreated = placeholder.getAction() == UpsertAction.CREATED;
        } else {
            speaker = store.findPerson(resolution.getPersonId())
                .orElseThrow(() -> new IllegalStateException(
                    "Resolved speaker " + resolution.getPersonId() + " is missing from the store"));
        }

        store.saveSpeech(SpeechSegment.builder()
            .speechId(speechId)
            .session(candidate.getSession())
            .topic(candidate.getTopic())
            .speaker(speaker)
            .text(candidate.getText())
            .date(candidate.getSession().getDate())
            .orderInTopic(candidate.getOrdinal())
            .sourceReference(candidate.getSourceReference())
            .build());
        return new SpeechUpsert(speechId, UpsertAction.CREATED, resolution, placeholderCreated);
    }

    private static boolean fillIfEmpty(Supplier<String> current, Consumer<String> setter, String incoming) {
        if (StringUtils.hasText(current.get()) || !StringUtils.hasText(incoming)) {
            return false;
        }
        setter.accept(incoming);
        return true;
    }
}
