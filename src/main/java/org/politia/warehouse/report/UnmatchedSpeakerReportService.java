package org.politia.warehouse.report;

import lombok.extern.slf4j.Slf4j;
import org.politia.warehouse.entity.Person;
import org.politia.warehouse.normalize.TextNormalizer;
import org.politia.warehouse.repository.PersonRepository;
import org.politia.warehouse.repository.SpeechSegmentRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists placeholder persons so that their speeches can be re-linked by hand. The pipeline never
 * deletes placeholders itself.
 */
@Slf4j
@Service
public class UnmatchedSpeakerReportService {

    private final PersonRepository personRepository;
    private final SpeechSegmentRepository speechSegmentRepository;

    public UnmatchedSpeakerReportService(PersonRepository personRepository,
                                         SpeechSegmentRepository speechSegmentRepository) {
        this.personRepository = personRepository;
        this.speechSegmentRepository = speechSegmentRepository;
    }

    @Transactional(readOnly = true)
    public UnmatchedSpeakerReport buildReport() {
        List<PlaceholderSpeaker> speakers = new ArrayList<>();
        for (Person person : personRepository.findByPlaceholderTrueOrderByPersonId()) {
            speakers.add(PlaceholderSpeaker.builder()
                .personId(person.getPersonId())
                .fullName(person.getFullName())
                .normalizedName(TextNormalizer.normalizeName(person.getFullName()))
                .familyName(person.getFamilyName())
                .givenName(person.getGivenName())
                .speechCount(speechSegmentRepository.countBySpeakerPersonId(person.getPersonId()))
                .build());
        }
        return new UnmatchedSpeakerReport(speakers);
    }

    /**
     * Builds the report and writes it to the log.
     */
    public UnmatchedSpeakerReport logReport() {
        UnmatchedSpeakerReport report = buildReport();
        log.info("Unmatched speakers awaiting review: {}", report.getTotalUnmatched());
        for (PlaceholderSpeaker speaker : report.getSpeakers()) {
            log.info("placeholder_id={} full_name=\"{}\" normalized=\"{}\" speeches={}",
                speaker.getPersonId(), speaker.getFullName(), speaker.getNormalizedName(), speaker.getSpeechCount());
        }
        return report;
    }
}
