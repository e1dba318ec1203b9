package org.politia.warehouse.pipeline.event;

import lombok.extern.slf4j.Slf4j;
import org.politia.warehouse.pipeline.UnitReport;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes the pipeline's events to the log as key=value lines.
 */
@Slf4j
@Component
public class IngestionEventLogger {

    @EventListener
    public void onUnitProcessed(UnitProcessedEvent event) {
        UnitReport report = event.getReport();
        if (report.isCommitted()) {
            log.info("unit_id={} kind={} outcome=committed created={} updated={} skipped={} rejected={} placeholders_created={}",
                report.getUnitId(), report.getKind(), report.getCreated(), report.getUpdated(),
                report.getSkipped(), report.getRejected(), report.getPlaceholdersCreated());
        } else {
            log.warn("unit_id={} kind={} outcome=rolled_back created=0 updated=0 skipped=0 rejected=0 placeholders_created=0 failure=\"{}\"",
                report.getUnitId(), report.getKind(), report.getFailure());
        }
    }

    @EventListener
    public void onUnresolvedSpeaker(UnresolvedSpeakerEvent event) {
        log.info("unresolved_speaker unit_id={} raw_name=\"{}\" normalized=\"{}\" placeholder_id={} ambiguous={}",
            event.getUnitId(), event.getRawName(), event.getNormalizedName(), event.getPlaceholderId(), event.isAmbiguous());
    }
}
