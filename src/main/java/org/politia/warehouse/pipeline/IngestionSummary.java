package org.politia.warehouse.pipeline;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Totals of one ingestion phase over all of its units.
 */
@Getter
public class IngestionSummary {

    private final UnitKind kind;
    private final List<UnitReport> units = new ArrayList<>();
    private int committed;
    private int rolledBack;
    private int created;
    private int updated;
    private int skipped;
    private int rejected;
    private int placeholdersCreated;

    public IngestionSummary(UnitKind kind) {
        this.kind = kind;
    }

    public void add(UnitReport report) {
        units.add(report);
        if (report.isCommitted()) {
            committed++;
        } else {
            rolledBack++;
        }
        created += report.getCreated();
        updated += report.getUpdated();
        skipped += report.getSkipped();
        rejected += report.getRejected();
        placeholdersCreated += report.getPlaceholdersCreated();
    }

    public List<UnitReport> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public int getTotalUnits() {
        return units.size();
    }

    @Override
    public String toString() {
        return kind + ": units=" + units.size() + " committed=" + committed + " rolledBack=" + rolledBack
            + " created=" + created + " updated=" + updated + " skipped=" + skipped
            + " rejected=" + rejected + " placeholders=" + placeholdersCreated;
    }
}
