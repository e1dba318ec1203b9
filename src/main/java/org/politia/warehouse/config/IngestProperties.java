package org.politia.warehouse.config;

import lombok.Data;
import org.politia.warehouse.entity.Chamber;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ingestion settings, bound from {@code application.yml} under the {@code politia.ingest.*} prefix.
 *
 * <p>The two paths can be overridden per run with the {@code profilesPath} and
 * {@code transcriptsPath} job parameters.</p>
 */
@Data
@ConfigurationProperties(prefix = "politia.ingest")
public class IngestProperties {

    /**
     * Directory of person profile files, one JSON object per file.
     */
    private String profilesPath;

    /**
     * Directory of transcript files named {@code <legislature>__<session>.json}.
     */
    private String transcriptsPath;

    private boolean processProfiles = true;

    private boolean processTranscripts = true;

    /**
     * Chamber assumed for transcript files whose name does not carry one.
     */
    private Chamber defaultChamber = Chamber.CAMERA;
}
