package org.politia.warehouse.config;

import lombok.extern.slf4j.Slf4j;
import org.politia.warehouse.pipeline.IngestionOrchestrator;
import org.politia.warehouse.pipeline.IngestionSummary;
import org.politia.warehouse.report.UnmatchedSpeakerReportService;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * The ingestion run as a Spring Batch job: profiles, then transcripts, then the unmatched speaker
 * report.
 *
 * <p>Steps use a resourceless transaction manager because the orchestrator opens one store
 * transaction per unit itself.</p>
 */
@Slf4j
@Configuration
public class IngestionJobConfig {

    public static final String JOB_NAME = "politiaIngestionJob";
    public static final String PROFILES_PATH_PARAMETER = "profilesPath";
    public static final String TRANSCRIPTS_PATH_PARAMETER = "transcriptsPath";

    @Bean
    public Job politiaIngestionJob(
        JobRepository jobRepository,
        @Qualifier("profileStep") Step profileStep,
        @Qualifier("transcriptStep") Step transcriptStep,
        @Qualifier("unmatchedSpeakerReportStep") Step unmatchedSpeakerReportStep
    ) {
        return new JobBuilder(JOB_NAME, jobRepository)
            .incrementer(new RunIdIncrementer())
            .start(profileStep)
            .next(transcriptStep)
            .next(unmatchedSpeakerReportStep)
            .build();
    }

    @Bean
    public Step profileStep(JobRepository jobRepository, IngestionOrchestrator orchestrator, IngestProperties properties) {
        return new StepBuilder("profileStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                if (!properties.isProcessProfiles()) {
                    log.info("Profile ingestion disabled, skipping");
                    return RepeatStatus.FINISHED;
                }
                Path directory = resolvePath(chunkContext, PROFILES_PATH_PARAMETER, properties.getProfilesPath());
                if (directory == null) {
                    log.warn("No profiles path configured, skipping profile ingestion");
                    return RepeatStatus.FINISHED;
                }
                record(contribution, orchestrator.ingestProfiles(directory));
                return RepeatStatus.FINISHED;
            }, new ResourcelessTransactionManager())
            .build();
    }

    @Bean
    public Step transcriptStep(JobRepository jobRepository, IngestionOrchestrator orchestrator, IngestProperties properties) {
        return new StepBuilder("transcriptStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                if (!properties.isProcessTranscripts()) {
                    log.info("Transcript ingestion disabled, skipping");
                    return RepeatStatus.FINISHED;
                }
                Path directory = resolvePath(chunkContext, TRANSCRIPTS_PATH_PARAMETER, properties.getTranscriptsPath());
                if (directory == null) {
                    log.warn("No transcripts path configured, skipping transcript ingestion");
                    return RepeatStatus.FINISHED;
                }
                record(contribution, orchestrator.ingestTranscripts(directory));
                return RepeatStatus.FINISHED;
            }, new ResourcelessTransactionManager())
            .build();
    }

    @Bean
    public Step unmatchedSpeakerReportStep(JobRepository jobRepository, UnmatchedSpeakerReportService reportService) {
        return new StepBuilder("unmatchedSpeakerReportStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                reportService.logReport();
                return RepeatStatus.FINISHED;
            }, new ResourcelessTransactionManager())
            .build();
    }

    private static Path resolvePath(ChunkContext chunkContext, String parameter, String configured) {
        Object fromJob = chunkContext.getStepContext().getJobParameters().get(parameter);
        String value = fromJob != null ? fromJob.toString() : configured;
        return StringUtils.hasText(value) ? Path.of(value) : null;
    }

    private static void record(StepContribution contribution, IngestionSummary summary) {
        contribution.incrementWriteCount(summary.getCreated() + summary.getUpdated());
        contribution.incrementFilterCount(summary.getSkipped() + summary.getRejected());
    }
}
