package com.civilworks.carbon;

import com.civilworks.carbon.dto.IngestDtos;
import com.civilworks.carbon.dto.PipelineDtos;
import com.civilworks.carbon.service.CivilWorksFilter;
import com.civilworks.carbon.service.ContractCleaningService;
import com.civilworks.carbon.service.IngestService;
import com.civilworks.carbon.service.MissingInputException;
import com.civilworks.carbon.service.ScreeningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Batch entry point. {@code --stage=ingest|filter|clean|screen|all} selects what runs; stages
 * of {@code all} run in that order and the chain stops at the first stage that fails.
 *
 * <p>Exit codes: 0 success, 1 missing input or unknown stage, 2 ingestion aborted.
 */
@Component
@ConditionalOnProperty(prefix = "app.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    enum Stage { INGEST, FILTER, CLEAN, SCREEN, ALL }

    private final IngestService ingestService;
    private final CivilWorksFilter civilWorksFilter;
    private final ContractCleaningService cleaningService;
    private final ScreeningService screeningService;
    private int exitCode = 0;

    public PipelineRunner(IngestService ingestService, CivilWorksFilter civilWorksFilter,
                          ContractCleaningService cleaningService, ScreeningService screeningService) {
        this.ingestService = ingestService;
        this.civilWorksFilter = civilWorksFilter;
        this.cleaningService = cleaningService;
        this.screeningService = screeningService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> values = args.getOptionValues("stage");
        String requested = values == null || values.isEmpty() ? "all" : values.get(0);
        Stage stage;
        try {
            stage = Stage.valueOf(requested.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.error("Unknown stage '{}', expected one of ingest, filter, clean, screen, all", requested);
            exitCode = 1;
            return;
        }

        try {
            if (stage == Stage.INGEST || stage == Stage.ALL) {
                IngestDtos.IngestReport report = ingestService.ingest();
                if (report.getOutcome() == IngestDtos.Outcome.ABORTED) {
                    log.error("Ingestion aborted ({}); {} contracts kept, rerun to resume from the saved cursor",
                            report.getFailure(), report.getAccepted());
                    exitCode = 2;
                    return;
                }
            }
            if (stage == Stage.FILTER || stage == Stage.ALL) {
                civilWorksFilter.run();
            }
            if (stage == Stage.CLEAN || stage == Stage.ALL) {
                cleaningService.run();
            }
            if (stage == Stage.SCREEN || stage == Stage.ALL) {
                PipelineDtos.ScreeningReport report = screeningService.run();
                log.info("Saved screening output to {} {}", report.getOutput_path(), report.getStatus_counts());
            }
        } catch (MissingInputException e) {
            log.error("Error: {}. Run the preceding stage first or place the file in the data directory.", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
