package teranet.mapdev.listings.runner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import teranet.mapdev.listings.exception.CliUsageException;
import teranet.mapdev.listings.model.SourceType;
import teranet.mapdev.listings.service.EtlPipeline;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reads the command line and runs the pipeline once.
 *
 * Options:
 * - --source=PATH (required)
 * - --source-type=archive|flat|auto (default auto)
 * - --output-dir=PATH (default etl.paths.processed-data)
 *
 * Disabled with etl.cli.enabled=false (tests drive the pipeline directly).
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "etl.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EtlCommandLineRunner implements ApplicationRunner {

    static final String USAGE = "Usage: --source=PATH [--source-type=archive|flat|auto] [--output-dir=PATH] [--config=FILE]";

    private final EtlPipeline pipeline;

    public EtlCommandLineRunner(EtlPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public void run(ApplicationArguments args) {
        String source = singleValue(args, "source");
        if (source == null || source.isBlank()) {
            log.error("Missing required option --source. {}", USAGE);
            throw new CliUsageException("Missing required option --source. " + USAGE);
        }

        SourceType sourceType = SourceType.fromName(singleValue(args, "source-type"));
        String outputDir = singleValue(args, "output-dir");

        log.info("Running pipeline for source {} (type {})", source, sourceType);
        pipeline.run(Paths.get(source), sourceType, outputDir != null ? Path.of(outputDir) : null);
    }

    private String singleValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new CliUsageException("Option --" + name + " given more than once. " + USAGE);
        }
        return values.get(0);
    }
}
