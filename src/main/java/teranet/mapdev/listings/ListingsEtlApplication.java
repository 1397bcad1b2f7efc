package teranet.mapdev.listings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point of the listings ETL job.
 *
 * Usage:
 *   java -jar listings-etl.jar --source=data/raw/listings.zip [--source-type=archive|flat|auto]
 *        [--output-dir=data/processed] [--config=etl.yml] [--etl.some.property=value]
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class ListingsEtlApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(ListingsEtlApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(application.run(translateArgs(args))));
    }

    /**
     * Rewrites the --config shortcut into Spring's additional config location.
     * "--config=etl.yml" and "--config etl.yml" are both accepted.
     */
    static String[] translateArgs(String[] args) {
        List<String> translated = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--config=")) {
                translated.add(additionalLocation(arg.substring("--config=".length())));
            } else if (arg.equals("--config") && i + 1 < args.length) {
                translated.add(additionalLocation(args[++i]));
            } else {
                translated.add(arg);
            }
        }
        return translated.toArray(new String[0]);
    }

    private static String additionalLocation(String path) {
        return "--spring.config.additional-location=file:" + path;
    }
}
