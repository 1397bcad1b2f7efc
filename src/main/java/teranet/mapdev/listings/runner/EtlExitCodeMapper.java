package teranet.mapdev.listings.runner;

import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;
import teranet.mapdev.listings.exception.CliUsageException;

/**
 * Process exit codes: 2 for command-line usage errors, 1 for any other failure.
 */
@Component
public class EtlExitCodeMapper implements ExitCodeExceptionMapper {

    public static final int USAGE_ERROR = 2;
    public static final int FAILURE = 1;

    @Override
    public int getExitCode(Throwable exception) {
        // Runner exceptions arrive wrapped by Spring Boot
        for (Throwable cause = exception; cause != null; cause = cause.getCause()) {
            if (cause instanceof CliUsageException) {
                return USAGE_ERROR;
            }
        }
        return FAILURE;
    }
}
