package teranet.mapdev.listings.runner;

import org.junit.jupiter.api.Test;
import teranet.mapdev.listings.exception.CliUsageException;
import teranet.mapdev.listings.exception.SourceNotFoundException;

import static org.junit.jupiter.api.Assertions.*;

class EtlExitCodeMapperTest {

    private final EtlExitCodeMapper mapper = new EtlExitCodeMapper();

    @Test
    void testGetExitCode_UsageErrorWrapped() {
        IllegalStateException wrapped = new IllegalStateException("Failed to execute ApplicationRunner",
                new CliUsageException("Missing required option --source"));

        assertEquals(EtlExitCodeMapper.USAGE_ERROR, mapper.getExitCode(wrapped));
    }

    @Test
    void testGetExitCode_OtherFailure() {
        assertEquals(EtlExitCodeMapper.FAILURE, mapper.getExitCode(new SourceNotFoundException("missing")));
        assertEquals(EtlExitCodeMapper.FAILURE, mapper.getExitCode(new RuntimeException("boom")));
    }
}
