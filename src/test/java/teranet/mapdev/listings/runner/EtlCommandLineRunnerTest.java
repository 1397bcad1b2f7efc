package teranet.mapdev.listings.runner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import teranet.mapdev.listings.exception.CliUsageException;
import teranet.mapdev.listings.exception.UnsupportedSourceTypeException;
import teranet.mapdev.listings.model.SourceType;
import teranet.mapdev.listings.service.EtlPipeline;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for EtlCommandLineRunner
 */
@ExtendWith(MockitoExtension.class)
class EtlCommandLineRunnerTest {

    @Mock
    private EtlPipeline pipeline;

    private EtlCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new EtlCommandLineRunner(pipeline);
    }

    @Test
    void testRun_AllOptions() {
        runner.run(new DefaultApplicationArguments(
                "--source=data/raw/listings.zip", "--source-type=archive", "--output-dir=out"));

        verify(pipeline).run(Path.of("data/raw/listings.zip"), SourceType.ARCHIVE, Path.of("out"));
    }

    @Test
    void testRun_DefaultsToAutoAndConfiguredOutput() {
        runner.run(new DefaultApplicationArguments("--source=listings.csv"));

        verify(pipeline).run(Path.of("listings.csv"), SourceType.AUTO, null);
    }

    @Test
    void testRun_MissingSource_Throws() {
        CliUsageException exception = assertThrows(CliUsageException.class,
                () -> runner.run(new DefaultApplicationArguments("--output-dir=out")));

        assertTrue(exception.getMessage().contains(EtlCommandLineRunner.USAGE));
        verifyNoInteractions(pipeline);
    }

    @Test
    void testRun_RepeatedOption_Throws() {
        assertThrows(CliUsageException.class,
                () -> runner.run(new DefaultApplicationArguments("--source=a.csv", "--source=b.csv")));
    }

    @Test
    void testRun_UnknownSourceType_Throws() {
        assertThrows(UnsupportedSourceTypeException.class,
                () -> runner.run(new DefaultApplicationArguments("--source=a.csv", "--source-type=xml")));
        verifyNoInteractions(pipeline);
    }
}
