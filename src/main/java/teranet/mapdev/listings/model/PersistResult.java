package teranet.mapdev.listings.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Files and tables the loader wrote, and the targets that failed.
 */
@Data
@NoArgsConstructor
public class PersistResult {

    /** Output format name → file written. */
    private Map<String, Path> writtenFiles = new LinkedHashMap<>();

    /** Output format name → error message. */
    private Map<String, String> failedFormats = new LinkedHashMap<>();

    private List<String> skippedFormats = new ArrayList<>();

    private Path latestFile;

    private Path metadataFile;

    private DatabaseLoadResult databaseResult = DatabaseLoadResult.disabled();

    /**
     * All paths written during the load phase, in write order.
     */
    public List<Path> allPaths() {
        List<Path> paths = new ArrayList<>(writtenFiles.values());
        if (latestFile != null) {
            paths.add(latestFile);
        }
        if (metadataFile != null) {
            paths.add(metadataFile);
        }
        return paths;
    }
}
