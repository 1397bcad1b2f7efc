package teranet.mapdev.listings.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Service responsible for source checksums and compression handling.
 *
 * Features:
 * - SHA-256 checksum of the source file, recorded in the run summary
 * - gzip decompression of flat sources (.gz)
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class FileChecksumService {

    private static final Logger logger = LoggerFactory.getLogger(FileChecksumService.class);

    /**
     * Calculate the SHA-256 checksum of a file.
     *
     * @param file the file to calculate checksum for
     * @return SHA-256 checksum as hexadecimal string
     * @throws IOException if file cannot be read
     */
    public String calculateFileChecksum(Path file) throws IOException {
        logger.debug("Calculating SHA-256 checksum for file: {}", file);

        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }

        try (InputStream inputStream = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int bytesRead;

            while ((bytesRead = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, bytesRead);
            }
        }

        String checksum = bytesToHex(digest.digest());
        logger.debug("Calculated checksum for {}: {}", file.getFileName(), checksum);
        return checksum;
    }

    /**
     * Open a flat source for reading.
     *
     * compression:
     * - infer → gzip when the file name ends with .gz, plain otherwise
     * - gzip  → always gzip
     * - none  → never
     *
     * @param file        the file to open
     * @param compression infer, gzip or none
     * @return decompressed InputStream (or the plain file stream)
     * @throws IOException if the file cannot be opened or is not valid gzip
     */
    public InputStream getDecompressedInputStream(Path file, String compression) throws IOException {
        InputStream inputStream = new BufferedInputStream(Files.newInputStream(file));

        if (isGzip(file, compression)) {
            logger.debug("Decompressing GZIP file: {}", file.getFileName());
            try {
                return new GZIPInputStream(inputStream);
            } catch (IOException e) {
                inputStream.close();
                throw e;
            }
        }

        logger.debug("Using plain input stream for: {}", file.getFileName());
        return inputStream;
    }

    public boolean isGzip(Path file, String compression) {
        String mode = compression == null ? "infer" : compression.toLowerCase(Locale.ROOT);
        switch (mode) {
            case "gzip":
                return true;
            case "none":
                return false;
            default:
                return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz");
        }
    }

    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder();

        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }

        return hexString.toString();
    }
}
