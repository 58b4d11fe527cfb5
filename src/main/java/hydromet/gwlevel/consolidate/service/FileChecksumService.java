package hydromet.gwlevel.consolidate.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.zip.GZIPInputStream;

/**
 * Service responsible for file checksums and compressed input.
 *
 * Features:
 * - SHA-256 checksum recorded with every raw file for traceability
 * - Transparent reading of gzip-compressed station files (.gz)
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class FileChecksumService {

    private static final Logger logger = LoggerFactory.getLogger(FileChecksumService.class);

    private static final int BUFFER_SIZE = 8192;

    /**
     * Calculate SHA-256 checksum of the given content.
     *
     * @param content the bytes to hash
     * @return SHA-256 checksum as hexadecimal string
     */
    public String calculateChecksum(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return bytesToHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Calculate SHA-256 checksum of a file without loading it into memory.
     *
     * @param path the file to hash
     * @return SHA-256 checksum as hexadecimal string
     * @throws IOException if the file cannot be read
     */
    public String calculateChecksum(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, bytesRead);
            }
            return bytesToHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Read a file fully, decompressing it first if the name ends with .gz.
     *
     * @param path the file to read
     * @return the (decompressed) content
     * @throws IOException if the file cannot be read or the gzip stream is corrupt
     */
    public byte[] readDecompressed(Path path) throws IOException {
        String filename = path.getFileName().toString();
        if (filename.endsWith(".gz")) {
            logger.debug("Decompressing GZIP file: {}", filename);
            try (InputStream inputStream = new GZIPInputStream(Files.newInputStream(path))) {
                return inputStream.readAllBytes();
            }
        }
        return Files.readAllBytes(path);
    }

    /**
     * Convert byte array to hexadecimal string.
     *
     * @param bytes the byte array to convert
     * @return hexadecimal string representation
     */
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
