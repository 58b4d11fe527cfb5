package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.model.RawFile;
import hydromet.gwlevel.consolidate.model.RegionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local ingestion boundary: finds region folders under the input root and
 * loads their station files one at a time.
 *
 * Folder layout:
 *   input-root/
 *     Goa_groundWater_2024/           region code "Goa"
 *       station_001_1994-2024.csv
 *       station_002.csv.gz
 *
 * Only sub-folders whose name contains the region folder marker are scanned.
 */
@Service
public class RegionFolderScanner {

    private static final Logger logger = LoggerFactory.getLogger(RegionFolderScanner.class);

    private final ConsolidationConfig config;
    private final FileChecksumService fileChecksumService;
    private final Pattern reportingPeriodPattern;

    public RegionFolderScanner(ConsolidationConfig config, FileChecksumService fileChecksumService) {
        this.config = config;
        this.fileChecksumService = fileChecksumService;
        this.reportingPeriodPattern = Pattern.compile(config.getReshape().getReportingPeriodPattern());
    }

    /**
     * List the region folders under the input root, sorted by folder name.
     *
     * @param inputRoot parent folder of the region folders
     * @return one entry per region folder, each with its files sorted by name
     * @throws IOException if the input root cannot be listed
     * @throws IllegalArgumentException if the input root is not a directory
     */
    public List<RegionSource> discoverRegions(Path inputRoot) throws IOException {
        if (!Files.isDirectory(inputRoot)) {
            throw new IllegalArgumentException("Input root is not a directory: " + inputRoot);
        }

        List<Path> folders;
        try (Stream<Path> children = Files.list(inputRoot)) {
            folders = children
                    .filter(Files::isDirectory)
                    .filter(path -> path.getFileName().toString().contains(config.getRegionFolderMarker()))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<RegionSource> regions = new ArrayList<>();
        for (Path folder : folders) {
            String regionCode = regionCodeOf(folder);
            List<Path> files = listStationFiles(folder);
            if (files.isEmpty()) {
                logger.warn("No station files found in {}", folder);
            }
            regions.add(new RegionSource(regionCode, folder, files));
        }

        logger.info("Found {} region folders under {}", regions.size(), inputRoot);
        return regions;
    }

    /**
     * Load one station file as an immutable raw file.
     *
     * @throws IOException if the file cannot be read
     */
    public RawFile load(String regionCode, Path path) throws IOException {
        byte[] content = fileChecksumService.readDecompressed(path);
        LocalDateTime receivedAt = LocalDateTime.ofInstant(
                Files.getLastModifiedTime(path).toInstant(), ZoneId.systemDefault());
        LocalDate[] period = extractReportedPeriod(path.getFileName().toString());

        return new RawFile(regionCode, path.toString(), content,
                fileChecksumService.calculateChecksum(content), receivedAt, period[0], period[1]);
    }

    /**
     * Region code of a folder: its name up to the first delimiter.
     */
    public String regionCodeOf(Path folder) {
        String name = folder.getFileName().toString();
        String delimiter = config.getRegionNameDelimiter();
        int end = delimiter == null || delimiter.isEmpty() ? -1 : name.indexOf(delimiter);
        return end > 0 ? name.substring(0, end) : name;
    }

    /**
     * Reporting period announced by a filename, as {start, end}; entries are null when absent.
     * A bare year stands for the whole year.
     */
    public LocalDate[] extractReportedPeriod(String filename) {
        LocalDate[] period = new LocalDate[2];
        Matcher matcher = reportingPeriodPattern.matcher(filename);
        if (!matcher.find()) {
            return period;
        }
        try {
            period[0] = toDate(matcher.group("start"), true);
            period[1] = toDate(matcher.group("end"), false);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            logger.debug("Ignoring unreadable reporting period in {}: {}", filename, e.getMessage());
            period[0] = null;
            period[1] = null;
        }
        if (period[0] != null && period[1] != null && period[1].isBefore(period[0])) {
            logger.debug("Ignoring inverted reporting period in {}", filename);
            period[0] = null;
            period[1] = null;
        }
        return period;
    }

    private static LocalDate toDate(String text, boolean start) {
        if (text == null) {
            return null;
        }
        if (text.length() == 4) {
            int year = Integer.parseInt(text);
            return start ? LocalDate.of(year, 1, 1) : LocalDate.of(year, 12, 31);
        }
        return LocalDate.parse(text);
    }

    private List<Path> listStationFiles(Path folder) throws IOException {
        try (Stream<Path> children = Files.list(folder)) {
            return children
                    .filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return config.getSupportedExtensions().stream()
                .anyMatch(extension -> name.endsWith(extension.toLowerCase(Locale.ROOT)));
    }
}
