package de.bsommerfeld.patchfetcher.app.patchlist;

import de.bsommerfeld.patchfetcher.core.config.ConfigException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a patch-list CSV file.
 *
 * <pre>
 * # patch, version, description, group, platform
 * 6880880,19c,OPatch,tools,226
 * 34672698,,OJVM bundle,db,Linux x86-64
 * 31424070,,Generic patch,misc,
 * </pre>
 *
 * Lines starting with {@code #} are comments. The version and description
 * columns are informational. Rows without exactly five columns, or without a
 * numeric patch number, are skipped with a warning.
 */
public class PatchListReader {

    private static final Logger LOG = LoggerFactory.getLogger(PatchListReader.class);

    static final int COLUMNS = 5;

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setCommentMarker('#')
            .setIgnoreEmptyLines(true)
            .build();

    /**
     * @throws ConfigException if the file cannot be read or is not valid CSV
     */
    public List<PatchListEntry> read(Path file) throws ConfigException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Patch list not found: " + file.toAbsolutePath());
        }

        List<PatchListEntry> entries = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord row : parser) {
                long line = parser.getCurrentLineNumber();
                if (row.size() != COLUMNS) {
                    LOG.warn("Skipping line {} of {}: expected {} columns, found {}", line, file.getFileName(),
                            COLUMNS, row.size());
                    continue;
                }
                String patchNumber = row.get(0).trim();
                if (patchNumber.isEmpty() || !patchNumber.chars().allMatch(Character::isDigit)) {
                    LOG.warn("Skipping line {} of {}: '{}' is not a patch number", line, file.getFileName(),
                            patchNumber);
                    continue;
                }
                entries.add(new PatchListEntry(line, patchNumber, row.get(3), row.get(4)));
            }
        } catch (IOException | UncheckedIOException e) {
            throw new ConfigException("Cannot read patch list " + file + ": " + e.getMessage(), e);
        }

        LOG.info("Read {} patch(es) from {}", entries.size(), file.getFileName());
        return entries;
    }
}
