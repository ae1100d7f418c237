package com.cinemaregistry.scrape.output;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.model.FetchOutcome;
import com.cinemaregistry.scrape.model.ResultSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes checkpoints as CSV and JSON files into the configured output
 * directory:
 * <ul>
 *   <li>{@code all_cinemas_data_<label>.csv|.json}: every record, columns are the union of all fields seen</li>
 *   <li>{@code cinema_name_zzid_<label>.csv} and {@code cinema_simple_<label>.json}: id, name and code only</li>
 *   <li>{@code error_logs_<label>.csv}: failed identifiers</li>
 * </ul>
 * Files with nothing to report are skipped.
 */
@Component
public class FileResultPersister implements ResultPersister {
    private static final Logger log = LoggerFactory.getLogger(FileResultPersister.class);
    private static final String[] ERROR_HEADERS = {"cinemaid", "error", "timestamp"};

    private final ScraperProperties.Output output;
    private final ObjectMapper objectMapper;
    private final DateTimeFormatter labelFormat;
    private final DateTimeFormatter timestampFormat;

    public FileResultPersister(ScraperProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.output = properties.getOutput();
        this.objectMapper = objectMapper;
        this.labelFormat = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(clock.getZone());
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(clock.getZone());
    }

    @Override
    public void persist(ResultSnapshot snapshot, Instant label) throws IOException {
        Path directory = Paths.get(output.getDirectory());
        Files.createDirectories(directory);
        String suffix = labelFormat.format(label);

        if (!snapshot.records().isEmpty()) {
            writeFullCsv(directory.resolve("all_cinemas_data_" + suffix + ".csv"), snapshot.records());
            writeJson(directory.resolve("all_cinemas_data_" + suffix + ".json"), snapshot.records());

            List<Map<String, Object>> projection = project(snapshot.records());
            writeProjectionCsv(directory.resolve("cinema_name_zzid_" + suffix + ".csv"), projection);
            writeJson(directory.resolve("cinema_simple_" + suffix + ".json"), projection);
        }
        if (!snapshot.errors().isEmpty()) {
            writeErrorCsv(directory.resolve("error_logs_" + suffix + ".csv"), snapshot.errors());
        }
        log.debug("Checkpoint {} written to {}", suffix, directory.toAbsolutePath());
    }

    List<Map<String, Object>> project(List<Map<String, Object>> records) {
        List<Map<String, Object>> out = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(output.getIdentifierField(), record.get(output.getIdentifierField()));
            row.put(output.getNameField(), record.get(output.getNameField()));
            row.put(output.getCodeField(), record.get(output.getCodeField()));
            out.add(row);
        }
        return out;
    }

    private void writeFullCsv(Path path, List<Map<String, Object>> records) throws IOException {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            columns.addAll(record.keySet());
        }
        writeRows(path, new ArrayList<>(columns), records);
    }

    private void writeProjectionCsv(Path path, List<Map<String, Object>> projection) throws IOException {
        List<String> columns = List.of(output.getIdentifierField(), output.getNameField(), output.getCodeField());
        writeRows(path, columns, projection);
    }

    private void writeRows(Path path, List<String> columns, List<Map<String, Object>> rows) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(columns.toArray(new String[0]))
            .build();
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Map<String, Object> row : rows) {
                List<String> values = new ArrayList<>(columns.size());
                for (String column : columns) {
                    values.add(str(row.get(column)));
                }
                printer.printRecord(values);
            }
        }
    }

    private void writeErrorCsv(Path path, List<FetchOutcome.Failure> errors) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(ERROR_HEADERS)
            .build();
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (FetchOutcome.Failure failure : errors) {
                printer.printRecord(
                    failure.identifier(),
                    str(failure.reason()),
                    failure.timestamp() == null ? "" : timestampFormat.format(failure.timestamp())
                );
            }
        }
    }

    private void writeJson(Path path, List<Map<String, Object>> rows) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), rows);
    }

    private String str(Object value) {
        return value == null ? "" : value.toString();
    }
}
