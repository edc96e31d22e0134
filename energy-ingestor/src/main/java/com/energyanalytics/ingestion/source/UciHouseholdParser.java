package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.exception.FetchException;
import com.energyanalytics.ingestion.model.HouseholdReading;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the UCI "Individual household electric power consumption" text file.
 *
 * Semicolon separated, one row per minute, "?" marks a missing value:
 *   Date;Time;Global_active_power;Global_reactive_power;Voltage;Global_intensity;
 *   Sub_metering_1;Sub_metering_2;Sub_metering_3
 *
 * Dates are local wall-clock time of the metered house (Sceaux, France) and are
 * converted to UTC here. Only rows inside the requested window are kept.
 */
@Component
@Slf4j
public class UciHouseholdParser {

    static final ZoneId HOUSEHOLD_ZONE = ZoneId.of("Europe/Paris");

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("d/M/yyyy H:mm:ss", Locale.ROOT);

    private static final String MISSING = "?";

    private static final List<String> REQUIRED_COLUMNS = List.of(
            "date", "time", "global_active_power", "global_reactive_power", "voltage",
            "global_intensity", "sub_metering_1", "sub_metering_2", "sub_metering_3");

    /**
     * @throws FetchException permanent when the header does not match the UCI layout
     */
    public List<HouseholdReading> parse(Reader reader, String householdId, String sourceFile, TimeWindow window) {
        try (CSVReader csv = new CSVReaderBuilder(reader)
                .withCSVParser(new CSVParserBuilder().withSeparator(';').build())
                .build()) {

            String[] header = csv.readNext();
            if (header == null) {
                throw FetchFailures.malformed(sourceFile, "empty file");
            }
            Map<String, Integer> idx = indexHeader(header);
            for (String column : REQUIRED_COLUMNS) {
                if (!idx.containsKey(column)) {
                    throw FetchFailures.malformed(sourceFile, "missing column " + column);
                }
            }

            List<HouseholdReading> readings = new ArrayList<>();
            int malformed = 0;
            int outside = 0;

            String[] cols;
            while ((cols = csv.readNext()) != null) {
                if (cols.length < REQUIRED_COLUMNS.size()) {
                    malformed++;
                    continue;
                }

                Instant timestamp = parseTimestamp(cols[idx.get("date")], cols[idx.get("time")]);
                if (timestamp == null) {
                    malformed++;
                    continue;
                }
                if (!window.contains(timestamp)) {
                    outside++;
                    continue;
                }

                readings.add(HouseholdReading.builder()
                        .timestamp(timestamp)
                        .householdId(householdId)
                        .globalActivePower(parseValue(cols[idx.get("global_active_power")]))
                        .globalReactivePower(parseValue(cols[idx.get("global_reactive_power")]))
                        .voltage(parseValue(cols[idx.get("voltage")]))
                        .globalIntensity(parseValue(cols[idx.get("global_intensity")]))
                        .subMetering1(parseValue(cols[idx.get("sub_metering_1")]))
                        .subMetering2(parseValue(cols[idx.get("sub_metering_2")]))
                        .subMetering3(parseValue(cols[idx.get("sub_metering_3")]))
                        .sourceFile(sourceFile)
                        .build());
            }

            log.info("Parsed {}: {} readings in window, {} outside, {} malformed skipped",
                    sourceFile, readings.size(), outside, malformed);
            return readings;

        } catch (CsvValidationException e) {
            throw FetchFailures.malformed(sourceFile, e.getMessage());
        } catch (IOException e) {
            throw FetchFailures.fromIo(e, sourceFile);
        }
    }

    // ── Field parsing ─────────────────────────────────────────────────────────

    private Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            // The UCI header starts with a UTF-8 BOM in some mirrors
            String name = header[i].replace("﻿", "").trim().toLowerCase(Locale.ROOT);
            idx.put(name, i);
        }
        return idx;
    }

    private Instant parseTimestamp(String date, String time) {
        try {
            LocalDateTime local = LocalDateTime.parse(date.trim() + " " + time.trim(), TIMESTAMP_FORMAT);
            return local.atZone(HOUSEHOLD_ZONE).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Double parseValue(String val) {
        if (val == null || val.isBlank() || MISSING.equals(val.trim())) return null;
        try { return Double.parseDouble(val.trim()); } catch (NumberFormatException e) { return null; }
    }
}
