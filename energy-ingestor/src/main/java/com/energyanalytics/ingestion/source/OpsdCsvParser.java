package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.model.GridOperation;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the Open Power System Data "time_series_60min_singleindex" CSV.
 *
 * One row per UTC hour, one column per country and variable, e.g.
 *   utc_timestamp, cet_cest_timestamp, DE_load_actual_entsoe_transparency,
 *   DE_solar_generation_actual, FR_price_day_ahead, ...
 *
 * Only columns for the requested countries are read. Countries with no column in the
 * file are skipped; rows where every value is blank produce no record.
 */
@Component
@Slf4j
public class OpsdCsvParser {

    static final String SOURCE_NAME = "Open Power System Data";

    private static final List<String> TIMESTAMP_COLUMNS = List.of("utc_timestamp", "timestamp", "time (utc)");

    // ── Column suffixes, appended to the lower-cased country code ──────────────
    private static final String LOAD_ACTUAL    = "_load_actual_entsoe_transparency";
    private static final String LOAD_FORECAST  = "_load_forecast_entsoe_transparency";
    private static final String SOLAR          = "_solar_generation_actual";
    private static final String WIND_ONSHORE   = "_wind_onshore_generation_actual";
    private static final String WIND_OFFSHORE  = "_wind_offshore_generation_actual";
    private static final String HYDRO          = "_hydro_generation_actual";
    private static final String NUCLEAR        = "_nuclear_generation_actual";
    private static final String FOSSIL_GAS     = "_fossil_gas_generation_actual";
    private static final String FOSSIL_COAL    = "_fossil_hard_coal_generation_actual";
    private static final String FOSSIL_LIGNITE = "_fossil_brown_coal_lignite_generation_actual";
    private static final String PRICE          = "_price_day_ahead";

    /**
     * @throws com.energyanalytics.ingestion.exception.FetchException permanent when no timestamp column exists
     */
    public List<GridOperation> parse(Reader reader, List<String> countries, TimeWindow window, String sourceName) {
        try (CSVReader csv = new CSVReader(reader)) {
            String[] header = csv.readNext();
            if (header == null) {
                throw FetchFailures.malformed(sourceName, "empty file");
            }
            Map<String, Integer> idx = indexHeader(header);
            Integer tsCol = TIMESTAMP_COLUMNS.stream().map(idx::get).filter(i -> i != null).findFirst().orElse(null);
            if (tsCol == null) {
                throw FetchFailures.malformed(sourceName, "no utc_timestamp column");
            }

            Map<String, Map<String, Integer>> columnsByCountry = new LinkedHashMap<>();
            for (String country : countries) {
                Map<String, Integer> cols = countryColumns(country, idx);
                if (cols.isEmpty()) {
                    log.warn("OPSD file {} has no columns for country {}", sourceName, country);
                } else {
                    columnsByCountry.put(country.toUpperCase(Locale.ROOT), cols);
                }
            }
            if (columnsByCountry.isEmpty()) {
                throw FetchFailures.malformed(sourceName, "no columns for any of " + countries);
            }

            List<GridOperation> operations = new ArrayList<>();
            int malformed = 0;
            String[] row;
            while ((row = csv.readNext()) != null) {
                Instant timestamp = parseTimestamp(safeGet(row, tsCol));
                if (timestamp == null) {
                    malformed++;
                    continue;
                }
                if (!window.contains(timestamp)) continue;

                for (Map.Entry<String, Map<String, Integer>> e : columnsByCountry.entrySet()) {
                    GridOperation op = toOperation(timestamp, e.getKey(), e.getValue(), row);
                    if (op != null) {
                        operations.add(op);
                    }
                }
            }

            log.info("Parsed {}: {} grid records for {}, {} malformed rows skipped",
                    sourceName, operations.size(), columnsByCountry.keySet(), malformed);
            return operations;

        } catch (CsvValidationException e) {
            throw FetchFailures.malformed(sourceName, e.getMessage());
        } catch (IOException e) {
            throw FetchFailures.fromIo(e, sourceName);
        }
    }

    private GridOperation toOperation(Instant timestamp, String country, Map<String, Integer> cols, String[] row) {
        Double load = value(row, cols.get(LOAD_ACTUAL));
        Double forecast = value(row, cols.get(LOAD_FORECAST));
        Double solar = value(row, cols.get(SOLAR));
        Double onshore = value(row, cols.get(WIND_ONSHORE));
        Double offshore = value(row, cols.get(WIND_OFFSHORE));
        Double hydro = value(row, cols.get(HYDRO));
        Double nuclear = value(row, cols.get(NUCLEAR));
        Double fossil = sum(value(row, cols.get(FOSSIL_GAS)),
                value(row, cols.get(FOSSIL_COAL)),
                value(row, cols.get(FOSSIL_LIGNITE)));
        Double price = value(row, cols.get(PRICE));

        if (load == null && forecast == null && solar == null && onshore == null && offshore == null
                && hydro == null && nuclear == null && fossil == null && price == null) {
            return null;
        }

        Double total = sum(solar, onshore, offshore, hydro, nuclear, fossil);

        return GridOperation.builder()
                .timestamp(timestamp)
                .countryCode(country)
                .regionCode(country)
                .loadActualMw(load)
                .loadForecastMw(forecast)
                .solarGenerationActualMw(solar)
                .windOnshoreGenerationActualMw(onshore)
                .windOffshoreGenerationActualMw(offshore)
                .hydroGenerationActualMw(hydro)
                .nuclearGenerationActualMw(nuclear)
                .fossilGenerationActualMw(fossil)
                .totalGenerationMw(total)
                .netImportExportMw(total != null && load != null ? load - total : null)
                .priceDayAheadEurMwh(price)
                .source(SOURCE_NAME)
                .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            idx.put(header[i].replace("﻿", "").trim().toLowerCase(Locale.ROOT), i);
        }
        return idx;
    }

    private Map<String, Integer> countryColumns(String country, Map<String, Integer> idx) {
        String prefix = country.toLowerCase(Locale.ROOT);
        Map<String, Integer> cols = new HashMap<>();
        for (String suffix : List.of(LOAD_ACTUAL, LOAD_FORECAST, SOLAR, WIND_ONSHORE, WIND_OFFSHORE,
                HYDRO, NUCLEAR, FOSSIL_GAS, FOSSIL_COAL, FOSSIL_LIGNITE, PRICE)) {
            Integer i = idx.get(prefix + suffix);
            if (i != null) {
                cols.put(suffix, i);
            }
        }
        return cols;
    }

    private Instant parseTimestamp(String val) {
        if (val.isBlank()) return null;
        try {
            return OffsetDateTime.parse(val).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Double value(String[] row, Integer col) {
        if (col == null) return null;
        String val = safeGet(row, col);
        if (val.isBlank()) return null;
        try { return Double.parseDouble(val); } catch (NumberFormatException e) { return null; }
    }

    /** Sum of the non-null arguments, null when all are null. */
    private Double sum(Double... values) {
        Double total = null;
        for (Double v : values) {
            if (v != null) {
                total = (total == null ? 0.0 : total) + v;
            }
        }
        return total;
    }

    private String safeGet(String[] cols, int idx) {
        if (idx >= cols.length) return "";
        return cols[idx] == null ? "" : cols[idx].trim();
    }
}
