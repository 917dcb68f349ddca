package com.koni.vitals.infrastructure.web.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.koni.vitals.application.query.ReadingExportRow;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders exported audit rows as CSV with a header line.
 * Columns follow {@link ReadingExportRow}; fields with commas or quotes are quoted.
 */
@Component
public class ReadingCsvWriter {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(ReadingExportRow.class).withHeader();

    /**
     * @param rows the rows to render, possibly empty
     * @return the CSV document; only the header line when there are no rows
     */
    public String write(List<ReadingExportRow> rows) {
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render audit export as CSV", e);
        }
    }
}
