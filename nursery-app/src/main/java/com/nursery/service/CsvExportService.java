package com.nursery.service;

import com.nursery.model.NurseryRecord;
import com.nursery.model.RecordKind;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders an owner's records as one CSV document with a section per exported kind.
 *
 * <pre>
 *
 * === SEEDLINGS RECEIVED ===
 * date,type,supplier,price,lot_number,quantity
 * 2024-03-01,Oak,Green Ltd,1.5,L-7,40
 *
 *
 * === DELIVERY NOTES ===
 * ...
 * </pre>
 *
 * Every section header is written even when the kind has no records; distributed
 * seedlings are not exported.
 */
@Service
public class CsvExportService {

    private static final Logger log = LoggerFactory.getLogger(CsvExportService.class);

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final NurseryRecordService recordService;
    private final Clock clock;

    public CsvExportService(NurseryRecordService recordService, Clock clock) {
        this.recordService = recordService;
        this.clock = clock;
    }

    public String export(String ownerId) {
        StringBuilder out = new StringBuilder();
        List<RecordKind> sections = RecordKind.exported();
        for (int i = 0; i < sections.size(); i++) {
            RecordKind kind = sections.get(i);
            out.append(i == 0 ? "\n" : "\n\n")
                .append("=== ").append(kind.exportTitle()).append(" ===\n");

            List<NurseryRecord> records = recordService.listForExport(kind, ownerId);
            if (!records.isEmpty()) {
                writeTable(out, kind, records);
            }
        }
        log.info("Exported CSV for {}", ownerId);
        return out.toString();
    }

    public String fileName() {
        return "nursery_data_" + LocalDate.now(clock).format(FILE_DATE) + ".csv";
    }

    private static void writeTable(StringBuilder out, RecordKind kind, List<NurseryRecord> records) {
        List<String> columns = kind.exportColumns();
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(columns.toArray(String[]::new))
            .build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (NurseryRecord record : records) {
                printer.printRecord(columns.stream().map(record::get).toList());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + kind.path() + " section", e);
        }
    }
}
