package com.nursery.controller;

import com.nursery.service.CsvExportService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/export")
public class ExportApiController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final CsvExportService exportService;

    public ExportApiController(CsvExportService exportService) {
        this.exportService = exportService;
    }

    @GetMapping("/csv")
    public ResponseEntity<String> exportCsv(@AuthenticationPrincipal String username) {
        String csv = exportService.export(username);
        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(exportService.fileName())
            .build();
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .body(csv);
    }
}
