package com.nursery.controller;

import com.nursery.model.NurseryRecord;
import com.nursery.model.RecordKind;
import com.nursery.service.NurseryRecordService;
import com.nursery.service.RecordNotFoundException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * CRUD endpoints for all six record kinds, dispatched on the {resource} path segment.
 */
@RestController
@RequestMapping("/api")
public class RecordApiController {

    private final NurseryRecordService recordService;

    public RecordApiController(NurseryRecordService recordService) {
        this.recordService = recordService;
    }

    @PostMapping("/{resource}")
    public NurseryRecord create(@PathVariable String resource,
                                @RequestBody Map<String, Object> body,
                                @AuthenticationPrincipal String username) {
        return recordService.create(kindOf(resource), username, body);
    }

    @GetMapping("/{resource}")
    public List<NurseryRecord> list(@PathVariable String resource,
                                    @AuthenticationPrincipal String username) {
        return recordService.list(kindOf(resource), username);
    }

    @DeleteMapping("/{resource}/{id}")
    public Map<String, String> delete(@PathVariable String resource,
                                      @PathVariable String id,
                                      @AuthenticationPrincipal String username) {
        recordService.deleteById(kindOf(resource), username, id);
        return Map.of("message", "Deleted successfully");
    }

    private static RecordKind kindOf(String resource) {
        return RecordKind.fromPath(resource)
            .orElseThrow(() -> new RecordNotFoundException("Unknown resource: " + resource));
    }
}
