package com.example.media_registry.controller;

import com.example.media_registry.dto.web.GrantResponse;
import com.example.media_registry.dto.web.OkResponse;
import com.example.media_registry.dto.web.RecordCreatedResponse;
import com.example.media_registry.dto.web.RecordMetadataRequest;
import com.example.media_registry.dto.web.RecordResponse;
import com.example.media_registry.dto.web.TransferRequest;
import com.example.media_registry.model.MediaRecord;
import com.example.media_registry.service.AccessMatrixService;
import com.example.media_registry.service.ArchiveService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/records")
public class MediaRecordController {
    private static final String CALLER_HEADER = "${registry.caller-header:X-Caller}";

    private final ArchiveService archiveService;
    private final AccessMatrixService accessMatrixService;

    public MediaRecordController(ArchiveService archiveService, AccessMatrixService accessMatrixService) {
        this.archiveService = archiveService;
        this.accessMatrixService = accessMatrixService;
    }

    @PostMapping
    public ResponseEntity<RecordCreatedResponse> archive(@RequestHeader(name = CALLER_HEADER, required = false) String caller,
                                                         @RequestBody RecordMetadataRequest request) {
        long id = archiveService.create(request.toMetadata(), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(new RecordCreatedResponse(id));
    }

    @GetMapping("/{id}")
    public RecordResponse get(@PathVariable long id) {
        return toResponse(archiveService.get(id));
    }

    @PutMapping("/{id}")
    public OkResponse modify(@PathVariable long id,
                             @RequestHeader(name = CALLER_HEADER, required = false) String caller,
                             @RequestBody RecordMetadataRequest request) {
        archiveService.update(id, request.toMetadata(), caller);
        return OkResponse.OK;
    }

    @PostMapping("/{id}/transfer")
    public OkResponse transfer(@PathVariable long id,
                               @RequestHeader(name = CALLER_HEADER, required = false) String caller,
                               @RequestBody TransferRequest request) {
        archiveService.transfer(id, request.newOwner(), caller);
        return OkResponse.OK;
    }

    @DeleteMapping("/{id}")
    public OkResponse remove(@PathVariable long id,
                             @RequestHeader(name = CALLER_HEADER, required = false) String caller) {
        archiveService.delete(id, caller);
        return OkResponse.OK;
    }

    @PutMapping("/{id}/grants/{principal}")
    public OkResponse grant(@PathVariable long id, @PathVariable String principal,
                            @RequestHeader(name = CALLER_HEADER, required = false) String caller) {
        accessMatrixService.grant(id, principal, caller);
        return OkResponse.OK;
    }

    @DeleteMapping("/{id}/grants/{principal}")
    public OkResponse revoke(@PathVariable long id, @PathVariable String principal,
                             @RequestHeader(name = CALLER_HEADER, required = false) String caller) {
        accessMatrixService.revoke(id, principal, caller);
        return OkResponse.OK;
    }

    @GetMapping("/{id}/grants/{principal}")
    public GrantResponse check(@PathVariable long id, @PathVariable String principal) {
        return new GrantResponse(id, principal, accessMatrixService.check(id, principal));
    }

    private static RecordResponse toResponse(MediaRecord r) {
        return new RecordResponse(r.getId(), r.getName(), r.getOwner(), r.getByteCount(),
                r.getCreatedAt(), r.getSummary(), r.getLabels());
    }
}
