package com.z254.genesis.mnemos.api.v1;

import com.z254.genesis.mnemos.api.dto.MemoryRequest;
import com.z254.genesis.mnemos.retrieval.PageResult;
import com.z254.genesis.mnemos.retrieval.RecordView;
import com.z254.genesis.mnemos.retrieval.SearchQuery;
import com.z254.genesis.mnemos.service.MemoryService;
import com.z254.genesis.mnemos.store.BackupInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller for memory records, retrieval and backups.
 */
@RestController
@RequestMapping("/api/v1/memories")
@Tag(name = "Memories", description = "Durable memory storage and retrieval")
@Slf4j
public class MemoryController {

    private final MemoryService memoryService;

    public MemoryController(MemoryService memoryService) {
        this.memoryService = memoryService;
    }

    @PostMapping
    @Operation(summary = "Store memory", description = "Write a memory atomically; assigns an id when absent")
    @ApiResponse(responseCode = "201", description = "Memory stored")
    @ApiResponse(responseCode = "400", description = "Invalid id, content missing or emotion score out of range")
    public Mono<ResponseEntity<RecordView>> put(@Valid @RequestBody MemoryRequest request) {
        return memoryService.put(request.toRecord())
                .map(stored -> ResponseEntity.status(HttpStatus.CREATED).body(stored));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get memory", description = "Load a verified memory, repairing it from backup if corrupted")
    @ApiResponse(responseCode = "200", description = "Memory found")
    @ApiResponse(responseCode = "404", description = "Memory not found")
    @ApiResponse(responseCode = "500", description = "Memory corrupted with no valid backup")
    public Mono<RecordView> get(@Parameter(description = "Memory ID") @PathVariable String id) {
        return memoryService.get(id);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete memory", description = "Back up the store, then remove the memory")
    @ApiResponse(responseCode = "204", description = "Memory deleted")
    @ApiResponse(responseCode = "404", description = "Memory not found")
    public Mono<ResponseEntity<Void>> delete(@Parameter(description = "Memory ID") @PathVariable String id) {
        return memoryService.delete(id)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/{id}/references")
    @Operation(summary = "Reference memory", description = "Count a read-reference and stamp its time")
    @ApiResponse(responseCode = "200", description = "Reference recorded")
    @ApiResponse(responseCode = "404", description = "Memory not found")
    public Mono<RecordView> reference(@Parameter(description = "Memory ID") @PathVariable String id) {
        return memoryService.reference(id);
    }

    @GetMapping
    @Operation(summary = "List memories", description = "One page of memories in a deterministic order")
    @ApiResponse(responseCode = "200", description = "Page returned")
    @ApiResponse(responseCode = "400", description = "Invalid page, page size or sort key")
    public Mono<PageResult<RecordView>> page(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @Parameter(description = "created, referenced, references or id") @RequestParam(required = false) String sort) {
        return memoryService.page(page, pageSize, sort);
    }

    @PostMapping("/search")
    @Operation(summary = "Search memories", description = "Ranked search over content and themes with filters")
    @ApiResponse(responseCode = "200", description = "Results returned")
    public Mono<PageResult<RecordView>> search(@Valid @RequestBody(required = false) SearchQuery query) {
        return memoryService.search(query != null ? query : new SearchQuery());
    }

    @PostMapping("/backups")
    @Operation(summary = "Create backup", description = "Point-in-time copy of every record")
    @ApiResponse(responseCode = "201", description = "Backup created")
    public Mono<ResponseEntity<BackupInfo>> backup() {
        return memoryService.backup()
                .map(info -> ResponseEntity.status(HttpStatus.CREATED).body(info));
    }

    @GetMapping("/backups")
    @Operation(summary = "List backups", description = "Retained backups, newest first")
    public Mono<List<BackupInfo>> listBackups() {
        return memoryService.listBackups();
    }
}
