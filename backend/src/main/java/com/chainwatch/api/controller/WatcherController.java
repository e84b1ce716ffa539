package com.chainwatch.api.controller;

import com.chainwatch.api.dto.ErrorBody;
import com.chainwatch.api.dto.WatchAccountRequest;
import com.chainwatch.api.dto.WatchProgramLogsRequest;
import com.chainwatch.api.dto.WatchTransactionLogsRequest;
import com.chainwatch.api.dto.WatcherResponse;
import com.chainwatch.domain.LogsFilter;
import com.chainwatch.ingestion.watch.RegisteredWatcher;
import com.chainwatch.ingestion.watch.SolanaWatchService;
import com.chainwatch.ingestion.watch.WatcherRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * POST /watchers/{accounts|program-logs|transaction-logs} start a watcher (202);
 * GET /watchers lists them; DELETE /watchers/{id} stops one.
 */
@RestController
@RequestMapping("/api/v1/watchers")
@RequiredArgsConstructor
public class WatcherController {

    private final SolanaWatchService watchService;
    private final WatcherRegistry registry;

    @PostMapping("/accounts")
    public ResponseEntity<WatcherResponse> watchAccount(@Valid @RequestBody WatchAccountRequest request) {
        RegisteredWatcher watcher = watchService.watchAccount(request.address().trim(), request.commitment());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(watcher));
    }

    @PostMapping("/program-logs")
    public ResponseEntity<WatcherResponse> watchProgramLogs(@Valid @RequestBody WatchProgramLogsRequest request) {
        RegisteredWatcher watcher = watchService.watchProgramLogs(request.programId().trim(), request.commitment());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(watcher));
    }

    @PostMapping("/transaction-logs")
    public ResponseEntity<WatcherResponse> watchTransactionLogs(@Valid @RequestBody WatchTransactionLogsRequest request) {
        LogsFilter filter = LogsFilter.parse(request.filter(), request.mentions());
        RegisteredWatcher watcher = watchService.watchTransactionLogs(filter, request.commitment());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(watcher));
    }

    @GetMapping
    public List<WatcherResponse> list() {
        return registry.list().stream().map(WatcherController::toResponse).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return registry.find(id)
                .<ResponseEntity<?>>map(w -> ResponseEntity.ok(toResponse(w)))
                .orElseGet(() -> notFound(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> stop(@PathVariable String id) {
        if (!registry.stop(id)) {
            return notFound(id);
        }
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<?> notFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of("WATCHER_NOT_FOUND", "No watcher with id " + id));
    }

    private static WatcherResponse toResponse(RegisteredWatcher w) {
        return new WatcherResponse(
                w.id(),
                w.kind().name(),
                w.target(),
                w.handle().state().name(),
                w.handle().lastAcceptedSlot(),
                w.startedAt());
    }
}
