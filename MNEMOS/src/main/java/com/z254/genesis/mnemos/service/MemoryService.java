package com.z254.genesis.mnemos.service;

import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.ErrorTranslator;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.common.observability.SwarmEventLogger;
import com.z254.genesis.common.web.CorrelationContext;
import com.z254.genesis.mnemos.config.MnemosProperties;
import com.z254.genesis.mnemos.domain.MemoryRecord;
import com.z254.genesis.mnemos.retrieval.MemoryRetrievalEngine;
import com.z254.genesis.mnemos.retrieval.PageResult;
import com.z254.genesis.mnemos.retrieval.RecordView;
import com.z254.genesis.mnemos.retrieval.SearchQuery;
import com.z254.genesis.mnemos.retrieval.SortKey;
import com.z254.genesis.mnemos.store.BackupInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Reactive facade over the retrieval engine. Store work runs on the bounded elastic scheduler
 * and every call is bounded by {@code mnemos.store.call-timeout}.
 */
@Service
@Slf4j
public class MemoryService {

    private final MemoryRetrievalEngine engine;
    private final ErrorTranslator translator;
    private final SwarmEventLogger eventLogger;
    private final Duration callTimeout;
    private final int defaultPageSize;

    public MemoryService(MemoryRetrievalEngine engine, ErrorTranslator translator, SwarmEventLogger eventLogger,
                         MnemosProperties mnemosProperties) {
        this.engine = engine;
        this.translator = translator;
        this.eventLogger = eventLogger;
        this.callTimeout = mnemosProperties.getStore().getCallTimeout();
        this.defaultPageSize = mnemosProperties.getRetrieval().getDefaultPageSize();
    }

    public Mono<RecordView> put(MemoryRecord record) {
        return call("put", () -> engine.view(engine.put(record)))
                .flatMap(view -> audit("memory_stored", Map.of("id", view.getId(), "checksum", view.getChecksum()))
                        .thenReturn(view));
    }

    public Mono<RecordView> get(String id) {
        return call("get", () -> engine.view(engine.get(id)));
    }

    public Mono<RecordView> reference(String id) {
        return call("reference", () -> engine.view(engine.reference(id)));
    }

    public Mono<Void> delete(String id) {
        return call("delete", () -> {
            engine.delete(id);
            return id;
        }).flatMap(deleted -> audit("memory_deleted", Map.of("id", deleted)));
    }

    public Mono<PageResult<RecordView>> page(Integer page, Integer pageSize, String sort) {
        return call("page", () -> engine.getPage(
                page != null ? page : 1,
                pageSize != null ? pageSize : defaultPageSize,
                SortKey.fromWireName(sort)));
    }

    public Mono<PageResult<RecordView>> search(SearchQuery query) {
        return call("search", () -> engine.search(query));
    }

    public Mono<BackupInfo> backup() {
        return call("backup", engine::backup)
                .flatMap(info -> audit("backup_created", Map.of("backupId", info.id(), "records", info.recordCount()))
                        .thenReturn(info));
    }

    public Mono<List<BackupInfo>> listBackups() {
        return call("list-backups", engine::listBackups);
    }

    private <T> Mono<T> call(String operation, Callable<T> action) {
        return Mono.fromCallable(action)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(callTimeout)
                .onErrorMap(TimeoutException.class, e -> SwarmException.of(ErrorKind.TIMEOUT,
                        "Store " + operation + " exceeded " + callTimeout.toMillis() + "ms",
                        Map.of("operation", operation)))
                .onErrorMap(e -> !(e instanceof SwarmException), translator::toException)
                .doOnError(e -> log.debug("Memory {} failed: {}", operation, e.getMessage()));
    }

    private Mono<Void> audit(String eventType, Map<String, Object> data) {
        return CorrelationContext.current()
                .doOnNext(correlationId -> eventLogger.logEvent(eventType, correlationId, data))
                .then();
    }
}
