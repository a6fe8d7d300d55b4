package com.certchaperone.backend.modules.admin.application.enrichment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

import com.certchaperone.backend.modules.admin.application.AdminQueryRunner;
import com.certchaperone.backend.modules.admin.application.AdminRequestContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves per-row lookups for one page of results. Keys are de-duplicated and split into
 * batches; lookups inside a batch run concurrently, batches run one after another.
 *
 * <p>A lookup that fails or finds nothing is simply absent from the result. Only the request
 * deadline aborts enrichment as a whole.
 */
@Component
public class BatchEnricher {

    private static final Logger log = LoggerFactory.getLogger(BatchEnricher.class);

    private final AdminQueryRunner queryRunner;
    private final int batchSize;

    public BatchEnricher(AdminQueryRunner queryRunner,
                         @Value("${app.admin.enrichment.batch-size:10}") int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("app.admin.enrichment.batch-size must be positive");
        }
        this.queryRunner = queryRunner;
        this.batchSize = batchSize;
    }

    public <K, V> Map<K, V> resolve(Collection<K> keys,
                                    Function<K, Optional<V>> lookup,
                                    AdminRequestContext context) {
        List<K> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
        distinct.removeIf(Objects::isNull);
        Map<K, V> resolved = new HashMap<>();
        for (int start = 0; start < distinct.size(); start += batchSize) {
            List<K> batch = distinct.subList(start, Math.min(start + batchSize, distinct.size()));
            resolveBatch(batch, lookup, context, resolved);
        }
        return resolved;
    }

    private <K, V> void resolveBatch(List<K> batch,
                                     Function<K, Optional<V>> lookup,
                                     AdminRequestContext context,
                                     Map<K, V> sink) {
        List<Future<Optional<V>>> futures = new ArrayList<>(batch.size());
        for (K key : batch) {
            futures.add(submitLookup(key, lookup));
        }
        queryRunner.awaitAll(futures, context);
        for (int i = 0; i < batch.size(); i++) {
            K key = batch.get(i);
            queryRunner.join(futures.get(i)).ifPresent(value -> sink.put(key, value));
        }
    }

    private <K, V> Future<Optional<V>> submitLookup(K key, Function<K, Optional<V>> lookup) {
        try {
            return queryRunner.submit(() -> lookupQuietly(key, lookup));
        } catch (RejectedExecutionException ex) {
            log.warn("Enrichment lookup for {} rejected by the query pool", key);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    private static <K, V> Optional<V> lookupQuietly(K key, Function<K, Optional<V>> lookup) {
        try {
            return lookup.apply(key);
        } catch (RuntimeException ex) {
            log.warn("Enrichment lookup failed for {}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }
}
