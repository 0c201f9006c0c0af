/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.olapcubes.core;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import com.github.totyumengr.olapcubes.core.Snapshot.Record;

/**
 * In-memory cube over one immutable {@link Snapshot}. A query is a linear pipeline: resolve hierarchy, coerce
 * measure types, filter, aggregate and sort. Any stage failure ends the query with that stage's exception, partial
 * results are never returned.
 * 
 * <p>Queries only read the snapshot and work on their own views of it, so they run in parallel without locking.
 * {@link #refresh(Snapshot)} is the only writer and swaps the reference atomically.
 * 
 * @author mengran
 *
 */
public class CubeQueryService implements CubeOperations {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CubeQueryService.class);
    
    private final SchemaContract contract;
    private final HierarchyRegistry registry;
    private final AtomicReference<Snapshot> snapshot;
    
    private final TypeCoercionStage coercionStage = new TypeCoercionStage();
    private final FilterStage filterStage = new FilterStage();
    private final AggregationStage aggregationStage = new AggregationStage();
    
    public CubeQueryService(Snapshot snapshot) {
        this(snapshot, SchemaContract.kpiCube());
    }
    
    public CubeQueryService(Snapshot snapshot, SchemaContract contract) {
        this(snapshot, contract, HierarchyRegistry.defaults());
    }
    
    /**
     * @param snapshot base of cube
     * @param contract schema of snapshot
     * @param registry valid groupings
     * @throws EmptyBaseException when snapshot has no rows
     */
    public CubeQueryService(Snapshot snapshot, SchemaContract contract, HierarchyRegistry registry) {
        super();
        Assert.notNull(contract, "Schema contract can not be null.");
        Assert.notNull(registry, "Hierarchy registry can not be null.");
        checkBase(snapshot);
        
        this.contract = contract;
        this.registry = registry;
        this.snapshot = new AtomicReference<Snapshot>(snapshot);
        LOGGER.info("Cube based on {} with {}", snapshot, contract);
    }
    
    private static void checkBase(Snapshot snapshot) {
        
        Assert.notNull(snapshot, "Snapshot can not be null.");
        if (snapshot.isEmpty()) {
            throw new EmptyBaseException(snapshot.getName());
        }
    }
    
    // ---------------------------- Query API ----------------------------

    @Override
    public List<ResultRow> query(String hierarchyKey, FilterSet filters) {
        
        long enterTime = System.currentTimeMillis();
        if (filters == null) {
            filters = FilterSet.none();
        }
        // Pin snapshot, a concurrent refresh must not change it under this query.
        Snapshot base = snapshot.get();
        
        Hierarchy hierarchy = registry.resolve(hierarchyKey);
        List<String> missing = hierarchy.getColumns().stream().filter(c -> !base.hasColumn(c))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new SchemaException("Group columns of " + hierarchy.getKey() + " not found in snapshot " 
                    + base.getName(), missing);
        }
        
        List<Record> records = coercionStage.apply(base, contract.getMeasureColumns());
        records = filterStage.apply(records, filters, base);
        LOGGER.debug("Prepare {} records using {}ms.", records.size(), System.currentTimeMillis() - enterTime);
        
        List<ResultRow> rows = aggregationStage.apply(records, hierarchy.getColumns(), contract.getMeasures());
        LOGGER.info("Group by {} filter {} on {} result {} rows using {} ms.", hierarchy, filters, base.getName(), 
                rows.size(), System.currentTimeMillis() - enterTime);
        return rows;
    }

    @Override
    public List<ResultRow> query(CubeQuery request) {
        
        Assert.notNull(request, "Query request can not be null.");
        return query(request.getHierarchyKey(), request.getFilters());
    }

    @Override
    public List<String> listHierarchies() {
        return registry.getKeys();
    }

    @Override
    public void refresh(Snapshot newSnapshot) {
        
        try {
            checkBase(newSnapshot);
        } catch (EmptyBaseException e) {
            LOGGER.warn("Reject refresh, keep {} active. {}", snapshot.get(), e.getMessage());
            throw e;
        }
        Snapshot previous = snapshot.getAndSet(newSnapshot);
        LOGGER.info("Refresh {} successfully into {}.", previous, newSnapshot);
    }
    
    /**
     * @param parallelModel specify Java8 Stream mode of filter and aggregation. Sequential by default, which keeps
     * floating point results identical across repeated queries.
     */
    public void setParallelMode(boolean parallelModel) {
        
        filterStage.setParallelMode(parallelModel);
        aggregationStage.setParallelMode(parallelModel);
    }
    
    /**
     * @return active snapshot
     */
    public Snapshot getSnapshot() {
        return snapshot.get();
    }

    public SchemaContract getContract() {
        return contract;
    }

    @Override
    public String toString() {
        return "CubeQueryService [snapshot=" + snapshot.get() + "]";
    }
}
