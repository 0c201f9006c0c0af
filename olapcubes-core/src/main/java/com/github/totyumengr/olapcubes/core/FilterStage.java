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

import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.totyumengr.olapcubes.core.Snapshot.Record;

/**
 * Slice and dice: keeps records whose dimensions equal every present member of a {@link FilterSet}. Relative order
 * of records is preserved. Excluding everything is a valid outcome, and a member of another type than the column's
 * simply matches nothing.
 * 
 * @author mengran
 *
 */
public class FilterStage {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(FilterStage.class);
    
    private volatile boolean parallelMode = false;
    
    public void setParallelMode(boolean parallelMode) {
        this.parallelMode = parallelMode;
    }
    
    /**
     * Build one conjunctive predicate, identity when filters are absent.
     * @param filters equality constraints
     * @return predicate on record
     */
    public Predicate<Record> predicate(FilterSet filters) {
        
        Predicate<Record> andFilter = a -> true;
        if (filters == null) {
            return andFilter;
        }
        for (Entry<Dimension, Object> entry : filters.getConstraints().entrySet()) {
            String column = entry.getKey().getColumn();
            Object member = entry.getValue();
            andFilter = andFilter.and(a -> Objects.equals(a.get(column), member));
        }
        return andFilter;
    }
    
    /**
     * Predicate evaluation, for record lists without index.
     * @param records records to filter
     * @param filters equality constraints, <code>null</code> means none
     * @return matched records in original order
     */
    public List<Record> apply(List<Record> records, FilterSet filters) {
        
        if (filters == null || filters.isEmpty()) {
            return records;
        }
        Stream<Record> stream = parallelMode ? records.parallelStream() : records.stream();
        List<Record> matched = stream.filter(predicate(filters)).collect(Collectors.toList());
        LOGGER.debug("Filter {} matched {}/{} records by predicate.", filters, matched.size(), records.size());
        return matched;
    }
    
    /**
     * Use bitmap index of snapshot when every filtered column is indexed, otherwise fall back to predicate.
     * @param records view of snapshot, position equals record ID
     * @param filters equality constraints, <code>null</code> means none
     * @param snapshot base of records
     * @return matched records in original order
     * @throws SchemaException when a filtered column is absent from snapshot
     */
    public List<Record> apply(List<Record> records, FilterSet filters, Snapshot snapshot) throws SchemaException {
        
        if (filters == null || filters.isEmpty()) {
            return records;
        }
        List<String> missing = filters.getConstraints().keySet().stream().map(Dimension::getColumn)
                .filter(c -> !snapshot.hasColumn(c)).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new SchemaException("Filter columns not found in snapshot " + snapshot.getName(), missing);
        }
        if (records.size() != snapshot.size() 
                || !filters.getConstraints().keySet().stream().allMatch(d -> snapshot.isIndexed(d.getColumn()))) {
            return apply(records, filters);
        }
        
        RoaringBitmap ands = null;
        for (Entry<Dimension, Object> entry : filters.getConstraints().entrySet()) {
            RoaringBitmap matched = snapshot.lookup(entry.getKey().getColumn(), entry.getValue());
            ands = ands == null ? matched.clone() : RoaringBitmap.and(ands, matched);
            if (ands.isEmpty()) {
                break;
            }
        }
        
        int[] ids = ands.toArray();
        List<Record> matched = new ArrayList<Record>(ids.length);
        for (int id : ids) {
            matched.add(records.get(id));
        }
        LOGGER.debug("Filter {} matched {}/{} records by bitmap index.", filters, matched.size(), records.size());
        return matched;
    }
}
