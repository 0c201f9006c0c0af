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
import java.util.Collections;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import com.github.totyumengr.olapcubes.core.Snapshot.Record;

/**
 * Drill-down and roll-up: groups records by the exact tuple of group columns (order matters) and reduces every
 * measure with its declared function. One row per distinct tuple, sorted ascending by the tuple.
 * 
 * @author mengran
 *
 */
public class AggregationStage {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationStage.class);
    
    private volatile boolean parallelMode = false;
    
    public void setParallelMode(boolean parallelMode) {
        this.parallelMode = parallelMode;
    }
    
    /**
     * Mutable reduction container of one group.
     */
    private static class MeasureAccumulator {
        
        private final List<Measure> measures;
        private final DoubleSummaryStatistics[] stats;
        
        MeasureAccumulator(List<Measure> measures) {
            this.measures = measures;
            this.stats = new DoubleSummaryStatistics[measures.size()];
            for (int i = 0; i < stats.length; i++) {
                stats[i] = new DoubleSummaryStatistics();
            }
        }
        
        void accept(Record record) {
            for (int i = 0; i < stats.length; i++) {
                Object value = record.get(measures.get(i).getColumn());
                if (value != null) {
                    stats[i].accept(((Number) value).doubleValue());
                }
            }
        }
        
        MeasureAccumulator combine(MeasureAccumulator other) {
            for (int i = 0; i < stats.length; i++) {
                stats[i].combine(other.stats[i]);
            }
            return this;
        }
        
        List<Double> reduce() {
            List<Double> reduced = new ArrayList<Double>(stats.length);
            for (int i = 0; i < stats.length; i++) {
                reduced.add(measures.get(i).getFunction().reduce(stats[i]));
            }
            return reduced;
        }
    }
    
    /**
     * @param records filtered records, measure values coerced
     * @param groupColumns ordered, non-empty group columns
     * @param measures measures to reduce
     * @return sorted rows, empty when records is empty
     */
    public List<ResultRow> apply(List<Record> records, List<String> groupColumns, List<Measure> measures) {
        
        Assert.notEmpty(groupColumns, "Group columns can not empty.");
        if (records.isEmpty()) {
            return Collections.emptyList();
        }
        
        Collector<Record, MeasureAccumulator, MeasureAccumulator> reducing = Collector.of(
                () -> new MeasureAccumulator(measures), MeasureAccumulator::accept, MeasureAccumulator::combine);
        Stream<Record> stream = parallelMode ? records.parallelStream() : records.stream();
        Map<GroupKey, MeasureAccumulator> groups = stream.collect(
                Collectors.groupingBy(r -> GroupKey.of(r, groupColumns), reducing));
        
        List<Entry<GroupKey, MeasureAccumulator>> sorted = new ArrayList<Entry<GroupKey, MeasureAccumulator>>(
                groups.entrySet());
        sorted.sort(Entry.comparingByKey());
        
        List<ResultRow> rows = new ArrayList<ResultRow>(sorted.size());
        for (Entry<GroupKey, MeasureAccumulator> e : sorted) {
            rows.add(new ResultRow(groupColumns, e.getKey().values(), measures, e.getValue().reduce()));
        }
        LOGGER.debug("Group {} records by {} into {} rows.", records.size(), groupColumns, rows.size());
        return Collections.unmodifiableList(rows);
    }
}
