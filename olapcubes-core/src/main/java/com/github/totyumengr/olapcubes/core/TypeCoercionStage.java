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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.totyumengr.olapcubes.core.Snapshot.Record;

/**
 * Makes sure measure columns hold 64-bit floating point values before aggregation, whatever numeric type the
 * producer emitted. Returns a new view, the snapshot is never touched.
 * 
 * @author mengran
 *
 */
public class TypeCoercionStage {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(TypeCoercionStage.class);
    
    /**
     * @param snapshot query base
     * @param measureColumns declared measure columns
     * @return records in snapshot order, measure values are {@link Double} or absent
     * @throws SchemaException when a measure column is absent from snapshot or holds a non numeric value
     */
    public List<Record> apply(Snapshot snapshot, List<String> measureColumns) throws SchemaException {
        
        List<String> missing = measureColumns.stream().filter(c -> !snapshot.hasColumn(c))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            LOGGER.error("Measure columns {} not found in {}, check the cube producer.", missing, snapshot);
            throw new SchemaException("Measure columns not found in snapshot " + snapshot.getName(), missing);
        }
        
        List<Record> records = snapshot.getRecords();
        List<Record> coerced = new ArrayList<Record>(records.size());
        int copied = 0;
        for (Record record : records) {
            Map<String, Object> replaced = null;
            for (String column : measureColumns) {
                Object value = record.get(column);
                if (value == null || value instanceof Double) {
                    continue;
                }
                if (replaced == null) {
                    replaced = new HashMap<String, Object>(measureColumns.size());
                }
                replaced.put(column, toDouble(column, value));
            }
            if (replaced == null) {
                coerced.add(record);
            } else {
                coerced.add(record.with(replaced));
                copied++;
            }
        }
        LOGGER.debug("Coerce measures {} of {}, {} records widened.", measureColumns, snapshot.getName(), copied);
        return coerced;
    }
    
    private Double toDouble(String column, Object value) throws SchemaException {
        
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new SchemaException("Measure " + column + " has non numeric value " + value, e);
        }
    }
}
