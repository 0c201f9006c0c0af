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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Materialized fact table the cube is queried against. It is produced once by the ETL side, normalized at this
 * ingestion boundary (lower-case column names, widened scalar types) and never mutated afterwards, so any number of
 * queries can read it at the same time.
 * 
 * <p>Equality index on dimension columns use <a href="https://github.com/lemire/RoaringBitmap">RoaringBitmap</a>,
 * keyed by column and typed member so <code>2023L</code> and <code>"2023"</code> never share a bitmap.
 * 
 * @author mengran
 *
 */
public class Snapshot {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(Snapshot.class);
    
    private final String name;
    private final long createdTime;
    private final Set<String> columns;
    private final List<Record> records;
    
    /**
     * Column -&gt; member -&gt; record IDs. Read only after {@link SnapshotBuilder#done()}.
     */
    private final Map<String, Map<Object, RoaringBitmap>> bitmapIndex;
    
    /**
     * One row of the fact table. Record ID equals its position in {@link Snapshot#getRecords()}.
     * @author mengran
     *
     */
    public static final class Record {
        
        private final int id;
        private final Map<String, Object> values;
        
        Record(int id, Map<String, Object> values) {
            super();
            this.id = id;
            this.values = Collections.unmodifiableMap(values);
        }

        public int getId() {
            return id;
        }
        
        /**
         * @param column lower-case column name
         * @return value, <code>null</code> when absent
         */
        public Object get(String column) {
            return values.get(column);
        }
        
        public Map<String, Object> getValues() {
            return values;
        }
        
        /**
         * @param replaced columns to replace
         * @return a new record with same ID, this one is untouched
         */
        Record with(Map<String, Object> replaced) {
            
            Map<String, Object> copy = new LinkedHashMap<String, Object>(values);
            copy.putAll(replaced);
            return new Record(id, copy);
        }

        @Override
        public String toString() {
            return "Record [id=" + id + ", values=" + values + "]";
        }
    }
    
    private Snapshot(String name, Set<String> columns, List<Record> records, 
            Map<String, Map<Object, RoaringBitmap>> bitmapIndex) {
        super();
        this.name = name;
        this.createdTime = System.currentTimeMillis();
        this.columns = Collections.unmodifiableSet(columns);
        this.records = Collections.unmodifiableList(records);
        this.bitmapIndex = bitmapIndex;
    }
    
    /**
     * Builder pattern class for {@link Snapshot}, chain model begin with {@link #build(String)} and end with 
     * {@link #done()}.
     * 
     * @author mengran
     *
     */
    public static class SnapshotBuilder {
        
        private String name;
        private LinkedHashSet<String> columns;
        private List<Record> records;
        private Set<String> indexColumns;
        
        public SnapshotBuilder build(String name) {
            
            if (this.name != null) {
                throw new IllegalStateException("Previous building " + this.name + " is doing, call #done to finish it.");
            }
            Assert.hasText(name, "Snapshot name can not empty.");
            
            this.name = name;
            this.columns = new LinkedHashSet<String>();
            this.records = new ArrayList<Record>();
            this.indexColumns = new LinkedHashSet<String>();
            return this;
        }
        
        /**
         * Start building and index dimension columns declared in contract.
         * @param name snapshot name
         * @param contract schema of fact table
         * @return this builder
         */
        public SnapshotBuilder build(String name, SchemaContract contract) {
            
            build(name);
            for (Dimension d : contract.getDimensions()) {
                indexColumns.add(d.getColumn());
            }
            return this;
        }
        
        public SnapshotBuilder indexColumns(Collection<String> indexColumns) {
            
            checkStarted();
            for (String column : indexColumns) {
                this.indexColumns.add(normalizeColumn(column));
            }
            return this;
        }
        
        /**
         * Declare columns ahead of rows, for sources like JDBC result sets where columns are known first.
         * @param columnNames column names in any case
         * @return this builder
         * @throws IllegalStateException if two columns are same after lower-casing
         */
        public SnapshotBuilder addColumns(List<String> columnNames) {
            
            checkStarted();
            for (String column : columnNames) {
                String normalized = normalizeColumn(column);
                if (!columns.add(normalized)) {
                    throw new IllegalStateException("Column " + column + " has exists.");
                }
            }
            return this;
        }
        
        /**
         * @param datas values in order of {@link #addColumns(List)}
         * @return this builder
         */
        public SnapshotBuilder addDatas(List<?> datas) {
            
            checkStarted();
            if (datas.size() != columns.size()) {
                throw new IllegalStateException("Row " + records.size() + " has " + datas.size() 
                    + " values but " + columns.size() + " columns declared.");
            }
            Map<String, Object> values = new LinkedHashMap<String, Object>(columns.size());
            int i = 0;
            for (String column : columns) {
                putValue(values, column, datas.get(i++));
            }
            records.add(new Record(records.size(), values));
            return this;
        }
        
        /**
         * @param row column name in any case to value, unseen columns are registered
         * @return this builder
         * @throws IllegalStateException if two keys of row are same after lower-casing
         */
        public SnapshotBuilder addRow(Map<String, ?> row) {
            
            checkStarted();
            Map<String, Object> values = new LinkedHashMap<String, Object>(row.size());
            Set<String> seen = new HashSet<String>(row.size());
            for (Entry<String, ?> e : row.entrySet()) {
                String column = normalizeColumn(e.getKey());
                if (!seen.add(column)) {
                    throw new IllegalStateException("Column " + e.getKey() + " has exists.");
                }
                columns.add(column);
                putValue(values, column, e.getValue());
            }
            records.add(new Record(records.size(), values));
            return this;
        }
        
        public Snapshot done() {
            
            checkStarted();
            Map<String, Map<Object, RoaringBitmap>> bitmapIndex = new HashMap<String, Map<Object, RoaringBitmap>>();
            for (String column : indexColumns) {
                if (!columns.contains(column)) {
                    LOGGER.warn("Skip index of {} because {} has no such column.", column, name);
                    continue;
                }
                Map<Object, RoaringBitmap> members = new HashMap<Object, RoaringBitmap>();
                for (Record record : records) {
                    Object member = record.get(column);
                    if (member == null) {
                        continue;
                    }
                    members.computeIfAbsent(member, k -> new RoaringBitmap()).add(record.getId());
                }
                members.values().forEach(RoaringBitmap::runOptimize);
                bitmapIndex.put(column, members);
                LOGGER.debug("Index for {} of {} members", column, members.size());
            }
            
            Snapshot snapshot = new Snapshot(name, columns, records, bitmapIndex);
            LOGGER.info("Build completed: name {} with {} columns {} and {} records, {} indexes.", 
                    name, columns.size(), columns, records.size(), bitmapIndex.size());
            
            name = null;
            columns = null;
            records = null;
            indexColumns = null;
            return snapshot;
        }
        
        private void checkStarted() {
            if (name == null) {
                throw new IllegalStateException("Current building is not started, call #build first.");
            }
        }
        
        private void putValue(Map<String, Object> values, String column, Object raw) {
            
            Object value = normalizeValue(raw);
            if (value == null) {
                LOGGER.trace("Absent value of {} in row {}", column, records.size());
                return;
            }
            values.put(column, value);
        }
    }
    
    static String normalizeColumn(String column) {
        
        Assert.hasText(column, "Column name can not empty.");
        return column.trim().toLowerCase(Locale.ROOT);
    }
    
    /**
     * Widen scalar value into one of {@link String}, {@link Long} or {@link Double}.
     * @param raw value from producer
     * @return normalized value, <code>null</code> when absent
     * @throws SchemaException when value is not a supported scalar
     */
    static Object normalizeValue(Object raw) throws SchemaException {
        
        if (raw == null) {
            return null;
        }
        if (raw instanceof Long || raw instanceof Double || raw instanceof String) {
            return raw;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger) {
            try {
                return ((BigInteger) raw).longValueExact();
            } catch (ArithmeticException e) {
                throw new SchemaException("Integer value " + raw + " is out of long range", e);
            }
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof CharSequence) {
            return raw.toString();
        }
        throw new SchemaException("Unsupported value type " + raw.getClass().getName() + " of value " + raw);
    }
    
    public String getName() {
        return name;
    }

    public long getCreatedTime() {
        return createdTime;
    }
    
    public int size() {
        return records.size();
    }
    
    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<Record> getRecords() {
        return records;
    }

    public Set<String> getColumns() {
        return columns;
    }
    
    public boolean hasColumn(String column) {
        return columns.contains(column);
    }
    
    public boolean isIndexed(String column) {
        return bitmapIndex.containsKey(column);
    }
    
    /**
     * @param column indexed column
     * @param member typed member
     * @return IDs of records which column equal to member, <b>shared</b> so callers must not modify it. Empty if
     * no record matches.
     * @throws IllegalArgumentException if column is not indexed
     */
    RoaringBitmap lookup(String column, Object member) throws IllegalArgumentException {
        
        Map<Object, RoaringBitmap> members = bitmapIndex.get(column);
        if (members == null) {
            throw new IllegalArgumentException("Can not find bitmap index for " + column);
        }
        RoaringBitmap bitmap = members.get(member);
        return bitmap == null ? new RoaringBitmap() : bitmap;
    }

    @Override
    public String toString() {
        return "Snapshot [name=" + name + ", columns=" + columns + ", records=" + records.size() + "]";
    }
}
