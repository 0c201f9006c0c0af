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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One group of a query result: group column values first, then one reduced value per measure in declared order.
 * @author mengran
 *
 */
public final class ResultRow {
    
    private final Map<String, Object> values;
    private final List<Object> groupValues;
    
    ResultRow(List<String> groupColumns, List<Object> groupValues, List<Measure> measures, List<Double> reduced) {
        super();
        Map<String, Object> values = new LinkedHashMap<String, Object>(groupColumns.size() + measures.size());
        for (int i = 0; i < groupColumns.size(); i++) {
            values.put(groupColumns.get(i), groupValues.get(i));
        }
        for (int i = 0; i < measures.size(); i++) {
            values.put(measures.get(i).getColumn(), reduced.get(i));
        }
        this.values = Collections.unmodifiableMap(values);
        this.groupValues = groupValues;
    }
    
    public Object get(String column) {
        return values.get(column);
    }
    
    /**
     * @param measureColumn measure column
     * @return reduced value, <code>null</code> if absent
     */
    public Double getMeasure(String measureColumn) {
        return (Double) values.get(measureColumn);
    }
    
    /**
     * @return values of group columns, left to right
     */
    public List<Object> getGroupValues() {
        return groupValues;
    }
    
    /**
     * @return column to value in output order, suitable for serialization
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj || (obj instanceof ResultRow && values.equals(((ResultRow) obj).values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
