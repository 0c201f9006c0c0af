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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.totyumengr.olapcubes.core.Snapshot.Record;

/**
 * Tuple of group column values. Ordered left to right by each value's natural order: absent first, numbers by
 * value, text lexicographically. Values of unrelated types are ordered by type name to keep ordering total.
 * 
 * @author mengran
 *
 */
final class GroupKey implements Comparable<GroupKey> {
    
    private final Object[] values;
    
    private GroupKey(Object[] values) {
        this.values = values;
    }
    
    static GroupKey of(Record record, List<String> groupColumns) {
        
        Object[] values = new Object[groupColumns.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = record.get(groupColumns.get(i));
        }
        return new GroupKey(values);
    }
    
    List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public int compareTo(GroupKey o) {
        
        for (int i = 0; i < values.length; i++) {
            int c = compareValues(values[i], o.values[i]);
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }
    
    @SuppressWarnings({ "unchecked", "rawtypes" })
    static int compareValues(Object a, Object b) {
        
        if (a == b) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        if (a.getClass() == b.getClass() && a instanceof Comparable) {
            return ((Comparable) a).compareTo(b);
        }
        if (a instanceof Number && b instanceof Number) {
            int c = Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            if (c != 0) {
                return c;
            }
        }
        return a.getClass().getName().compareTo(b.getClass().getName());
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj || (obj instanceof GroupKey && Arrays.equals(values, ((GroupKey) obj).values));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
