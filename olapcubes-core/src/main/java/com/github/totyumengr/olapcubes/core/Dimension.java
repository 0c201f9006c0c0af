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

/**
 * Dimension columns of the KPI fact table. Each one carries the scalar type its members have after ingestion, so
 * transport layers can convert raw request parameters before building a {@link FilterSet}.
 * 
 * @author mengran
 *
 */
public enum Dimension {
    
    ANIO("anio", Long.class),
    PRODUCTO("producto", String.class),
    PROYECTO("proyecto", String.class);
    
    private final String column;
    private final Class<?> valueType;
    
    private Dimension(String column, Class<?> valueType) {
        this.column = column;
        this.valueType = valueType;
    }
    
    /**
     * @return lower-case column name in {@link Snapshot}
     */
    public String getColumn() {
        return column;
    }
    
    public Class<?> getValueType() {
        return valueType;
    }
    
    /**
     * Convert a textual member (for example a request parameter) into this dimension's scalar type.
     * Surrounding whitespace is not part of a member, for text and integer members alike.
     * @param text member text, blank means absent
     * @return typed member or <code>null</code> when blank
     * @throws IllegalArgumentException when text can not be converted
     */
    public Object parse(String text) throws IllegalArgumentException {
        
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String trimmed = text.trim();
        if (valueType == Long.class) {
            try {
                return Long.valueOf(trimmed);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Dimension " + column + " expects an integer member but got " 
                        + text, e);
            }
        }
        return trimmed;
    }
    
    /**
     * @param column column name, case insensitive
     * @return matched dimension or <code>null</code>
     */
    public static Dimension ofColumn(String column) {
        
        for (Dimension d : values()) {
            if (d.column.equalsIgnoreCase(column)) {
                return d;
            }
        }
        return null;
    }
}
