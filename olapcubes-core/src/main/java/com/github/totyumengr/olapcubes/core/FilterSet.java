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
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Sparse equality constraints on dimensions, used to slice and dice the cube. Absent members (<code>null</code> or
 * blank text) impose no constraint. Members are widened like {@link Snapshot} values, so an {@link Integer} year
 * matches a {@link Long} year, while a textual year or an integer beyond the <code>long</code> range matches nothing
 * on an integer column. Only scalar members are accepted.
 * 
 * @author mengran
 *
 */
public final class FilterSet {
    
    private static final FilterSet NONE = new FilterSet(new EnumMap<Dimension, Object>(Dimension.class));
    
    private final Map<Dimension, Object> constraints;
    
    private FilterSet(EnumMap<Dimension, Object> constraints) {
        super();
        this.constraints = Collections.unmodifiableMap(constraints);
    }
    
    public static FilterSet none() {
        return NONE;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * @param members dimension to optional member, <code>null</code> means no filter
     * @return filter set
     */
    public static FilterSet of(Map<Dimension, ?> members) {
        
        if (members == null || members.isEmpty()) {
            return NONE;
        }
        Builder builder = builder();
        for (Entry<Dimension, ?> e : members.entrySet()) {
            builder.with(e.getKey(), e.getValue());
        }
        return builder.build();
    }
    
    public static class Builder {
        
        private final EnumMap<Dimension, Object> constraints = new EnumMap<Dimension, Object>(Dimension.class);
        
        private Builder() {
            super();
        }
        
        public Builder with(Dimension dimension, Object member) {
            
            if (dimension == null) {
                throw new IllegalArgumentException("Filter dimension can not be null.");
            }
            Object value = normalizeMember(dimension, member);
            if (value == null || (value instanceof String && ((String) value).trim().isEmpty())) {
                constraints.remove(dimension);
            } else {
                constraints.put(dimension, value);
            }
            return this;
        }
        
        /**
         * @throws IllegalArgumentException when member is not a scalar
         */
        private static Object normalizeMember(Dimension dimension, Object member) throws IllegalArgumentException {
            
            if (member instanceof BigInteger && ((BigInteger) member).bitLength() >= Long.SIZE) {
                // Out of any ingested value range, kept so it matches nothing.
                return member;
            }
            if (member == null || member instanceof Number || member instanceof CharSequence) {
                return Snapshot.normalizeValue(member);
            }
            throw new IllegalArgumentException("Dimension " + dimension.getColumn() + " expects a scalar member but got " 
                    + member.getClass().getSimpleName() + " " + member);
        }
        
        public FilterSet build() {
            return constraints.isEmpty() ? NONE : new FilterSet(new EnumMap<Dimension, Object>(constraints));
        }
    }
    
    /**
     * @return present constraints only, in {@link Dimension} order
     */
    public Map<Dimension, Object> getConstraints() {
        return constraints;
    }
    
    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj || (obj instanceof FilterSet && constraints.equals(((FilterSet) obj).constraints));
    }

    @Override
    public int hashCode() {
        return constraints.hashCode();
    }

    @Override
    public String toString() {
        return constraints.toString();
    }
}
