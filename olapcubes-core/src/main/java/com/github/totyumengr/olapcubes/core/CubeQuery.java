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
 * Request of one cube query: a grouping key and optional equality filters.
 * @author mengran
 *
 */
public final class CubeQuery {
    
    private final String hierarchyKey;
    private final FilterSet filters;
    
    public CubeQuery(String hierarchyKey, FilterSet filters) {
        super();
        this.hierarchyKey = hierarchyKey;
        this.filters = filters == null ? FilterSet.none() : filters;
    }
    
    public static CubeQuery of(String hierarchyKey) {
        return new CubeQuery(hierarchyKey, FilterSet.none());
    }

    public String getHierarchyKey() {
        return hierarchyKey;
    }

    public FilterSet getFilters() {
        return filters;
    }

    @Override
    public String toString() {
        return "CubeQuery [hierarchyKey=" + hierarchyKey + ", filters=" + filters + "]";
    }
}
