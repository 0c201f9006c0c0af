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

/**
 * <p>Define supported cube operations. Bindings (REST, RPC, in-process) map them one to one onto their transport
 * and translate {@link CubeException CubeExceptions} into their own signaling.
 * 
 * @author mengran
 *
 */
public interface CubeOperations {
    
    /**
     * Slice/dice by filters then drill-down/roll-up to the hierarchy. It equal to "SELECT {hierarchy columns}, 
     * {measure functions} FROM {snapshot} WHERE {dimension1 = a} AND {dimension2 = b} GROUP BY 
     * {hierarchy columns} ORDER BY {hierarchy columns}".
     * @param hierarchyKey registered grouping key
     * @param filters equality filters, <code>null</code> means none
     * @return sorted rows, empty (not an error) when filters exclude everything
     * @throws InvalidHierarchyException when hierarchy key is unknown
     * @throws SchemaException when snapshot violates schema contract
     */
    List<ResultRow> query(String hierarchyKey, FilterSet filters);
    
    /**
     * @param request query request
     * @return sorted rows
     * @see #query(String, FilterSet)
     */
    List<ResultRow> query(CubeQuery request);
    
    /**
     * @return valid hierarchy keys in registration order
     */
    List<String> listHierarchies();
    
    /**
     * Atomically replace the active snapshot. Running queries finish on the snapshot they started with.
     * @param newSnapshot replacement
     * @throws EmptyBaseException when replacement has no rows, previous snapshot stays active
     */
    void refresh(Snapshot newSnapshot);
}
