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
package com.github.totyumengr.olapcubes.server;

import java.util.Map;

import com.github.totyumengr.olapcubes.core.CubeOperations;
import com.github.totyumengr.olapcubes.core.CubeQueryService;
import com.github.totyumengr.olapcubes.core.Snapshot;

/**
 * Owns the {@link CubeQueryService} of this node and the snapshot it is based on.
 * 
 * <p>Snapshot is read from the aggregation table the ETL side writes into the data warehouse. Until a load
 * succeeds, {@link CubeOperations} calls fail with {@link CubeNotReadyException}.
 * 
 * @author mengran
 *
 */
public interface OlapCubeManager extends CubeOperations {
    
    /**
     * Read aggregation table again and swap it in atomically, or create the cube when not ready yet.
     * @return snapshot now active
     * @throws com.github.totyumengr.olapcubes.core.EmptyBaseException when table is empty, previous snapshot 
     * stays active
     */
    Snapshot reload();
    
    /**
     * @return <code>true</code> when a snapshot is loaded
     */
    boolean isReady();
    
    /**
     * @return name, record count and load time of active snapshot, or last load error
     */
    Map<String, Object> status();
}
