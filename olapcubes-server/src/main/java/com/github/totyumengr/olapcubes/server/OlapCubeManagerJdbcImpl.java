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

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import com.github.totyumengr.olapcubes.core.CubeQuery;
import com.github.totyumengr.olapcubes.core.CubeQueryService;
import com.github.totyumengr.olapcubes.core.FilterSet;
import com.github.totyumengr.olapcubes.core.ResultRow;
import com.github.totyumengr.olapcubes.core.SchemaContract;
import com.github.totyumengr.olapcubes.core.Snapshot;
import com.github.totyumengr.olapcubes.core.Snapshot.SnapshotBuilder;

/**
 * Implementation beyond {@link JdbcTemplate}.
 * 
 * <p>{@link #sourceSql} is important, we use the {@link ResultSetMetaData#getColumnLabel(int)} as column names, so
 * aliases in SQL decide how columns are matched with {@link SchemaContract}. Case does not matter.
 * 
 * @author mengran
 *
 */
@Service
public class OlapCubeManagerJdbcImpl implements OlapCubeManager, InitializingBean {

    private static final Logger LOGGER = LoggerFactory.getLogger(OlapCubeManagerJdbcImpl.class);
    
    @Autowired
    private JdbcTemplate jdbcTemplate;
    
    @Value("${olapcubes.snapshot.name:MV_OLAP_CUBE_KPIs}")
    private String snapshotName;
    @Value("${olapcubes.snapshot.sourceSql:SELECT * FROM MV_OLAP_CUBE_KPIs}")
    private String sourceSql;
    @Value("${olapcubes.query.parallel:false}")
    private boolean parallelMode;
    
    private final SchemaContract contract = SchemaContract.kpiCube();
    
    /**
     * Manage target object, <code>null</code> until first successful load.
     */
    private volatile CubeQueryService cube;
    
    private volatile String lastError;
    
    @Override
    public void afterPropertiesSet() {
        
        try {
            reload();
        } catch (RuntimeException e) {
            // Stay not ready, callers get CubeNotReadyException until a refresh succeeds.
            lastError = e.getMessage();
            LOGGER.error("Fail to load cube from {} on startup, cube is not available.", sourceSql, e);
        }
    }
    
    private Snapshot fetch() {
        
        LOGGER.info("Start fetching data and building snapshot {} by {}", snapshotName, sourceSql);
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        
        SnapshotBuilder builder = new SnapshotBuilder().build(snapshotName, contract);
        AtomicBoolean processMeta = new AtomicBoolean(true);
        jdbcTemplate.query(sourceSql, new RowCallbackHandler() {

            @Override
            public void processRow(ResultSet rs) throws SQLException {
                
                ResultSetMetaData meta = rs.getMetaData();
                if (processMeta.get()) {
                    List<String> columns = new ArrayList<String>(meta.getColumnCount());
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        LOGGER.debug("Add column {} of type {}", meta.getColumnLabel(i), meta.getColumnTypeName(i));
                        columns.add(meta.getColumnLabel(i));
                    }
                    builder.addColumns(columns);
                    // End meta setting
                    processMeta.set(false);
                }
                
                List<Object> datas = new ArrayList<Object>(meta.getColumnCount());
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    datas.add(rs.getObject(i));
                }
                builder.addDatas(datas);
            }
        });
        
        Snapshot snapshot = builder.done();
        stopWatch.stop();
        LOGGER.info("Fetched {} using {} ms", snapshot, stopWatch.getTotalTimeMillis());
        return snapshot;
    }
    
    // ------------------------------ Implementation ------------------------------

    @Override
    public synchronized Snapshot reload() {
        
        Snapshot snapshot = fetch();
        if (cube == null) {
            CubeQueryService created = new CubeQueryService(snapshot, contract);
            created.setParallelMode(parallelMode);
            cube = created;
        } else {
            cube.refresh(snapshot);
        }
        lastError = null;
        return snapshot;
    }
    
    @Override
    public boolean isReady() {
        return cube != null;
    }
    
    private CubeQueryService cube() {
        
        CubeQueryService current = cube;
        if (current == null) {
            throw new CubeNotReadyException("Cube " + snapshotName + " is not loaded. " 
                    + (lastError == null ? "" : lastError));
        }
        return current;
    }

    @Override
    public List<ResultRow> query(String hierarchyKey, FilterSet filters) {
        return cube().query(hierarchyKey, filters);
    }

    @Override
    public List<ResultRow> query(CubeQuery request) {
        return cube().query(request);
    }

    @Override
    public List<String> listHierarchies() {
        return cube().listHierarchies();
    }

    @Override
    public synchronized void refresh(Snapshot newSnapshot) {
        cube().refresh(newSnapshot);
    }

    @Override
    public Map<String, Object> status() {
        
        Map<String, Object> status = new LinkedHashMap<String, Object>();
        CubeQueryService current = cube;
        status.put("ready", current != null);
        status.put("name", snapshotName);
        if (current != null) {
            Snapshot snapshot = current.getSnapshot();
            status.put("records", snapshot.size());
            status.put("columns", snapshot.getColumns());
            status.put("loadedTime", snapshot.getCreatedTime());
        }
        if (lastError != null) {
            status.put("lastError", lastError);
        }
        return status;
    }

    @Override
    public String toString() {
        return "OlapCubeManagerJdbcImpl [snapshotName=" + snapshotName + ", cube=" + cube + "]";
    }
}
