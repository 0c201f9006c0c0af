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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.github.totyumengr.olapcubes.core.Snapshot.SnapshotBuilder;

/**
 * One measure cube, <code>cpi</code> aggregated by mean.
 * @author mengran
 *
 */
public class CpiCubeTest {
    
    private static final SchemaContract CPI_CONTRACT = new SchemaContract(
            Arrays.asList(Dimension.ANIO, Dimension.PRODUCTO), Arrays.asList(Measure.mean("cpi")));
    
    private CubeQueryService cube;
    
    static Map<String, Object> row(Object anio, Object producto, Object cpi) {
        
        Map<String, Object> row = new LinkedHashMap<String, Object>(3);
        row.put("anio", anio);
        row.put("producto", producto);
        row.put("cpi", cpi);
        return row;
    }
    
    static Snapshot snapshot(String name, List<Map<String, Object>> rows) {
        
        SnapshotBuilder builder = new SnapshotBuilder().build(name, CPI_CONTRACT);
        rows.forEach(builder::addRow);
        return builder.done();
    }
    
    @Before
    public void prepare() {
        cube = new CubeQueryService(snapshot("CpiCubeTest", Arrays.asList(
                row(2023, "A", 0.8), row(2023, "B", 1.2), row(2024, "A", 1.0))), CPI_CONTRACT);
    }
    
    @Test
    public void testGroupByAnio() {
        
        List<ResultRow> rows = cube.query("Anio", FilterSet.none());
        
        Assert.assertEquals(2, rows.size());
        Assert.assertEquals(2023L, rows.get(0).get("anio"));
        Assert.assertEquals(1.0, rows.get(0).getMeasure("cpi"), 0.000000001);
        Assert.assertEquals(2024L, rows.get(1).get("anio"));
        Assert.assertEquals(1.0, rows.get(1).getMeasure("cpi"), 0.000000001);
        Assert.assertEquals(2, rows.get(0).asMap().size());
    }
    
    @Test
    public void testGroupByAnioSliceProducto() {
        
        Map<Dimension, Object> filters = new HashMap<Dimension, Object>();
        filters.put(Dimension.PRODUCTO, "A");
        filters.put(Dimension.ANIO, null);
        List<ResultRow> rows = cube.query("Anio", FilterSet.of(filters));
        
        Assert.assertEquals(2, rows.size());
        Assert.assertEquals(2023L, rows.get(0).get("anio"));
        Assert.assertEquals(0.8, rows.get(0).getMeasure("cpi"), 0.000000001);
        Assert.assertEquals(2024L, rows.get(1).get("anio"));
        Assert.assertEquals(1.0, rows.get(1).getMeasure("cpi"), 0.000000001);
    }
    
    @Test
    public void testUnknownYearIsEmptyResult() {
        
        List<ResultRow> rows = cube.query("Anio", FilterSet.builder().with(Dimension.ANIO, 1999).build());
        Assert.assertNotNull(rows);
        Assert.assertTrue(rows.isEmpty());
    }
    
    @Test
    public void testNeverDefaultsToAHierarchy() {
        
        for (String key : Arrays.asList("NotARealKey", "", "   ", null, "Anio,Producto", "anio")) {
            try {
                cube.query(key, FilterSet.none());
                Assert.fail("Accepted " + key);
            } catch (InvalidHierarchyException e) {
                Assert.assertEquals(cube.listHierarchies(), e.getValidKeys());
            }
        }
    }
    
    @Test
    public void testMissingMeasureColumn() {
        
        SchemaContract contract = new SchemaContract(Arrays.asList(Dimension.ANIO), 
                Arrays.asList(Measure.mean("cpi"), Measure.sum("schedule_variance_sum")));
        CubeQueryService broken = new CubeQueryService(cube.getSnapshot(), contract);
        try {
            broken.query("Anio", FilterSet.none());
            Assert.fail();
        } catch (SchemaException e) {
            Assert.assertEquals(Collections.singletonList("schedule_variance_sum"), e.getMissingColumns());
        }
    }
    
    @Test
    public void testMissingDimensionColumn() {
        
        try {
            cube.query("Proyecto", FilterSet.none());
            Assert.fail();
        } catch (SchemaException e) {
            Assert.assertEquals(Collections.singletonList("proyecto"), e.getMissingColumns());
        }
        try {
            cube.query("Anio", FilterSet.builder().with(Dimension.PROYECTO, "P100").build());
            Assert.fail();
        } catch (SchemaException e) {
            Assert.assertEquals(Collections.singletonList("proyecto"), e.getMissingColumns());
        }
    }
    
    @Test
    public void testMeasureTypesAreWidened() {
        
        CubeQueryService mixed = new CubeQueryService(snapshot("mixed", Arrays.asList(
                row(2023, "A", 1), row(2023, "B", "2.5"), row(2023, "C", null), row(2024, "A", null))), CPI_CONTRACT);
        
        List<ResultRow> rows = mixed.query("Anio", FilterSet.none());
        Assert.assertEquals(1.75, rows.get(0).getMeasure("cpi"), 0.000000001);
        // No value at all in group means absent mean.
        Assert.assertNull(rows.get(1).getMeasure("cpi"));
    }
    
    @Test(expected = SchemaException.class)
    public void testNonNumericMeasure() {
        
        new CubeQueryService(snapshot("bad", Arrays.asList(row(2023, "A", "n/a"))), CPI_CONTRACT)
            .query("Anio", FilterSet.none());
    }
}
