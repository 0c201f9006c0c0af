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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.github.totyumengr.olapcubes.core.Snapshot.SnapshotBuilder;

/**
 * @author mengran
 *
 */
public class SnapshotTest {
    
    @Test
    public void testColumnNamesAreLowerCased() {
        
        Map<String, Object> row = new LinkedHashMap<String, Object>();
        row.put("Anio", 2023);
        row.put(" PRODUCTO ", "Producto A");
        row.put("CPI_Index_Promedio", 0.8);
        Snapshot snapshot = new SnapshotBuilder().build("SnapshotTest").addRow(row).done();
        
        Assert.assertEquals(Arrays.asList("anio", "producto", "cpi_index_promedio"), 
                Arrays.asList(snapshot.getColumns().toArray()));
        Assert.assertEquals(2023L, snapshot.getRecords().get(0).get("anio"));
        Assert.assertNull(snapshot.getRecords().get(0).get("Anio"));
    }
    
    @Test
    public void testValuesAreNormalized() {
        
        Snapshot snapshot = new SnapshotBuilder().build("SnapshotTest")
            .addColumns(Arrays.asList("a", "b", "c", "d", "e", "f", "g"))
            .addDatas(Arrays.asList((short) 1, 2, BigInteger.TEN, 1.5f, new BigDecimal("2.25"), 
                    new StringBuilder("text"), null))
            .done();
        Map<String, Object> values = snapshot.getRecords().get(0).getValues();
        
        Assert.assertEquals(1L, values.get("a"));
        Assert.assertEquals(2L, values.get("b"));
        Assert.assertEquals(10L, values.get("c"));
        Assert.assertEquals(1.5, values.get("d"));
        Assert.assertEquals(2.25, values.get("e"));
        Assert.assertEquals("text", values.get("f"));
        Assert.assertFalse(values.containsKey("g"));
        Assert.assertTrue(snapshot.hasColumn("g"));
    }
    
    @Test(expected = SchemaException.class)
    public void testUnsupportedValue() {
        new SnapshotBuilder().build("SnapshotTest").addColumns(Arrays.asList("d")).addDatas(Arrays.asList(new Date()));
    }
    
    @Test(expected = IllegalStateException.class)
    public void testColumnsCollideAfterLowerCasing() {
        new SnapshotBuilder().build("SnapshotTest").addColumns(Arrays.asList("Anio", "ANIO"));
    }
    
    @Test(expected = IllegalStateException.class)
    public void testRowKeysCollideAfterLowerCasing() {
        
        Map<String, Object> row = new LinkedHashMap<String, Object>();
        row.put("producto", null);
        row.put("Producto", "A");
        new SnapshotBuilder().build("SnapshotTest").addRow(row);
    }
    
    @Test(expected = IllegalStateException.class)
    public void testRowWidthMustMatchColumns() {
        new SnapshotBuilder().build("SnapshotTest").addColumns(Arrays.asList("a", "b")).addDatas(Arrays.asList(1));
    }
    
    @Test(expected = IllegalStateException.class)
    public void testBuildNotStarted() {
        new SnapshotBuilder().addColumns(Arrays.asList("a"));
    }
    
    @Test
    public void testBuilderIsReusable() {
        
        SnapshotBuilder builder = new SnapshotBuilder();
        Snapshot first = builder.build("first").addColumns(Arrays.asList("a")).addDatas(Arrays.asList(1)).done();
        Snapshot second = builder.build("second").done();
        
        Assert.assertEquals(1, first.size());
        Assert.assertTrue(second.isEmpty());
        try {
            builder.done();
            Assert.fail();
        } catch (IllegalStateException e) {
            Assert.assertTrue(e.getMessage().contains("#build"));
        }
    }
    
    @Test(expected = UnsupportedOperationException.class)
    public void testRecordsAreImmutable() {
        
        Snapshot snapshot = new SnapshotBuilder().build("SnapshotTest")
            .addColumns(Arrays.asList("a")).addDatas(Arrays.asList(1)).done();
        snapshot.getRecords().get(0).getValues().put("a", 2L);
    }
    
    @Test
    public void testIndexOnContractDimensions() {
        
        Snapshot snapshot = new SnapshotBuilder().build("SnapshotTest", SchemaContract.kpiCube())
            .addColumns(Arrays.asList("anio", "producto", "cpi_index_promedio"))
            .addDatas(Arrays.asList(2023, "A", 0.8))
            .addDatas(Arrays.asList(2023, "B", 0.9))
            .done();
        
        Assert.assertTrue(snapshot.isIndexed("anio"));
        Assert.assertTrue(snapshot.isIndexed("producto"));
        Assert.assertFalse(snapshot.isIndexed("proyecto"));
        Assert.assertFalse(snapshot.isIndexed("cpi_index_promedio"));
        Assert.assertEquals(2, snapshot.lookup("anio", 2023L).getCardinality());
        Assert.assertTrue(snapshot.lookup("anio", "2023").isEmpty());
    }
    
    @Test
    public void testIntegerBeyondLongIsSchemaError() {
        
        SnapshotBuilder builder = new SnapshotBuilder().build("SnapshotTest").addColumns(Arrays.asList("anio"));
        try {
            builder.addDatas(Arrays.asList(new BigInteger("99999999999999999999")));
            Assert.fail();
        } catch (SchemaException e) {
            Assert.assertTrue(e.getCause() instanceof ArithmeticException);
        }
    }
}
