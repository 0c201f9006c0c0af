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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.Assert;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.totyumengr.olapcubes.core.Snapshot.SnapshotBuilder;

/**
 * @author mengran
 *
 */
public class SnapshotRefreshTest {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotRefreshTest.class);
    
    private static final SchemaContract CPI_CONTRACT = new SchemaContract(
            Arrays.asList(Dimension.ANIO, Dimension.PRODUCTO), Arrays.asList(Measure.mean("cpi")));
    
    private static Snapshot uniform(String name, double cpi, int years) {
        
        List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
        for (int i = 0; i < years; i++) {
            rows.add(CpiCubeTest.row(2000 + i, "A", cpi));
            rows.add(CpiCubeTest.row(2000 + i, "B", cpi));
        }
        return CpiCubeTest.snapshot(name, rows);
    }
    
    @Test(expected = EmptyBaseException.class)
    public void testEmptyBase() {
        new CubeQueryService(new SnapshotBuilder().build("empty").done(), CPI_CONTRACT);
    }
    
    @Test
    public void testEmptyRefreshKeepsPrevious() {
        
        Snapshot base = uniform("base", 1.0, 2);
        CubeQueryService cube = new CubeQueryService(base, CPI_CONTRACT);
        try {
            cube.refresh(new SnapshotBuilder().build("empty").done());
            Assert.fail();
        } catch (EmptyBaseException e) {
            Assert.assertSame(base, cube.getSnapshot());
        }
        Assert.assertEquals(2, cube.query("Anio", FilterSet.none()).size());
    }
    
    @Test
    public void testRefresh() {
        
        CubeQueryService cube = new CubeQueryService(uniform("v1", 1.0, 2), CPI_CONTRACT);
        cube.refresh(uniform("v2", 2.0, 3));
        
        List<ResultRow> rows = cube.query("Anio", FilterSet.none());
        Assert.assertEquals(3, rows.size());
        Assert.assertEquals(2.0, rows.get(2).getMeasure("cpi"), 0.000000001);
        Assert.assertEquals("v2", cube.getSnapshot().getName());
    }
    
    @Test
    public void testQueriesNeverSeeTornSnapshot() throws Throwable {
        
        Snapshot ones = uniform("ones", 1.0, 20);
        Snapshot twos = uniform("twos", 2.0, 30);
        CubeQueryService cube = new CubeQueryService(ones, CPI_CONTRACT);
        
        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<Integer>> futures = new ArrayList<Future<Integer>>();
        for (int t = 0; t < 4; t++) {
            futures.add(executor.submit(new Callable<Integer>() {
                @Override
                public Integer call() throws Exception {
                    int checked = 0;
                    while (running.get() || checked == 0) {
                        List<ResultRow> rows = cube.query("Anio_Producto", FilterSet.none());
                        double first = rows.get(0).getMeasure("cpi");
                        int expectedSize = first == 1.0 ? 40 : 60;
                        Assert.assertEquals(expectedSize, rows.size());
                        for (ResultRow row : rows) {
                            Assert.assertEquals(first, row.getMeasure("cpi"), 0.0);
                        }
                        checked++;
                    }
                    return checked;
                }
            }));
        }
        
        for (int i = 0; i < 200; i++) {
            cube.refresh(i % 2 == 0 ? twos : ones);
        }
        running.set(false);
        executor.shutdown();
        
        int total = 0;
        for (Future<Integer> f : futures) {
            total += f.get(30, TimeUnit.SECONDS);
        }
        Assert.assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        LOGGER.info("Checked {} concurrent queries.", total);
        Assert.assertSame(ones, cube.getSnapshot());
        Assert.assertEquals(1.0, cube.query("Producto", FilterSet.none()).get(0).getMeasure("cpi"), 0.0);
    }
}
