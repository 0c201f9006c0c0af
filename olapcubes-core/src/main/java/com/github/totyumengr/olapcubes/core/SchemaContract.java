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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.util.Assert;

/**
 * Declares dimension and measure columns of the fact table the cube is built on. Immutable, declared once.
 * 
 * @author mengran
 *
 */
public final class SchemaContract {
    
    private static final SchemaContract KPI_CUBE = new SchemaContract(
            Arrays.asList(Dimension.ANIO, Dimension.PRODUCTO, Dimension.PROYECTO),
            Arrays.asList(
                Measure.mean("cpi_index_promedio"),
                Measure.mean("spi_index_promedio"),
                Measure.sum("schedule_variance_sum"),
                Measure.mean("densidad_defectos_promedio")));
    
    private final List<Dimension> dimensions;
    private final List<Measure> measures;
    
    public SchemaContract(List<Dimension> dimensions, List<Measure> measures) {
        super();
        Assert.notEmpty(dimensions, "Schema must declare a dimension column at least.");
        Assert.notEmpty(measures, "Schema must declare a measure column at least.");
        
        Set<String> allNames = new HashSet<String>();
        for (Dimension d : dimensions) {
            if (!allNames.add(d.getColumn())) {
                throw new IllegalStateException("Dimension " + d.getColumn() + " has exists.");
            }
        }
        for (Measure m : measures) {
            if (!allNames.add(m.getColumn())) {
                throw new IllegalStateException("Measure " + m.getColumn() + " has exists.");
            }
        }
        this.dimensions = Collections.unmodifiableList(new ArrayList<Dimension>(dimensions));
        this.measures = Collections.unmodifiableList(new ArrayList<Measure>(measures));
    }
    
    /**
     * @return EVM and quality KPI contract of the DSS aggregation table
     */
    public static SchemaContract kpiCube() {
        return KPI_CUBE;
    }

    public List<Dimension> getDimensions() {
        return dimensions;
    }

    public List<Measure> getMeasures() {
        return measures;
    }
    
    public List<String> getMeasureColumns() {
        return measures.stream().map(Measure::getColumn).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "SchemaContract [dimensions=" + dimensions + ", measures=" + measures + "]";
    }
}
