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

import java.util.Locale;
import java.util.Objects;

import org.springframework.util.Assert;

/**
 * Numeric column and the function it is aggregated with.
 * @author mengran
 *
 */
public final class Measure {
    
    private final String column;
    private final AggregationFunction function;
    
    public Measure(String column, AggregationFunction function) {
        super();
        Assert.hasText(column, "Measure column can not empty.");
        Assert.notNull(function, "Measure must declare an aggregation function.");
        this.column = column.toLowerCase(Locale.ROOT);
        this.function = function;
    }
    
    public static Measure mean(String column) {
        return new Measure(column, AggregationFunction.MEAN);
    }
    
    public static Measure sum(String column) {
        return new Measure(column, AggregationFunction.SUM);
    }

    public String getColumn() {
        return column;
    }

    public AggregationFunction getFunction() {
        return function;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Measure)) {
            return false;
        }
        Measure other = (Measure) obj;
        return column.equals(other.column) && function == other.function;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, function);
    }

    @Override
    public String toString() {
        return function + "(" + column + ")";
    }
}
