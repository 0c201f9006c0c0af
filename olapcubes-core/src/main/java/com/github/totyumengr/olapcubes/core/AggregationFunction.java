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

import java.util.DoubleSummaryStatistics;

/**
 * Reduce functions a {@link Measure} can declare.
 * 
 * @author mengran
 *
 */
public enum AggregationFunction {
    
    /**
     * Arithmetic mean of non-absent values, absent if the group has none.
     */
    MEAN {
        @Override
        public Double reduce(DoubleSummaryStatistics values) {
            return values.getCount() == 0 ? null : values.getAverage();
        }
    },
    
    SUM {
        @Override
        public Double reduce(DoubleSummaryStatistics values) {
            return values.getSum();
        }
    };
    
    /**
     * @param values accumulated non-absent values of one group
     * @return reduced value
     */
    public abstract Double reduce(DoubleSummaryStatistics values);
}
