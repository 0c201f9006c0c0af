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
import java.util.List;
import java.util.stream.Collectors;

/**
 * Groupings the cube supports. Key is what callers send, columns are what the fact table is grouped by, in order.
 * Composite hierarchies are fixed combinations so callers can not inject arbitrary columns into a query.
 * 
 * @author mengran
 *
 */
public enum Hierarchy {
    
    ANIO("Anio", Dimension.ANIO),
    PRODUCTO("Producto", Dimension.PRODUCTO),
    PROYECTO("Proyecto", Dimension.PROYECTO),
    ANIO_PRODUCTO("Anio_Producto", Dimension.ANIO, Dimension.PRODUCTO),
    PROYECTO_ANIO("Proyecto_Anio", Dimension.PROYECTO, Dimension.ANIO);
    
    private final String key;
    private final List<Dimension> levels;
    private final List<String> columns;
    
    private Hierarchy(String key, Dimension... levels) {
        this.key = key;
        this.levels = Collections.unmodifiableList(Arrays.asList(levels));
        this.columns = Collections.unmodifiableList(this.levels.stream().map(Dimension::getColumn)
                .collect(Collectors.toList()));
    }

    public String getKey() {
        return key;
    }

    public List<Dimension> getLevels() {
        return levels;
    }
    
    /**
     * @return ordered, non-empty group columns
     */
    public List<String> getColumns() {
        return columns;
    }
    
    @Override
    public String toString() {
        return key + columns;
    }
}
