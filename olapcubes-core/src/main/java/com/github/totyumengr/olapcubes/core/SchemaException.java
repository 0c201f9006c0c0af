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
import java.util.Collections;
import java.util.List;

/**
 * Snapshot does not honor the {@link SchemaContract}: a declared column is missing or a value has a type the cube
 * can not use. Signals an upstream producer defect.
 * 
 * @author mengran
 *
 */
public class SchemaException extends CubeException {

    private static final long serialVersionUID = 1L;
    
    private final List<String> missingColumns;

    public SchemaException(String message) {
        super(message);
        this.missingColumns = Collections.emptyList();
    }
    
    public SchemaException(String message, Throwable cause) {
        super(message, cause);
        this.missingColumns = Collections.emptyList();
    }
    
    public SchemaException(String message, List<String> missingColumns) {
        super(message + " " + missingColumns);
        this.missingColumns = Collections.unmodifiableList(new ArrayList<String>(missingColumns));
    }

    /**
     * @return absent columns, empty when the failure is about a value
     */
    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
