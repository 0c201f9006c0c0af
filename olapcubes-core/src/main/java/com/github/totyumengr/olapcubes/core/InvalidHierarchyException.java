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
 * Requested grouping key is not registered. Carries the valid keys so callers can correct themselves.
 * @author mengran
 *
 */
public class InvalidHierarchyException extends CubeException {

    private static final long serialVersionUID = 1L;
    
    private final String requestedKey;
    private final List<String> validKeys;

    public InvalidHierarchyException(String requestedKey, List<String> validKeys) {
        super("Invalid group hierarchy " + requestedKey + ", use one of: " + validKeys);
        this.requestedKey = requestedKey;
        this.validKeys = Collections.unmodifiableList(new ArrayList<String>(validKeys));
    }

    public String getRequestedKey() {
        return requestedKey;
    }

    public List<String> getValidKeys() {
        return validKeys;
    }
}
