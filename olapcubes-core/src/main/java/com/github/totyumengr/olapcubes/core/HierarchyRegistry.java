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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.util.Assert;

/**
 * Single source of truth for valid groupings. Immutable after construction.
 * @author mengran
 *
 */
public class HierarchyRegistry {
    
    /**
     * BOM, no-break space and zero-width characters transports tend to leave in query strings.
     */
    private static final Pattern INVISIBLE_CHARS = Pattern.compile("[\\uFEFF\\u00A0\\u200B\\u200C\\u200D\\u2060]");
    
    private static final HierarchyRegistry DEFAULTS = new HierarchyRegistry(Arrays.asList(Hierarchy.values()));
    
    private final Map<String, Hierarchy> hierarchies;
    
    public HierarchyRegistry(Collection<Hierarchy> hierarchies) {
        super();
        Assert.notEmpty(hierarchies, "Registry must have a hierarchy at least.");
        
        Map<String, Hierarchy> map = new LinkedHashMap<String, Hierarchy>(hierarchies.size());
        for (Hierarchy h : hierarchies) {
            if (map.put(h.getKey(), h) != null) {
                throw new IllegalStateException("Hierarchy " + h.getKey() + " has exists.");
            }
        }
        this.hierarchies = Collections.unmodifiableMap(map);
    }
    
    /**
     * @return registry of every {@link Hierarchy}
     */
    public static HierarchyRegistry defaults() {
        return DEFAULTS;
    }
    
    /**
     * @param key grouping key, surrounding whitespace and invisible characters are ignored
     * @return registered hierarchy carrying its ordered group columns
     * @throws InvalidHierarchyException when key is not registered
     */
    public Hierarchy resolve(String key) throws InvalidHierarchyException {
        
        String cleaned = clean(key);
        Hierarchy hierarchy = cleaned == null ? null : hierarchies.get(cleaned);
        if (hierarchy == null) {
            throw new InvalidHierarchyException(key, getKeys());
        }
        return hierarchy;
    }
    
    /**
     * @return valid keys in registration order
     */
    public List<String> getKeys() {
        return Collections.unmodifiableList(new ArrayList<String>(hierarchies.keySet()));
    }
    
    static String clean(String key) {
        
        if (key == null) {
            return null;
        }
        return INVISIBLE_CHARS.matcher(key).replaceAll("").trim();
    }

    @Override
    public String toString() {
        return "HierarchyRegistry " + hierarchies.values();
    }
}
