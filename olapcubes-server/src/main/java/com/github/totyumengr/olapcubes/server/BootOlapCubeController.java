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
package com.github.totyumengr.olapcubes.server;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.util.ObjectUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.olapcubes.core.CubeException;
import com.github.totyumengr.olapcubes.core.Dimension;
import com.github.totyumengr.olapcubes.core.EmptyBaseException;
import com.github.totyumengr.olapcubes.core.FilterSet;
import com.github.totyumengr.olapcubes.core.InvalidHierarchyException;
import com.github.totyumengr.olapcubes.core.ResultRow;
import com.github.totyumengr.olapcubes.core.SchemaException;
import com.github.totyumengr.olapcubes.core.Snapshot;

/**
 * HTTP binding of {@link OlapCubeManager}. Slice, dice and drill-down are all served by <code>/api/olap/query</code>.
 * @author mengran
 *
 */
@Controller
public class BootOlapCubeController {

    private static final Logger LOGGER = LoggerFactory.getLogger(BootOlapCubeController.class);
    
    private static final String AUTHORIZATION = "Authorization";
    
    private ObjectMapper objectMapper = new ObjectMapper();
    
    @Autowired
    private OlapCubeManager manager;
    
    @Value("${olapcubes.security.tokens:Bearer DSS-Access-Token,Bearer Project-Lead-Token}")
    private String[] accessTokens;
    @Value("${olapcubes.security.adminTokens:Bearer Project-Lead-Token}")
    private String[] adminTokens;
    
    private void checkToken(String authorization, String[] accepted) {
        
        if (authorization == null || !Arrays.asList(accepted).contains(authorization)) {
            throw new CubeAccessDeniedException("Access denied.");
        }
    }
    
    private static Map<String, Object> detail(String message) {
        
        Map<String, Object> body = new LinkedHashMap<String, Object>();
        body.put("detail", message);
        return body;
    }
    
    /**
     * @param params dimension column to member text, unknown parameters are ignored
     * @param filterJson optional JSON object of dimension column to member, request parameters win
     * @return typed filters
     */
    FilterSet parseFilters(Map<String, String> params, String filterJson) throws JsonProcessingException {
        
        FilterSet.Builder builder = FilterSet.builder();
        if (StringUtils.hasText(filterJson)) {
            Map<String, Object> json = objectMapper.readValue(filterJson, new TypeReference<Map<String, Object>>() {});
            LOGGER.debug("Parse json filter to {}", json);
            for (Entry<String, Object> e : json.entrySet()) {
                Dimension dimension = Dimension.ofColumn(e.getKey());
                if (dimension == null) {
                    throw new IllegalArgumentException("Unknown filter dimension " + e.getKey());
                }
                Object member = e.getValue();
                builder.with(dimension, member instanceof String ? dimension.parse((String) member) : member);
            }
        }
        for (Dimension dimension : Dimension.values()) {
            String text = params.get(dimension.getColumn());
            if (text != null) {
                builder.with(dimension, dimension.parse(text));
            }
        }
        return builder.build();
    }
    
    @RequestMapping(value="/api/olap/query", method=RequestMethod.GET)
    public @ResponseBody ResponseEntity<Object> query(@RequestHeader(value=AUTHORIZATION, required=false) String authorization,
        @RequestParam("group_by_dimension") String groupByDimension, 
        @RequestParam(value="filterJson", required=false) String filterJson,
        @RequestParam Map<String, String> params) throws Throwable {
        
        checkToken(authorization, accessTokens);
        FilterSet filters = parseFilters(params, filterJson);
        LOGGER.info("Query group by {} with filter {}", groupByDimension, filters);
        
        List<ResultRow> rows = manager.query(groupByDimension, filters);
        if (rows.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(detail("No data found for the applied filters."));
        }
        return ResponseEntity.ok(rows.stream().map(ResultRow::asMap).collect(Collectors.toList()));
    }
    
    @RequestMapping(value="/api/olap/hierarchies", method=RequestMethod.GET)
    public @ResponseBody List<String> hierarchies(@RequestHeader(value=AUTHORIZATION, required=false) String authorization) {
        
        checkToken(authorization, accessTokens);
        return manager.listHierarchies();
    }
    
    @RequestMapping(value="/api/olap/status", method=RequestMethod.GET)
    public @ResponseBody Map<String, Object> status(@RequestHeader(value=AUTHORIZATION, required=false) String authorization) {
        
        checkToken(authorization, accessTokens);
        Map<String, Object> status = manager.status();
        LOGGER.info("Cube status {}", status);
        return status;
    }
    
    @RequestMapping(value="/api/olap/refresh", method=RequestMethod.POST)
    public @ResponseBody Map<String, Object> refresh(@RequestHeader(value=AUTHORIZATION, required=false) String authorization) {
        
        checkToken(authorization, adminTokens);
        Snapshot snapshot = manager.reload();
        LOGGER.info("Refresh cube successfully to {}", snapshot);
        
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        result.put("name", snapshot.getName());
        result.put("records", snapshot.size());
        return result;
    }
    
    // ------------------------------ Error mapping ------------------------------
    
    @ExceptionHandler(InvalidHierarchyException.class)
    public ResponseEntity<Map<String, Object>> invalidHierarchy(InvalidHierarchyException e) {
        
        Map<String, Object> body = detail("Invalid query parameter: " + e.getMessage());
        body.put("validKeys", e.getValidKeys());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
    
    @ExceptionHandler({IllegalArgumentException.class, JsonProcessingException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(detail("Invalid query parameter: " + e.getMessage()));
    }
    
    @ExceptionHandler(CubeAccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> accessDenied(CubeAccessDeniedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(detail(e.getMessage()));
    }
    
    @ExceptionHandler(CubeNotReadyException.class)
    public ResponseEntity<Map<String, Object>> notReady(CubeNotReadyException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(detail("Service unavailable. " + e.getMessage()));
    }
    
    @ExceptionHandler(EmptyBaseException.class)
    public ResponseEntity<Map<String, Object>> emptyBase(EmptyBaseException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(detail(e.getMessage()));
    }
    
    @ExceptionHandler({SchemaException.class, CubeException.class, DataAccessException.class})
    public ResponseEntity<Map<String, Object>> internalError(Exception e) {
        
        LOGGER.error("Error occurred when process cube request, manager {}", ObjectUtils.getDisplayString(manager), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(detail("Internal error when process OLAP query: " + e.getMessage()));
    }
}
