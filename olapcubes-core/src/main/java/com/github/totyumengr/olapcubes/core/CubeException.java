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

/**
 * Root of failures a cube query or refresh reports to its caller. Every failure is a deterministic function of the
 * request and the snapshot, so none of them is worth retrying with the same input.
 * 
 * @author mengran
 *
 */
public abstract class CubeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected CubeException(String message) {
        super(message);
    }
    
    protected CubeException(String message, Throwable cause) {
        super(message, cause);
    }
}
