/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.gpxio.util.exceptions;

import java.util.Collections;
import java.util.Map;

/**
 * Base class of every failure while reading or writing a GPX document. Reading and writing are
 * one-shot transformations, so the first problem found aborts the whole operation and is
 * reported through one of the subclasses.
 * <p>
 * The details map names the offending element or attribute and the element it was found in,
 * so that callers can build a diagnostic without knowing the position in the input.
 */
public abstract class GpxException extends Exception {

    public GpxException(String message) {
        super(message);
    }

    public GpxException(String message, Throwable cause) {
        super(message, cause);
    }

    public Map<String, Object> getDetails() {
        return Collections.emptyMap();
    }
}
