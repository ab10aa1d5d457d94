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

import java.util.HashMap;
import java.util.Map;

/**
 * An attribute or text value that cannot be converted into its model type, e.g. a latitude that
 * is not a number, a malformed time or an email address with more than one '@'.
 */
public class InvalidValueException extends GpxException {

    private final String element;
    private final String value;

    public InvalidValueException(String message, String element, String value) {
        super(message);
        this.element = element;
        this.value = value;
    }

    public InvalidValueException(String message, String element, String value, Throwable cause) {
        super(message, cause);
        this.element = element;
        this.value = value;
    }

    public String getElement() {
        return element;
    }

    public String getValue() {
        return value;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new HashMap<>(2);
        details.put("element", element);
        details.put("value", value);
        return details;
    }
}
