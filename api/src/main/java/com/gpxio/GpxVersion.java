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
package com.gpxio;

/**
 * The two incompatible schema generations of GPX. UNKNOWN is only used for documents that were
 * not read from a file and never had a version assigned.
 */
public enum GpxVersion {
    UNKNOWN(null, null),
    GPX10("1.0", "http://www.topografix.com/GPX/1/0"),
    GPX11("1.1", "http://www.topografix.com/GPX/1/1");

    private final String value;
    private final String namespace;

    GpxVersion(String value, String namespace) {
        this.value = value;
        this.namespace = namespace;
    }

    /**
     * @return the value of the version attribute, e.g. "1.1"
     */
    public String getValue() {
        return value;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * @return the version for the specified attribute value or UNKNOWN
     */
    public static GpxVersion find(String value) {
        for (GpxVersion version : values()) {
            if (version.value != null && version.value.equals(value))
                return version;
        }
        return UNKNOWN;
    }
}
