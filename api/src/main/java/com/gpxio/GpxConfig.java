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

import com.gpxio.util.PMap;

import java.util.Map;
import java.util.TreeMap;

/**
 * This class represents the configuration of the GPX reader and writer. The key-value pairs are
 * kept in a string-string map, the known keys have typed accessors including their default
 * values.
 */
public class GpxConfig {
    public static final String DEFAULT_CREATOR = "https://github.com/gpxio/gpxio";

    public static final String WRITER_CREATOR = "writer.creator";
    public static final String WRITER_INDENT = "writer.indent";
    public static final String READER_KEEP_EXTENSIONS = "reader.keep_extensions";
    public static final String READER_LENIENT_TIME = "reader.lenient_time";

    private final PMap map;

    public GpxConfig() {
        this(new PMap());
    }

    public GpxConfig(PMap pMap) {
        this.map = pMap;
    }

    public GpxConfig put(String key, Object value) {
        map.put(key, value);
        return this;
    }

    public boolean has(String key) {
        return map.has(key);
    }

    /**
     * The creator attribute written for documents that do not specify one.
     */
    public String getCreator() {
        return map.get(WRITER_CREATOR, DEFAULT_CREATOR);
    }

    /**
     * Spaces per nesting level, 0 writes everything into one line.
     */
    public int getIndent() {
        return Math.max(0, map.getInt(WRITER_INDENT, 2));
    }

    public boolean isKeepExtensions() {
        return map.getBool(READER_KEEP_EXTENSIONS, true);
    }

    /**
     * If true times without offset like 2001-10-26T21:32:52 are accepted and treated as UTC.
     */
    public boolean isLenientTime() {
        return map.getBool(READER_LENIENT_TIME, true);
    }

    public PMap asPMap() {
        return map;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("properties:\n");
        for (Map.Entry<String, String> entry : new TreeMap<>(map.toMap()).entrySet()) {
            sb.append(entry.getKey()).append(": ").append(entry.getValue());
            sb.append("\n");
        }
        return sb.toString();
    }
}
