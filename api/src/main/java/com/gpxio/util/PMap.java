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
package com.gpxio.util;

import java.util.HashMap;
import java.util.Map;

/**
 * A properties map (String to String) with convenient accessors. Keys are stored in under_score
 * notation and can be queried in camelCase or under_score.
 */
public class PMap {
    private final Map<String, String> map;

    public PMap() {
        this(new HashMap<>(5));
    }

    public PMap(Map<String, String> map) {
        this.map = new HashMap<>(map.size());
        for (Map.Entry<String, String> e : map.entrySet()) {
            if (!Helper.isEmpty(e.getKey()))
                put(e.getKey(), e.getValue());
        }
    }

    public PMap(PMap map) {
        this.map = new HashMap<>(map.map);
    }

    /**
     * Parses a string like "writer.indent=4|reader.keep_extensions=false".
     */
    public PMap(String propertiesString) {
        this.map = new HashMap<>(5);

        for (String s : propertiesString.split("\\|")) {
            s = s.trim();
            int index = s.indexOf("=");
            if (index < 0)
                continue;

            put(s.substring(0, index).trim(), s.substring(index + 1).trim());
        }
    }

    public PMap put(String key, Object str) {
        if (str == null)
            throw new NullPointerException("Value cannot be null. Use remove instead.");

        map.put(Helper.camelCaseToUnderScore(key), str.toString());
        return this;
    }

    public PMap remove(String key) {
        map.remove(Helper.camelCaseToUnderScore(key));
        return this;
    }

    public boolean has(String key) {
        return map.containsKey(Helper.camelCaseToUnderScore(key));
    }

    public int getInt(String key, int _default) {
        String str = getStringOrNull(key);
        if (str == null)
            return _default;
        try {
            return Integer.parseInt(str);
        } catch (NumberFormatException ex) {
            return _default;
        }
    }

    public boolean getBool(String key, boolean _default) {
        String str = getStringOrNull(key);
        return str != null ? Boolean.parseBoolean(str) : _default;
    }

    public String get(String key, String _default) {
        String str = getStringOrNull(key);
        return str != null ? str : _default;
    }

    public String getStringOrNull(String key) {
        if (Helper.isEmpty(key))
            return null;
        return map.get(Helper.camelCaseToUnderScore(key));
    }

    /**
     * This method copies the underlying structure into a new Map object
     */
    public Map<String, String> toMap() {
        return new HashMap<>(map);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
