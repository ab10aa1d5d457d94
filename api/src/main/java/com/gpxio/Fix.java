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

import java.util.Objects;

/**
 * <p>Type of GPS fix. Value comes from list: {'none'|'2d'|'3d'|'dgps'|'pps'}</p>
 * <ul>
 * <li>none = GPS had no fix.</li>
 * <li>pps = military signal used</li>
 * </ul>
 * <p>To signify "the fix info is unknown", leave out the fix entirely. Receivers write values
 * that are not in this list, these are kept unchanged as "other" fix types.</p>
 */
public final class Fix {

    public static final Fix NONE = new Fix("none", false);
    /**
     * Longitude and latitude only, needs at least 3 satellites.
     */
    public static final Fix TWO_D = new Fix("2d", false);
    /**
     * Longitude, latitude and altitude, needs at least 4 satellites.
     */
    public static final Fix THREE_D = new Fix("3d", false);
    public static final Fix DGPS = new Fix("dgps", false);
    public static final Fix PPS = new Fix("pps", false);

    private final String value;
    private final boolean other;

    private Fix(String value, boolean other) {
        this.value = value;
        this.other = other;
    }

    /**
     * @return one of the constants or an "other" fix type holding the specified value
     */
    public static Fix of(String value) {
        Objects.requireNonNull(value, "fix value");
        if (NONE.value.equals(value)) {
            return NONE;
        } else if (TWO_D.value.equals(value)) {
            return TWO_D;
        } else if (THREE_D.value.equals(value)) {
            return THREE_D;
        } else if (DGPS.value.equals(value)) {
            return DGPS;
        } else if (PPS.value.equals(value)) {
            return PPS;
        }
        return new Fix(value, true);
    }

    public String getValue() {
        return value;
    }

    /**
     * @return true if the value is not one of none, 2d, 3d, dgps or pps
     */
    public boolean isOther() {
        return other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((Fix) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return other ? "other(" + value + ")" : value;
    }
}
