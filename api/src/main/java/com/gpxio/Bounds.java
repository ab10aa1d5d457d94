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
 * The bounding box of a GPX file, defined by minLon, maxLon followed by minLat which is south(!)
 * and maxLat. Unlike a BBox used for searching this box may be degenerated (min equals max) but
 * the minimum is never larger than the maximum. Such input is rejected and never swapped.
 */
public final class Bounds {
    // longitude = x, latitude = y
    private final double minLon;
    private final double maxLon;
    private final double minLat;
    private final double maxLat;

    public Bounds(double minLon, double maxLon, double minLat, double maxLat) {
        if (!isValid(minLon, maxLon, minLat, maxLat))
            throw new IllegalArgumentException("Invalid bounds " + minLon + "," + maxLon + "," + minLat + "," + maxLat
                    + ", minimum must not be larger than maximum");
        this.minLon = minLon;
        this.maxLon = maxLon;
        this.minLat = minLat;
        this.maxLat = maxLat;
    }

    public static boolean isValid(double minLon, double maxLon, double minLat, double maxLat) {
        // NaN fails both comparisons
        return minLon <= maxLon && minLat <= maxLat;
    }

    public double getMinLon() {
        return minLon;
    }

    public double getMaxLon() {
        return maxLon;
    }

    public double getMinLat() {
        return minLat;
    }

    public double getMaxLat() {
        return maxLat;
    }

    public boolean contains(double lat, double lon) {
        return lat <= maxLat && lat >= minLat && lon <= maxLon && lon >= minLon;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;

        Bounds b = (Bounds) obj;
        return Double.compare(minLon, b.minLon) == 0 && Double.compare(maxLon, b.maxLon) == 0
                && Double.compare(minLat, b.minLat) == 0 && Double.compare(maxLat, b.maxLat) == 0;
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 17 * hash + Double.hashCode(minLon);
        hash = 17 * hash + Double.hashCode(maxLon);
        hash = 17 * hash + Double.hashCode(minLat);
        hash = 17 * hash + Double.hashCode(maxLat);
        return hash;
    }

    @Override
    public String toString() {
        return minLon + "," + maxLon + "," + minLat + "," + maxLat;
    }
}
