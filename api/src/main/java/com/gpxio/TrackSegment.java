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

import com.gpxio.util.Helper;

import java.util.List;
import java.util.Objects;

/**
 * A track segment holds a list of track points which are logically connected in order. To
 * represent a single GPS track where GPS reception was lost, or the GPS receiver was turned off,
 * a new segment is started for each continuous span of track data.
 */
public final class TrackSegment {
    private final List<Waypoint> points;
    private final String extensions;

    public TrackSegment(List<Waypoint> points) {
        this(points, null);
    }

    public TrackSegment(List<Waypoint> points, String extensions) {
        this.points = Helper.immutableCopy(points);
        this.extensions = extensions;
    }

    public List<Waypoint> getPoints() {
        return points;
    }

    public String getExtensions() {
        return extensions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TrackSegment that = (TrackSegment) o;
        return points.equals(that.points) && Objects.equals(extensions, that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, extensions);
    }

    @Override
    public String toString() {
        return "TrackSegment{points=" + points.size() + '}';
    }
}
