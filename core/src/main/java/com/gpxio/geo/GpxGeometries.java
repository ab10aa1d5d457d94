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
package com.gpxio.geo;

import com.gpxio.Bounds;
import com.gpxio.Gpx;
import com.gpxio.Route;
import com.gpxio.Track;
import com.gpxio.TrackSegment;
import com.gpxio.Waypoint;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts GPX elements into JTS geometries. x is the longitude, y the latitude and z the
 * elevation, which is NaN for points without elevation.
 */
public class GpxGeometries {
    private final GeometryFactory factory;

    public GpxGeometries() {
        this(new GeometryFactory());
    }

    public GpxGeometries(GeometryFactory factory) {
        this.factory = factory;
    }

    public static Coordinate toCoordinate(Waypoint point) {
        return point.getElevation() == null
                ? new Coordinate(point.getLon(), point.getLat())
                : new Coordinate(point.getLon(), point.getLat(), point.getElevation());
    }

    public Point toPoint(Waypoint point) {
        return factory.createPoint(toCoordinate(point));
    }

    public LineString toLineString(TrackSegment segment) {
        return toLineString(segment.getPoints());
    }

    public LineString toLineString(Route route) {
        return toLineString(route.getPoints());
    }

    /**
     * A single point results in a line string with two equal coordinates, as JTS rejects line strings with
     * one coordinate. No point results in an empty line string.
     */
    public LineString toLineString(List<Waypoint> points) {
        if (points.isEmpty())
            return factory.createLineString();

        Coordinate[] coordinates = new Coordinate[points.size() == 1 ? 2 : points.size()];
        for (int i = 0; i < points.size(); i++) {
            coordinates[i] = toCoordinate(points.get(i));
        }
        if (points.size() == 1)
            coordinates[1] = coordinates[0].copy();
        return factory.createLineString(coordinates);
    }

    public MultiLineString toMultiLineString(Track track) {
        LineString[] lines = new LineString[track.getSegments().size()];
        for (int i = 0; i < lines.length; i++) {
            lines[i] = toLineString(track.getSegments().get(i));
        }
        return factory.createMultiLineString(lines);
    }

    public static Envelope toEnvelope(Bounds bounds) {
        return new Envelope(bounds.getMinLon(), bounds.getMaxLon(), bounds.getMinLat(), bounds.getMaxLat());
    }

    /**
     * @return the waypoints as points, the routes as line strings and the tracks as multi line
     * strings, in this order
     */
    public GeometryCollection toGeometryCollection(Gpx gpx) {
        List<Geometry> geometries = new ArrayList<>();
        for (Waypoint waypoint : gpx.getWaypoints()) {
            geometries.add(toPoint(waypoint));
        }
        for (Route route : gpx.getRoutes()) {
            geometries.add(toLineString(route));
        }
        for (Track track : gpx.getTracks()) {
            geometries.add(toMultiLineString(track));
        }
        return factory.createGeometryCollection(geometries.toArray(new Geometry[0]));
    }

    /**
     * @return the envelope of all points of the document, empty if it has no points
     */
    public Envelope calcEnvelope(Gpx gpx) {
        Envelope envelope = new Envelope();
        for (Waypoint waypoint : gpx.getWaypoints()) {
            envelope.expandToInclude(waypoint.getLon(), waypoint.getLat());
        }
        for (Route route : gpx.getRoutes()) {
            for (Waypoint point : route.getPoints()) {
                envelope.expandToInclude(point.getLon(), point.getLat());
            }
        }
        for (Track track : gpx.getTracks()) {
            for (TrackSegment segment : track.getSegments()) {
                for (Waypoint point : segment.getPoints()) {
                    envelope.expandToInclude(point.getLon(), point.getLat());
                }
            }
        }
        return envelope;
    }
}
