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
package com.gpxio.reader;

import com.gpxio.GpxVersion;
import com.gpxio.Link;
import com.gpxio.Waypoint;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import com.gpxio.util.exceptions.InvalidValueException;
import com.gpxio.util.exceptions.PointOutOfBoundsException;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads a point. The same grammar is used for waypoints (wpt), track points (trkpt) and route
 * points (rtept).
 */
public class WaypointParser {

    private WaypointParser() {
    }

    /**
     * @param tag one of wpt, trkpt or rtept
     */
    public static Waypoint parse(ParseContext context, String tag) throws GpxException {
        XmlEvent element = context.verifyStartingTag(tag);
        String latValue = ParseContext.requireAttribute(element, "lat");
        String lonValue = ParseContext.requireAttribute(element, "lon");
        double lat = StringParser.toDouble(latValue, "lat");
        double lon = StringParser.toDouble(lonValue, "lon");
        if (!Waypoint.isValidLatitude(lat))
            throw new PointOutOfBoundsException("latitude must be in [-90, 90] but was " + latValue, tag, latValue);
        if (!Waypoint.isValidLongitude(lon))
            throw new PointOutOfBoundsException("longitude must be in [-180, 180) but was " + lonValue, tag, lonValue);

        Waypoint.Builder builder = Waypoint.builder(lat, lon);
        // GPX 1.0 only
        String url = null;
        String urlName = null;

        Set<String> seen = new HashSet<>();
        XmlEvent child;
        while ((child = context.nextChild(tag, seen)) != null) {
            String name = child.getName();
            switch (name) {
                case "ele":
                    builder.setElevation(StringParser.parseDouble(context, name));
                    break;
                case "time":
                    builder.setTime(TimeParser.parse(context));
                    break;
                case "magvar":
                    builder.setMagneticVariation(StringParser.parseDouble(context, name));
                    break;
                case "geoidheight":
                    builder.setGeoidHeight(StringParser.parseDouble(context, name));
                    break;
                case "name":
                    builder.setName(StringParser.parse(context, name));
                    break;
                case "cmt":
                    builder.setComment(StringParser.parse(context, name, true));
                    break;
                case "desc":
                    builder.setDescription(StringParser.parse(context, name, true));
                    break;
                case "src":
                    builder.setSource(StringParser.parse(context, name, true));
                    break;
                case "sym":
                    builder.setSymbol(StringParser.parse(context, name));
                    break;
                case "type":
                    builder.setType(StringParser.parse(context, name));
                    break;
                case "fix":
                    builder.setFix(FixParser.parse(context));
                    break;
                case "sat":
                    builder.setSatellites(StringParser.parseNonNegativeInt(context, name));
                    break;
                case "hdop":
                    builder.setHdop(StringParser.parseDouble(context, name));
                    break;
                case "vdop":
                    builder.setVdop(StringParser.parseDouble(context, name));
                    break;
                case "pdop":
                    builder.setPdop(StringParser.parseDouble(context, name));
                    break;
                case "ageofdgpsdata":
                    builder.setAgeOfDgpsData(StringParser.parseDouble(context, name));
                    break;
                case "dgpsid":
                    builder.setDgpsId(parseDgpsId(context));
                    break;
                case "extensions":
                    builder.setExtensions(ExtensionsParser.parse(context));
                    break;
                case "link":
                    context.requireVersion(GpxVersion.GPX11, name, tag);
                    builder.addLink(LinkParser.parse(context));
                    break;
                case "course":
                    context.requireVersion(GpxVersion.GPX10, name, tag);
                    builder.setCourse(StringParser.parseDouble(context, name));
                    break;
                case "speed":
                    context.requireVersion(GpxVersion.GPX10, name, tag);
                    builder.setSpeed(StringParser.parseDouble(context, name));
                    break;
                case "url":
                    context.requireVersion(GpxVersion.GPX10, name, tag);
                    url = StringParser.parse(context, name, true);
                    break;
                case "urlname":
                    context.requireVersion(GpxVersion.GPX10, name, tag);
                    urlName = StringParser.parse(context, name, true);
                    break;
                default:
                    throw GpxGrammarException.invalidChildElement(name, tag);
            }
        }

        if (url != null)
            builder.addLink(new Link(url, urlName, null));
        return builder.build();
    }

    private static int parseDgpsId(ParseContext context) throws GpxException {
        String value = StringParser.parse(context, "dgpsid");
        int dgpsId = StringParser.toInt(value, "dgpsid");
        if (!Waypoint.isValidDgpsId(dgpsId))
            throw new InvalidValueException("dgpsid must be in [0, " + Waypoint.MAX_DGPS_ID + "] but was " + value,
                    "dgpsid", value);
        return dgpsId;
    }
}
