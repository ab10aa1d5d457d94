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

import com.gpxio.TrackSegment;
import com.gpxio.Waypoint;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class TrackSegmentParser {
    private static final String TAG = "trkseg";

    private TrackSegmentParser() {
    }

    public static TrackSegment parse(ParseContext context) throws GpxException {
        context.verifyStartingTag(TAG);
        List<Waypoint> points = new ArrayList<>();
        String extensions = null;

        Set<String> seen = new HashSet<>();
        XmlEvent child;
        while ((child = context.nextChild(TAG, seen)) != null) {
            switch (child.getName()) {
                case "trkpt":
                    points.add(WaypointParser.parse(context, "trkpt"));
                    break;
                case "extensions":
                    extensions = ExtensionsParser.parse(context);
                    break;
                default:
                    throw GpxGrammarException.invalidChildElement(child.getName(), TAG);
            }
        }
        return new TrackSegment(points, extensions);
    }
}
