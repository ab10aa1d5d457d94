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

import com.gpxio.Bounds;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import com.gpxio.util.exceptions.PointOutOfBoundsException;

/**
 * Reads the bounds element from its minlat, minlon, maxlat and maxlon attributes.
 */
public class BoundsParser {
    private static final String TAG = "bounds";

    private BoundsParser() {
    }

    public static Bounds parse(ParseContext context) throws GpxException {
        XmlEvent element = context.verifyStartingTag(TAG);
        double minLat = readAttribute(element, "minlat");
        double maxLat = readAttribute(element, "maxlat");
        double minLon = readAttribute(element, "minlon");
        double maxLon = readAttribute(element, "maxlon");

        if (minLat > maxLat)
            throw new PointOutOfBoundsException("minlat " + minLat + " is greater than maxlat " + maxLat,
                    TAG, minLat + "," + maxLat);
        if (minLon > maxLon)
            throw new PointOutOfBoundsException("minlon " + minLon + " is greater than maxlon " + maxLon,
                    TAG, minLon + "," + maxLon);

        while (true) {
            XmlEvent event = context.next();
            if (event == null)
                throw GpxGrammarException.missingClosingTag(TAG);
            if (event.isOpen())
                throw GpxGrammarException.invalidChildElement(event.getName(), TAG);
            if (event.isClose()) {
                if (!event.getName().equals(TAG))
                    throw GpxGrammarException.invalidClosingTag(event.getName(), TAG);
                return new Bounds(minLon, maxLon, minLat, maxLat);
            }
        }
    }

    private static double readAttribute(XmlEvent element, String attribute) throws GpxException {
        return StringParser.toDouble(ParseContext.requireAttribute(element, attribute), attribute);
    }
}
