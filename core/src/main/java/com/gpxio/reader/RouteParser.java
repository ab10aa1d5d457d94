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
import com.gpxio.Route;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads a route. Unlike a track a route has no segments but holds its points directly.
 */
public class RouteParser {
    private static final String TAG = "rte";

    private RouteParser() {
    }

    public static Route parse(ParseContext context) throws GpxException {
        context.verifyStartingTag(TAG);
        Route.Builder builder = Route.builder();
        // GPX 1.0 only
        String url = null;
        String urlName = null;

        Set<String> seen = new HashSet<>();
        XmlEvent child;
        while ((child = context.nextChild(TAG, seen)) != null) {
            String name = child.getName();
            switch (name) {
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
                case "number":
                    builder.setNumber(StringParser.parseNonNegativeInt(context, name));
                    break;
                case "type":
                    builder.setType(StringParser.parse(context, name));
                    break;
                case "extensions":
                    builder.setExtensions(ExtensionsParser.parse(context));
                    break;
                case "rtept":
                    builder.addPoint(WaypointParser.parse(context, "rtept"));
                    break;
                case "link":
                    context.requireVersion(GpxVersion.GPX11, name, TAG);
                    builder.addLink(LinkParser.parse(context));
                    break;
                case "url":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    url = StringParser.parse(context, name, true);
                    break;
                case "urlname":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    urlName = StringParser.parse(context, name, true);
                    break;
                default:
                    throw GpxGrammarException.invalidChildElement(name, TAG);
            }
        }

        if (url != null)
            builder.addLink(new Link(url, urlName, null));
        return builder.build();
    }
}
