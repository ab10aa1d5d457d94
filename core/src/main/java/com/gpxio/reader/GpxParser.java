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

import com.gpxio.Gpx;
import com.gpxio.GpxVersion;
import com.gpxio.Link;
import com.gpxio.Metadata;
import com.gpxio.Person;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import com.gpxio.util.exceptions.UnknownVersionException;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads the root element of a GPX document.
 * <p>
 * The version attribute decides which grammar applies to the whole document. GPX 1.1 has a
 * metadata element while GPX 1.0 keeps name, author, time, bounds etc. directly below the root.
 * For GPX 1.0 these values are collected and turned into a {@link Metadata} when the root is
 * closed, so both versions end up in the same model.
 */
public class GpxParser {
    private static final String TAG = "gpx";

    private GpxParser() {
    }

    public static Gpx parse(ParseContext context) throws GpxException {
        XmlEvent element = context.verifyStartingTag(TAG);
        String versionValue = ParseContext.requireAttribute(element, "version");
        GpxVersion version = GpxVersion.find(versionValue.trim());
        if (version == GpxVersion.UNKNOWN)
            throw new UnknownVersionException(versionValue);
        // must happen before any child is read
        context.setVersion(version);

        Gpx.Builder gpx = Gpx.builder(version);
        gpx.setCreator(element.getAttribute("creator"));

        // GPX 1.0 only
        Metadata.Builder metadata = Metadata.builder();
        String author = null;
        String email = null;
        String url = null;
        String urlName = null;

        Set<String> seen = new HashSet<>();
        XmlEvent child;
        while ((child = context.nextChild(TAG, seen)) != null) {
            String name = child.getName();
            switch (name) {
                case "wpt":
                    gpx.addWaypoint(WaypointParser.parse(context, name));
                    break;
                case "trk":
                    gpx.addTrack(TrackParser.parse(context));
                    break;
                case "rte":
                    gpx.addRoute(RouteParser.parse(context));
                    break;
                case "extensions":
                    gpx.setExtensions(ExtensionsParser.parse(context));
                    break;
                case "metadata":
                    context.requireVersion(GpxVersion.GPX11, name, TAG);
                    gpx.setMetadata(MetadataParser.parse(context));
                    break;
                case "name":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    metadata.setName(StringParser.parse(context, name));
                    break;
                case "desc":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    metadata.setDescription(StringParser.parse(context, name, true));
                    break;
                case "author":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    author = StringParser.parse(context, name);
                    break;
                case "email":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    email = EmailParser.checkAddress(StringParser.parse(context, name));
                    break;
                case "url":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    url = StringParser.parse(context, name, true);
                    break;
                case "urlname":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    urlName = StringParser.parse(context, name, true);
                    break;
                case "time":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    metadata.setTime(TimeParser.parse(context));
                    break;
                case "keywords":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    metadata.setKeywords(StringParser.parse(context, name));
                    break;
                case "bounds":
                    context.requireVersion(GpxVersion.GPX10, name, TAG);
                    metadata.setBounds(BoundsParser.parse(context));
                    break;
                default:
                    throw GpxGrammarException.invalidChildElement(name, TAG);
            }
        }

        if (version == GpxVersion.GPX10) {
            Person person = new Person(author, email, url == null ? null : new Link(url, urlName, null));
            if (!person.isEmpty())
                metadata.setAuthor(person);
            if (!metadata.isEmpty())
                gpx.setMetadata(metadata.build());
        }
        return gpx.build();
    }
}
