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

import com.gpxio.GpxConfig;
import com.gpxio.GpxVersion;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import com.gpxio.util.exceptions.GpxXmlException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * The state shared by all element parsers of one document: the event stream, the configuration
 * and the GPX version detected from the root element. The version is set by {@link GpxParser}
 * before any child element is read.
 *
 * @see GpxParser
 */
public class ParseContext {
    // children which may occur more than once in their parent
    private static final Set<String> REPEATABLE = new HashSet<>(Arrays.asList(
            "link", "wpt", "rte", "trk", "trkseg", "trkpt", "rtept"));

    private final XmlEventStream events;
    private final GpxConfig config;
    private GpxVersion version = GpxVersion.UNKNOWN;

    public ParseContext(XmlEventStream events, GpxConfig config) {
        this.events = events;
        this.config = config;
    }

    public ParseContext(XmlEventStream events, GpxConfig config, GpxVersion version) {
        this(events, config);
        this.version = version;
    }

    public XmlEvent peek() throws GpxXmlException {
        return events.peek();
    }

    public XmlEvent next() throws GpxXmlException {
        return events.next();
    }

    public GpxConfig getConfig() {
        return config;
    }

    public GpxVersion getVersion() {
        return version;
    }

    public void setVersion(GpxVersion version) {
        this.version = version;
    }

    public boolean isGpx10() {
        return version == GpxVersion.GPX10;
    }

    /**
     * Rejects a child element which is only part of the grammar of the specified version.
     */
    public void requireVersion(GpxVersion expected, String child, String parent) throws GpxGrammarException {
        if (version != expected)
            throw GpxGrammarException.invalidChildElement(child, parent);
    }

    /**
     * Consumes the opening tag of the specified element. Whitespace in front of it is skipped.
     *
     * @return the open event with the attributes of the element
     */
    public XmlEvent verifyStartingTag(String name) throws GpxException {
        XmlEvent event = events.next();
        while (event != null && event.isWhitespace()) {
            event = events.next();
        }

        if (event == null)
            throw GpxGrammarException.missingOpeningTag(name);
        if (!event.isOpen() || !event.getName().equals(name))
            throw GpxGrammarException.unexpectedContent(event.describe(), name);
        return event;
    }

    /**
     * Moves to the next child element of the specified parent. Text between the children is
     * skipped, the closing tag of the parent is consumed.
     *
     * @param seen names of the children read so far, used to reject single-valued children
     *             which occur twice
     * @return the not yet consumed open event of the next child or null if the parent was closed
     */
    public XmlEvent nextChild(String parent, Set<String> seen) throws GpxException {
        while (true) {
            XmlEvent event = events.peek();
            if (event == null)
                throw GpxGrammarException.missingClosingTag(parent);

            switch (event.getType()) {
                case OPEN:
                    if (!REPEATABLE.contains(event.getName()) && !seen.add(event.getName()))
                        throw GpxGrammarException.tagOpenedTwice(event.getName(), parent);
                    return event;
                case CLOSE:
                    events.next();
                    if (!event.getName().equals(parent))
                        throw GpxGrammarException.invalidClosingTag(event.getName(), parent);
                    return null;
                default:
                    events.next();
            }
        }
    }

    /**
     * @return the value of the specified attribute
     * @throws GpxGrammarException if the element lacks the attribute
     */
    public static String requireAttribute(XmlEvent element, String attribute) throws GpxGrammarException {
        String value = element.getAttribute(attribute);
        if (value == null)
            throw GpxGrammarException.lacksAttribute(attribute, element.getName());
        return value;
    }
}
