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
import com.gpxio.GpxConfig;
import com.gpxio.util.exceptions.GpxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.Reader;

/**
 * Reads GPX 1.0 and 1.1 documents into a {@link Gpx}. The document is read in a single pass
 * and the first problem aborts the reading.
 * <p>
 * Usage:
 * <pre>
 * Gpx gpx = new GpxReader().read(inputStream);
 * </pre>
 * The input is not closed. Instances are thread-safe, a new parser is created per call.
 */
public class GpxReader {
    private static final Logger logger = LoggerFactory.getLogger(GpxReader.class);
    private final GpxConfig config;

    public GpxReader() {
        this(new GpxConfig());
    }

    public GpxReader(GpxConfig config) {
        this.config = config;
    }

    public Gpx read(InputStream in) throws GpxException {
        try (XmlEventStream events = XmlEventStream.of(in)) {
            return read(events);
        }
    }

    public Gpx read(Reader reader) throws GpxException {
        try (XmlEventStream events = XmlEventStream.of(reader)) {
            return read(events);
        }
    }

    public Gpx read(XmlEventStream events) throws GpxException {
        ParseContext context = new ParseContext(events, config);
        Gpx gpx = GpxParser.parse(context);
        if (logger.isDebugEnabled())
            logger.debug("read GPX " + gpx.getVersion().getValue() + " with " + gpx.getWaypoints().size()
                    + " waypoints, " + gpx.getTracks().size() + " tracks, " + gpx.getRoutes().size()
                    + " routes, creator: " + gpx.getCreator());
        return gpx;
    }

    public GpxConfig getConfig() {
        return config;
    }
}
