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
import com.gpxio.Track;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TrackParserTest {

    @Test
    public void testTrack() throws GpxException {
        Track track = TrackParser.parse(ParseContexts.of("<trk>\n"
                + "  <name>Morning Ride</name>\n"
                + "  <cmt>cold</cmt>\n"
                + "  <desc>around the lake</desc>\n"
                + "  <src>watch</src>\n"
                + "  <link href=\"http://example.com/ride\"/>\n"
                + "  <number>3</number>\n"
                + "  <type>cycling</type>\n"
                + "  <trkseg>\n"
                + "    <trkpt lat=\"1\" lon=\"2\"/>\n"
                + "    <trkpt lat=\"1.5\" lon=\"2.5\"/>\n"
                + "  </trkseg>\n"
                + "  <trkseg>\n"
                + "    <trkpt lat=\"3\" lon=\"4\"/>\n"
                + "    <extensions><a xmlns=\"urn:a\"/></extensions>\n"
                + "  </trkseg>\n"
                + "  <trkseg/>\n"
                + "</trk>"));

        assertEquals("Morning Ride", track.getName());
        assertEquals("cold", track.getComment());
        assertEquals("around the lake", track.getDescription());
        assertEquals("watch", track.getSource());
        assertEquals(new Link("http://example.com/ride"), track.getLinks().get(0));
        assertEquals(3, track.getNumber());
        assertEquals("cycling", track.getType());
        assertEquals(3, track.getSegments().size());
        assertEquals(2, track.getSegments().get(0).getPoints().size());
        assertEquals(2.5, track.getSegments().get(0).getPoints().get(1).getLon());
        assertEquals("<a xmlns=\"urn:a\"></a>", track.getSegments().get(1).getExtensions());
        assertTrue(track.getSegments().get(2).getPoints().isEmpty());
    }

    @Test
    public void testGpx10Url() throws GpxException {
        Track track = TrackParser.parse(ParseContexts.of("<trk><url>http://example.com</url><urlname>x</urlname></trk>",
                GpxVersion.GPX10));
        assertEquals(new Link("http://example.com", "x", null), track.getLinks().get(0));

        assertThrows(GpxGrammarException.class, () -> TrackParser.parse(ParseContexts.of(
                "<trk><url>http://example.com</url></trk>")));
    }

    @Test
    public void testPointsOutsideOfSegment() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class, () -> TrackParser.parse(ParseContexts.of(
                "<trk><trkpt lat=\"1\" lon=\"2\"/></trk>")));
        assertEquals("trkpt", ex.getName());
        assertEquals("trk", ex.getParent());
    }

    @Test
    public void testRoutePointInSegment() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class, () -> TrackSegmentParser.parse(ParseContexts.of(
                "<trkseg><rtept lat=\"1\" lon=\"2\"/></trkseg>")));
        assertEquals(GpxGrammarException.Reason.INVALID_CHILD_ELEMENT, ex.getReason());
    }

    @Test
    public void testNumberTwice() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class, () -> TrackParser.parse(ParseContexts.of(
                "<trk><number>1</number><number>2</number></trk>")));
        assertEquals(GpxGrammarException.Reason.TAG_OPENED_TWICE, ex.getReason());
        assertEquals("number", ex.getName());
        assertEquals("trk", ex.getParent());
    }
}
