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
import com.gpxio.Gpx;
import com.gpxio.GpxVersion;
import com.gpxio.Link;
import com.gpxio.Metadata;
import com.gpxio.Person;
import com.gpxio.Waypoint;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import com.gpxio.util.exceptions.InvalidValueException;
import com.gpxio.util.exceptions.UnknownVersionException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class GpxParserTest {

    private static Gpx parse(String xml) throws GpxException {
        return GpxParser.parse(ParseContexts.of(xml, GpxVersion.UNKNOWN));
    }

    @Test
    public void testTwoWaypoints() throws GpxException {
        Gpx gpx = parse("<gpx version=\"1.1\"><wpt lat=\"1.23\" lon=\"2.34\"></wpt>"
                + "<wpt lon=\"10.256\" lat=\"-81.324\"><time>2001-10-26T19:32:52+00:00</time></wpt></gpx>");

        assertEquals(GpxVersion.GPX11, gpx.getVersion());
        assertEquals(2, gpx.getWaypoints().size());
        Waypoint second = gpx.getWaypoints().get(1);
        assertEquals(10.256, second.getLon());
        assertEquals(-81.324, second.getLat());
        assertEquals(OffsetDateTime.of(2001, 10, 26, 19, 32, 52, 0, ZoneOffset.UTC), second.getTime());
        assertNull(gpx.getMetadata());
        assertNull(gpx.getCreator());
    }

    @Test
    public void testVersionIsSetBeforeChildrenAreRead() throws GpxException {
        ParseContext context = ParseContexts.of("<gpx version=\"1.0\" creator=\"me\"/>", GpxVersion.UNKNOWN);
        Gpx gpx = GpxParser.parse(context);

        assertEquals(GpxVersion.GPX10, context.getVersion());
        assertEquals("me", gpx.getCreator());
    }

    @Test
    public void testGpx10MetadataIsCollected() throws GpxException {
        Gpx gpx = parse("<gpx version=\"1.0\">\n"
                + "  <name>Boston sights</name>\n"
                + "  <author>Jane Doe</author>\n"
                + "  <email>jane@example.com</email>\n"
                + "  <url>http://www.example.com/boston</url>\n"
                + "  <urlname>Boston guide</urlname>\n"
                + "  <time>2002-02-27T17:18:33Z</time>\n"
                + "  <bounds minlat=\"42.4\" minlon=\"-71.2\" maxlat=\"42.5\" maxlon=\"-71.1\"/>\n"
                + "</gpx>");

        Metadata metadata = gpx.getMetadata();
        assertEquals("Boston sights", metadata.getName());
        assertEquals(new Person("Jane Doe", "jane@example.com",
                new Link("http://www.example.com/boston", "Boston guide", null)), metadata.getAuthor());
        assertEquals(new Bounds(-71.2, -71.1, 42.4, 42.5), metadata.getBounds());
        assertEquals(OffsetDateTime.of(2002, 2, 27, 17, 18, 33, 0, ZoneOffset.UTC), metadata.getTime());
        assertTrue(metadata.getLinks().isEmpty());
    }

    @Test
    public void testGpx10AndGpx11MetadataAreEqual() throws GpxException {
        Gpx gpx10 = parse("<gpx version=\"1.0\"><author>Jane Doe</author>"
                + "<bounds minlat=\"42.4\" minlon=\"-71.2\" maxlat=\"42.5\" maxlon=\"-71.1\"/></gpx>");
        Gpx gpx11 = parse("<gpx version=\"1.1\"><metadata><author><name>Jane Doe</name></author>"
                + "<bounds minlat=\"42.4\" minlon=\"-71.2\" maxlat=\"42.5\" maxlon=\"-71.1\"/></metadata></gpx>");

        assertEquals(gpx11.getMetadata(), gpx10.getMetadata());
    }

    @Test
    public void testGpx10WithoutAuthor() throws GpxException {
        Gpx gpx = parse("<gpx version=\"1.0\"><keywords>a, b</keywords><urlname>only a name</urlname></gpx>");
        assertEquals("a, b", gpx.getMetadata().getKeywords());
        assertNull(gpx.getMetadata().getAuthor());

        assertNull(parse("<gpx version=\"1.0\"><wpt lat=\"1\" lon=\"2\"/></gpx>").getMetadata());
    }

    @Test
    public void testGpx10EmailNeedsOneAt() {
        for (String email : new String[]{"jane", "jane@home@example.com"}) {
            InvalidValueException ex = assertThrows(InvalidValueException.class,
                    () -> parse("<gpx version=\"1.0\"><author>Jane</author><email>" + email + "</email></gpx>"));
            assertEquals("email", ex.getElement());
            assertEquals(email, ex.getValue());
        }
    }

    @Test
    public void testGpx10ElementsRejectedInGpx11() {
        for (String child : new String[]{"<author>Jane</author>", "<name>x</name>", "<time>2002-02-27T17:18:33Z</time>",
                "<bounds minlat=\"1\" minlon=\"1\" maxlat=\"2\" maxlon=\"2\"/>", "<email>a@b.c</email>"}) {
            GpxGrammarException ex = assertThrows(GpxGrammarException.class,
                    () -> parse("<gpx version=\"1.1\">" + child + "</gpx>"));
            assertEquals(GpxGrammarException.Reason.INVALID_CHILD_ELEMENT, ex.getReason());
            assertEquals("gpx", ex.getParent());
        }
    }

    @Test
    public void testMetadataRejectedInGpx10() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class,
                () -> parse("<gpx version=\"1.0\"><metadata><name>x</name></metadata></gpx>"));
        assertEquals("metadata", ex.getName());
    }

    @Test
    public void testVersion() {
        UnknownVersionException ex = assertThrows(UnknownVersionException.class,
                () -> parse("<gpx version=\"1.2\"></gpx>"));
        assertEquals("1.2", ex.getVersion());

        GpxGrammarException missing = assertThrows(GpxGrammarException.class, () -> parse("<gpx></gpx>"));
        assertEquals(GpxGrammarException.Reason.LACKS_ATTRIBUTE, missing.getReason());
        assertEquals("version", missing.getName());
    }

    @Test
    public void testOtherRoot() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class,
                () -> parse("<kml version=\"1.1\"></kml>"));
        assertEquals(GpxGrammarException.Reason.MISSING_OPENING_TAG, ex.getReason());
    }

    @Test
    public void testMetadataTwice() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class,
                () -> parse("<gpx version=\"1.1\"><metadata/><metadata/></gpx>"));
        assertEquals(GpxGrammarException.Reason.TAG_OPENED_TWICE, ex.getReason());
        assertEquals("metadata", ex.getName());
        assertEquals("gpx", ex.getParent());
    }

    @Test
    public void testTracksRoutesAndExtensions() throws GpxException {
        Gpx gpx = parse("<gpx version=\"1.1\" xmlns=\"http://www.topografix.com/GPX/1/1\">"
                + "<rte><rtept lat=\"1\" lon=\"2\"/></rte><trk><trkseg/></trk><trk/>"
                + "<extensions><foo>bar</foo></extensions></gpx>");

        assertEquals(1, gpx.getRoutes().size());
        assertEquals(2, gpx.getTracks().size());
        assertEquals("<foo xmlns=\"http://www.topografix.com/GPX/1/1\">bar</foo>", gpx.getExtensions());
    }
}
