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

import com.gpxio.Fix;
import com.gpxio.GpxVersion;
import com.gpxio.Link;
import com.gpxio.Waypoint;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import com.gpxio.util.exceptions.InvalidValueException;
import com.gpxio.util.exceptions.PointOutOfBoundsException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class WaypointParserTest {

    private static Waypoint parse(String xml) throws GpxException {
        return WaypointParser.parse(ParseContexts.of(xml), "wpt");
    }

    @Test
    public void testAllChildren() throws GpxException {
        Waypoint point = parse("<wpt lat=\"47.644548\" lon=\"-122.326897\">\n"
                + "  <ele>4.46</ele>\n"
                + "  <time>2009-10-17T18:37:26Z</time>\n"
                + "  <magvar>12.5</magvar>\n"
                + "  <geoidheight>-17.2</geoidheight>\n"
                + "  <name>Home</name>\n"
                + "  <cmt/>\n"
                + "  <desc>My home</desc>\n"
                + "  <src>Garmin eTrex</src>\n"
                + "  <link href=\"http://example.com/a\"/>\n"
                + "  <link href=\"http://example.com/b\"><text>b</text></link>\n"
                + "  <sym>House</sym>\n"
                + "  <type>home</type>\n"
                + "  <fix>3d</fix>\n"
                + "  <sat>8</sat>\n"
                + "  <hdop>1.1</hdop>\n"
                + "  <vdop>1.2</vdop>\n"
                + "  <pdop>1.3</pdop>\n"
                + "  <ageofdgpsdata>2</ageofdgpsdata>\n"
                + "  <dgpsid>17</dgpsid>\n"
                + "  <extensions><x:a xmlns:x=\"urn:x\">1</x:a></extensions>\n"
                + "</wpt>");

        assertEquals(47.644548, point.getLat());
        assertEquals(-122.326897, point.getLon());
        assertEquals(4.46, point.getElevation());
        assertEquals(OffsetDateTime.of(2009, 10, 17, 18, 37, 26, 0, ZoneOffset.UTC), point.getTime());
        assertEquals(12.5, point.getMagneticVariation());
        assertEquals(-17.2, point.getGeoidHeight());
        assertEquals("Home", point.getName());
        assertEquals("", point.getComment());
        assertEquals("My home", point.getDescription());
        assertEquals("Garmin eTrex", point.getSource());
        assertEquals(2, point.getLinks().size());
        assertEquals(new Link("http://example.com/b", "b", null), point.getLinks().get(1));
        assertEquals("House", point.getSymbol());
        assertEquals("home", point.getType());
        assertEquals(Fix.THREE_D, point.getFix());
        assertEquals(8, point.getSatellites());
        assertEquals(1.1, point.getHdop());
        assertEquals(1.2, point.getVdop());
        assertEquals(1.3, point.getPdop());
        assertEquals(2.0, point.getAgeOfDgpsData());
        assertEquals(17, point.getDgpsId());
        assertEquals("<x:a xmlns:x=\"urn:x\">1</x:a>", point.getExtensions());
        assertNull(point.getSpeed());
    }

    @ParameterizedTest
    @CsvSource({"90.0, 0", "-90.0, 0", "0, -180.0", "0, 179.9"})
    public void testPointInRange(String lat, String lon) throws GpxException {
        Waypoint point = parse("<wpt lat=\"" + lat + "\" lon=\"" + lon + "\"/>");
        assertEquals(Double.parseDouble(lat), point.getLat());
    }

    @ParameterizedTest
    @CsvSource({"90.1, 0", "-90.1, 0", "0, 180.0", "0, -180.1"})
    public void testPointOutOfRange(String lat, String lon) {
        assertThrows(PointOutOfBoundsException.class, () -> parse("<wpt lat=\"" + lat + "\" lon=\"" + lon + "\"/>"));
    }

    @Test
    public void testMissingCoordinate() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class, () -> parse("<wpt lat=\"1\"/>"));
        assertEquals(GpxGrammarException.Reason.LACKS_ATTRIBUTE, ex.getReason());
        assertEquals("lon", ex.getName());
        assertThrows(InvalidValueException.class, () -> parse("<wpt lat=\"1\" lon=\"east\"/>"));
    }

    @Test
    public void testOtherFix() throws GpxException {
        Waypoint point = parse("<wpt lat=\"1\" lon=\"2\"><fix>KF_4SV_OR_MORE</fix></wpt>");
        assertTrue(point.getFix().isOther());
        assertEquals("KF_4SV_OR_MORE", point.getFix().getValue());
    }

    @Test
    public void testDgpsIdRange() throws GpxException {
        assertEquals(1023, parse("<wpt lat=\"1\" lon=\"2\"><dgpsid>1023</dgpsid></wpt>").getDgpsId());
        InvalidValueException ex = assertThrows(InvalidValueException.class,
                () -> parse("<wpt lat=\"1\" lon=\"2\"><dgpsid>1024</dgpsid></wpt>"));
        assertEquals("dgpsid", ex.getElement());
        assertThrows(InvalidValueException.class, () -> parse("<wpt lat=\"1\" lon=\"2\"><dgpsid>-1</dgpsid></wpt>"));
    }

    @Test
    public void testGpx10Children() throws GpxException {
        Waypoint point = WaypointParser.parse(ParseContexts.of("<trkpt lat=\"1\" lon=\"2\">"
                + "<course>180.5</course><speed>4.2</speed>"
                + "<url>http://example.com</url><urlname>Example</urlname>"
                + "</trkpt>", GpxVersion.GPX10), "trkpt");

        assertEquals(180.5, point.getCourse());
        assertEquals(4.2, point.getSpeed());
        assertEquals(1, point.getLinks().size());
        assertEquals(new Link("http://example.com", "Example", null), point.getLinks().get(0));
    }

    @Test
    public void testGpx10ChildrenRejectedInGpx11() {
        for (String child : new String[]{"<speed>4.2</speed>", "<course>1</course>", "<url>http://example.com</url>"}) {
            GpxGrammarException ex = assertThrows(GpxGrammarException.class,
                    () -> parse("<wpt lat=\"1\" lon=\"2\">" + child + "</wpt>"));
            assertEquals(GpxGrammarException.Reason.INVALID_CHILD_ELEMENT, ex.getReason());
        }
    }

    @Test
    public void testLinkRejectedInGpx10() {
        assertThrows(GpxGrammarException.class, () -> WaypointParser.parse(ParseContexts.of(
                "<wpt lat=\"1\" lon=\"2\"><link href=\"http://example.com\"/></wpt>", GpxVersion.GPX10), "wpt"));
    }

    @Test
    public void testUnknownChildAndDuplicate() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class,
                () -> parse("<wpt lat=\"1\" lon=\"2\"><trkseg/></wpt>"));
        assertEquals("trkseg", ex.getName());
        assertEquals("wpt", ex.getParent());

        ex = assertThrows(GpxGrammarException.class,
                () -> parse("<wpt lat=\"1\" lon=\"2\"><ele>1</ele><ele>2</ele></wpt>"));
        assertEquals(GpxGrammarException.Reason.TAG_OPENED_TWICE, ex.getReason());
    }

    @Test
    public void testOtherPointTag() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class, () -> {
            ParseContext context = ParseContexts.of("<trkseg><trkpt lat=\"1\" lon=\"2\"/></trkseg>");
            context.verifyStartingTag("trkseg");
            WaypointParser.parse(context, "rtept");
        });
        assertEquals(GpxGrammarException.Reason.MISSING_OPENING_TAG, ex.getReason());
    }
}
