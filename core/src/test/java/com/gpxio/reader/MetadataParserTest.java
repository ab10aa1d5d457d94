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
import com.gpxio.Link;
import com.gpxio.Metadata;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class MetadataParserTest {

    @Test
    public void testMetadata() throws GpxException {
        Metadata metadata = MetadataParser.parse(ParseContexts.of("<metadata>\n"
                + "  <name>Boston sights</name>\n"
                + "  <desc>Places to visit</desc>\n"
                + "  <author><name>Jane Doe</name><email id=\"jane\" domain=\"example.com\"/></author>\n"
                + "  <copyright author=\"Jane Doe\"><year>2002</year></copyright>\n"
                + "  <link href=\"http://www.example.com/boston\"><text>Boston guide</text></link>\n"
                + "  <link href=\"http://www.example.com\"/>\n"
                + "  <time>2002-02-27T17:18:33Z</time>\n"
                + "  <keywords>boston, sights</keywords>\n"
                + "  <bounds minlat=\"42.401051\" minlon=\"-71.126602\" maxlat=\"42.468655\" maxlon=\"-71.102973\"/>\n"
                + "</metadata>"));

        assertEquals("Boston sights", metadata.getName());
        assertEquals("Places to visit", metadata.getDescription());
        assertEquals("Jane Doe", metadata.getAuthor().getName());
        assertEquals("jane@example.com", metadata.getAuthor().getEmail());
        assertEquals(2002, metadata.getCopyright().getYear());
        assertEquals(2, metadata.getLinks().size());
        assertEquals(new Link("http://www.example.com/boston", "Boston guide", null), metadata.getLinks().get(0));
        assertEquals(OffsetDateTime.of(2002, 2, 27, 17, 18, 33, 0, ZoneOffset.UTC), metadata.getTime());
        assertEquals("boston, sights", metadata.getKeywords());
        assertEquals(new Bounds(-71.126602, -71.102973, 42.401051, 42.468655), metadata.getBounds());
    }

    @Test
    public void testInvalidChild() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class, () -> MetadataParser.parse(ParseContexts.of(
                "<metadata><wpt lat=\"1\" lon=\"2\"/></metadata>")));
        assertEquals("wpt", ex.getName());
        assertEquals("metadata", ex.getParent());
    }
}
