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

import com.gpxio.Link;
import com.gpxio.Person;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PersonParserTest {

    @Test
    public void testPerson() throws GpxException {
        Person person = PersonParser.parse(ParseContexts.of("<author>\n"
                + "  <name>John Doe</name>\n"
                + "  <email id=\"john.doe\" domain=\"example.com\"/>\n"
                + "  <link href=\"http://example.com/john\"><text>home</text></link>\n"
                + "</author>"), "author");

        assertEquals("John Doe", person.getName());
        assertEquals("john.doe@example.com", person.getEmail());
        assertEquals(new Link("http://example.com/john", "home", null), person.getLink());
    }

    @Test
    public void testEmptyPerson() throws GpxException {
        assertTrue(PersonParser.parse(ParseContexts.of("<author/>"), "author").isEmpty());
    }

    @Test
    public void testSecondLink() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class, () -> PersonParser.parse(ParseContexts.of(
                "<author><link href=\"a\"/><link href=\"b\"/></author>"), "author"));
        assertEquals(GpxGrammarException.Reason.TAG_OPENED_TWICE, ex.getReason());
        assertEquals("link", ex.getName());
        assertEquals("author", ex.getParent());
    }

    @Test
    public void testInvalidChild() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class, () -> PersonParser.parse(ParseContexts.of(
                "<author><url>http://example.com</url></author>"), "author"));
        assertEquals("url", ex.getName());
        assertEquals("author", ex.getParent());
    }
}
