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

import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import com.gpxio.util.exceptions.InvalidValueException;
import com.gpxio.util.exceptions.NoContentException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StringParserTest {

    @Test
    public void testSimpleString() throws GpxException {
        assertEquals("hello world", StringParser.parse(ParseContexts.of("<name>hello world</name>"), "name"));
    }

    @Test
    public void testTextIsJoined() throws GpxException {
        // the comment is dropped, the spaces around it stay
        assertEquals("a  & b <c>", StringParser.parse(
                ParseContexts.of("<desc>a <!-- comment --> &amp; b <![CDATA[<c>]]></desc>"), "desc"));
    }

    @Test
    public void testChildElementIsRejected() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class,
                () -> StringParser.parse(ParseContexts.of("<name>bar<baz></baz></name>"), "name"));
        assertEquals(GpxGrammarException.Reason.INVALID_CHILD_ELEMENT, ex.getReason());
        assertEquals("baz", ex.getName());
    }

    @Test
    public void testOtherStartingTag() {
        GpxGrammarException ex = assertThrows(GpxGrammarException.class,
                () -> StringParser.parse(ParseContexts.of("<foo>bar</foo>"), "name"));
        assertEquals(GpxGrammarException.Reason.MISSING_OPENING_TAG, ex.getReason());
        assertEquals("name", ex.getParent());
    }

    @Test
    public void testMissingEndTag() {
        // the tokenizer already complains
        assertThrows(GpxException.class, () -> StringParser.parse(ParseContexts.of("<name>bar"), "name"));
    }

    @Test
    public void testNoContent() {
        assertThrows(NoContentException.class, () -> StringParser.parse(ParseContexts.of("<name></name>"), "name"));
        assertThrows(NoContentException.class, () -> StringParser.parse(ParseContexts.of("<name> \n </name>"), "name"));
    }

    @Test
    public void testEmptyContentAllowed() throws GpxException {
        assertEquals("", StringParser.parse(ParseContexts.of("<cmt/>"), "cmt", true));
        assertEquals("", StringParser.parse(ParseContexts.of("<cmt>  </cmt>"), "cmt", true));
    }

    @Test
    public void testNumbers() throws GpxException {
        assertEquals(4.46, StringParser.parseDouble(ParseContexts.of("<ele> 4.46\n</ele>"), "ele"));
        assertEquals(7, StringParser.parseNonNegativeInt(ParseContexts.of("<sat>7</sat>"), "sat"));

        InvalidValueException ex = assertThrows(InvalidValueException.class,
                () -> StringParser.parseDouble(ParseContexts.of("<ele>high</ele>"), "ele"));
        assertEquals("ele", ex.getElement());
        assertEquals("high", ex.getValue());
        assertThrows(InvalidValueException.class, () -> StringParser.parseDouble(ParseContexts.of("<ele>NaN</ele>"), "ele"));
        assertThrows(InvalidValueException.class, () -> StringParser.parseNonNegativeInt(ParseContexts.of("<sat>-1</sat>"), "sat"));
        assertThrows(InvalidValueException.class, () -> StringParser.parseNonNegativeInt(ParseContexts.of("<sat>1.5</sat>"), "sat"));
    }
}
