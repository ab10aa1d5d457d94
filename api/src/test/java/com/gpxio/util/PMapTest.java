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
package com.gpxio.util;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class PMapTest {

    @Test
    public void singleStringPropertyCanBeRetrieved() {
        PMap subject = new PMap("writer.creator=me");

        assertEquals("me", subject.get("writer.creator", ""));
    }

    @Test
    public void propertiesFromStringAreTrimmed() {
        PMap subject = new PMap(" writer.indent = 4 | reader.keep_extensions=false|invalid");

        assertEquals(4, subject.getInt("writer.indent", 2));
        assertFalse(subject.getBool("reader.keep_extensions", true));
        assertFalse(subject.has("invalid"));
    }

    @Test
    public void camelCaseKeysAreStoredWithUnderScore() {
        PMap subject = new PMap().put("reader.keepExtensions", false);

        assertTrue(subject.has("reader.keep_extensions"));
        assertTrue(subject.has("reader.keepExtensions"));
        assertEquals("false", subject.toMap().get("reader.keep_extensions"));
    }

    @Test
    public void invalidNumberResultsInDefault() {
        PMap subject = new PMap("writer.indent=many");

        assertEquals(2, subject.getInt("writer.indent", 2));
        assertEquals(7, subject.getInt("missing", 7));
    }

    @Test
    public void nullValueIsRejected() {
        assertThrows(NullPointerException.class, () -> new PMap().put("key", null));
    }

    @Test
    public void copyIsIndependent() {
        PMap original = new PMap(Collections.singletonMap("a", "b"));
        PMap copy = new PMap(original).remove("a");

        assertTrue(original.has("a"));
        assertTrue(copy.isEmpty());
        assertNull(copy.getStringOrNull("a"));
    }
}
