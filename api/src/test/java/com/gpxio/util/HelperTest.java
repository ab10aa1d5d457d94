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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HelperTest {

    @Test
    public void testToDecimalString() {
        assertEquals("0.000001", Helper.toDecimalString(1e-6));
        assertEquals("4.0", Helper.toDecimalString(4));
        assertEquals("-122.326897", Helper.toDecimalString(-122.326897));
        assertEquals("10000000.0", Helper.toDecimalString(1e7));
        assertEquals("47.644548", Helper.toDecimalString(47.644548));
        assertEquals("0.1", Helper.toDecimalString(0.1));
    }

    @Test
    public void testCamelCaseToUnderScore() {
        assertEquals("keep_extensions", Helper.camelCaseToUnderScore("keepExtensions"));
        assertEquals("writer.indent", Helper.camelCaseToUnderScore("writer.indent"));
        assertEquals("", Helper.camelCaseToUnderScore(""));
    }

    @Test
    public void testIsEmpty() {
        assertTrue(Helper.isEmpty(null));
        assertTrue(Helper.isEmpty(" \n"));
        assertFalse(Helper.isEmpty("a"));
    }

    @Test
    public void testImmutableCopy() {
        List<String> list = new ArrayList<>(Arrays.asList("a", "b"));
        List<String> copy = Helper.immutableCopy(list);
        list.add("c");

        assertEquals(Arrays.asList("a", "b"), copy);
        assertThrows(UnsupportedOperationException.class, () -> copy.add("d"));
    }
}
