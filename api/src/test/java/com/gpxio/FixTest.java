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
package com.gpxio;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FixTest {

    @Test
    public void testKnownValues() {
        assertSame(Fix.NONE, Fix.of("none"));
        assertSame(Fix.TWO_D, Fix.of("2d"));
        assertSame(Fix.THREE_D, Fix.of("3d"));
        assertSame(Fix.DGPS, Fix.of("dgps"));
        assertSame(Fix.PPS, Fix.of("pps"));
        assertFalse(Fix.PPS.isOther());
    }

    @Test
    public void testOtherValueIsKept() {
        Fix fix = Fix.of("KF_4SV_OR_MORE");

        assertTrue(fix.isOther());
        assertEquals("KF_4SV_OR_MORE", fix.getValue());
        assertEquals(Fix.of("KF_4SV_OR_MORE"), fix);
        assertEquals("other(KF_4SV_OR_MORE)", fix.toString());
        // case matters
        assertTrue(Fix.of("3D").isOther());
    }
}
