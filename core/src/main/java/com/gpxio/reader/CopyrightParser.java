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

import com.gpxio.Copyright;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;
import com.gpxio.util.exceptions.InvalidValueException;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads the copyright element: the author attribute plus year and license children.
 */
public class CopyrightParser {
    private static final String TAG = "copyright";

    private CopyrightParser() {
    }

    public static Copyright parse(ParseContext context) throws GpxException {
        XmlEvent element = context.verifyStartingTag(TAG);
        String author = element.getAttribute("author");
        Integer year = null;
        String license = null;

        Set<String> seen = new HashSet<>();
        XmlEvent child;
        while ((child = context.nextChild(TAG, seen)) != null) {
            switch (child.getName()) {
                case "year":
                    String value = StringParser.parse(context, "year");
                    year = StringParser.toInt(value, "year");
                    if (year < 0 || year > 9999)
                        throw new InvalidValueException("year must have at most 4 digits: " + value, "year", value);
                    break;
                case "license":
                    license = StringParser.parse(context, "license");
                    break;
                default:
                    throw GpxGrammarException.invalidChildElement(child.getName(), TAG);
            }
        }
        return new Copyright(author, year, license);
    }
}
