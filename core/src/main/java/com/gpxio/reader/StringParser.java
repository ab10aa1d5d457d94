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

/**
 * Reads the text content of a leaf element like name, ele or sat. Leaf elements must not
 * contain child elements.
 */
public class StringParser {

    private StringParser() {
    }

    /**
     * @param allowEmpty if true an element without text content results in an empty string,
     *                   otherwise it is rejected
     */
    public static String parse(ParseContext context, String tag, boolean allowEmpty) throws GpxException {
        context.verifyStartingTag(tag);
        StringBuilder sb = new StringBuilder();
        while (true) {
            XmlEvent event = context.next();
            if (event == null)
                throw GpxGrammarException.missingClosingTag(tag);

            if (event.isOpen())
                throw GpxGrammarException.invalidChildElement(event.getName(), tag);
            if (event.isText()) {
                sb.append(event.getText());
                continue;
            }
            if (!event.getName().equals(tag))
                throw GpxGrammarException.invalidClosingTag(event.getName(), tag);
            break;
        }

        String str = sb.toString();
        if (str.trim().isEmpty()) {
            if (allowEmpty)
                return "";
            throw new NoContentException(tag);
        }
        return str;
    }

    public static String parse(ParseContext context, String tag) throws GpxException {
        return parse(context, tag, false);
    }

    public static double parseDouble(ParseContext context, String tag) throws GpxException {
        return toDouble(parse(context, tag), tag);
    }

    public static int parseNonNegativeInt(ParseContext context, String tag) throws GpxException {
        String value = parse(context, tag);
        int result = toInt(value, tag);
        if (result < 0)
            throw new InvalidValueException("negative value for " + tag + ": " + value, tag, value);
        return result;
    }

    /**
     * Parses an xsd:decimal. NaN and infinite values are rejected.
     */
    public static double toDouble(String value, String element) throws InvalidValueException {
        double result;
        try {
            result = Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidValueException("cannot parse " + element + " as decimal: " + value, element, value, ex);
        }
        if (Double.isNaN(result) || Double.isInfinite(result))
            throw new InvalidValueException("invalid decimal for " + element + ": " + value, element, value);
        return result;
    }

    public static int toInt(String value, String element) throws InvalidValueException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidValueException("cannot parse " + element + " as integer: " + value, element, value, ex);
        }
    }
}
