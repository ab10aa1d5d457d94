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

/**
 * Reads a GPX 1.1 email element. The address is split into the id and domain attributes and
 * joined to id@domain.
 */
public class EmailParser {
    private static final String TAG = "email";

    private EmailParser() {
    }

    public static String parse(ParseContext context) throws GpxException {
        XmlEvent element = context.verifyStartingTag(TAG);
        String id = ParseContext.requireAttribute(element, "id");
        String domain = ParseContext.requireAttribute(element, "domain");
        if (id.isEmpty() || domain.isEmpty() || id.indexOf('@') >= 0 || domain.indexOf('@') >= 0)
            throw new InvalidValueException("email id and domain must be non-empty and must not contain @: "
                    + id + ", " + domain, TAG, id + "@" + domain);

        while (true) {
            XmlEvent event = context.next();
            if (event == null)
                throw GpxGrammarException.missingClosingTag(TAG);
            if (event.isOpen())
                throw GpxGrammarException.invalidChildElement(event.getName(), TAG);
            if (event.isClose()) {
                if (!event.getName().equals(TAG))
                    throw GpxGrammarException.invalidClosingTag(event.getName(), TAG);
                return id + "@" + domain;
            }
        }
    }

    /**
     * Checks the text of a GPX 1.0 email element.
     *
     * @return the address
     * @throws InvalidValueException if the address does not contain exactly one @
     */
    public static String checkAddress(String address) throws InvalidValueException {
        int index = address.indexOf('@');
        if (index < 0 || address.indexOf('@', index + 1) >= 0)
            throw new InvalidValueException("email address must contain exactly one @: " + address, TAG, address);
        return address;
    }
}
