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

import java.util.HashSet;
import java.util.Set;

/**
 * Reads a GPX 1.1 person, e.g. the author of the metadata.
 */
public class PersonParser {

    private PersonParser() {
    }

    /**
     * @param tag the name of the element holding the person, e.g. author
     */
    public static Person parse(ParseContext context, String tag) throws GpxException {
        context.verifyStartingTag(tag);
        String name = null;
        String email = null;
        Link link = null;

        Set<String> seen = new HashSet<>();
        XmlEvent child;
        while ((child = context.nextChild(tag, seen)) != null) {
            switch (child.getName()) {
                case "name":
                    name = StringParser.parse(context, "name");
                    break;
                case "email":
                    email = EmailParser.parse(context);
                    break;
                case "link":
                    if (link != null)
                        throw GpxGrammarException.tagOpenedTwice("link", tag);
                    link = LinkParser.parse(context);
                    break;
                default:
                    throw GpxGrammarException.invalidChildElement(child.getName(), tag);
            }
        }
        return new Person(name, email, link);
    }
}
