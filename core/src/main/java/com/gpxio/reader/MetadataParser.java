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

import com.gpxio.Metadata;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxGrammarException;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads the GPX 1.1 metadata element. For GPX 1.0 the metadata is collected from the children
 * of the root element instead, see {@link GpxParser}.
 */
public class MetadataParser {
    private static final String TAG = "metadata";

    private MetadataParser() {
    }

    public static Metadata parse(ParseContext context) throws GpxException {
        context.verifyStartingTag(TAG);
        Metadata.Builder builder = Metadata.builder();

        Set<String> seen = new HashSet<>();
        XmlEvent child;
        while ((child = context.nextChild(TAG, seen)) != null) {
            String name = child.getName();
            switch (name) {
                case "name":
                    builder.setName(StringParser.parse(context, name));
                    break;
                case "desc":
                    builder.setDescription(StringParser.parse(context, name, true));
                    break;
                case "author":
                    builder.setAuthor(PersonParser.parse(context, name));
                    break;
                case "copyright":
                    builder.setCopyright(CopyrightParser.parse(context));
                    break;
                case "link":
                    builder.addLink(LinkParser.parse(context));
                    break;
                case "time":
                    builder.setTime(TimeParser.parse(context));
                    break;
                case "keywords":
                    builder.setKeywords(StringParser.parse(context, name));
                    break;
                case "bounds":
                    builder.setBounds(BoundsParser.parse(context));
                    break;
                case "extensions":
                    builder.setExtensions(ExtensionsParser.parse(context));
                    break;
                default:
                    throw GpxGrammarException.invalidChildElement(name, TAG);
            }
        }
        return builder.build();
    }
}
