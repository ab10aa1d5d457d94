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
package com.gpxio.util.exceptions;

import java.util.HashMap;
import java.util.Map;

/**
 * The XML is well-formed but does not follow the element grammar of GPX, e.g. a child element
 * that is not allowed inside its parent or a required attribute that is missing.
 */
public class GpxGrammarException extends GpxException {

    public enum Reason {
        INVALID_CHILD_ELEMENT,
        INVALID_CLOSING_TAG,
        MISSING_CLOSING_TAG,
        MISSING_OPENING_TAG,
        LACKS_ATTRIBUTE,
        TAG_OPENED_TWICE
    }

    private final Reason reason;
    // element or attribute name, null for missing tags
    private final String name;
    private final String parent;

    private GpxGrammarException(Reason reason, String name, String parent, String message) {
        super(message);
        this.reason = reason;
        this.name = name;
        this.parent = parent;
    }

    public static GpxGrammarException invalidChildElement(String child, String parent) {
        return new GpxGrammarException(Reason.INVALID_CHILD_ELEMENT, child, parent,
                "invalid child element '" + child + "' in " + parent);
    }

    public static GpxGrammarException invalidClosingTag(String got, String parent) {
        return new GpxGrammarException(Reason.INVALID_CLOSING_TAG, got, parent,
                "invalid closing tag '" + got + "' in " + parent);
    }

    public static GpxGrammarException missingClosingTag(String parent) {
        return new GpxGrammarException(Reason.MISSING_CLOSING_TAG, null, parent,
                "missing closing tag for " + parent);
    }

    public static GpxGrammarException missingOpeningTag(String parent) {
        return new GpxGrammarException(Reason.MISSING_OPENING_TAG, null, parent,
                "missing opening tag for " + parent);
    }

    public static GpxGrammarException lacksAttribute(String attribute, String parent) {
        return new GpxGrammarException(Reason.LACKS_ATTRIBUTE, attribute, parent,
                "invalid element " + parent + ", lacks required attribute " + attribute);
    }

    public static GpxGrammarException tagOpenedTwice(String tag, String parent) {
        return new GpxGrammarException(Reason.TAG_OPENED_TWICE, tag, parent,
                "tag opened twice in " + parent + ": " + tag);
    }

    /**
     * Unexpected content where the opening tag of an element was expected, e.g. text or a
     * closing tag.
     */
    public static GpxGrammarException unexpectedContent(String content, String parent) {
        return new GpxGrammarException(Reason.MISSING_OPENING_TAG, content, parent,
                "unexpected " + content + " where " + parent + " was expected");
    }

    public Reason getReason() {
        return reason;
    }

    public String getName() {
        return name;
    }

    public String getParent() {
        return parent;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new HashMap<>(3);
        details.put("reason", reason.name().toLowerCase());
        details.put("parent", parent);
        if (name != null)
            details.put("name", name);
        return details;
    }
}
