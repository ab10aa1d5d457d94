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

import com.gpxio.util.Helper;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A structural XML event as seen by the element parsers: an element was opened, closed or text
 * was found. Element names are local names, the prefix and namespace are kept for the
 * re-serialization of extensions only.
 */
public final class XmlEvent {

    public enum Type {
        OPEN, CLOSE, TEXT
    }

    public static final class Attribute {
        private final String name;
        private final String prefix;
        private final String namespaceUri;
        private final String value;

        public Attribute(String name, String prefix, String namespaceUri, String value) {
            this.name = name;
            this.prefix = prefix == null ? "" : prefix;
            this.namespaceUri = namespaceUri == null ? "" : namespaceUri;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public String getPrefix() {
            return prefix;
        }

        public String getNamespaceUri() {
            return namespaceUri;
        }

        public String getValue() {
            return value;
        }

        public String getQualifiedName() {
            return prefix.isEmpty() ? name : prefix + ":" + name;
        }

        @Override
        public String toString() {
            return getQualifiedName() + "=" + value;
        }
    }

    private final Type type;
    private final String name;
    private final String prefix;
    private final String namespaceUri;
    // prefix to URI, the default namespace has the empty prefix
    private final Map<String, String> namespaces;
    private final List<Attribute> attributes;
    private final String text;
    private final boolean whitespace;

    private XmlEvent(Type type, String name, String prefix, String namespaceUri, Map<String, String> namespaces,
                     List<Attribute> attributes, String text) {
        this.type = type;
        this.name = name;
        this.prefix = prefix == null ? "" : prefix;
        this.namespaceUri = namespaceUri == null ? "" : namespaceUri;
        this.namespaces = namespaces;
        this.attributes = attributes;
        this.text = text;
        this.whitespace = type == Type.TEXT && Helper.isEmpty(text);
    }

    public static XmlEvent open(String name, String prefix, String namespaceUri, Map<String, String> namespaces,
                                List<Attribute> attributes) {
        return new XmlEvent(Type.OPEN, name, prefix, namespaceUri, namespaces, attributes, null);
    }

    public static XmlEvent open(String name, List<Attribute> attributes) {
        return open(name, "", "", Collections.<String, String>emptyMap(), attributes);
    }

    public static XmlEvent close(String name, String prefix) {
        return new XmlEvent(Type.CLOSE, name, prefix, "", Collections.<String, String>emptyMap(),
                Collections.<Attribute>emptyList(), null);
    }

    public static XmlEvent text(String text) {
        return new XmlEvent(Type.TEXT, null, "", "", Collections.<String, String>emptyMap(),
                Collections.<Attribute>emptyList(), text);
    }

    public Type getType() {
        return type;
    }

    public boolean isOpen() {
        return type == Type.OPEN;
    }

    public boolean isClose() {
        return type == Type.CLOSE;
    }

    public boolean isText() {
        return type == Type.TEXT;
    }

    /**
     * @return the local name of an opened or closed element, null for text
     */
    public String getName() {
        return name;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getQualifiedName() {
        return prefix.isEmpty() ? name : prefix + ":" + name;
    }

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public Map<String, String> getNamespaces() {
        return namespaces;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    /**
     * @return the value of the attribute with the specified local name or null
     */
    public String getAttribute(String localName) {
        for (Attribute attribute : attributes) {
            if (attribute.getName().equals(localName))
                return attribute.getValue();
        }
        return null;
    }

    public String getText() {
        return text;
    }

    /**
     * @return true if this is a text event without any non-whitespace character
     */
    public boolean isWhitespace() {
        return whitespace;
    }

    /**
     * A short description of this event for error messages.
     */
    public String describe() {
        switch (type) {
            case OPEN:
                return "opening tag '" + getQualifiedName() + "'";
            case CLOSE:
                return "closing tag '" + getQualifiedName() + "'";
            default:
                return "text '" + text.trim() + "'";
        }
    }

    @Override
    public String toString() {
        return type + (type == Type.TEXT ? " '" + text + "'" : " " + getQualifiedName() + " " + attributes);
    }
}
