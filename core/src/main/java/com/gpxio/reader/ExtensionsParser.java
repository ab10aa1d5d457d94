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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consumes an extensions element with arbitrary content, including nested extensions elements.
 * The content is not validated but kept as XML string, see {@link #parse(ParseContext)}.
 */
public class ExtensionsParser {
    private static final String TAG = "extensions";

    private ExtensionsParser() {
    }

    /**
     * Reads the extensions element. The returned string contains the inner XML of the element
     * with leading and trailing whitespace removed. Every namespace prefix used inside is
     * declared inside, so the string can be written into another document as it is.
     *
     * @return the inner XML or null if the element is empty or extensions are not kept
     */
    public static String parse(ParseContext context) throws GpxException {
        context.verifyStartingTag(TAG);
        boolean keep = context.getConfig().isKeepExtensions();
        StringBuilder sb = new StringBuilder();
        // opened but not yet closed elements inside the extensions element
        Deque<XmlEvent> openElements = new ArrayDeque<>();
        // namespace declarations per open element
        Deque<Map<String, String>> scopes = new ArrayDeque<>();

        while (true) {
            XmlEvent event = context.next();
            if (event == null)
                throw GpxGrammarException.missingClosingTag(TAG);

            switch (event.getType()) {
                case OPEN:
                    openElements.push(event);
                    Map<String, String> scope = declaredNamespaces(event, scopes);
                    scopes.push(scope);
                    if (keep)
                        appendOpen(sb, event, scope);
                    break;
                case CLOSE:
                    if (openElements.isEmpty()) {
                        if (!TAG.equals(event.getName()))
                            throw GpxGrammarException.invalidClosingTag(event.getQualifiedName(), TAG);
                        String xml = sb.toString().trim();
                        return !keep || xml.isEmpty() ? null : xml;
                    }

                    XmlEvent open = openElements.pop();
                    scopes.pop();
                    if (!open.getQualifiedName().equals(event.getQualifiedName()))
                        throw GpxGrammarException.invalidClosingTag(event.getQualifiedName(), open.getQualifiedName());
                    if (keep)
                        sb.append("</").append(event.getQualifiedName()).append('>');
                    break;
                default:
                    if (keep)
                        escape(sb, event.getText(), false);
            }
        }
    }

    /**
     * Collects the namespace declarations needed for the element: the ones of the element itself
     * plus the ones of prefixes used by the element or its attributes that are declared outside
     * of the extensions element.
     */
    private static Map<String, String> declaredNamespaces(XmlEvent event, Deque<Map<String, String>> scopes) {
        Map<String, String> scope = new LinkedHashMap<>(event.getNamespaces());
        Map<String, String> required = new HashMap<>();
        required.put(event.getPrefix(), event.getNamespaceUri());
        for (XmlEvent.Attribute attribute : event.getAttributes()) {
            // unprefixed attributes are in no namespace
            if (!attribute.getPrefix().isEmpty() && !"xml".equals(attribute.getPrefix()))
                required.put(attribute.getPrefix(), attribute.getNamespaceUri());
        }

        for (Map.Entry<String, String> entry : required.entrySet()) {
            if (scope.containsKey(entry.getKey()))
                continue;
            String inScope = lookup(scopes, entry.getKey());
            if (!entry.getValue().equals(inScope))
                scope.put(entry.getKey(), entry.getValue());
        }
        return scope;
    }

    private static String lookup(Deque<Map<String, String>> scopes, String prefix) {
        for (Map<String, String> scope : scopes) {
            String uri = scope.get(prefix);
            if (uri != null)
                return uri;
        }
        return null;
    }

    private static void appendOpen(StringBuilder sb, XmlEvent event, Map<String, String> namespaces) {
        sb.append('<').append(event.getQualifiedName());
        for (Map.Entry<String, String> entry : namespaces.entrySet()) {
            sb.append(entry.getKey().isEmpty() ? " xmlns" : " xmlns:" + entry.getKey()).append("=\"");
            escape(sb, entry.getValue(), true);
            sb.append('"');
        }
        for (XmlEvent.Attribute attribute : event.getAttributes()) {
            sb.append(' ').append(attribute.getQualifiedName()).append("=\"");
            escape(sb, attribute.getValue(), true);
            sb.append('"');
        }
        sb.append('>');
    }

    static void escape(StringBuilder sb, String text, boolean attribute) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append(attribute ? "&quot;" : "\"");
                    break;
                case '\n':
                    sb.append(attribute ? "&#10;" : "\n");
                    break;
                case '\t':
                    sb.append(attribute ? "&#9;" : "\t");
                    break;
                case '\r':
                    sb.append("&#13;");
                    break;
                default:
                    sb.append(c);
            }
        }
    }
}
