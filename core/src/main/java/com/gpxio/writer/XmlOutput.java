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
package com.gpxio.writer;

import com.ctc.wstx.stax.WstxInputFactory;
import com.gpxio.util.Helper;
import org.codehaus.stax2.XMLInputFactory2;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Adds line breaks and indentation to the output of a StAX writer, which writes everything into
 * one line otherwise.
 */
class XmlOutput {
    private static final XMLInputFactory INPUT_FACTORY = createInputFactory();
    private final XMLStreamWriter writer;
    private final int indent;
    // per open element: true if a child element was written
    private final Deque<Boolean> hasChildren = new ArrayDeque<>();

    XmlOutput(XMLStreamWriter writer, int indent) {
        this.writer = writer;
        this.indent = indent;
    }

    private static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory2.P_LAZY_PARSING, false);
        return factory;
    }

    XMLStreamWriter getWriter() {
        return writer;
    }

    void startElement(String name) throws XMLStreamException {
        newLine();
        writer.writeStartElement(name);
        hasChildren.push(false);
    }

    void endElement() throws XMLStreamException {
        if (hasChildren.pop()) {
            writeIndent(hasChildren.size());
        }
        writer.writeEndElement();
    }

    /**
     * Writes an element without children. Attributes can be added until the next element is
     * started.
     */
    void emptyElement(String name) throws XMLStreamException {
        newLine();
        writer.writeEmptyElement(name);
    }

    void attribute(String name, String value) throws XMLStreamException {
        writer.writeAttribute(name, value);
    }

    void textElement(String name, String text) throws XMLStreamException {
        newLine();
        writer.writeStartElement(name);
        writer.writeCharacters(text);
        writer.writeEndElement();
    }

    void textElementIfExists(String name, String text) throws XMLStreamException {
        if (text != null)
            textElement(name, text);
    }

    void decimalElementIfExists(String name, Double value) throws XMLStreamException {
        if (value != null)
            textElement(name, Helper.toDecimalString(value));
    }

    void integerElementIfExists(String name, Integer value) throws XMLStreamException {
        if (value != null)
            textElement(name, Integer.toString(value));
    }

    /**
     * Writes the specified XML fragment as content of a new element. The fragment must be
     * well-formed and declare the namespace prefixes it uses.
     */
    void fragmentElement(String name, String xml) throws XMLStreamException {
        startElement(name);
        hasChildren.pop();
        hasChildren.push(true);
        writeIndent(hasChildren.size());
        copy(xml);
        endElement();
    }

    private void copy(String xml) throws XMLStreamException {
        XMLStreamReader reader = INPUT_FACTORY.createXMLStreamReader(new StringReader("<fragment>" + xml + "</fragment>"));
        try {
            reader.nextTag();
            int depth = 0;
            while (reader.hasNext()) {
                switch (reader.next()) {
                    case XMLStreamConstants.START_ELEMENT:
                        copyStartElement(reader);
                        depth++;
                        break;
                    case XMLStreamConstants.END_ELEMENT:
                        if (depth == 0)
                            return;
                        writer.writeEndElement();
                        depth--;
                        break;
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA:
                    case XMLStreamConstants.SPACE:
                        writer.writeCharacters(reader.getText());
                        break;
                    case XMLStreamConstants.COMMENT:
                        writer.writeComment(reader.getText());
                        break;
                    default:
                        break;
                }
            }
        } finally {
            reader.close();
        }
    }

    private void copyStartElement(XMLStreamReader reader) throws XMLStreamException {
        String prefix = reader.getPrefix();
        String uri = reader.getNamespaceURI();
        writer.writeStartElement(prefix == null ? "" : prefix, reader.getLocalName(), uri == null ? "" : uri);
        for (int i = 0; i < reader.getNamespaceCount(); i++) {
            String nsPrefix = reader.getNamespacePrefix(i);
            String nsUri = reader.getNamespaceURI(i);
            if (Helper.isEmpty(nsPrefix))
                writer.writeDefaultNamespace(nsUri == null ? "" : nsUri);
            else
                writer.writeNamespace(nsPrefix, nsUri);
        }
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            String attrPrefix = reader.getAttributePrefix(i);
            if (Helper.isEmpty(attrPrefix))
                writer.writeAttribute(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
            else
                writer.writeAttribute(attrPrefix, reader.getAttributeNamespace(i), reader.getAttributeLocalName(i),
                        reader.getAttributeValue(i));
        }
    }

    private void newLine() throws XMLStreamException {
        if (!hasChildren.isEmpty() && !hasChildren.peek()) {
            hasChildren.pop();
            hasChildren.push(true);
        }
        writeIndent(hasChildren.size());
    }

    private void writeIndent(int depth) throws XMLStreamException {
        if (indent <= 0)
            return;
        StringBuilder sb = new StringBuilder(1 + depth * indent);
        sb.append('\n');
        for (int i = 0; i < depth * indent; i++) {
            sb.append(' ');
        }
        writer.writeCharacters(sb.toString());
    }
}
