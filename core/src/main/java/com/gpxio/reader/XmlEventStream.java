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

import com.ctc.wstx.stax.WstxInputFactory;
import com.gpxio.util.exceptions.GpxXmlException;
import org.codehaus.stax2.XMLInputFactory2;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.Closeable;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a StAX reader into a forward-only, one-event-lookahead sequence of {@link XmlEvent}s.
 * Comments, processing instructions, the DTD and the document start and end are skipped.
 */
public class XmlEventStream implements Closeable {
    private final XMLStreamReader parser;
    private XmlEvent peeked;

    public XmlEventStream(XMLStreamReader parser) {
        this.parser = parser;
    }

    public static XmlEventStream of(InputStream in) throws GpxXmlException {
        try {
            return new XmlEventStream(createInputFactory().createXMLStreamReader(in));
        } catch (XMLStreamException ex) {
            throw new GpxXmlException("cannot open XML input", ex);
        }
    }

    public static XmlEventStream of(Reader reader) throws GpxXmlException {
        try {
            return new XmlEventStream(createInputFactory().createXMLStreamReader(reader));
        } catch (XMLStreamException ex) {
            throw new GpxXmlException("cannot open XML input", ex);
        }
    }

    static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        // report malformed content in next() and not later in getText()
        factory.setProperty(XMLInputFactory2.P_LAZY_PARSING, false);
        return factory;
    }

    /**
     * @return the next event without consuming it or null if the document is exhausted
     */
    public XmlEvent peek() throws GpxXmlException {
        if (peeked == null)
            peeked = readNext();
        return peeked;
    }

    /**
     * @return the next event or null if the document is exhausted
     */
    public XmlEvent next() throws GpxXmlException {
        XmlEvent event = peek();
        peeked = null;
        return event;
    }

    private XmlEvent readNext() throws GpxXmlException {
        try {
            while (parser.hasNext()) {
                int event = parser.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT:
                        return createOpen();
                    case XMLStreamConstants.END_ELEMENT:
                        return XmlEvent.close(parser.getLocalName(), parser.getPrefix());
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA:
                    case XMLStreamConstants.SPACE:
                        return XmlEvent.text(parser.getText());
                    default:
                        // comments, processing instructions, DTD
                        break;
                }
            }
            return null;
        } catch (XMLStreamException ex) {
            throw new GpxXmlException("error while parsing XML", ex);
        }
    }

    private XmlEvent createOpen() {
        Map<String, String> namespaces = Collections.emptyMap();
        int namespaceCount = parser.getNamespaceCount();
        if (namespaceCount > 0) {
            namespaces = new LinkedHashMap<>(namespaceCount);
            for (int i = 0; i < namespaceCount; i++) {
                String prefix = parser.getNamespacePrefix(i);
                String uri = parser.getNamespaceURI(i);
                namespaces.put(prefix == null ? "" : prefix, uri == null ? "" : uri);
            }
        }

        List<XmlEvent.Attribute> attributes = Collections.emptyList();
        int attributeCount = parser.getAttributeCount();
        if (attributeCount > 0) {
            attributes = new ArrayList<>(attributeCount);
            for (int i = 0; i < attributeCount; i++) {
                attributes.add(new XmlEvent.Attribute(parser.getAttributeLocalName(i), parser.getAttributePrefix(i),
                        parser.getAttributeNamespace(i), parser.getAttributeValue(i)));
            }
        }
        return XmlEvent.open(parser.getLocalName(), parser.getPrefix(), parser.getNamespaceURI(), namespaces, attributes);
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (XMLStreamException ex) {
            throw new IllegalStateException("cannot close XML reader", ex);
        }
    }
}
