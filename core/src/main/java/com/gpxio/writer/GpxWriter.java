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

import com.ctc.wstx.stax.WstxOutputFactory;
import com.gpxio.Bounds;
import com.gpxio.Copyright;
import com.gpxio.Gpx;
import com.gpxio.GpxConfig;
import com.gpxio.GpxVersion;
import com.gpxio.Link;
import com.gpxio.Metadata;
import com.gpxio.Person;
import com.gpxio.Route;
import com.gpxio.Track;
import com.gpxio.TrackSegment;
import com.gpxio.Waypoint;
import com.gpxio.util.Helper;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.GpxXmlException;
import com.gpxio.util.exceptions.InvalidValueException;
import com.gpxio.util.exceptions.UnknownVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Writes a {@link Gpx} as GPX 1.0 or 1.1 document, depending on its version. The written
 * document reads back into an equal {@link Gpx}.
 * <p>
 * Some information has no place in GPX 1.0 and is dropped: metadata links, copyright and
 * extensions, all but the first link of points, tracks and routes, and the type of links.
 * Speed and course of points exist in GPX 1.0 only and are dropped for GPX 1.1.
 */
public class GpxWriter {
    private static final Logger logger = LoggerFactory.getLogger(GpxWriter.class);
    private final GpxConfig config;
    private final XMLOutputFactory factory = new WstxOutputFactory();

    public GpxWriter() {
        this(new GpxConfig());
    }

    public GpxWriter(GpxConfig config) {
        this.config = config;
    }

    /**
     * Writes the document UTF-8 encoded. The stream is flushed but not closed.
     */
    public void write(Gpx gpx, OutputStream out) throws GpxException {
        try {
            XMLStreamWriter writer = factory.createXMLStreamWriter(out, "UTF-8");
            writer.writeStartDocument("UTF-8", "1.0");
            writeDocument(gpx, writer);
        } catch (XMLStreamException ex) {
            throw new GpxXmlException("cannot write GPX", ex);
        }
    }

    /**
     * Writes the document. The writer is flushed but not closed.
     */
    public void write(Gpx gpx, Writer out) throws GpxException {
        try {
            XMLStreamWriter writer = factory.createXMLStreamWriter(out);
            writer.writeStartDocument("1.0");
            writeDocument(gpx, writer);
        } catch (XMLStreamException ex) {
            throw new GpxXmlException("cannot write GPX", ex);
        }
    }

    /**
     * Writes the gpx element into a StAX writer owned by the caller, the start and end of the
     * document are left to the caller. The writer must not repair namespaces.
     */
    public void write(Gpx gpx, XMLStreamWriter writer) throws GpxException {
        try {
            writeGpx(gpx, new XmlOutput(writer, config.getIndent()));
        } catch (XMLStreamException ex) {
            throw new GpxXmlException("cannot write GPX", ex);
        }
    }

    public String toXml(Gpx gpx) throws GpxException {
        StringWriter sw = new StringWriter();
        write(gpx, sw);
        return sw.toString();
    }

    private void writeDocument(Gpx gpx, XMLStreamWriter writer) throws GpxException, XMLStreamException {
        XmlOutput out = new XmlOutput(writer, config.getIndent());
        writeGpx(gpx, out);
        if (config.getIndent() > 0)
            writer.writeCharacters("\n");
        writer.writeEndDocument();
        writer.flush();
        writer.close();
    }

    private void writeGpx(Gpx gpx, XmlOutput out) throws GpxException, XMLStreamException {
        GpxVersion version = gpx.getVersion();
        if (version == GpxVersion.UNKNOWN)
            throw new UnknownVersionException(version.name());

        out.startElement("gpx");
        out.getWriter().writeDefaultNamespace(version.getNamespace());
        out.attribute("version", version.getValue());
        out.attribute("creator", gpx.getCreator() == null ? config.getCreator() : gpx.getCreator());

        Metadata metadata = gpx.getMetadata();
        if (metadata != null) {
            if (version == GpxVersion.GPX10)
                writeFlatMetadata(metadata, out);
            else
                writeMetadata(metadata, out);
        }

        for (Waypoint waypoint : gpx.getWaypoints()) {
            writeWaypoint("wpt", waypoint, version, out);
        }
        for (Route route : gpx.getRoutes()) {
            writeRoute(route, version, out);
        }
        for (Track track : gpx.getTracks()) {
            writeTrack(track, version, out);
        }
        writeExtensions(gpx.getExtensions(), out);
        out.endElement();

        if (logger.isDebugEnabled())
            logger.debug("wrote GPX " + version.getValue() + " with " + gpx.getWaypoints().size() + " waypoints, "
                    + gpx.getTracks().size() + " tracks, " + gpx.getRoutes().size() + " routes");
    }

    private void writeMetadata(Metadata metadata, XmlOutput out) throws GpxException, XMLStreamException {
        out.startElement("metadata");
        out.textElementIfExists("name", metadata.getName());
        out.textElementIfExists("desc", metadata.getDescription());
        if (metadata.getAuthor() != null)
            writePerson("author", metadata.getAuthor(), out);
        if (metadata.getCopyright() != null)
            writeCopyright(metadata.getCopyright(), out);
        writeLinks(metadata.getLinks(), GpxVersion.GPX11, out);
        writeTimeIfExists(metadata.getTime(), out);
        out.textElementIfExists("keywords", metadata.getKeywords());
        if (metadata.getBounds() != null)
            writeBounds(metadata.getBounds(), out);
        writeExtensions(metadata.getExtensions(), out);
        out.endElement();
    }

    /**
     * GPX 1.0 has no metadata element, its fields are children of the gpx element.
     */
    private void writeFlatMetadata(Metadata metadata, XmlOutput out) throws GpxException, XMLStreamException {
        out.textElementIfExists("name", metadata.getName());
        out.textElementIfExists("desc", metadata.getDescription());
        Person author = metadata.getAuthor();
        if (author != null) {
            out.textElementIfExists("author", author.getName());
            if (author.getEmail() != null) {
                splitEmail(author.getEmail());
                out.textElement("email", author.getEmail());
            }
            writeLinks(author.getLink() == null ? null : Collections.singletonList(author.getLink()),
                    GpxVersion.GPX10, out);
        }
        writeTimeIfExists(metadata.getTime(), out);
        out.textElementIfExists("keywords", metadata.getKeywords());
        if (metadata.getBounds() != null)
            writeBounds(metadata.getBounds(), out);
    }

    private void writePerson(String tag, Person person, XmlOutput out) throws GpxException, XMLStreamException {
        out.startElement(tag);
        out.textElementIfExists("name", person.getName());
        if (person.getEmail() != null) {
            String[] email = splitEmail(person.getEmail());
            out.emptyElement("email");
            out.attribute("id", email[0]);
            out.attribute("domain", email[1]);
        }
        if (person.getLink() != null)
            writeLink(person.getLink(), out);
        out.endElement();
    }

    /**
     * @return id and domain of the address
     */
    static String[] splitEmail(String email) throws InvalidValueException {
        String[] parts = email.split("@", -1);
        if (parts.length != 2)
            throw new InvalidValueException("email address must contain exactly one @: " + email, "email", email);
        return parts;
    }

    private void writeCopyright(Copyright copyright, XmlOutput out) throws XMLStreamException {
        out.startElement("copyright");
        if (copyright.getAuthor() != null)
            out.attribute("author", copyright.getAuthor());
        if (copyright.getYear() != null)
            out.textElement("year", String.format(Locale.ROOT, "%04d", copyright.getYear()));
        out.textElementIfExists("license", copyright.getLicense());
        out.endElement();
    }

    /**
     * GPX 1.1 has any number of link elements, GPX 1.0 a single url and urlname.
     */
    private void writeLinks(List<Link> links, GpxVersion version, XmlOutput out) throws XMLStreamException {
        if (links == null || links.isEmpty())
            return;
        if (version == GpxVersion.GPX10) {
            Link link = links.get(0);
            out.textElement("url", link.getHref());
            out.textElementIfExists("urlname", link.getText());
            return;
        }
        for (Link link : links) {
            writeLink(link, out);
        }
    }

    private void writeLink(Link link, XmlOutput out) throws XMLStreamException {
        out.startElement("link");
        out.attribute("href", link.getHref());
        out.textElementIfExists("text", link.getText());
        out.textElementIfExists("type", link.getType());
        out.endElement();
    }

    private void writeBounds(Bounds bounds, XmlOutput out) throws XMLStreamException {
        out.emptyElement("bounds");
        out.attribute("minlat", Helper.toDecimalString(bounds.getMinLat()));
        out.attribute("minlon", Helper.toDecimalString(bounds.getMinLon()));
        out.attribute("maxlat", Helper.toDecimalString(bounds.getMaxLat()));
        out.attribute("maxlon", Helper.toDecimalString(bounds.getMaxLon()));
    }

    private void writeTimeIfExists(OffsetDateTime time, XmlOutput out) throws XMLStreamException {
        if (time != null)
            out.textElement("time", formatTime(time));
    }

    static String formatTime(OffsetDateTime time) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(time.withOffsetSameInstant(ZoneOffset.UTC));
    }

    private void writeExtensions(String extensions, XmlOutput out) throws XMLStreamException {
        if (!Helper.isEmpty(extensions))
            out.fragmentElement("extensions", extensions);
    }

    private void writeWaypoint(String tag, Waypoint point, GpxVersion version, XmlOutput out) throws XMLStreamException {
        out.startElement(tag);
        out.attribute("lat", Helper.toDecimalString(point.getLat()));
        out.attribute("lon", Helper.toDecimalString(point.getLon()));
        out.decimalElementIfExists("ele", point.getElevation());
        writeTimeIfExists(point.getTime(), out);
        if (version == GpxVersion.GPX10) {
            out.decimalElementIfExists("course", point.getCourse());
            out.decimalElementIfExists("speed", point.getSpeed());
        }
        out.decimalElementIfExists("magvar", point.getMagneticVariation());
        out.decimalElementIfExists("geoidheight", point.getGeoidHeight());
        out.textElementIfExists("name", point.getName());
        out.textElementIfExists("cmt", point.getComment());
        out.textElementIfExists("desc", point.getDescription());
        out.textElementIfExists("src", point.getSource());
        writeLinks(point.getLinks(), version, out);
        out.textElementIfExists("sym", point.getSymbol());
        out.textElementIfExists("type", point.getType());
        if (point.getFix() != null)
            out.textElement("fix", point.getFix().getValue());
        out.integerElementIfExists("sat", point.getSatellites());
        out.decimalElementIfExists("hdop", point.getHdop());
        out.decimalElementIfExists("vdop", point.getVdop());
        out.decimalElementIfExists("pdop", point.getPdop());
        out.decimalElementIfExists("ageofdgpsdata", point.getAgeOfDgpsData());
        out.integerElementIfExists("dgpsid", point.getDgpsId());
        writeExtensions(point.getExtensions(), out);
        out.endElement();
    }

    private void writeTrack(Track track, GpxVersion version, XmlOutput out) throws XMLStreamException {
        out.startElement("trk");
        out.textElementIfExists("name", track.getName());
        out.textElementIfExists("cmt", track.getComment());
        out.textElementIfExists("desc", track.getDescription());
        out.textElementIfExists("src", track.getSource());
        writeLinks(track.getLinks(), version, out);
        out.integerElementIfExists("number", track.getNumber());
        out.textElementIfExists("type", track.getType());
        writeExtensions(track.getExtensions(), out);
        for (TrackSegment segment : track.getSegments()) {
            out.startElement("trkseg");
            for (Waypoint point : segment.getPoints()) {
                writeWaypoint("trkpt", point, version, out);
            }
            writeExtensions(segment.getExtensions(), out);
            out.endElement();
        }
        out.endElement();
    }

    private void writeRoute(Route route, GpxVersion version, XmlOutput out) throws XMLStreamException {
        out.startElement("rte");
        out.textElementIfExists("name", route.getName());
        out.textElementIfExists("cmt", route.getComment());
        out.textElementIfExists("desc", route.getDescription());
        out.textElementIfExists("src", route.getSource());
        writeLinks(route.getLinks(), version, out);
        out.integerElementIfExists("number", route.getNumber());
        out.textElementIfExists("type", route.getType());
        writeExtensions(route.getExtensions(), out);
        for (Waypoint point : route.getPoints()) {
            writeWaypoint("rtept", point, version, out);
        }
        out.endElement();
    }

    public GpxConfig getConfig() {
        return config;
    }
}
