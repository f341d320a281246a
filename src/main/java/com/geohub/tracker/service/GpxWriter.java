package com.geohub.tracker.service;

import com.geohub.tracker.entity.GeoPoint;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders points as a GPX 1.1 document: one track, one segment, one
 * {@code trkpt} per point in the given order.
 */
public final class GpxWriter {

    public static final String GPX_NAMESPACE = "http://www.topografix.com/GPX/1/1";
    public static final String MEDIA_TYPE = "application/gpx+xml";

    private static final String CREATOR = "GeoHub Tracker";
    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();

    private GpxWriter() {
    }

    public static String write(String trackName, List<GeoPoint> points) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = OUTPUT_FACTORY.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("gpx");
            xml.writeDefaultNamespace(GPX_NAMESPACE);
            xml.writeAttribute("version", "1.1");
            xml.writeAttribute("creator", CREATOR);

            xml.writeStartElement("trk");
            writeText(xml, "name", trackName);
            xml.writeStartElement("trkseg");
            for (GeoPoint point : points) {
                writePoint(xml, point);
            }
            xml.writeEndElement(); // trkseg
            xml.writeEndElement(); // trk

            xml.writeEndElement(); // gpx
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Could not render GPX for " + trackName, e);
        }
        return out.toString();
    }

    private static void writePoint(XMLStreamWriter xml, GeoPoint point) throws XMLStreamException {
        xml.writeStartElement("trkpt");
        xml.writeAttribute("lat", String.valueOf(point.getLatitude() == null ? 0.0 : point.getLatitude()));
        xml.writeAttribute("lon", String.valueOf(point.getLongitude() == null ? 0.0 : point.getLongitude()));
        if (point.getElevation() != null) {
            writeText(xml, "ele", String.valueOf(point.getElevation()));
        }
        if (point.getTime() != null) {
            writeText(xml, "time", DateTimeFormatter.ISO_INSTANT.format(point.getTime()));
        }
        if (point.getNote() != null) {
            writeText(xml, "desc", point.getNote());
        }
        if (point.getSpeed() != null) {
            // GPX 1.1 has no speed element in the base schema
            xml.writeStartElement("extensions");
            writeText(xml, "speed", String.valueOf(point.getSpeed()));
            xml.writeEndElement();
        }
        xml.writeEndElement();
    }

    private static void writeText(XMLStreamWriter xml, String element, String text) throws XMLStreamException {
        xml.writeStartElement(element);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }
}
