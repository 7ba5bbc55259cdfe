package com.feedrelay.tais.ingest;

import com.feedrelay.tais.config.TaisProperties;
import com.feedrelay.tais.model.TrackUpdate;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Normalizes a TAIS {@code TATrackAndFlightPlan} document into per-track field updates.
 *
 * <p>Field policy:
 * <ul>
 *   <li>records without a track number or a numeric lat/lon pair are skipped</li>
 *   <li>absent, blank and sentinel values ({@code unavailable}, {@code unassigned}, all-zero
 *       Mode S address) become {@code null}, meaning "keep the stored value"</li>
 *   <li>ground speed and track are derived from {@code vx}/{@code vy}</li>
 *   <li>a field that fails to parse is dropped on its own; the rest of the record still applies</li>
 * </ul>
 */
@Component
public class TaisMessageParser {
  private static final String UNAVAILABLE = "unavailable";
  private static final String UNASSIGNED = "unassigned";
  // Plain decimal with optional sign and exponent; no hex floats or type suffixes.
  private static final Pattern PLAIN_DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private final TaisProperties properties;
  private final DocumentBuilderFactory documentBuilderFactory;

  public TaisMessageParser(TaisProperties properties) {
    this.properties = properties;
    this.documentBuilderFactory = secureFactory();
  }

  /**
   * Parses one forwarded message.
   *
   * @param topic broker topic the message arrived on
   * @param body raw XML body
   * @return classification plus extracted updates; never {@code null}
   */
  public ParseResult parse(String topic, String body) {
    if (!hasTopicPrefix(topic)) {
      return ParseResult.ignored(ParseResult.Status.IGNORED_TOPIC);
    }
    if (body == null || body.isBlank()) {
      return ParseResult.malformed("EmptyBody", "message body is empty");
    }

    Element root;
    try {
      root = parseDocument(body).getDocumentElement();
    } catch (SAXException | IOException | ParserConfigurationException ex) {
      return ParseResult.malformed(ex.getClass().getSimpleName(), ex.getMessage());
    }

    if (root == null || !properties.getRootElement().equals(localName(root))) {
      return ParseResult.ignored(ParseResult.Status.IGNORED_SCHEMA);
    }

    String facility = text(root, "src");
    if (facility == null) {
      return ParseResult.malformed("MissingFacility", "message has no <src> facility code");
    }

    List<TrackUpdate> updates = new ArrayList<>();
    int skipped = 0;
    for (Element record : children(root, "record")) {
      TrackUpdate update = parseRecord(record);
      if (update == null) {
        skipped++;
      } else {
        updates.add(update);
      }
    }
    return ParseResult.accepted(facility, updates, skipped);
  }

  private boolean hasTopicPrefix(String topic) {
    String prefix = properties.getTopicPrefix();
    return topic != null && topic.regionMatches(true, 0, prefix, 0, prefix.length());
  }

  private TrackUpdate parseRecord(Element record) {
    Element track = child(record, "track");
    if (track == null) {
      return null;
    }
    String trackNum = text(track, "trackNum");
    Double lat = parseCoordinate(text(track, "lat"));
    Double lon = parseCoordinate(text(track, "lon"));
    if (trackNum == null || lat == null || lon == null) {
      return null;
    }

    Integer groundSpeed = null;
    Integer groundTrack = null;
    Integer vx = parseInt(text(track, "vx"));
    Integer vy = parseInt(text(track, "vy"));
    if (vx != null && vy != null) {
      double speedRaw = Math.sqrt((double) vx * vx + (double) vy * vy);
      groundSpeed = (int) Math.rint(speedRaw);
      if (speedRaw > 0) {
        groundTrack = headingDegrees(vx, vy);
      }
    }

    String modeS = text(track, "acAddress");
    if (modeS != null && modeS.chars().allMatch(c -> c == '0')) {
      modeS = null;
    }

    return new TrackUpdate(
        trackNum,
        lat,
        lon,
        text(track, "reportedBeaconCode"),
        parseInt(text(track, "reportedAltitude")),
        parseInt(text(track, "vVert")),
        parseFlag(text(track, "frozen")),
        parseFlag(text(track, "pseudo")),
        modeS,
        groundSpeed,
        groundTrack,
        parseFlightPlan(child(record, "flightPlan")),
        parseEnhanced(child(record, "enhancedData")));
  }

  private TrackUpdate.FlightPlanFields parseFlightPlan(Element fp) {
    if (fp == null) {
      return null;
    }
    return new TrackUpdate.FlightPlanFields(
        text(fp, "acid"),
        text(fp, "acType"),
        text(fp, "flightRules"),
        text(fp, "entryFix"),
        text(fp, "exitFix"),
        text(fp, "assignedBeaconCode"),
        parseInt(text(fp, "requestedAltitude")),
        text(fp, "runway"),
        text(fp, "scratchPad1"),
        text(fp, "scratchPad2"),
        unlessSentinel(text(fp, "cps"), UNASSIGNED),
        unlessSentinel(text(fp, "category"), UNAVAILABLE),
        unlessSentinel(text(fp, "eqptSuffix"), UNAVAILABLE),
        text(fp, "pendingHandoff"));
  }

  private TrackUpdate.EnhancedFields parseEnhanced(Element enhanced) {
    if (enhanced == null) {
      return null;
    }
    return new TrackUpdate.EnhancedFields(
        text(enhanced, "departureAirport"),
        text(enhanced, "destinationAirport"));
  }

  /** Compass heading of the velocity vector, rounded half-even into [0, 360). */
  static int headingDegrees(int vx, int vy) {
    double heading = Math.toDegrees(Math.atan2(vx, vy));
    if (heading < 0) {
      heading += 360.0;
    }
    return ((int) Math.rint(heading)) % 360;
  }

  static Integer parseInt(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  static Double parseCoordinate(String value) {
    if (value == null) {
      return null;
    }
    if (!PLAIN_DECIMAL.matcher(value).matches()) {
      return null;
    }
    try {
      double parsed = Double.parseDouble(value);
      return Double.isFinite(parsed) ? parsed : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  static Boolean parseFlag(String value) {
    return value == null ? null : "1".equals(value);
  }

  private static String unlessSentinel(String value, String sentinel) {
    return value == null || sentinel.equals(value) ? null : value;
  }

  private Document parseDocument(String body)
      throws ParserConfigurationException, SAXException, IOException {
    // DocumentBuilder is not thread-safe; the factory is. DefaultHandler keeps fatal errors
    // as exceptions without the stderr echo.
    DocumentBuilder builder = documentBuilderFactory.newDocumentBuilder();
    builder.setErrorHandler(new DefaultHandler());
    return builder.parse(new InputSource(new StringReader(body)));
  }

  private static DocumentBuilderFactory secureFactory() {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setExpandEntityReferences(false);
    try {
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    } catch (ParserConfigurationException ex) {
      throw new IllegalStateException("XML parser does not support secure processing", ex);
    }
    return factory;
  }

  private static String localName(Node node) {
    return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
  }

  private static Element child(Element parent, String name) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
        return (Element) node;
      }
    }
    return null;
  }

  private static List<Element> children(Element parent, String name) {
    List<Element> out = new ArrayList<>();
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
        out.add((Element) node);
      }
    }
    return out;
  }

  // Blank text is reported as absent.
  private static String text(Element parent, String name) {
    Element element = child(parent, name);
    if (element == null) {
      return null;
    }
    String value = element.getTextContent();
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.strip();
  }
}
