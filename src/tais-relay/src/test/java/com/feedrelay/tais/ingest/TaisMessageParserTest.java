package com.feedrelay.tais.ingest;

import static com.feedrelay.tais.TaisMessages.TOPIC;
import static com.feedrelay.tais.TaisMessages.message;
import static com.feedrelay.tais.TaisMessages.position;
import static com.feedrelay.tais.TaisMessages.record;
import static org.assertj.core.api.Assertions.assertThat;

import com.feedrelay.tais.config.TaisProperties;
import com.feedrelay.tais.model.TrackUpdate;
import org.junit.jupiter.api.Test;

class TaisMessageParserTest {
  private final TaisMessageParser parser = new TaisMessageParser(new TaisProperties());

  @Test
  void parsesTrackFlightPlanAndEnhancedBlocks() {
    String body = """
        <TATrackAndFlightPlan>
          <src>N90</src>
          <record>
            <track>
              <trackNum>1234</trackNum>
              <lat>40.6413</lat>
              <lon>-73.7781</lon>
              <reportedBeaconCode>4521</reportedBeaconCode>
              <reportedAltitude>3500</reportedAltitude>
              <vVert>-700</vVert>
              <frozen>0</frozen>
              <pseudo>1</pseudo>
              <acAddress>A1B2C3</acAddress>
              <vx>100</vx>
              <vy>0</vy>
            </track>
            <flightPlan>
              <acid>DAL123</acid>
              <acType>B738</acType>
              <flightRules>IFR</flightRules>
              <entryFix>CAMRN</entryFix>
              <exitFix>MERIT</exitFix>
              <assignedBeaconCode>4521</assignedBeaconCode>
              <requestedAltitude>350</requestedAltitude>
              <runway>31L</runway>
              <scratchPad1>ILS</scratchPad1>
              <scratchPad2>H</scratchPad2>
              <cps>2K</cps>
              <category>M</category>
              <eqptSuffix>L</eqptSuffix>
              <pendingHandoff>4A</pendingHandoff>
            </flightPlan>
            <enhancedData>
              <departureAirport>KJFK</departureAirport>
              <destinationAirport>KATL</destinationAirport>
            </enhancedData>
          </record>
        </TATrackAndFlightPlan>
        """;

    ParseResult result = parser.parse(TOPIC, body);

    assertThat(result.status()).isEqualTo(ParseResult.Status.ACCEPTED);
    assertThat(result.facility()).isEqualTo("N90");
    assertThat(result.skippedRecords()).isZero();
    assertThat(result.updates()).hasSize(1);

    TrackUpdate update = result.updates().get(0);
    assertThat(update.trackNum()).isEqualTo("1234");
    assertThat(update.lat()).isEqualTo(40.6413);
    assertThat(update.lon()).isEqualTo(-73.7781);
    assertThat(update.reportedSquawk()).isEqualTo("4521");
    assertThat(update.altitudeFeet()).isEqualTo(3500);
    assertThat(update.verticalRateFpm()).isEqualTo(-700);
    assertThat(update.frozen()).isFalse();
    assertThat(update.pseudo()).isTrue();
    assertThat(update.modeSCode()).isEqualTo("A1B2C3");
    assertThat(update.groundSpeedKnots()).isEqualTo(100);
    assertThat(update.groundTrackDegrees()).isEqualTo(90);

    TrackUpdate.FlightPlanFields fp = update.flightPlan();
    assertThat(fp.callsign()).isEqualTo("DAL123");
    assertThat(fp.aircraftType()).isEqualTo("B738");
    assertThat(fp.flightRules()).isEqualTo("IFR");
    assertThat(fp.entryFix()).isEqualTo("CAMRN");
    assertThat(fp.exitFix()).isEqualTo("MERIT");
    assertThat(fp.assignedSquawk()).isEqualTo("4521");
    assertThat(fp.requestedAltitude()).isEqualTo(350);
    assertThat(fp.runway()).isEqualTo("31L");
    assertThat(fp.scratchpad1()).isEqualTo("ILS");
    assertThat(fp.scratchpad2()).isEqualTo("H");
    assertThat(fp.owner()).isEqualTo("2K");
    assertThat(fp.wakeCategory()).isEqualTo("M");
    assertThat(fp.equipmentSuffix()).isEqualTo("L");
    assertThat(fp.pendingHandoff()).isEqualTo("4A");

    assertThat(update.enhanced().origin()).isEqualTo("KJFK");
    assertThat(update.enhanced().destination()).isEqualTo("KATL");
  }

  @Test
  void absentSubBlocksAndFieldsStayNull() {
    ParseResult result = parser.parse(TOPIC, message("N90", position("77", "40.0", "-73.0")));

    TrackUpdate update = result.updates().get(0);
    assertThat(update.flightPlan()).isNull();
    assertThat(update.enhanced()).isNull();
    assertThat(update.frozen()).isNull();
    assertThat(update.pseudo()).isNull();
    assertThat(update.altitudeFeet()).isNull();
    assertThat(update.groundSpeedKnots()).isNull();
    assertThat(update.groundTrackDegrees()).isNull();
  }

  @Test
  void skipsRecordsWithoutIdentityOrNumericPosition() {
    String body = message(
        "N90",
        position("1", "40.1", "-73.1"),
        "<record><track><lat>40.2</lat><lon>-73.2</lon></track></record>",
        position("3", "abc", "-73.3"),
        position("4", "40.4", ""),
        "<record><flightPlan><acid>AAL1</acid></flightPlan></record>",
        position("6", "NaN", "-73.6"));

    ParseResult result = parser.parse(TOPIC, body);

    assertThat(result.status()).isEqualTo(ParseResult.Status.ACCEPTED);
    assertThat(result.updates()).extracting(TrackUpdate::trackNum).containsExactly("1");
    assertThat(result.skippedRecords()).isEqualTo(5);
  }

  @Test
  void derivesSpeedAndHeadingFromVelocityComponents() {
    ParseResult result = parser.parse(TOPIC, message(
        "N90",
        record("1", "40", "-73", "<vx>-3</vx><vy>-4</vy>", ""),
        record("2", "40", "-73", "<vx>0</vx><vy>0</vy>", ""),
        record("3", "40", "-73", "<vx>fast</vx><vy>10</vy>", ""),
        record("4", "40", "-73", "<vx>250</vx>", "")));

    TrackUpdate southWest = result.updates().get(0);
    assertThat(southWest.groundSpeedKnots()).isEqualTo(5);
    assertThat(southWest.groundTrackDegrees()).isEqualTo(217);

    TrackUpdate stationary = result.updates().get(1);
    assertThat(stationary.groundSpeedKnots()).isZero();
    assertThat(stationary.groundTrackDegrees()).isNull();

    assertThat(result.updates().get(2).groundSpeedKnots()).isNull();
    assertThat(result.updates().get(2).groundTrackDegrees()).isNull();
    assertThat(result.updates().get(3).groundSpeedKnots()).isNull();
  }

  @Test
  void headingIsNormalizedIntoZeroTo360() {
    assertThat(TaisMessageParser.headingDegrees(0, 250)).isZero();
    assertThat(TaisMessageParser.headingDegrees(250, 0)).isEqualTo(90);
    assertThat(TaisMessageParser.headingDegrees(0, -250)).isEqualTo(180);
    assertThat(TaisMessageParser.headingDegrees(-250, 0)).isEqualTo(270);
    // -0.057 degrees rounds up to 360, which wraps to north.
    assertThat(TaisMessageParser.headingDegrees(-1, 1000)).isZero();
  }

  @Test
  void sentinelAndBlankValuesAreTreatedAsAbsent() {
    String fp = "<flightPlan>"
        + "<eqptSuffix>unavailable</eqptSuffix>"
        + "<category>unavailable</category>"
        + "<cps>unassigned</cps>"
        + "<runway>   </runway>"
        + "<scratchPad1></scratchPad1>"
        + "<scratchPad2> </scratchPad2>"
        + "<acid>JBU9</acid>"
        + "</flightPlan>";
    ParseResult result = parser.parse(TOPIC, message(
        "N90", record("9", "40", "-73", "<acAddress>000000</acAddress>", fp)));

    TrackUpdate update = result.updates().get(0);
    assertThat(update.modeSCode()).isNull();
    assertThat(update.flightPlan().equipmentSuffix()).isNull();
    assertThat(update.flightPlan().wakeCategory()).isNull();
    assertThat(update.flightPlan().owner()).isNull();
    assertThat(update.flightPlan().runway()).isNull();
    assertThat(update.flightPlan().scratchpad1()).isNull();
    assertThat(update.flightPlan().scratchpad2()).isNull();
    assertThat(update.flightPlan().callsign()).isEqualTo("JBU9");
  }

  @Test
  void sentinelsMatchOnlyTheExactLowercaseLiteral() {
    String fp = "<flightPlan>"
        + "<eqptSuffix>Unavailable</eqptSuffix>"
        + "<category>UNAVAILABLE</category>"
        + "<cps>UNASSIGNED</cps>"
        + "</flightPlan>";
    ParseResult result = parser.parse(TOPIC, message("N90", record("9", "40", "-73", "", fp)));

    TrackUpdate.FlightPlanFields plan = result.updates().get(0).flightPlan();
    assertThat(plan.equipmentSuffix()).isEqualTo("Unavailable");
    assertThat(plan.wakeCategory()).isEqualTo("UNAVAILABLE");
    assertThat(plan.owner()).isEqualTo("UNASSIGNED");
  }

  @Test
  void coordinatesMustBePlainDecimals() {
    ParseResult result = parser.parse(TOPIC, message(
        "N90",
        position("1", "0x1p3", "-73"),
        position("2", "40.5d", "-73"),
        position("3", "40", "-73f"),
        position("4", "4.05e1", "-7.3E+1"),
        position("5", "+40.", ".5")));

    assertThat(result.skippedRecords()).isEqualTo(3);
    assertThat(result.updates()).extracting(TrackUpdate::trackNum).containsExactly("4", "5");
    assertThat(result.updates().get(0).lat()).isEqualTo(40.5);
    assertThat(result.updates().get(0).lon()).isEqualTo(-73.0);
    assertThat(result.updates().get(1).lon()).isEqualTo(0.5);
  }

  @Test
  void singleUnparseableFieldDoesNotDropTheRecord() {
    ParseResult result = parser.parse(TOPIC, message(
        "N90",
        record("5", "40", "-73", "<reportedAltitude>3500.5</reportedAltitude><vVert>-300</vVert>", "")));

    TrackUpdate update = result.updates().get(0);
    assertThat(update.altitudeFeet()).isNull();
    assertThat(update.verticalRateFpm()).isEqualTo(-300);
  }

  @Test
  void flagsAreTrueOnlyForLiteralOne() {
    ParseResult result = parser.parse(TOPIC, message(
        "N90",
        record("1", "40", "-73", "<frozen>1</frozen><pseudo>true</pseudo>", "")));

    assertThat(result.updates().get(0).frozen()).isTrue();
    assertThat(result.updates().get(0).pseudo()).isFalse();
  }

  @Test
  void topicPrefixIsCaseInsensitive() {
    assertThat(parser.parse("tais/N90", message("N90", position("1", "40", "-73"))).status())
        .isEqualTo(ParseResult.Status.ACCEPTED);
    assertThat(parser.parse("ASDEX/KJFK", message("N90", position("1", "40", "-73"))).status())
        .isEqualTo(ParseResult.Status.IGNORED_TOPIC);
    assertThat(parser.parse(null, message("N90", position("1", "40", "-73"))).status())
        .isEqualTo(ParseResult.Status.IGNORED_TOPIC);
  }

  @Test
  void foreignRootElementIsIgnored() {
    ParseResult result = parser.parse(TOPIC, "<asdexMsg><src>KJFK</src></asdexMsg>");

    assertThat(result.status()).isEqualTo(ParseResult.Status.IGNORED_SCHEMA);
    assertThat(result.updates()).isEmpty();
  }

  @Test
  void malformedDocumentsAreReportedNotThrown() {
    ParseResult broken = parser.parse(TOPIC, "<TATrackAndFlightPlan><src>N90</src>");
    assertThat(broken.status()).isEqualTo(ParseResult.Status.MALFORMED);
    assertThat(broken.errorCategory()).isEqualTo("SAXParseException");

    ParseResult empty = parser.parse(TOPIC, "  ");
    assertThat(empty.status()).isEqualTo(ParseResult.Status.MALFORMED);

    ParseResult noFacility = parser.parse(TOPIC,
        "<TATrackAndFlightPlan>" + position("1", "40", "-73") + "</TATrackAndFlightPlan>");
    assertThat(noFacility.status()).isEqualTo(ParseResult.Status.MALFORMED);
    assertThat(noFacility.errorCategory()).isEqualTo("MissingFacility");
  }

  @Test
  void rejectsDoctypeDeclarations() {
    String body = "<?xml version=\"1.0\"?><!DOCTYPE x [<!ENTITY e \"boom\">]>"
        + "<TATrackAndFlightPlan><src>&e;</src></TATrackAndFlightPlan>";

    assertThat(parser.parse(TOPIC, body).status()).isEqualTo(ParseResult.Status.MALFORMED);
  }
}
