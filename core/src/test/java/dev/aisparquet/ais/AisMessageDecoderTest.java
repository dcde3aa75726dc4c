/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

import org.junit.jupiter.api.Test;

import dev.aisparquet.ais.AisMessage.ExtendedPositionReportClassB;
import dev.aisparquet.ais.AisMessage.PositionReportClassA;
import dev.aisparquet.ais.AisMessage.PositionReportClassB;
import dev.aisparquet.ais.AisMessage.StaticAndVoyageData;
import dev.aisparquet.ais.AisMessage.StaticDataReportPartA;
import dev.aisparquet.ais.AisMessage.StaticDataReportPartB;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AisMessageDecoderTest {

    @Test
    void testSupportedMessageTypes() {
        assertThat(AisMessageDecoder.isSupported(1)).isTrue();
        assertThat(AisMessageDecoder.isSupported(3)).isTrue();
        assertThat(AisMessageDecoder.isSupported(4)).isFalse();
        assertThat(AisMessageDecoder.isSupported(5)).isTrue();
        assertThat(AisMessageDecoder.isSupported(18)).isTrue();
        assertThat(AisMessageDecoder.isSupported(19)).isTrue();
        assertThat(AisMessageDecoder.isSupported(21)).isFalse();
        assertThat(AisMessageDecoder.isSupported(24)).isTrue();
    }

    @Test
    void testPositionReportClassA() {
        AisMessage message = AisMessageDecoder.decode(AisPayload.of("15RTgt0PAso;90TKcjM8h6g208CQ", 0));

        assertThat(message).isInstanceOf(PositionReportClassA.class);
        PositionReportClassA report = (PositionReportClassA) message;
        assertThat(report.messageType()).isEqualTo(1);
        assertThat(report.mmsi()).isEqualTo(371798000);
        assertThat(report.navigationStatus()).isZero();
        assertThat(report.rateOfTurn()).isEqualTo(-127);
        assertThat(report.speedOverGroundTenths()).isEqualTo(123);
        assertThat(report.positionAccuracy()).isTrue();
        assertThat(report.longitude10000thMins()).isEqualTo(-74037230);
        assertThat(report.latitude10000thMins()).isEqualTo(29028980);
        assertThat(report.courseOverGround10thDegrees()).isEqualTo(2240);
        assertThat(report.trueHeadingDegrees()).isEqualTo(215);
        assertThat(report.timeStampSecond()).isEqualTo(33);
    }

    @Test
    void testStaticAndVoyageData() {
        String payload = "55?MbV02;H;s<HtKR20EHE:0@T4@Dn2222222216L961O5Gf0NSQEp6ClRp8" + "88888888880";
        AisMessage message = AisMessageDecoder.decode(AisPayload.of(payload, 2));

        assertThat(message).isInstanceOf(StaticAndVoyageData.class);
        StaticAndVoyageData data = (StaticAndVoyageData) message;
        assertThat(data.mmsi()).isEqualTo(351759000);
        assertThat(data.imoNumber()).isEqualTo(9134270);
        assertThat(data.callSign().toString()).isEqualTo("3FOF8  ");
        assertThat(data.vesselName().toString()).startsWith("EVER DIADEM");
        assertThat(data.shipType()).isEqualTo(70);
        assertThat(data.dimensionToBow()).isEqualTo(225);
        assertThat(data.dimensionToStern()).isEqualTo(70);
        assertThat(data.dimensionToPort()).isEqualTo(1);
        assertThat(data.dimensionToStarboard()).isEqualTo(31);
        assertThat(data.positionFixType()).isEqualTo(1);
        assertThat(data.etaMonth()).isEqualTo(5);
        assertThat(data.etaDay()).isEqualTo(15);
        assertThat(data.etaHour()).isEqualTo(14);
        assertThat(data.etaMinute()).isZero();
        assertThat(data.draught10thMetres()).isEqualTo(122);
        assertThat(data.destination().toString()).startsWith("NEW YORK");
        assertThat(data.isDteNotReady()).isFalse();
    }

    @Test
    void testPositionReportClassB() {
        AisPayload payload = AisPayloadBuilder.messageType(18)
                .unsigned(1, 2)
                .unsigned(235000001, 30)
                .unsigned(7, 8)
                .unsigned(52, 10)
                .bool(false)
                .signed(-600000, 28)
                .signed(30000000, 27)
                .unsigned(900, 12)
                .unsigned(511, 9)
                .unsigned(60, 6)
                .unsigned(2, 2)
                .unsigned(1, 1)
                .bool(true)
                .bool(false)
                .bool(true)
                .bool(true)
                .bool(false)
                .bool(true)
                .unsigned(1, 1)
                .padTo(168)
                .build();

        PositionReportClassB report = (PositionReportClassB) AisMessageDecoder.decode(payload);

        assertThat(report.repeatIndicator()).isEqualTo(1);
        assertThat(report.mmsi()).isEqualTo(235000001);
        assertThat(report.regionalReserved38()).isEqualTo(7);
        assertThat(report.speedOverGroundTenths()).isEqualTo(52);
        assertThat(report.longitude10000thMins()).isEqualTo(-600000);
        assertThat(report.latitude10000thMins()).isEqualTo(30000000);
        assertThat(report.courseOverGround10thDegrees()).isEqualTo(900);
        assertThat(report.trueHeadingDegrees()).isEqualTo(511);
        assertThat(report.timeStampSecond()).isEqualTo(60);
        assertThat(report.regionalReserved139()).isEqualTo(2);
        assertThat(report.csUnit()).isEqualTo(1);
        assertThat(report.hasDisplay()).isTrue();
        assertThat(report.isDscAttached()).isFalse();
        assertThat(report.canSwitchBands()).isTrue();
        assertThat(report.canAcceptMessage22ChannelAssignment()).isTrue();
        assertThat(report.isAssigned()).isFalse();
        assertThat(report.raimFlag()).isTrue();
        assertThat(report.radioStatusType()).isEqualTo(1);
    }

    @Test
    void testExtendedPositionReportClassB() {
        AisPayload payload = AisPayloadBuilder.messageType(19)
                .unsigned(0, 2)
                .unsigned(244000123, 30)
                .unsigned(0, 8)
                .unsigned(15, 10)
                .bool(true)
                .signed(1000, 28)
                .signed(-2000, 27)
                .unsigned(100, 12)
                .unsigned(10, 9)
                .unsigned(5, 6)
                .unsigned(3, 4)
                .text("SEA BREEZE", 120)
                .unsigned(37, 8)
                .unsigned(10, 9)
                .unsigned(5, 9)
                .unsigned(2, 6)
                .unsigned(3, 6)
                .unsigned(1, 4)
                .bool(false)
                .bool(true)
                .bool(false)
                .unsigned(0, 4)
                .build();

        ExtendedPositionReportClassB report = (ExtendedPositionReportClassB) AisMessageDecoder.decode(payload);

        assertThat(report.mmsi()).isEqualTo(244000123);
        assertThat(report.positionAccuracy()).isTrue();
        assertThat(report.latitude10000thMins()).isEqualTo(-2000);
        assertThat(report.regionalReserved139()).isEqualTo(3);
        assertThat(report.shipName().toString()).isEqualTo("SEA BREEZE");
        assertThat(report.shipType()).isEqualTo(37);
        assertThat(report.dimensionToBow()).isEqualTo(10);
        assertThat(report.dimensionToStarboard()).isEqualTo(3);
        assertThat(report.positionFixType()).isEqualTo(1);
        assertThat(report.raimFlag()).isFalse();
        assertThat(report.isDteNotReady()).isTrue();
        assertThat(report.isAssigned()).isFalse();
    }

    @Test
    void testStaticDataReportParts() {
        AisPayload partA = AisPayloadBuilder.messageType(24)
                .unsigned(0, 2)
                .unsigned(211000002, 30)
                .unsigned(0, 2)
                .text("LITTLE WING", 120)
                .build();
        AisPayload partB = AisPayloadBuilder.messageType(24)
                .unsigned(0, 2)
                .unsigned(211000002, 30)
                .unsigned(1, 2)
                .unsigned(36, 8)
                .unsigned(0, 42)
                .text("DA1234", 42)
                .unsigned(8, 9)
                .unsigned(4, 9)
                .unsigned(1, 6)
                .unsigned(2, 6)
                .padTo(168)
                .build();

        StaticDataReportPartA a = (StaticDataReportPartA) AisMessageDecoder.decode(partA);
        assertThat(a.mmsi()).isEqualTo(211000002);
        assertThat(a.vesselName().toString()).isEqualTo("LITTLE WING");

        StaticDataReportPartB b = (StaticDataReportPartB) AisMessageDecoder.decode(partB);
        assertThat(b.shipType()).isEqualTo(36);
        assertThat(b.callSign().toString()).isEqualTo("DA1234");
        assertThat(b.dimensionToBow()).isEqualTo(8);
        assertThat(b.dimensionToStern()).isEqualTo(4);
        assertThat(b.dimensionToPort()).isEqualTo(1);
        assertThat(b.dimensionToStarboard()).isEqualTo(2);
    }

    @Test
    void testInvalidStaticDataReportPart() {
        AisPayload payload = AisPayloadBuilder.messageType(24)
                .unsigned(0, 32)
                .unsigned(2, 2)
                .padTo(168)
                .build();

        assertThatThrownBy(() -> AisMessageDecoder.decode(payload))
                .isInstanceOf(AisDecodingException.class)
                .hasMessageContaining("part number");
    }

    @Test
    void testTruncatedPayload() {
        AisPayload payload = AisPayloadBuilder.messageType(1).unsigned(0, 60).build();

        assertThatThrownBy(() -> AisMessageDecoder.decode(payload))
                .isInstanceOf(AisDecodingException.class);
    }

    @Test
    void testUnsupportedType() {
        AisPayload payload = AisPayloadBuilder.messageType(4).padTo(168).build();

        assertThatThrownBy(() -> AisMessageDecoder.decode(payload))
                .isInstanceOf(AisDecodingException.class)
                .hasMessageContaining("Unsupported message type: 4");
    }
}
