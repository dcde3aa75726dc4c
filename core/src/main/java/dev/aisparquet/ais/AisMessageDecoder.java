/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

import dev.aisparquet.ais.AisMessage.ExtendedPositionReportClassB;
import dev.aisparquet.ais.AisMessage.PositionReportClassA;
import dev.aisparquet.ais.AisMessage.PositionReportClassB;
import dev.aisparquet.ais.AisMessage.StaticAndVoyageData;
import dev.aisparquet.ais.AisMessage.StaticDataReportPartA;
import dev.aisparquet.ais.AisMessage.StaticDataReportPartB;

/**
 * Decodes AIS payloads of the supported message kinds into {@link AisMessage} records.
 * Bit offsets follow ITU-R M.1371.
 */
public final class AisMessageDecoder {

    private AisMessageDecoder() {
    }

    /**
     * Whether messages of the given type can be decoded.
     */
    public static boolean isSupported(int messageType) {
        return (messageType >= 1 && messageType <= 3)
                || messageType == 5
                || messageType == 18
                || messageType == 19
                || messageType == 24;
    }

    /**
     * Decodes all fields of the message. Either every field is decoded or an exception is thrown.
     *
     * @throws AisDecodingException if the message type is not supported or the payload is too short
     */
    public static AisMessage decode(AisPayload payload) {
        int messageType = payload.messageType();
        return switch (messageType) {
            case 1, 2, 3 -> decodePositionReportClassA(payload, messageType);
            case 5 -> decodeStaticAndVoyageData(payload, messageType);
            case 18 -> decodePositionReportClassB(payload, messageType);
            case 19 -> decodeExtendedPositionReportClassB(payload, messageType);
            case 24 -> decodeStaticDataReport(payload, messageType);
            default -> throw new AisDecodingException("Unsupported message type: " + messageType);
        };
    }

    private static PositionReportClassA decodePositionReportClassA(AisPayload p, int messageType) {
        return new PositionReportClassA(
                messageType,
                p.getUnsigned(6, 2),
                p.getUnsigned(8, 30),
                p.getUnsigned(38, 4),
                p.getSigned(42, 8),
                p.getUnsigned(50, 10),
                p.getBoolean(60),
                p.getSigned(61, 28),
                p.getSigned(89, 27),
                p.getUnsigned(116, 12),
                p.getUnsigned(128, 9),
                p.getUnsigned(137, 6),
                p.getUnsigned(143, 2),
                p.getUnsigned(145, 3),
                p.getBoolean(148),
                p.getUnsigned(149, 2),
                p.getUnsigned(151, 3),
                p.getUnsigned(154, 14));
    }

    private static StaticAndVoyageData decodeStaticAndVoyageData(AisPayload p, int messageType) {
        return new StaticAndVoyageData(
                messageType,
                p.getUnsigned(6, 2),
                p.getUnsigned(8, 30),
                p.getUnsigned(38, 2),
                p.getUnsigned(40, 30),
                p.getText(70, 42),
                p.getText(112, 120),
                p.getUnsigned(232, 8),
                p.getUnsigned(240, 9),
                p.getUnsigned(249, 9),
                p.getUnsigned(258, 6),
                p.getUnsigned(264, 6),
                p.getUnsigned(270, 4),
                p.getUnsigned(274, 4),
                p.getUnsigned(278, 5),
                p.getUnsigned(283, 5),
                p.getUnsigned(288, 6),
                p.getUnsigned(294, 8),
                p.getText(302, 120),
                p.getBoolean(422),
                p.getUnsigned(423, 1));
    }

    private static PositionReportClassB decodePositionReportClassB(AisPayload p, int messageType) {
        return new PositionReportClassB(
                messageType,
                p.getUnsigned(6, 2),
                p.getUnsigned(8, 30),
                p.getUnsigned(38, 8),
                p.getUnsigned(46, 10),
                p.getBoolean(56),
                p.getSigned(57, 28),
                p.getSigned(85, 27),
                p.getUnsigned(112, 12),
                p.getUnsigned(124, 9),
                p.getUnsigned(133, 6),
                p.getUnsigned(139, 2),
                p.getUnsigned(141, 1),
                p.getBoolean(142),
                p.getBoolean(143),
                p.getBoolean(144),
                p.getBoolean(145),
                p.getBoolean(146),
                p.getBoolean(147),
                p.getUnsigned(148, 1));
    }

    private static ExtendedPositionReportClassB decodeExtendedPositionReportClassB(AisPayload p, int messageType) {
        return new ExtendedPositionReportClassB(
                messageType,
                p.getUnsigned(6, 2),
                p.getUnsigned(8, 30),
                p.getUnsigned(38, 8),
                p.getUnsigned(46, 10),
                p.getBoolean(56),
                p.getSigned(57, 28),
                p.getSigned(85, 27),
                p.getUnsigned(112, 12),
                p.getUnsigned(124, 9),
                p.getUnsigned(133, 6),
                p.getUnsigned(139, 4),
                p.getText(143, 120),
                p.getUnsigned(263, 8),
                p.getUnsigned(271, 9),
                p.getUnsigned(280, 9),
                p.getUnsigned(289, 6),
                p.getUnsigned(295, 6),
                p.getUnsigned(301, 4),
                p.getBoolean(305),
                p.getBoolean(306),
                p.getBoolean(307),
                p.getUnsigned(308, 4));
    }

    private static AisMessage decodeStaticDataReport(AisPayload p, int messageType) {
        int partNumber = p.getUnsigned(38, 2);
        if (partNumber == 0) {
            return new StaticDataReportPartA(
                    messageType,
                    p.getUnsigned(6, 2),
                    p.getUnsigned(8, 30),
                    p.getText(40, 120));
        }
        else if (partNumber == 1) {
            return new StaticDataReportPartB(
                    messageType,
                    p.getUnsigned(6, 2),
                    p.getUnsigned(8, 30),
                    p.getUnsigned(40, 8),
                    p.getText(90, 42),
                    p.getUnsigned(132, 9),
                    p.getUnsigned(141, 9),
                    p.getUnsigned(150, 6),
                    p.getUnsigned(156, 6));
        }
        throw new AisDecodingException("Invalid static data report part number: " + partNumber);
    }
}
