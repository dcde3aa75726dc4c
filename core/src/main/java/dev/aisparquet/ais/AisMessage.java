/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

/**
 * A decoded AIS message. One record per supported message kind, carrying exactly the
 * fields that kind transmits, in their raw integer units (e.g. latitude in 1/10000 minutes).
 */
public sealed interface AisMessage {

    int messageType();

    int repeatIndicator();

    int mmsi();

    /**
     * Position report of a Class A transponder, message types 1, 2 and 3.
     */
    record PositionReportClassA(
            int messageType,
            int repeatIndicator,
            int mmsi,
            int navigationStatus,
            int rateOfTurn,
            int speedOverGroundTenths,
            boolean positionAccuracy,
            int longitude10000thMins,
            int latitude10000thMins,
            int courseOverGround10thDegrees,
            int trueHeadingDegrees,
            int timeStampSecond,
            int manoeuvreIndicator,
            int spareBits145,
            boolean raimFlag,
            int radioSyncState,
            int radioSlotTimeout,
            int radioSubMessage) implements AisMessage {
    }

    /**
     * Static and voyage related data, message type 5.
     */
    record StaticAndVoyageData(
            int messageType,
            int repeatIndicator,
            int mmsi,
            int aisVersion,
            int imoNumber,
            AisTextField callSign,
            AisTextField vesselName,
            int shipType,
            int dimensionToBow,
            int dimensionToStern,
            int dimensionToPort,
            int dimensionToStarboard,
            int positionFixType,
            int etaMonth,
            int etaDay,
            int etaHour,
            int etaMinute,
            int draught10thMetres,
            AisTextField destination,
            boolean isDteNotReady,
            int spare423) implements AisMessage {
    }

    /**
     * Standard position report of a Class B transponder, message type 18.
     */
    record PositionReportClassB(
            int messageType,
            int repeatIndicator,
            int mmsi,
            int regionalReserved38,
            int speedOverGroundTenths,
            boolean positionAccuracy,
            int longitude10000thMins,
            int latitude10000thMins,
            int courseOverGround10thDegrees,
            int trueHeadingDegrees,
            int timeStampSecond,
            int regionalReserved139,
            int csUnit,
            boolean hasDisplay,
            boolean isDscAttached,
            boolean canSwitchBands,
            boolean canAcceptMessage22ChannelAssignment,
            boolean isAssigned,
            boolean raimFlag,
            int radioStatusType) implements AisMessage {
    }

    /**
     * Extended position report of a Class B transponder, message type 19.
     */
    record ExtendedPositionReportClassB(
            int messageType,
            int repeatIndicator,
            int mmsi,
            int regionalReserved38,
            int speedOverGroundTenths,
            boolean positionAccuracy,
            int longitude10000thMins,
            int latitude10000thMins,
            int courseOverGround10thDegrees,
            int trueHeadingDegrees,
            int timeStampSecond,
            int regionalReserved139,
            AisTextField shipName,
            int shipType,
            int dimensionToBow,
            int dimensionToStern,
            int dimensionToPort,
            int dimensionToStarboard,
            int positionFixType,
            boolean raimFlag,
            boolean isDteNotReady,
            boolean isAssigned,
            int spare308) implements AisMessage {
    }

    /**
     * Static data report part A (vessel name), message type 24.
     */
    record StaticDataReportPartA(
            int messageType,
            int repeatIndicator,
            int mmsi,
            AisTextField vesselName) implements AisMessage {
    }

    /**
     * Static data report part B (ship type, call sign and dimensions), message type 24.
     */
    record StaticDataReportPartB(
            int messageType,
            int repeatIndicator,
            int mmsi,
            int shipType,
            AisTextField callSign,
            int dimensionToBow,
            int dimensionToStern,
            int dimensionToPort,
            int dimensionToStarboard) implements AisMessage {
    }
}
