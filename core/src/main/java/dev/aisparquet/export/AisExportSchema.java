/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

import dev.aisparquet.schema.ExportSchema;

/**
 * The fixed schema of AIS export files. Column names and order are relied upon by downstream
 * consumers and must not change.
 */
public final class AisExportSchema {

    public static final String SOURCE = "source";
    public static final String MESSAGE_TYPE = "messageType";
    public static final String TIMESTAMP = "timestamp";
    public static final String MMSI = "mmsi";
    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String COURSE_OVER_GROUND = "courseOverGround";
    public static final String TRUE_HEADING = "trueHeading";
    public static final String RADIO_SYNC_STATE = "radioSyncState";
    public static final String RAIM_FLAG = "raimFlag";
    public static final String SPARE_BITS = "spareBits";
    public static final String MANOEUVRE_INDICATOR = "manoeuvreIndicator";
    public static final String RADIO_SLOT_TIMEOUT = "radioSlotTimeout";
    public static final String POSITION_ACCURACY = "positionAccuracy";
    public static final String RATE_OF_TURN = "rateOfTurn";
    public static final String NAVIGATION_STATUS = "navigationStatus";
    public static final String REPEAT_INDICATOR = "repeatIndicator";
    public static final String RADIO_SUB_MESSAGE = "radioSubMessage";
    public static final String CAN_ACCEPT_MESSAGE_22_CHANNEL_ASSIGNMENTS = "canAcceptMessage22ChannelAssignments";
    public static final String CAN_SWITCH_BANDS = "canSwitchBands";
    public static final String IS_DSC_ATTACHED = "isDscAttached";
    public static final String HAS_DISPLAY = "hasDisplay";
    public static final String CS_UNIT = "csUnit";
    public static final String REGIONAL_RESERVED_139 = "regionalReserved139";
    public static final String RADIO_STATUS_TYPE = "radioStatusType";
    public static final String IS_ASSIGNED = "isAssigned";
    /** Seconds field of the UTC time stamp. The name is historical. */
    public static final String TIME_STAMP_SECOND = "timeStampSecondstatic";
    public static final String SPEED_OVER_GROUND_TENTHS = "speedOverGroundTenths";
    public static final String REGIONAL_RESERVED_38 = "regionalReserved38";
    public static final String POSITION_FIX_TYPE = "positionFixType";
    public static final String DIMENSION_TO_STARBOARD = "dimensionToStarboard";
    public static final String DIMENSION_TO_PORT = "dimensionToPort";
    public static final String DIMENSION_TO_STERN = "dimensionToStern";
    public static final String DIMENSION_TO_BOW = "dimensionToBow";
    public static final String SHIP_TYPE = "shipType";
    public static final String SPARE_308 = "spare308";
    public static final String DRAUGHT_10TH_METRES = "draught10thMetres";
    public static final String ETA_MINUTE = "etaMinute";
    public static final String ETA_HOUR = "etaHour";
    public static final String ETA_DAY = "etaDay";
    public static final String ETA_MONTH = "etaMonth";
    public static final String IMO_NUMBER = "imoNumber";
    public static final String AIS_VERSION = "aisVersion";
    public static final String IS_DTE_NOT_READY = "isDteNotReady";
    public static final String SPARE_423 = "spare423";
    public static final String SHIP_NAME = "shipName";
    public static final String DESTINATION = "destination";
    public static final String VESSEL_NAME = "vesselName";
    public static final String CALL_SIGN = "callSign";

    public static final int SHIP_NAME_BITS = 120;
    public static final int DESTINATION_BITS = 120;
    public static final int VESSEL_NAME_BITS = 120;
    public static final int CALL_SIGN_BITS = 42;

    public static final ExportSchema SCHEMA = ExportSchema.builder("ais")
            .int32(SOURCE)
            .int32(MESSAGE_TYPE)
            .int64(TIMESTAMP)
            .int32(MMSI)
            .int32(LATITUDE)
            .int32(LONGITUDE)
            .int32(COURSE_OVER_GROUND)
            .int32(TRUE_HEADING)
            .int32(RADIO_SYNC_STATE)
            .bool(RAIM_FLAG)
            .int32(SPARE_BITS)
            .int32(MANOEUVRE_INDICATOR)
            .int32(RADIO_SLOT_TIMEOUT)
            .bool(POSITION_ACCURACY)
            .int32(RATE_OF_TURN)
            .int32(NAVIGATION_STATUS)
            .int32(REPEAT_INDICATOR)
            .int32(RADIO_SUB_MESSAGE)
            .bool(CAN_ACCEPT_MESSAGE_22_CHANNEL_ASSIGNMENTS)
            .bool(CAN_SWITCH_BANDS)
            .bool(IS_DSC_ATTACHED)
            .bool(HAS_DISPLAY)
            .int32(CS_UNIT)
            .int32(REGIONAL_RESERVED_139)
            .int32(RADIO_STATUS_TYPE)
            .bool(IS_ASSIGNED)
            .int32(TIME_STAMP_SECOND)
            .int32(SPEED_OVER_GROUND_TENTHS)
            .int32(REGIONAL_RESERVED_38)
            .int32(POSITION_FIX_TYPE)
            .int32(DIMENSION_TO_STARBOARD)
            .int32(DIMENSION_TO_PORT)
            .int32(DIMENSION_TO_STERN)
            .int32(DIMENSION_TO_BOW)
            .int32(SHIP_TYPE)
            .int32(SPARE_308)
            .int32(DRAUGHT_10TH_METRES)
            .int32(ETA_MINUTE)
            .int32(ETA_HOUR)
            .int32(ETA_DAY)
            .int32(ETA_MONTH)
            .int32(IMO_NUMBER)
            .int32(AIS_VERSION)
            .bool(IS_DTE_NOT_READY)
            .int32(SPARE_423)
            .text(SHIP_NAME, SHIP_NAME_BITS)
            .text(DESTINATION, DESTINATION_BITS)
            .text(VESSEL_NAME, VESSEL_NAME_BITS)
            .text(CALL_SIGN, CALL_SIGN_BITS)
            .build();

    private AisExportSchema() {
    }
}
