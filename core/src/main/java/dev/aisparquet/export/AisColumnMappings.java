/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

import dev.aisparquet.ais.AisMessage;
import dev.aisparquet.ais.AisMessage.ExtendedPositionReportClassB;
import dev.aisparquet.ais.AisMessage.PositionReportClassA;
import dev.aisparquet.ais.AisMessage.PositionReportClassB;
import dev.aisparquet.ais.AisMessage.StaticAndVoyageData;
import dev.aisparquet.ais.AisMessage.StaticDataReportPartA;
import dev.aisparquet.ais.AisMessage.StaticDataReportPartB;
import dev.aisparquet.schema.ExportSchema;

import static dev.aisparquet.export.AisExportSchema.*;

/**
 * Column mappings of all supported message kinds. The identity columns {@code source},
 * {@code messageType} and {@code timestamp} are left to the {@link RowWriter}.
 */
public final class AisColumnMappings {

    private final MessageColumnMapping<PositionReportClassA> positionReportClassA;
    private final MessageColumnMapping<StaticAndVoyageData> staticAndVoyageData;
    private final MessageColumnMapping<PositionReportClassB> positionReportClassB;
    private final MessageColumnMapping<ExtendedPositionReportClassB> extendedPositionReportClassB;
    private final MessageColumnMapping<StaticDataReportPartA> staticDataReportPartA;
    private final MessageColumnMapping<StaticDataReportPartB> staticDataReportPartB;

    /**
     * Builds and validates the mappings against {@code schema}.
     *
     * @throws IllegalArgumentException if a mapped column is missing or has the wrong type or width
     */
    public AisColumnMappings(ExportSchema schema) {
        positionReportClassA = MessageColumnMapping.builder(PositionReportClassA.class, schema)
                .excluding(SOURCE, MESSAGE_TYPE, TIMESTAMP)
                .intColumn(MMSI, PositionReportClassA::mmsi)
                .intColumn(REPEAT_INDICATOR, PositionReportClassA::repeatIndicator)
                .intColumn(NAVIGATION_STATUS, PositionReportClassA::navigationStatus)
                .intColumn(RATE_OF_TURN, PositionReportClassA::rateOfTurn)
                .intColumn(SPEED_OVER_GROUND_TENTHS, PositionReportClassA::speedOverGroundTenths)
                .booleanColumn(POSITION_ACCURACY, PositionReportClassA::positionAccuracy)
                .intColumn(LONGITUDE, PositionReportClassA::longitude10000thMins)
                .intColumn(LATITUDE, PositionReportClassA::latitude10000thMins)
                .intColumn(COURSE_OVER_GROUND, PositionReportClassA::courseOverGround10thDegrees)
                .intColumn(TRUE_HEADING, PositionReportClassA::trueHeadingDegrees)
                .intColumn(TIME_STAMP_SECOND, PositionReportClassA::timeStampSecond)
                .intColumn(MANOEUVRE_INDICATOR, PositionReportClassA::manoeuvreIndicator)
                .intColumn(SPARE_BITS, PositionReportClassA::spareBits145)
                .booleanColumn(RAIM_FLAG, PositionReportClassA::raimFlag)
                .intColumn(RADIO_SYNC_STATE, PositionReportClassA::radioSyncState)
                .intColumn(RADIO_SLOT_TIMEOUT, PositionReportClassA::radioSlotTimeout)
                .intColumn(RADIO_SUB_MESSAGE, PositionReportClassA::radioSubMessage)
                .build();

        staticAndVoyageData = MessageColumnMapping.builder(StaticAndVoyageData.class, schema)
                .excluding(SOURCE, MESSAGE_TYPE, TIMESTAMP)
                .intColumn(MMSI, StaticAndVoyageData::mmsi)
                .intColumn(REPEAT_INDICATOR, StaticAndVoyageData::repeatIndicator)
                .intColumn(AIS_VERSION, StaticAndVoyageData::aisVersion)
                .intColumn(IMO_NUMBER, StaticAndVoyageData::imoNumber)
                .textColumn(CALL_SIGN, CALL_SIGN_BITS, StaticAndVoyageData::callSign)
                .textColumn(VESSEL_NAME, VESSEL_NAME_BITS, StaticAndVoyageData::vesselName)
                .intColumn(SHIP_TYPE, StaticAndVoyageData::shipType)
                .intColumn(DIMENSION_TO_BOW, StaticAndVoyageData::dimensionToBow)
                .intColumn(DIMENSION_TO_STERN, StaticAndVoyageData::dimensionToStern)
                .intColumn(DIMENSION_TO_PORT, StaticAndVoyageData::dimensionToPort)
                .intColumn(DIMENSION_TO_STARBOARD, StaticAndVoyageData::dimensionToStarboard)
                .intColumn(POSITION_FIX_TYPE, StaticAndVoyageData::positionFixType)
                .intColumn(ETA_MONTH, StaticAndVoyageData::etaMonth)
                .intColumn(ETA_DAY, StaticAndVoyageData::etaDay)
                .intColumn(ETA_HOUR, StaticAndVoyageData::etaHour)
                .intColumn(ETA_MINUTE, StaticAndVoyageData::etaMinute)
                .intColumn(DRAUGHT_10TH_METRES, StaticAndVoyageData::draught10thMetres)
                .textColumn(DESTINATION, DESTINATION_BITS, StaticAndVoyageData::destination)
                .booleanColumn(IS_DTE_NOT_READY, StaticAndVoyageData::isDteNotReady)
                .intColumn(SPARE_423, StaticAndVoyageData::spare423)
                .build();

        positionReportClassB = MessageColumnMapping.builder(PositionReportClassB.class, schema)
                .excluding(SOURCE, MESSAGE_TYPE, TIMESTAMP)
                .intColumn(MMSI, PositionReportClassB::mmsi)
                .intColumn(REPEAT_INDICATOR, PositionReportClassB::repeatIndicator)
                .intColumn(REGIONAL_RESERVED_38, PositionReportClassB::regionalReserved38)
                .intColumn(SPEED_OVER_GROUND_TENTHS, PositionReportClassB::speedOverGroundTenths)
                .booleanColumn(POSITION_ACCURACY, PositionReportClassB::positionAccuracy)
                .intColumn(LONGITUDE, PositionReportClassB::longitude10000thMins)
                .intColumn(LATITUDE, PositionReportClassB::latitude10000thMins)
                .intColumn(COURSE_OVER_GROUND, PositionReportClassB::courseOverGround10thDegrees)
                .intColumn(TRUE_HEADING, PositionReportClassB::trueHeadingDegrees)
                .intColumn(TIME_STAMP_SECOND, PositionReportClassB::timeStampSecond)
                .intColumn(REGIONAL_RESERVED_139, PositionReportClassB::regionalReserved139)
                .intColumn(CS_UNIT, PositionReportClassB::csUnit)
                .booleanColumn(HAS_DISPLAY, PositionReportClassB::hasDisplay)
                .booleanColumn(IS_DSC_ATTACHED, PositionReportClassB::isDscAttached)
                .booleanColumn(CAN_SWITCH_BANDS, PositionReportClassB::canSwitchBands)
                .booleanColumn(CAN_ACCEPT_MESSAGE_22_CHANNEL_ASSIGNMENTS, PositionReportClassB::canAcceptMessage22ChannelAssignment)
                .booleanColumn(IS_ASSIGNED, PositionReportClassB::isAssigned)
                .booleanColumn(RAIM_FLAG, PositionReportClassB::raimFlag)
                .intColumn(RADIO_STATUS_TYPE, PositionReportClassB::radioStatusType)
                .build();

        extendedPositionReportClassB = MessageColumnMapping.builder(ExtendedPositionReportClassB.class, schema)
                .excluding(SOURCE, MESSAGE_TYPE, TIMESTAMP)
                .intColumn(MMSI, ExtendedPositionReportClassB::mmsi)
                .intColumn(REPEAT_INDICATOR, ExtendedPositionReportClassB::repeatIndicator)
                .intColumn(REGIONAL_RESERVED_38, ExtendedPositionReportClassB::regionalReserved38)
                .intColumn(SPEED_OVER_GROUND_TENTHS, ExtendedPositionReportClassB::speedOverGroundTenths)
                .booleanColumn(POSITION_ACCURACY, ExtendedPositionReportClassB::positionAccuracy)
                .intColumn(LONGITUDE, ExtendedPositionReportClassB::longitude10000thMins)
                .intColumn(LATITUDE, ExtendedPositionReportClassB::latitude10000thMins)
                .intColumn(COURSE_OVER_GROUND, ExtendedPositionReportClassB::courseOverGround10thDegrees)
                .intColumn(TRUE_HEADING, ExtendedPositionReportClassB::trueHeadingDegrees)
                .intColumn(TIME_STAMP_SECOND, ExtendedPositionReportClassB::timeStampSecond)
                .intColumn(REGIONAL_RESERVED_139, ExtendedPositionReportClassB::regionalReserved139)
                .textColumn(SHIP_NAME, SHIP_NAME_BITS, ExtendedPositionReportClassB::shipName)
                .intColumn(SHIP_TYPE, ExtendedPositionReportClassB::shipType)
                .intColumn(DIMENSION_TO_BOW, ExtendedPositionReportClassB::dimensionToBow)
                .intColumn(DIMENSION_TO_STERN, ExtendedPositionReportClassB::dimensionToStern)
                .intColumn(DIMENSION_TO_PORT, ExtendedPositionReportClassB::dimensionToPort)
                .intColumn(DIMENSION_TO_STARBOARD, ExtendedPositionReportClassB::dimensionToStarboard)
                .intColumn(POSITION_FIX_TYPE, ExtendedPositionReportClassB::positionFixType)
                .booleanColumn(RAIM_FLAG, ExtendedPositionReportClassB::raimFlag)
                .booleanColumn(IS_DTE_NOT_READY, ExtendedPositionReportClassB::isDteNotReady)
                .booleanColumn(IS_ASSIGNED, ExtendedPositionReportClassB::isAssigned)
                .intColumn(SPARE_308, ExtendedPositionReportClassB::spare308)
                .build();

        staticDataReportPartA = MessageColumnMapping.builder(StaticDataReportPartA.class, schema)
                .excluding(SOURCE, MESSAGE_TYPE, TIMESTAMP)
                .intColumn(MMSI, StaticDataReportPartA::mmsi)
                .intColumn(REPEAT_INDICATOR, StaticDataReportPartA::repeatIndicator)
                .textColumn(VESSEL_NAME, VESSEL_NAME_BITS, StaticDataReportPartA::vesselName)
                .build();

        staticDataReportPartB = MessageColumnMapping.builder(StaticDataReportPartB.class, schema)
                .excluding(SOURCE, MESSAGE_TYPE, TIMESTAMP)
                .intColumn(MMSI, StaticDataReportPartB::mmsi)
                .intColumn(REPEAT_INDICATOR, StaticDataReportPartB::repeatIndicator)
                .intColumn(SHIP_TYPE, StaticDataReportPartB::shipType)
                .textColumn(CALL_SIGN, CALL_SIGN_BITS, StaticDataReportPartB::callSign)
                .intColumn(DIMENSION_TO_BOW, StaticDataReportPartB::dimensionToBow)
                .intColumn(DIMENSION_TO_STERN, StaticDataReportPartB::dimensionToStern)
                .intColumn(DIMENSION_TO_PORT, StaticDataReportPartB::dimensionToPort)
                .intColumn(DIMENSION_TO_STARBOARD, StaticDataReportPartB::dimensionToStarboard)
                .build();
    }

    /**
     * Writes all non-identity columns of {@code row} from {@code message}.
     */
    public void write(AisMessage message, ColumnBufferSet buffers, int row) {
        if (message instanceof PositionReportClassA m) {
            positionReportClassA.write(m, buffers, row);
        }
        else if (message instanceof StaticAndVoyageData m) {
            staticAndVoyageData.write(m, buffers, row);
        }
        else if (message instanceof PositionReportClassB m) {
            positionReportClassB.write(m, buffers, row);
        }
        else if (message instanceof ExtendedPositionReportClassB m) {
            extendedPositionReportClassB.write(m, buffers, row);
        }
        else if (message instanceof StaticDataReportPartA m) {
            staticDataReportPartA.write(m, buffers, row);
        }
        else if (message instanceof StaticDataReportPartB m) {
            staticDataReportPartB.write(m, buffers, row);
        }
        else {
            throw new IllegalArgumentException("No column mapping for " + message.getClass().getSimpleName());
        }
    }
}
