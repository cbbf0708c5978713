package com.questrail.kducer.session.internal.exec;

/**
 * The commands a caller can queue for the session loop.
 */
public enum CommandKind
{
    GET_FIRMWARE_VERSION,
    GET_PROGRAM,
    SELECT_PROGRAM,
    GET_SEQUENCE,
    SELECT_SEQUENCE,
    DISABLE_SCREWDRIVER,
    ENABLE_SCREWDRIVER,
    RUN_SCREWDRIVER,
    GET_ACTIVE_PROGRAM_DATA,
    GET_PROGRAM_DATA,
    GET_ALL_PROGRAM_DATA,
    SEND_PROGRAM_DATA,
    SEND_MULTIPLE_PROGRAM_DATA,
    GET_SEQUENCE_DATA,
    GET_ALL_SEQUENCE_DATA,
    SEND_SEQUENCE_DATA,
    SEND_MULTIPLE_SEQUENCE_DATA,
    GET_GENERAL_SETTINGS,
    SEND_GENERAL_SETTINGS,
    SEND_BARCODE,
    SET_HIGH_RES_GRAPH_MODE;

    /**
     * Whether the command may be run again from the start after the
     * connection dropped while it was executing. Running the screwdriver
     * again would repeat a tightening that may already have happened.
     */
    public boolean isRepeatableAfterReconnect() {
        return this != RUN_SCREWDRIVER;
    }
}
