package com.eh.digitalpathology.dicomrelay.association;

public class DimseStatus {

    private DimseStatus ( ) {
        throw new UnsupportedOperationException( "This is a utility class and cannot be instantiated" );
    }

    public static final int SUCCESS = 0x0000;
    public static final int PENDING = 0xFF00;
    public static final int PENDING_WARNING = 0xFF01;
    public static final int CANCEL = 0xFE00;
    public static final int WARNING_SUB_OPERATIONS_FAILED = 0xB000;
    public static final int OUT_OF_RESOURCES = 0xA700;
    public static final int CANNOT_UNDERSTAND = 0xC000;

    public static boolean isPending ( int status ) {
        return ( status & PENDING ) == PENDING;
    }

    public static boolean isSuccess ( int status ) {
        return status == SUCCESS;
    }

    public static boolean isWarning ( int status ) {
        return ( status & 0xF000 ) == 0xB000;
    }

    public static String toHex ( int status ) {
        return String.format( "0x%04X", status );
    }
}
