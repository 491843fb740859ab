package com.questrail.opendrive;

/**
 * Version identity of this codec and of the standard revision it implements.
 */
public final class OpenDriveVersion
{
    /** Codec version with the implemented standard version as build metadata. */
    public static final String CODEC_VERSION = "0.1.0+1.7.0";

    public static final String STANDARD_VERSION = "1.7.0";

    public static final int STANDARD_REV_MAJOR = 1;

    public static final int STANDARD_REV_MINOR = 7;

    private OpenDriveVersion() {
    }

    /**
     * @return true if a document declaring {@code revMajor.revMinor} can be read
     */
    public static boolean isSupported(int revMajor, int revMinor) {
        return revMajor == STANDARD_REV_MAJOR && revMinor >= 0 && revMinor <= STANDARD_REV_MINOR;
    }
}
