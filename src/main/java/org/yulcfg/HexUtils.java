package org.yulcfg;

import java.math.BigInteger;

public final class HexUtils {
    private HexUtils() {}

    /** e.g. 0x1000001 -> "0x1000001", 255 -> "0xff" (leading zeros dropped) */
    public static String toCompactHexWithPrefix(BigInteger value) {
        if (value.signum() < 0)
            throw new IllegalArgumentException("negative value: " + value);
        return "0x" + value.toString(16);
    }
}
