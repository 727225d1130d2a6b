package com.poolhistory.util;

/**
 * Simple validators/normalizers for EVM addresses.
 */
public final class AddressUtil {
    private AddressUtil(){}

    public static String normalize(String addr) {
        if (addr == null) throw new IllegalArgumentException("address is null");
        if (!addr.startsWith("0x")) throw new IllegalArgumentException("address must start with 0x: " + addr);
        String hex = addr.substring(2);
        if (hex.length() != 40) throw new IllegalArgumentException("invalid address length (need 40 hex chars): " + addr);
        return "0x" + hex.toLowerCase();
    }

    public static boolean isAddress(String s) {
        return s != null && s.length() == 42 && s.startsWith("0x") && s.substring(2).chars().allMatch(AddressUtil::isHex);
    }

    /**
     * Pull the pool address out of a legacy DeFiLlama id such as "0xabc...-ethereum" or
     * "curve-0xabc...". Falls back to the raw value when neither of the first two segments
     * looks like an address.
     */
    public static String extractAddress(String poolOld) {
        if (poolOld == null || poolOld.isBlank()) return poolOld;
        String[] parts = poolOld.split("-");
        for (int i = 0; i < Math.min(2, parts.length); i++) {
            if (parts[i].startsWith("0x")) {
                return isAddress(parts[i]) ? normalize(parts[i]) : parts[i];
            }
        }
        return poolOld;
    }

    private static boolean isHex(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
