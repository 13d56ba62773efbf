package com.cloud.topo.resource;

import com.cloud.topo.api.TopologyConfigException;

/**
 * An IPv4 CIDR block. The base address is held as an unsigned 32-bit value and
 * is always aligned to the prefix.
 */
public record Cidr(long base, int prefix) {

    public static final Cidr ANY_IPV4 = new Cidr(0L, 0);

    public Cidr {
        if (prefix < 0 || prefix > 32)
            throw new IllegalArgumentException("prefix " + prefix);
        if ((base & (size(prefix) - 1)) != 0)
            throw new IllegalArgumentException("base not aligned to /" + prefix);
    }

    /**
     * Parses dotted-quad notation such as {@code 10.0.0.0/16}.
     *
     * @param owner Resource name reported in the diagnostic.
     * @throws TopologyConfigException with code {@code invalid-cidr} if the text is
     *                                 not an IPv4 block or the address has host bits
     *                                 set below the prefix.
     */
    public static Cidr parse(String owner, String text) {
        int slash = text == null ? -1 : text.indexOf('/');
        if (slash < 0)
            throw invalid(owner, text, "missing prefix length");
        String[] octets = text.substring(0, slash).split("\\.", -1);
        if (octets.length != 4)
            throw invalid(owner, text, "expected four octets");
        long base = 0;
        int prefix;
        try {
            for (String octet : octets) {
                int value = parseDecimal(octet);
                if (value > 255)
                    throw invalid(owner, text, "octet " + octet + " is out of range");
                base = (base << 8) | value;
            }
            prefix = parseDecimal(text.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw invalid(owner, text, "not a number");
        }
        if (prefix > 32)
            throw invalid(owner, text, "prefix /" + prefix + " is longer than /32");
        if ((base & (size(prefix) - 1)) != 0)
            throw invalid(owner, text, "address is not aligned to /" + prefix);
        return new Cidr(base, prefix);
    }

    /** Number of addresses in the block. */
    public long size() {
        return size(prefix);
    }

    /** The block of length {@code mask} starting {@code offset} addresses into this one. */
    public Cidr subBlock(long offset, int mask) {
        return new Cidr(base + offset, mask);
    }

    @Override
    public String toString() {
        return ((base >>> 24) & 0xff) + "." + ((base >>> 16) & 0xff) + "." + ((base >>> 8) & 0xff) + "."
                + (base & 0xff) + "/" + prefix;
    }

    static long size(int prefix) {
        return 1L << (32 - prefix);
    }

    // Digits only: Integer.parseInt alone would accept "+1" and "-0"
    private static int parseDecimal(String digits) {
        if (digits.isEmpty() || digits.length() > 3 || !digits.chars().allMatch(Character::isDigit))
            throw new NumberFormatException(digits);
        return Integer.parseInt(digits);
    }

    private static TopologyConfigException invalid(String owner, String text, String why) {
        return new TopologyConfigException("invalid-cidr", String.valueOf(owner),
                "Not an IPv4 CIDR block (" + why + "): " + text);
    }
}
