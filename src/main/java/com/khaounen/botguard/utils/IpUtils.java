package com.khaounen.botguard.utils;

import com.khaounen.botguard.security.guard.GuardRequest;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public class IpUtils {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]{2,45}$");
    private static final Pattern IPV4_PREFIX = Pattern.compile("^(\\d+\\.\\d+\\.\\d+)\\.\\d+$");

    private static final String[] HEADERS = {
            "X-Real-Ip",
            "CF-Connecting-IP",
            "X-Forwarded-For",
            "X-Cluster-Client-Ip",
            "X-Forwarded",
            "True-Client-Ip",
            "X-Appengine-User-Ip"
    };

    private static final List<Cidr> RESERVED = List.of(
            Cidr.parse("0.0.0.0/8"),
            Cidr.parse("10.0.0.0/8"),
            Cidr.parse("100.64.0.0/10"),
            Cidr.parse("127.0.0.0/8"),
            Cidr.parse("169.254.0.0/16"),
            Cidr.parse("172.16.0.0/12"),
            Cidr.parse("192.0.0.0/24"),
            Cidr.parse("192.0.2.0/24"),
            Cidr.parse("192.88.99.0/24"),
            Cidr.parse("192.168.0.0/16"),
            Cidr.parse("198.18.0.0/15"),
            Cidr.parse("198.51.100.0/24"),
            Cidr.parse("203.0.113.0/24"),
            Cidr.parse("224.0.0.0/4"),
            Cidr.parse("240.0.0.0/4"),
            Cidr.parse("::/128"),
            Cidr.parse("::1/128"),
            Cidr.parse("64:ff9b::/96"),
            Cidr.parse("64:ff9b:1::/48"),
            Cidr.parse("100::/64"),
            Cidr.parse("2001::/32"),
            Cidr.parse("2001:20::/28"),
            Cidr.parse("2001:db8::/32"),
            Cidr.parse("2002::/16"),
            Cidr.parse("5f00::/16"),
            Cidr.parse("fc00::/7"),
            Cidr.parse("fe80::/64"),
            Cidr.parse("ff00::/8")
    );

    private IpUtils() {
    }

    /**
     * Picks the client address from proxy headers and the socket address.
     *
     * @return the first public IPv4/IPv6 literal found, or {@code null} when none is usable
     */
    public static String resolveIp(GuardRequest request) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String header : HEADERS) {
            addCandidates(candidates, request.header(header));
        }
        for (String header : HEADERS) {
            addCandidates(candidates, request.header(header + "-V6"));
        }
        addCandidates(candidates, request.remoteAddress());

        for (String candidate : candidates) {
            if (isValidIp(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static void addCandidates(Set<String> candidates, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                candidates.add(trimmed);
            }
        }
    }

    public static boolean isIpv4(String ip) {
        if (ip == null) {
            return false;
        }
        var m = IPV4.matcher(ip);
        if (!m.matches()) {
            return false;
        }
        for (int i = 1; i <= 4; i++) {
            if (Integer.parseInt(m.group(i)) > 255) {
                return false;
            }
        }
        return true;
    }

    public static boolean isIpv6(String ip) {
        if (ip == null || !ip.contains(":") || !IPV6.matcher(ip).matches()) {
            return false;
        }
        return parse(ip) != null;
    }

    /**
     * @return true for a syntactically valid address outside every reserved range
     */
    public static boolean isValidIp(String ip) {
        byte[] address;
        if (isIpv4(ip)) {
            address = parse(ip);
        } else if (isIpv6(ip)) {
            address = parse(ip);
            if (address != null && address.length == 4) {
                // IPv4-mapped IPv6 (::ffff:a.b.c.d)
                return false;
            }
        } else {
            return false;
        }
        if (address == null) {
            return false;
        }
        for (Cidr cidr : RESERVED) {
            if (cidr.contains(address)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reverses the labels of an address for DNS blacklist queries, e.g. {@code 1.2.3.4 -> 4.3.2.1}.
     */
    public static String reverse(String ip) {
        String separator = ip.contains(":") ? ":" : ".";
        String[] parts = ip.split(Pattern.quote(separator), -1);
        List<String> reversed = new ArrayList<>(List.of(parts));
        Collections.reverse(reversed);
        return String.join(separator, reversed);
    }

    /**
     * Truncates an address so it no longer identifies a single client.
     */
    public static String anonymize(String ip) {
        if (ip == null) return null;

        if (ip.contains(".")) {
            var m = IPV4_PREFIX.matcher(ip);
            if (m.matches()) return m.group(1) + ".0";
            return ip;
        }

        if (ip.contains(":")) {
            return ip.split(":")[0] + "::";
        }

        return ip;
    }

    private static byte[] parse(String literal) {
        try {
            // literals only; the patterns above rule out host names, so no DNS lookup happens
            return InetAddress.getByName(literal).getAddress();
        } catch (UnknownHostException | SecurityException ex) {
            return null;
        }
    }

    private record Cidr(byte[] network, int prefix) {

        static Cidr parse(String cidr) {
            String[] parts = cidr.split("/");
            byte[] network = IpUtils.parse(parts[0]);
            if (network == null) {
                throw new IllegalArgumentException("invalid network " + cidr);
            }
            return new Cidr(network, Integer.parseInt(parts[1]));
        }

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            int fullBytes = prefix / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefix % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xff << (8 - remainingBits)) & 0xff;
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}
