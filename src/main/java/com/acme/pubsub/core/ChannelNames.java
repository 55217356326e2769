package com.acme.pubsub.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Channel naming. LISTEN identifiers are limited to 63 bytes, so the wire name is a fixed
 * prefix plus a truncated SHA-256 of the logical name.
 */
public final class ChannelNames {

    public static final String WIRE_PREFIX = "pgpubsub_";
    public static final int MAX_IDENTIFIER_LENGTH = 63;
    private static final int HASH_LENGTH = 16;

    private ChannelNames() {
    }

    /**
     * Example: com.acme.blog.PostCreated -> com_acme_blog_postcreated
     */
    public static String logicalName(Class<?> channel) {
        return channel.getName().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }

    public static String wireName(String logicalName) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(logicalName.getBytes(StandardCharsets.UTF_8));
            return WIRE_PREFIX + HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String wireName(Class<?> channel) {
        return wireName(logicalName(channel));
    }
}
