package com.acme.pubsub.pg;

import com.acme.pubsub.core.ChannelConfigurationException;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

final class SqlIdentifiers {
    private static final Pattern PLAIN = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]{0,62}");

    private SqlIdentifiers() {
    }

    /**
     * Quotes a possibly schema qualified name: {@code public.post -> "public"."post"}.
     */
    static String quote(String name) {
        return Arrays.stream(name.split("\\.", -1))
            .map(SqlIdentifiers::quotePart)
            .collect(Collectors.joining("."));
    }

    private static String quotePart(String part) {
        if (!PLAIN.matcher(part).matches()) {
            throw new ChannelConfigurationException("Invalid SQL identifier: " + part);
        }
        return "\"" + part + "\"";
    }

    static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
