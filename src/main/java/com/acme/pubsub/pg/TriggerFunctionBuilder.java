package com.acme.pubsub.pg;

import com.acme.pubsub.core.ChannelEntry;
import com.acme.pubsub.core.NotificationContext;
import com.acme.pubsub.core.TrackedEntity;
import com.acme.pubsub.core.TriggerOperation;
import com.acme.pubsub.core.TriggerRegistration;
import jakarta.inject.Singleton;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Generates the PL/pgSQL trigger function and trigger DDL for a trigger channel.
 * <p>
 * The function builds {@code {"app", "model", "old", "new", "context", "extras"?, "db_version"?}},
 * then either NOTIFYs it directly or, for durable channels, stores it in the outbox and
 * NOTIFYs the new row id.
 */
@Singleton
public class TriggerFunctionBuilder {
    private static final String QUOTE_TAG = "$pgpubsub$";

    public String functionName(ChannelEntry<?> channel, TriggerRegistration registration) {
        return registration.triggerName(channel.wireName());
    }

    public String createFunction(ChannelEntry<?> channel, TriggerRegistration registration, Long dbVersion) {
        TrackedEntity<?> entity = channel.entity()
            .orElseThrow(() -> new IllegalArgumentException(channel + " is not a trigger channel"));
        String wire = SqlIdentifiers.literal(channel.wireName());
        StringBuilder sql = new StringBuilder();
        sql.append("CREATE OR REPLACE FUNCTION ").append(SqlIdentifiers.quote(functionName(channel, registration)))
            .append("() RETURNS trigger AS ").append(QUOTE_TAG).append('\n')
            .append("DECLARE\n")
            .append("    payload JSONB;\n")
            .append("    notify_payload TEXT;\n")
            .append("    context_text TEXT;\n")
            .append("    extras_builder TEXT;\n")
            .append("    extras JSONB;\n")
            .append("BEGIN\n")
            .append("    payload := jsonb_build_object(\n")
            .append("        'app', ").append(SqlIdentifiers.literal(entity.app())).append(",\n")
            .append("        'model', ").append(SqlIdentifiers.literal(entity.model())).append(",\n")
            .append("        'old', COALESCE(to_jsonb(OLD), 'null'::jsonb),\n")
            .append("        'new', COALESCE(to_jsonb(NEW), 'null'::jsonb));\n")
            .append("    context_text := current_setting('").append(NotificationContext.CONTEXT_SETTING).append("', true);\n")
            .append("    IF COALESCE(context_text, '') = '' THEN\n")
            .append("        context_text := '{}';\n")
            .append("    END IF;\n")
            .append("    payload := payload || jsonb_build_object('context', context_text::jsonb);\n")
            .append("    extras_builder := current_setting('").append(NotificationContext.EXTRAS_BUILDER_SETTING).append("', true);\n")
            .append("    IF COALESCE(extras_builder, '') <> '' THEN\n")
            .append("        EXECUTE format('SELECT %I()', extras_builder) INTO extras;\n")
            .append("        payload := payload || jsonb_build_object('extras', COALESCE(extras, '{}'::jsonb));\n")
            .append("    END IF;\n");
        if (dbVersion != null) {
            sql.append("    payload := payload || jsonb_build_object('db_version', ").append(dbVersion).append(");\n");
        }
        if (channel.durable()) {
            sql.append("    INSERT INTO ").append(PgNotificationStore.TABLE).append(" (channel, payload, db_version)\n")
                .append("    VALUES (").append(wire).append(", payload, ")
                .append(dbVersion != null ? dbVersion.toString() : "NULL").append(")\n")
                .append("    RETURNING id::text INTO notify_payload;\n");
        } else {
            sql.append("    notify_payload := payload::text;\n");
        }
        sql.append("    PERFORM pg_notify(").append(wire).append(", notify_payload);\n")
            .append("    RETURN COALESCE(NEW, OLD);\n")
            .append("END;\n")
            .append(QUOTE_TAG).append(" LANGUAGE plpgsql");
        return sql.toString();
    }

    /**
     * A {@code DO} block that creates the row trigger unless the table already has one with
     * the same name.
     */
    public String createTrigger(ChannelEntry<?> channel, TriggerRegistration registration) {
        TrackedEntity<?> entity = channel.entity()
            .orElseThrow(() -> new IllegalArgumentException(channel + " is not a trigger channel"));
        String name = functionName(channel, registration);
        String table = SqlIdentifiers.quote(entity.table());
        String events = registration.operations().stream()
            .sorted()
            .map(TriggerOperation::name)
            .collect(Collectors.joining(" OR "));
        return "DO " + QUOTE_TAG + "\n"
            + "BEGIN\n"
            + "    IF NOT EXISTS (SELECT 1 FROM pg_trigger WHERE tgname = " + SqlIdentifiers.literal(name)
            + " AND tgrelid = " + SqlIdentifiers.literal(table) + "::regclass) THEN\n"
            + "        CREATE TRIGGER " + SqlIdentifiers.quote(name) + "\n"
            + "            " + registration.timing().name().toUpperCase(Locale.ROOT) + " " + events
            + " ON " + table + "\n"
            + "            FOR EACH ROW EXECUTE FUNCTION " + SqlIdentifiers.quote(name) + "();\n"
            + "    END IF;\n"
            + "END\n"
            + QUOTE_TAG;
    }
}
