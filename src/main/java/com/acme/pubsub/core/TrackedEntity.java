package com.acme.pubsub.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An entity record together with its table binding and the column-to-field resolution used
 * when decoding row snapshots.
 */
public final class TrackedEntity<E> {

    private final RecordContract<E> contract;
    private final String table;
    private final String app;
    private final String model;
    private final String primaryKey;
    private final Map<String, RecordContract.Field> aliases = new HashMap<>();

    private TrackedEntity(RecordContract<E> contract, TrackedTable table) {
        this.contract = contract;
        this.table = table.name();
        this.app = table.app();
        this.model = table.model().isEmpty() ? contract.type().getSimpleName() : table.model();
        this.primaryKey = table.primaryKey();
        contract.fields().stream()
            .filter(f -> f.column() != null)
            .forEach(f -> aliases.put(f.column(), f));
    }

    public static <E> TrackedEntity<E> of(Class<E> type) {
        TrackedTable table = type.getAnnotation(TrackedTable.class);
        if (table == null) {
            throw new ChannelConfigurationException(type.getName() + " is not annotated with @TrackedTable");
        }
        return new TrackedEntity<>(RecordContract.of(type), table);
    }

    public RecordContract<E> contract() {
        return contract;
    }

    public Class<E> type() {
        return contract.type();
    }

    public String table() {
        return table;
    }

    public String app() {
        return app;
    }

    public String model() {
        return model;
    }

    public String primaryKey() {
        return primaryKey;
    }

    /**
     * Maps a physical column name to the record field it populates: explicit {@link Column}
     * alias, exact name, snake_case to camelCase, then the {@code _id} foreign key suffix.
     */
    public Optional<RecordContract.Field> resolveColumn(String column) {
        RecordContract.Field alias = aliases.get(column);
        if (alias != null) {
            return Optional.of(alias);
        }
        Optional<RecordContract.Field> field = contract.field(column).or(() -> contract.field(camelCase(column)));
        if (field.isPresent() || !column.endsWith("_id")) {
            return field;
        }
        String relation = column.substring(0, column.length() - 3);
        return contract.field(relation).or(() -> contract.field(camelCase(relation)));
    }

    static String camelCase(String column) {
        StringBuilder sb = new StringBuilder(column.length());
        boolean upper = false;
        for (char c : column.toCharArray()) {
            if (c == '_') {
                upper = sb.length() > 0;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }
}
