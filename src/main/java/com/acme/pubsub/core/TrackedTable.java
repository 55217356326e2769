package com.acme.pubsub.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds an entity record to the table its triggers are installed on.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TrackedTable {

    /** Table name, optionally schema qualified. */
    String name();

    /** App tag written into trigger payloads and used for schema version lookups. */
    String app();

    /** Model tag written into trigger payloads. Defaults to the record's simple name. */
    String model() default "";

    String primaryKey() default "id";
}
