// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type or method as internal API not intended for public use.
 *
 * <p>Elements annotated with {@code @InternalApi} are public only because
 * another tzkit module needs them. They may change or disappear between
 * versions without notice.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
public @interface InternalApi {
}
