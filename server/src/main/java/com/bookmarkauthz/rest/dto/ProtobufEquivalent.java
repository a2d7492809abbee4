package com.bookmarkauthz.rest.dto;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the Protobuf message a REST DTO mirrors. The REST adapters translate between the two by
 * hand; this annotation records the pairing.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ProtobufEquivalent {

  /** The corresponding Protobuf message class. */
  Class<?> value();

  /** Notes on fields that do not map one to one. */
  String description() default "";
}
