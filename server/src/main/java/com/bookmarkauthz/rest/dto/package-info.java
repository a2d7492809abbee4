/**
 * JSON request and response bodies of the permission REST API.
 *
 * <p>Each record mirrors a Protobuf message named by {@link
 * com.bookmarkauthz.rest.dto.ProtobufEquivalent} and carries the OpenAPI annotations the
 * documentation is generated from. Enum values travel as their wire tokens (e.g. {@code
 * RELATION_EDITOR}), denial reasons as short tokens (e.g. {@code NoGrant}), and timestamps as
 * milliseconds since epoch. Every record has a no-argument constructor for JSON binding.
 */
package com.bookmarkauthz.rest.dto;
