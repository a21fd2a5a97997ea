package com.contact.resolution.rest.dto;

/**
 * Body of {@code POST /api/v1/cache/invalidate}.
 *
 * @param lookup raw phone number or email address
 * @param type   {@code phone} or {@code email}
 * @param reason free text recorded with the invalidation, optional
 */
public record InvalidateRequest(String lookup, String type, String reason) {
}
