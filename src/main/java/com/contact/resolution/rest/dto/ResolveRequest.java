package com.contact.resolution.rest.dto;

/**
 * Body of {@code POST /api/v1/lookups/resolve}.
 *
 * @param lookup raw phone number or email address
 * @param type   {@code phone} or {@code email}
 */
public record ResolveRequest(String lookup, String type) {
}
