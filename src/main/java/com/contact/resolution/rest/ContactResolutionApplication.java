package com.contact.resolution.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeIn;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;

/**
 * Jakarta RS application for the contact resolution admin API.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Contact Resolution API",
                version = "1.0.0",
                description = "Resolves phone numbers and email addresses to canonical entities, " +
                        "invalidates cached mappings and reports tier health."
        )
)
@SecurityScheme(
        securitySchemeName = "apiKey",
        type = SecuritySchemeType.APIKEY,
        apiKeyName = "X-API-Key",
        in = SecuritySchemeIn.HEADER,
        description = "API key mapped to a role: VIEWER or OPERATOR."
)
public class ContactResolutionApplication extends Application {
}
