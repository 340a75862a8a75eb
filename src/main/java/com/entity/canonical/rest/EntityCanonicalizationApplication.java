package com.entity.canonical.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Entity Canonicalization API",
                version = "1.0.0",
                description = "Resolves entity mentions to canonical knowledge-base records through an " +
                        "exact synonym table and a ranked fuzzy search, and rebuilds the synonym " +
                        "indexes from entity mappings.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class EntityCanonicalizationApplication extends Application {
}
