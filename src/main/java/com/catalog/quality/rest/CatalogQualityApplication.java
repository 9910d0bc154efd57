package com.catalog.quality.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Catalog Quality API",
                version = "1.0.0",
                description = "Normalization sessions, duplicate groups, quality rule violations, " +
                        "correction suggestions and project quality statistics for catalog databases."
        )
)
public class CatalogQualityApplication extends Application {
}
