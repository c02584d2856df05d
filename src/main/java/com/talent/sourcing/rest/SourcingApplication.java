package com.talent.sourcing.rest;

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
                title = "Talent Sourcing API",
                version = "1.0.0",
                description = "Progressive, credit-aware candidate sourcing: organization discovery, " +
                        "free candidate preview, cached record collection and weighted evaluation."
        )
)
public class SourcingApplication extends Application {
}
