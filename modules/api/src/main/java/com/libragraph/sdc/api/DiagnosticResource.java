package com.libragraph.sdc.api;

import com.libragraph.sdc.core.model.AttributeValidator;
import com.libragraph.sdc.formats.registry.CodecRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Set;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @Inject
    CodecRegistry codecs;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Dataset store is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        Set<String> extensions = codecs.extensions();
        return Map.of(
                "name", appName,
                "version", appVersion,
                "modelVersion", AttributeValidator.MODEL_VERSION,
                "extensions", extensions,
                "java", System.getProperty("java.version")
        );
    }
}
