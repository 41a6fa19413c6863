package com.libragraph.sdc.api;

import com.libragraph.sdc.core.archive.ContainerArchive;
import com.libragraph.sdc.core.container.DataContainer;
import com.libragraph.sdc.core.sync.Credential;
import com.libragraph.sdc.core.sync.RemoteLookup;
import com.libragraph.sdc.core.sync.RemoteStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.NotAuthorizedException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * HTTP face of a {@link RemoteStore}. Datasets are exchanged as archive bytes;
 * every call needs an {@code Authorization: Token <key>} header.
 */
@Path("/api")
public class DatasetResource {

    private static final Logger log = Logger.getLogger(DatasetResource.class);

    static final String TOKEN_SCHEME = "Token";

    @Inject
    RemoteStore store;

    @Inject
    ContainerArchive archive;

    @POST
    @Path("/datasets")
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public Response create(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, byte[] body) {
        Credential credential = credential(authorization);
        DataContainer accepted = store.create(archive.fromBytes(body), credential).await().indefinitely();
        log.infof("Accepted dataset %s", accepted.uuid());
        return Response.status(Response.Status.CREATED)
                .entity(archive.toBytes(accepted))
                .build();
    }

    @PUT
    @Path("/datasets/{uuid}")
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public byte[] replace(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                          @PathParam("uuid") String uuid, byte[] body) {
        Credential credential = credential(authorization);
        DataContainer accepted = store.replace(uuid, archive.fromBytes(body), credential).await().indefinitely();
        log.infof("Replaced dataset %s", uuid);
        return archive.toBytes(accepted);
    }

    @GET
    @Path("/datasets/{uuid}/download")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public Response download(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                             @PathParam("uuid") String uuid) {
        RemoteLookup lookup = store.get(uuid, credential(authorization)).await().indefinitely();
        if (lookup instanceof RemoteLookup.Redirect redirect) {
            return Response.status(Response.Status.MOVED_PERMANENTLY)
                    .location(UriBuilder.fromPath("/api/datasets/{uuid}/download").build(redirect.uuid()))
                    .build();
        }
        return Response.ok(archive.toBytes(((RemoteLookup.Found) lookup).container())).build();
    }

    @GET
    @Path("/static-datasets")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public Response findStatic(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                               @QueryParam("type") String type, @QueryParam("hash") String hash) {
        Credential credential = credential(authorization);
        if (type == null || hash == null) {
            throw new BadRequestException("type and hash are required");
        }
        Optional<DataContainer> found = store.findStatic(type, hash, credential).await().indefinitely();
        return found
                .map(container -> Response.ok(archive.toBytes(container)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .type(MediaType.TEXT_PLAIN)
                        .entity("No static dataset of type " + type + " with hash " + hash)
                        .build());
    }

    static Credential credential(String authorization) {
        String prefix = TOKEN_SCHEME + " ";
        if (authorization == null || !authorization.startsWith(prefix)
                || authorization.substring(prefix.length()).isBlank()) {
            throw new NotAuthorizedException(TOKEN_SCHEME);
        }
        return new Credential(authorization.substring(prefix.length()).trim());
    }
}
