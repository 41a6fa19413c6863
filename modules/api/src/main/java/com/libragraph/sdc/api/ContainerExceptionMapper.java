package com.libragraph.sdc.api;

import com.libragraph.sdc.core.archive.CorruptArchiveException;
import com.libragraph.sdc.core.container.ItemNotFoundException;
import com.libragraph.sdc.core.model.SchemaViolationException;
import com.libragraph.sdc.core.sync.DatasetNotFoundException;
import com.libragraph.sdc.core.sync.ImmutableRemoteException;
import com.libragraph.sdc.core.sync.NotOwnerException;
import com.libragraph.sdc.core.sync.StaleWriteException;
import com.libragraph.sdc.formats.api.CodecException;
import com.libragraph.sdc.formats.api.UnsupportedFormatException;
import com.libragraph.sdc.types.ContainerException;
import com.libragraph.sdc.types.InvalidNameException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps container failures to status codes with the message as plain text.
 */
@Provider
public class ContainerExceptionMapper implements ExceptionMapper<ContainerException> {

    private static final Logger log = Logger.getLogger(ContainerExceptionMapper.class);

    static final int LOCKED = 423;

    @Override
    public Response toResponse(ContainerException e) {
        int status = statusOf(e);
        if (status >= 500) {
            log.errorf(e, "Request failed");
        } else {
            log.debugf("Request rejected with %d: %s", status, e.getMessage());
        }
        return Response.status(status)
                .type(MediaType.TEXT_PLAIN)
                .entity(e.getMessage())
                .build();
    }

    static int statusOf(ContainerException e) {
        if (e instanceof SchemaViolationException
                || e instanceof InvalidNameException
                || e instanceof CorruptArchiveException
                || e instanceof CodecException) {
            return 400;
        }
        if (e instanceof NotOwnerException) {
            return 403;
        }
        if (e instanceof DatasetNotFoundException || e instanceof ItemNotFoundException) {
            return 404;
        }
        if (e instanceof StaleWriteException) {
            return 409;
        }
        if (e instanceof UnsupportedFormatException) {
            return 415;
        }
        if (e instanceof ImmutableRemoteException) {
            return LOCKED;
        }
        return 500;
    }
}
