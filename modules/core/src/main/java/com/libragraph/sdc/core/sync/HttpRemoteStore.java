package com.libragraph.sdc.core.sync;

import com.libragraph.sdc.core.archive.ContainerArchive;
import com.libragraph.sdc.core.container.DataContainer;
import com.libragraph.sdc.core.model.SchemaViolationException;
import com.libragraph.sdc.types.ContainerException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Remote store reached over HTTP. Datasets travel as archive bytes.
 *
 * <pre>
 * POST /api/datasets                           201 stored archive
 * PUT  /api/datasets/{uuid}                    200 stored archive
 * GET  /api/datasets/{uuid}/download           200 archive | 301 Location of successor
 * GET  /api/static-datasets?type=..&amp;hash=..    200 archive | 404
 * </pre>
 *
 * Rejections map to exceptions by status: 400 schema, 401/403 owner, 404 not
 * found, 409 stale, 423 immutable. Anything else is a {@link RemoteStoreException}.
 */
public class HttpRemoteStore implements RemoteStore {

    private static final Logger log = Logger.getLogger(HttpRemoteStore.class);

    static final String OCTET_STREAM = "application/octet-stream";
    static final String DATASETS = "api/datasets/";
    static final String DOWNLOAD = "/download";

    private final URI baseUri;
    private final ContainerArchive archive;
    private final Duration timeout;
    private final HttpClient client;

    public HttpRemoteStore(URI baseUri, ContainerArchive archive, Duration timeout) {
        this.baseUri = baseUri.toString().endsWith("/") ? baseUri : URI.create(baseUri + "/");
        this.archive = archive;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public URI baseUri() {
        return baseUri;
    }

    @Override
    public Uni<DataContainer> create(DataContainer container, Credential credential) {
        HttpRequest request = request(baseUri.resolve("api/datasets"), credential)
                .header("Content-Type", OCTET_STREAM)
                .POST(HttpRequest.BodyPublishers.ofByteArray(archive.toBytes(container)))
                .build();
        return send(request, container.uuid())
                .map(response -> {
                    expect(response, 201, container.uuid());
                    return archive.fromBytes(response.body());
                });
    }

    @Override
    public Uni<DataContainer> replace(String uuid, DataContainer container, Credential credential) {
        HttpRequest request = request(baseUri.resolve(DATASETS + uuid), credential)
                .header("Content-Type", OCTET_STREAM)
                .PUT(HttpRequest.BodyPublishers.ofByteArray(archive.toBytes(container)))
                .build();
        return send(request, uuid)
                .map(response -> {
                    expect(response, 200, uuid);
                    return archive.fromBytes(response.body());
                });
    }

    @Override
    public Uni<RemoteLookup> get(String uuid, Credential credential) {
        HttpRequest request = request(baseUri.resolve(DATASETS + uuid + DOWNLOAD), credential)
                .GET()
                .build();
        return send(request, uuid)
                .map(response -> {
                    if (response.statusCode() == 301) {
                        String location = response.headers().firstValue("Location")
                                .orElseThrow(() -> new RemoteStoreException("Redirect without Location for " + uuid));
                        return new RemoteLookup.Redirect(successorOf(location));
                    }
                    expect(response, 200, uuid);
                    return new RemoteLookup.Found(archive.fromBytes(response.body()));
                });
    }

    @Override
    public Uni<Optional<DataContainer>> findStatic(String typeName, String hash, Credential credential) {
        URI uri = baseUri.resolve("api/static-datasets?type="
                + URLEncoder.encode(typeName, StandardCharsets.UTF_8)
                + "&hash=" + URLEncoder.encode(hash, StandardCharsets.UTF_8));
        HttpRequest request = request(uri, credential).GET().build();
        return send(request, hash)
                .map(response -> {
                    if (response.statusCode() == 404) {
                        return Optional.empty();
                    }
                    expect(response, 200, hash);
                    return Optional.of(archive.fromBytes(response.body()));
                });
    }

    private HttpRequest.Builder request(URI uri, Credential credential) {
        return HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Authorization", "Token " + credential.token())
                .header("Accept", OCTET_STREAM);
    }

    private Uni<HttpResponse<byte[]>> send(HttpRequest request, String subject) {
        log.debugf("%s %s", request.method(), request.uri());
        return Uni.createFrom()
                .completionStage(() -> client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()))
                .onFailure(e -> !(e instanceof ContainerException))
                .transform(e -> new RemoteStoreException(request.method() + " " + request.uri()
                        + " failed for " + subject, e));
    }

    /**
     * Extracts the uuid from {@code .../datasets/{uuid}/download}.
     */
    static String successorOf(String location) {
        String path = URI.create(location).getPath();
        if (path.endsWith(DOWNLOAD)) {
            path = path.substring(0, path.length() - DOWNLOAD.length());
        }
        int slash = path.lastIndexOf('/');
        if (slash < 0 || slash == path.length() - 1) {
            throw new RemoteStoreException("Unrecognized redirect location: " + location);
        }
        return path.substring(slash + 1);
    }

    private static void expect(HttpResponse<byte[]> response, int status, String uuid) {
        int code = response.statusCode();
        if (code == status) {
            return;
        }
        String message = new String(response.body(), StandardCharsets.UTF_8);
        throw switch (code) {
            case 400 -> new SchemaViolationException(message);
            case 401, 403 -> new NotOwnerException(uuid, message);
            case 404 -> new DatasetNotFoundException(uuid, message);
            case 409 -> new StaleWriteException(uuid, message);
            case 423 -> new ImmutableRemoteException(uuid, message);
            default -> new RemoteStoreException("Unexpected status " + code + " for " + uuid + ": " + message);
        };
    }
}
