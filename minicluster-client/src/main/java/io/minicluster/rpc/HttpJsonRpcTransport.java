/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.minicluster.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.minicluster.HostPort;
import io.minicluster.exceptions.RpcException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.minicluster.JsonCodec.*;
import static org.agrona.SystemUtil.getDurationInNanos;

/**
 * {@link RpcTransport} which sends each call as a JSON document in the body of an HTTP POST to
 * {@code http://<rpc endpoint>/rpc/<service>/<method>} and expects a JSON document in reply.
 * <p>
 * All proxies share one {@link HttpClient} driven by a single daemon thread.
 */
public final class HttpJsonRpcTransport implements RpcTransport
{
    /**
     * Timeout for establishing a connection to a server.
     */
    public static final String CONNECT_TIMEOUT_PROP_NAME = "minicluster.rpc.connect.timeout";

    /**
     * Default timeout for establishing a connection to a server.
     */
    public static final long CONNECT_TIMEOUT_DEFAULT_NS = TimeUnit.SECONDS.toNanos(5);

    static final String COORDINATOR_SERVICE = "CoordinatorService";
    static final String LIST_WORKERS_METHOD = "ListWorkers";
    static final String SERVERS = "servers";
    static final String INSTANCE_ID = "instance_id";
    static final String RPC_ADDRESSES = "rpc_addresses";
    static final String HTTP_ADDRESSES = "http_addresses";
    static final String MILLIS_SINCE_HEARTBEAT = "millis_since_heartbeat";

    private final String name;
    private final ExecutorService executor;
    private volatile HttpClient httpClient;
    private volatile boolean isClosed = false;

    /**
     * Create a transport with the connect timeout from {@link #CONNECT_TIMEOUT_PROP_NAME}.
     *
     * @param name used for the transport thread.
     */
    public HttpJsonRpcTransport(final String name)
    {
        this(name, getDurationInNanos(CONNECT_TIMEOUT_PROP_NAME, CONNECT_TIMEOUT_DEFAULT_NS));
    }

    /**
     * Create a transport.
     *
     * @param name             used for the transport thread.
     * @param connectTimeoutNs timeout for establishing a connection.
     */
    public HttpJsonRpcTransport(final String name, final long connectTimeoutNs)
    {
        this.name = name;
        executor = Executors.newSingleThreadExecutor(
            (runnable) ->
            {
                final Thread thread = new Thread(runnable, name);
                thread.setDaemon(true);
                return thread;
            });
        httpClient = HttpClient.newBuilder()
            .executor(executor)
            .connectTimeout(Duration.ofNanos(connectTimeoutNs))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    public String name()
    {
        return name;
    }

    public CoordinatorProxy coordinatorProxy(final HostPort address)
    {
        if (isClosed)
        {
            throw new IllegalStateException("transport is closed: " + name);
        }

        return new HttpCoordinatorProxy(address);
    }

    public boolean isClosed()
    {
        return isClosed;
    }

    public void close()
    {
        if (!isClosed)
        {
            isClosed = true;
            executor.shutdownNow();
            // the client's selector thread only exits once the client is unreachable
            httpClient = null;
        }
    }

    JsonNode call(final HostPort address, final String service, final String method, final long timeoutNs)
    {
        final HttpClient httpClient = this.httpClient;
        if (null == httpClient)
        {
            throw new RpcException("transport is closed: " + name);
        }

        final URI uri = URI.create("http://" + address + "/rpc/" + service + "/" + method);
        final HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofNanos(Math.max(1, timeoutNs)))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString("{}", StandardCharsets.UTF_8))
            .build();

        final HttpResponse<byte[]> response;
        try
        {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        }
        catch (final HttpTimeoutException ex)
        {
            throw new RpcException(service + "." + method + " timed out calling " + address, ex);
        }
        catch (final IOException ex)
        {
            throw new RpcException(service + "." + method + " failed calling " + address, ex);
        }
        catch (final InterruptedException ex)
        {
            Thread.currentThread().interrupt();
            throw new RpcException(service + "." + method + " interrupted calling " + address, ex);
        }

        if (response.statusCode() < 200 || response.statusCode() > 299)
        {
            throw new RpcException(
                service + "." + method + " failed calling " + address + " status=" + response.statusCode());
        }

        try
        {
            return mapper().readTree(response.body());
        }
        catch (final IOException ex)
        {
            throw new RpcException(service + "." + method + " returned invalid JSON from " + address, ex);
        }
    }

    static ListWorkersResponse decodeListWorkers(final JsonNode root)
    {
        final JsonNode servers = root.get(SERVERS);
        final List<WorkerEntry> entries = new ArrayList<>();
        if (null != servers && servers.isArray())
        {
            for (final JsonNode server : servers)
            {
                final JsonNode heartbeat = server.get(MILLIS_SINCE_HEARTBEAT);
                entries.add(new WorkerEntry(
                    decodeNodeInstance(server.get(INSTANCE_ID)),
                    decodeHostPorts(server, RPC_ADDRESSES),
                    decodeHostPorts(server, HTTP_ADDRESSES),
                    null == heartbeat ? 0 : heartbeat.asLong()));
            }
        }

        return new ListWorkersResponse(entries);
    }

    final class HttpCoordinatorProxy implements CoordinatorProxy
    {
        private final HostPort address;

        HttpCoordinatorProxy(final HostPort address)
        {
            this.address = address;
        }

        public HostPort address()
        {
            return address;
        }

        public ListWorkersResponse listWorkers(final long timeoutNs)
        {
            final JsonNode root = call(address, COORDINATOR_SERVICE, LIST_WORKERS_METHOD, timeoutNs);
            try
            {
                return decodeListWorkers(root);
            }
            catch (final IllegalArgumentException ex)
            {
                throw new RpcException("malformed " + LIST_WORKERS_METHOD + " response from " + address, ex);
            }
        }

        public String toString()
        {
            return "HttpCoordinatorProxy{address=" + address + '}';
        }
    }
}
