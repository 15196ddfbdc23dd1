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
package io.minicluster;

import io.minicluster.exceptions.MiniClusterException;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;

import static org.agrona.Strings.isEmpty;

/**
 * A network endpoint in {@code host:port} form as bound by, or requested of, a server process.
 */
public final class HostPort
{
    /**
     * Loopback address all servers of a mini cluster bind to.
     */
    public static final String LOCALHOST = "127.0.0.1";

    /**
     * Port value asking the operating system to choose an ephemeral port.
     */
    public static final int EPHEMERAL_PORT = 0;

    private final String host;
    private final int port;

    /**
     * Construct an endpoint.
     *
     * @param host name or address.
     * @param port in the range 0 to 65535, where 0 requests an ephemeral port.
     */
    public HostPort(final String host, final int port)
    {
        if (isEmpty(host))
        {
            throw new IllegalArgumentException("host must not be empty");
        }

        if (port < 0 || port > 0xFFFF)
        {
            throw new IllegalArgumentException("port out of range: " + port);
        }

        this.host = host;
        this.port = port;
    }

    /**
     * Endpoint on {@link #LOCALHOST} for a given port.
     *
     * @param port to bind or connect to.
     * @return endpoint on the loopback address.
     */
    public static HostPort localhost(final int port)
    {
        return new HostPort(LOCALHOST, port);
    }

    /**
     * Parse an endpoint of the form {@code host:port}.
     *
     * @param value to be parsed.
     * @return the endpoint.
     * @throws IllegalArgumentException if the value is not of the expected form.
     */
    public static HostPort parse(final String value)
    {
        if (isEmpty(value))
        {
            throw new IllegalArgumentException("endpoint must not be empty");
        }

        final int separatorIndex = value.lastIndexOf(':');
        if (separatorIndex <= 0 || separatorIndex == value.length() - 1)
        {
            throw new IllegalArgumentException("endpoint must be of the form host:port: " + value);
        }

        final int port;
        try
        {
            port = Integer.parseInt(value.substring(separatorIndex + 1));
        }
        catch (final NumberFormatException ex)
        {
            throw new IllegalArgumentException("invalid port in endpoint: " + value, ex);
        }

        return new HostPort(value.substring(0, separatorIndex), port);
    }

    /**
     * Render a list of endpoints separated by commas, the form servers accept for peer address flags.
     *
     * @param hostPorts to be rendered.
     * @return comma separated endpoints.
     */
    public static String toCommaSeparatedString(final List<HostPort> hostPorts)
    {
        final StringBuilder sb = new StringBuilder();
        for (final HostPort hostPort : hostPorts)
        {
            if (sb.length() > 0)
            {
                sb.append(',');
            }
            sb.append(hostPort.host).append(':').append(hostPort.port);
        }

        return sb.toString();
    }

    public String host()
    {
        return host;
    }

    public int port()
    {
        return port;
    }

    /**
     * Resolve the endpoint to a socket address.
     *
     * @return the resolved socket address.
     * @throws MiniClusterException if the host cannot be resolved.
     */
    public InetSocketAddress resolve()
    {
        final InetSocketAddress address = new InetSocketAddress(host, port);
        if (address.isUnresolved())
        {
            throw new MiniClusterException("unable to resolve host: " + this);
        }

        return address;
    }

    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (o == null || getClass() != o.getClass())
        {
            return false;
        }

        final HostPort that = (HostPort)o;
        return port == that.port && host.equals(that.host);
    }

    public int hashCode()
    {
        return Objects.hash(host, port);
    }

    public String toString()
    {
        return host + ":" + port;
    }
}
