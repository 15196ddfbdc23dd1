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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Status a server reports about itself once its listeners are bound: its identity and the endpoints it is
 * serving on.
 */
public final class ServerStatus
{
    private final NodeInstance nodeInstance;
    private final List<HostPort> boundRpcAddresses;
    private final List<HostPort> boundHttpAddresses;

    /**
     * Construct a status record.
     *
     * @param nodeInstance       identity of the reporting incarnation.
     * @param boundRpcAddresses  RPC endpoints the server has bound.
     * @param boundHttpAddresses HTTP endpoints the server has bound.
     */
    public ServerStatus(
        final NodeInstance nodeInstance,
        final List<HostPort> boundRpcAddresses,
        final List<HostPort> boundHttpAddresses)
    {
        this.nodeInstance = requireNonNull(nodeInstance, "nodeInstance");
        this.boundRpcAddresses = List.copyOf(boundRpcAddresses);
        this.boundHttpAddresses = List.copyOf(boundHttpAddresses);
    }

    public NodeInstance nodeInstance()
    {
        return nodeInstance;
    }

    public List<HostPort> boundRpcAddresses()
    {
        return boundRpcAddresses;
    }

    public List<HostPort> boundHttpAddresses()
    {
        return boundHttpAddresses;
    }

    /**
     * First bound RPC endpoint.
     *
     * @return first bound RPC endpoint.
     * @throws IllegalStateException if the server reported no RPC endpoint.
     */
    public HostPort boundRpcAddress()
    {
        if (boundRpcAddresses.isEmpty())
        {
            throw new IllegalStateException("no bound RPC address for " + nodeInstance);
        }

        return boundRpcAddresses.get(0);
    }

    /**
     * First bound HTTP endpoint.
     *
     * @return first bound HTTP endpoint.
     * @throws IllegalStateException if the server reported no HTTP endpoint.
     */
    public HostPort boundHttpAddress()
    {
        if (boundHttpAddresses.isEmpty())
        {
            throw new IllegalStateException("no bound HTTP address for " + nodeInstance);
        }

        return boundHttpAddresses.get(0);
    }

    public String toString()
    {
        return "ServerStatus{" +
            "nodeInstance=" + nodeInstance +
            ", boundRpcAddresses=" + boundRpcAddresses +
            ", boundHttpAddresses=" + boundHttpAddresses +
            '}';
    }
}
