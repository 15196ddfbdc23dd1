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

import io.minicluster.HostPort;
import io.minicluster.NodeInstance;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A worker registration as seen by a coordinator.
 */
public final class WorkerEntry
{
    private final NodeInstance instanceId;
    private final List<HostPort> rpcAddresses;
    private final List<HostPort> httpAddresses;
    private final long millisSinceHeartbeat;

    public WorkerEntry(
        final NodeInstance instanceId,
        final List<HostPort> rpcAddresses,
        final List<HostPort> httpAddresses,
        final long millisSinceHeartbeat)
    {
        this.instanceId = requireNonNull(instanceId, "instanceId");
        this.rpcAddresses = List.copyOf(rpcAddresses);
        this.httpAddresses = List.copyOf(httpAddresses);
        this.millisSinceHeartbeat = millisSinceHeartbeat;
    }

    public NodeInstance instanceId()
    {
        return instanceId;
    }

    public List<HostPort> rpcAddresses()
    {
        return rpcAddresses;
    }

    public List<HostPort> httpAddresses()
    {
        return httpAddresses;
    }

    public long millisSinceHeartbeat()
    {
        return millisSinceHeartbeat;
    }

    public String toString()
    {
        return "WorkerEntry{" +
            "instanceId=" + instanceId +
            ", rpcAddresses=" + rpcAddresses +
            ", httpAddresses=" + httpAddresses +
            ", millisSinceHeartbeat=" + millisSinceHeartbeat +
            '}';
    }
}
