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

/**
 * Shared transport used to reach servers over RPC. Read only after construction so it may be shared by every proxy
 * created from it. Closing the transport invalidates all proxies.
 */
public interface RpcTransport extends AutoCloseable
{
    /**
     * Create a proxy to the coordinator service at an endpoint.
     *
     * @param address RPC endpoint of a coordinator.
     * @return proxy to the coordinator.
     * @throws IllegalStateException if the transport is closed.
     */
    CoordinatorProxy coordinatorProxy(HostPort address);

    /**
     * Has the transport been closed.
     *
     * @return true if the transport has been closed.
     */
    boolean isClosed();

    /**
     * Release the resources of the transport. Idempotent.
     */
    void close();
}
