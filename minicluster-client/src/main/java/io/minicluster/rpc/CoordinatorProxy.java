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
import io.minicluster.exceptions.RpcException;

/**
 * Typed request/response calls to a coordinator.
 */
public interface CoordinatorProxy
{
    /**
     * RPC endpoint of the coordinator this proxy calls.
     *
     * @return RPC endpoint of the coordinator.
     */
    HostPort address();

    /**
     * List the workers currently registered with the coordinator. Registrations may be stale, i.e. belong to an
     * earlier incarnation of a worker which has since restarted.
     *
     * @param timeoutNs bound on the duration of the call.
     * @return the registered workers.
     * @throws RpcException if the call fails or times out.
     */
    ListWorkersResponse listWorkers(long timeoutNs);
}
