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

import java.util.List;

/**
 * Response to {@link CoordinatorProxy#listWorkers(long)}.
 */
public final class ListWorkersResponse
{
    private final List<WorkerEntry> servers;

    public ListWorkersResponse(final List<WorkerEntry> servers)
    {
        this.servers = List.copyOf(servers);
    }

    public List<WorkerEntry> servers()
    {
        return servers;
    }

    public String toString()
    {
        return "ListWorkersResponse{servers=" + servers + '}';
    }
}
