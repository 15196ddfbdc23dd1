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

/**
 * Builder for a client of the servers under test. The mini cluster points the builder at its coordinators and
 * then asks it to build, so callers configure everything except where the cluster lives.
 *
 * @param <T> type of client built.
 */
public interface ClientBuilder<T>
{
    /**
     * Set the coordinator RPC endpoints the client bootstraps from.
     *
     * @param coordinatorAddresses comma separated {@code host:port} endpoints.
     * @return this for a fluent API.
     */
    ClientBuilder<T> coordinatorAddresses(String coordinatorAddresses);

    /**
     * Build the client.
     *
     * @return a new client.
     */
    T build();
}
