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
package io.minicluster.exceptions;

/**
 * A wait for a server or the cluster to reach a state ran out of time.
 */
public class TimeoutException extends MiniClusterException
{
    private static final long serialVersionUID = -2185302214846170043L;

    /**
     * Timeout in the {@link MiniClusterException.Category#ERROR} category, a later attempt may succeed.
     *
     * @param message naming what was waited on and for how long.
     */
    public TimeoutException(final String message)
    {
        super(message);
    }
}
