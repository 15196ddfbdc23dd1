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
 * Invalid cluster topology or options, e.g. a mismatch between the coordinator count and the RPC ports supplied.
 * Always {@link MiniClusterException.Category#FATAL} as retrying cannot succeed.
 */
public class ConfigurationException extends MiniClusterException
{
    private static final long serialVersionUID = 8316403578913846720L;

    /**
     * Configuration exception with provided message and {@link MiniClusterException.Category#FATAL}.
     *
     * @param message to detail the exception.
     */
    public ConfigurationException(final String message)
    {
        super(message, Category.FATAL);
    }
}
