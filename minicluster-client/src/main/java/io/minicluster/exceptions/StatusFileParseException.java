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
 * A server status file exists but could not be read or decoded. Not retried.
 */
public class StatusFileParseException extends MiniClusterException
{
    private static final long serialVersionUID = -3380946417207652250L;

    /**
     * Parse exception with a detailed message and the underlying cause.
     *
     * @param message providing detail on the error.
     * @param cause   of the error.
     */
    public StatusFileParseException(final String message, final Throwable cause)
    {
        super(message, cause, Category.FATAL);
    }

    /**
     * Parse exception with a detailed message.
     *
     * @param message providing detail on the error.
     */
    public StatusFileParseException(final String message)
    {
        super(message, Category.FATAL);
    }
}
