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
 * Base of the errors raised while bringing up, supervising or tearing down a mini cluster. The message is prefixed
 * with the {@link Category} so it reads well in test output.
 */
public class MiniClusterException extends RuntimeException
{
    private static final long serialVersionUID = 4471856320715462219L;

    /**
     * How a caller should treat the failure.
     */
    public enum Category
    {
        /**
         * The cluster can not be brought up as asked, e.g. an invalid topology or a server binary writing an
         * unreadable status file. Trying again will fail the same way.
         */
        FATAL,

        /**
         * The operation failed, e.g. a timeout or a process which exited, but a later attempt may succeed.
         */
        ERROR
    }

    private final Category category;

    /**
     * Failure in the {@link Category#ERROR} category.
     *
     * @param message describing the failure.
     */
    public MiniClusterException(final String message)
    {
        this(message, Category.ERROR);
    }

    /**
     * Failure in the given category.
     *
     * @param message  describing the failure.
     * @param category of the failure.
     */
    public MiniClusterException(final String message, final Category category)
    {
        super(category.name() + " - " + message);
        this.category = category;
    }

    /**
     * Failure in the {@link Category#ERROR} category caused by another exception.
     *
     * @param message describing the failure.
     * @param cause   of the failure.
     */
    public MiniClusterException(final String message, final Throwable cause)
    {
        this(message, cause, Category.ERROR);
    }

    /**
     * Failure in the given category caused by another exception.
     *
     * @param message  describing the failure.
     * @param cause    of the failure.
     * @param category of the failure.
     */
    public MiniClusterException(final String message, final Throwable cause, final Category category)
    {
        super(category.name() + " - " + message, cause);
        this.category = category;
    }

    public Category category()
    {
        return category;
    }

    /**
     * Is the throwable a {@link MiniClusterException} in the {@link Category#FATAL} category.
     *
     * @param t to check, may be null.
     * @return true if retrying the operation which raised it is pointless.
     */
    public static boolean isFatal(final Throwable t)
    {
        return t instanceof MiniClusterException && Category.FATAL == ((MiniClusterException)t).category;
    }
}
