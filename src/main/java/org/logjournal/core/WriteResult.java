/*
 * Copyright 2014 the original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */


package org.logjournal.core;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of a single write slot. A batch may contain a mix of successful and failed results so callers must inspect every
 * result rather than assuming all-or-nothing behaviour.
 *
 * @author LogJournal contributors
 */
public final class WriteResult {
    private static final WriteResult SUCCESS = new WriteResult(null);
    private final Throwable cause;

    private WriteResult(final Throwable cause) {
        this.cause = cause;
    }

    public static WriteResult failure(final Throwable cause) {
        return new WriteResult(requireNonNull(cause, "Cause must not be null"));
    }

    public static WriteResult success() {
        return SUCCESS;
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    public boolean isSuccess() {
        return cause == null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "WriteResult[success]" : "WriteResult[failure=" + cause + "]";
    }
}
