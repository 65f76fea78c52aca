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


package org.logjournal.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Utilities for closeable resources.
 *
 * @author LogJournal contributors
 */
public final class Closeables {
    private static final Logger logger = LoggerFactory.getLogger(Closeables.class);

    private Closeables() {
        // empty
    }

    public static void close(final AutoCloseable... closeables) {
        requireNonNull(closeables, "Closeables must not be null");
        Arrays.stream(closeables).forEach(Closeables::closeWithRuntimeException);
    }

    public static void closeSilently(final AutoCloseable... closeables) {
        requireNonNull(closeables, "Closeables must not be null");
        Arrays.stream(closeables).forEach(Closeables::closeSilentlyAndLog);
    }

    private static void closeSilentlyAndLog(final AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }

        try {
            closeable.close();
        } catch (final Exception e) {
            logger.error("Unable to close resource [resource={}]", closeable, e);
        }
    }

    private static void closeWithRuntimeException(final AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }

        try {
            closeable.close();
        } catch (final Exception e) {
            throw new IllegalStateException("Unable to close resource", e);
        }
    }
}
