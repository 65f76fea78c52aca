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

import java.util.Iterator;

/**
 * A lazy, finite and forward-only view of a topic partition. The cursor ends at the high-water offset observed when it was
 * opened and cannot be resumed once closed.
 *
 * @author LogJournal contributors
 */
public interface LogCursor extends Iterator<byte[]>, AutoCloseable {
    @Override
    void close();
}
