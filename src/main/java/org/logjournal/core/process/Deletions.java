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


package org.logjournal.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * The deletion markers of all streams. Markers only live as long as the process, a restart makes all deleted records visible
 * again since nothing is ever removed from the log.
 *
 * @author LogJournal contributors
 */
final class Deletions {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ConcurrentMap<String, DeletionMarker> markers = new ConcurrentHashMap<>();

    /**
     * Replaces the marker of the stream.
     */
    void deleteTo(final String streamId, final long toSequenceNr, final boolean permanent) {
        log.debug("Delete [streamId={}, toSequenceNr={}, permanent={}]", streamId, toSequenceNr, permanent);
        markers.put(streamId, new DeletionMarker(toSequenceNr, permanent));
    }

    DeletionMarker markerFor(final String streamId) {
        return markers.getOrDefault(streamId, DeletionMarker.NONE);
    }
}
