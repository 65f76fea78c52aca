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

/**
 * How much of a stream is deleted. Markers are kept in memory only.
 *
 * @author LogJournal contributors
 */
final class DeletionMarker {
    static final DeletionMarker NONE = new DeletionMarker(0L, false);
    private final boolean permanent;
    private final long toSequenceNr;

    DeletionMarker(final long toSequenceNr, final boolean permanent) {
        this.toSequenceNr = toSequenceNr;
        this.permanent = permanent;
    }

    boolean permanent() {
        return permanent;
    }

    long toSequenceNr() {
        return toSequenceNr;
    }

    @Override
    public String toString() {
        return "DeletionMarker[toSequenceNr=" + toSequenceNr + ", permanent=" + permanent + "]";
    }
}
