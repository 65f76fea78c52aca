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

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Naming of the topics a stream is stored in.
 *
 * @author LogJournal contributors
 */
public final class JournalTopics {
    private static final Pattern ILLEGAL_TOPIC_CHARACTERS = Pattern.compile("[^\\w._-]");

    private JournalTopics() {
        // empty
    }

    /**
     * The topic holding the records of the given stream. Characters that are not allowed in topic names are replaced by an
     * underscore.
     */
    public static String journalTopic(final String streamId) {
        requireNonNull(streamId, "Stream id must not be null");
        return ILLEGAL_TOPIC_CHARACTERS.matcher(streamId).replaceAll("_");
    }
}
