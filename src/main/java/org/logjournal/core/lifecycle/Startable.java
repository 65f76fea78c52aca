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


package org.logjournal.core.lifecycle;

/**
 * Components that must be started before use.
 *
 * @param <T> The type returned after start, normally the component itself to allow chaining.
 *
 * @author LogJournal contributors
 */
@FunctionalInterface
public interface Startable<T> {
    /**
     * Start the component.
     *
     * @return The started component.
     */
    T start();
}
