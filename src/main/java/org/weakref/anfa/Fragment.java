/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.weakref.anfa;

import static java.lang.String.format;

/**
 * Entry and accept state of a sub-automaton under construction.
 * <p>
 * A fragment can be handed to exactly one combinator of the {@link Automaton.Builder}
 * that created it. Once used, it is marked as consumed and any further use is rejected.
 */
public final class Fragment
{
    private final int entry;
    private final int accept;
    private boolean consumed;

    Fragment(int entry, int accept)
    {
        this.entry = entry;
        this.accept = accept;
    }

    public int entry()
    {
        return entry;
    }

    public int accept()
    {
        return accept;
    }

    public boolean isConsumed()
    {
        return consumed;
    }

    void consume()
    {
        consumed = true;
    }

    @Override
    public String toString()
    {
        return format("%s..%s%s",
                entry,
                accept,
                consumed ? " (consumed)" : "");
    }
}
