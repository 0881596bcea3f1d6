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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestPatterns
{
    @Test
    public void testAlternationStarThenLiteral()
    {
        // (a|b)*b
        Automaton.Builder builder = new Automaton.Builder();
        Fragment a = builder.literal('a');
        Fragment b = builder.literal('b');
        Fragment repeated = builder.star(builder.union(a, b));
        Fragment pattern = builder.concatenate(repeated, builder.literal('b'));
        NfaSimulator simulator = new NfaSimulator(builder.build(pattern));

        assertTrue(simulator.matches("b"));
        assertTrue(simulator.matches("ab"));
        assertTrue(simulator.matches("bab"));
        assertTrue(simulator.matches("aab"));
        assertTrue(simulator.matches("abababbb"));

        assertFalse(simulator.matches(""));
        assertFalse(simulator.matches("a"));
        assertFalse(simulator.matches("ba"));
        assertFalse(simulator.matches("abc"));
    }

    @Test
    public void testNothing()
    {
        Automaton.Builder builder = new Automaton.Builder();
        NfaSimulator simulator = new NfaSimulator(builder.build(builder.nothing()));

        assertFalse(simulator.matches(""));
        assertFalse(simulator.matches("a"));
    }

    @Test
    public void testEmpty()
    {
        Automaton.Builder builder = new Automaton.Builder();
        NfaSimulator simulator = new NfaSimulator(builder.build(builder.empty()));

        assertTrue(simulator.matches(""));
        assertFalse(simulator.matches("a"));
    }

    @Test
    public void testStarOfEmpty()
    {
        Automaton.Builder builder = new Automaton.Builder();
        NfaSimulator simulator = new NfaSimulator(builder.build(builder.star(builder.empty())));

        assertTrue(simulator.matches(""));
        assertFalse(simulator.matches("a"));
    }

    @Test
    public void testUnionWithNothing()
    {
        // a|∅
        Automaton.Builder builder = new Automaton.Builder();
        Fragment a = builder.literal('a');
        NfaSimulator simulator = new NfaSimulator(builder.build(builder.union(a, builder.nothing())));

        assertTrue(simulator.matches("a"));
        assertFalse(simulator.matches(""));
        assertFalse(simulator.matches("aa"));
    }

    @Test
    public void testOptional()
    {
        // colou?r
        Automaton.Builder builder = new Automaton.Builder();
        Fragment prefix = word(builder, "colo");
        Fragment optional = builder.union(builder.literal('u'), builder.empty());
        Fragment pattern = builder.concatenate(builder.concatenate(prefix, optional), builder.literal('r'));
        NfaSimulator simulator = new NfaSimulator(builder.build(pattern));

        assertTrue(simulator.matches("color"));
        assertTrue(simulator.matches("colour"));
        assertFalse(simulator.matches("colouur"));
        assertFalse(simulator.matches("colo"));
    }

    @Test
    public void testNestedStar()
    {
        // (ab*)*
        Automaton.Builder builder = new Automaton.Builder();
        Fragment a = builder.literal('a');
        Fragment bs = builder.star(builder.literal('b'));
        NfaSimulator simulator = new NfaSimulator(builder.build(builder.star(builder.concatenate(a, bs))));

        assertTrue(simulator.matches(""));
        assertTrue(simulator.matches("a"));
        assertTrue(simulator.matches("abbab"));
        assertTrue(simulator.matches("aaa"));
        assertFalse(simulator.matches("b"));
        assertFalse(simulator.matches("bab"));
    }

    @Test
    public void testSupplementaryCodePoints()
    {
        Automaton.Builder builder = new Automaton.Builder();
        NfaSimulator simulator = new NfaSimulator(builder.build(builder.star(builder.literal(0x1F600))));

        assertTrue(simulator.matches("😀😀"));
        assertFalse(simulator.matches("\uD83D"));
    }

    private static Fragment word(Automaton.Builder builder, String value)
    {
        Fragment result = builder.empty();
        for (int i = 0; i < value.length(); i++) {
            result = builder.concatenate(result, builder.literal(value.charAt(i)));
        }
        return result;
    }
}
