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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Augmented NFA produced by Thompson's construction.
 * <p>
 * States are rows of a shared transition table, addressed by their index. Every state has
 * at most two outgoing transitions, held in two fixed slots.
 */
public record Automaton(int entry, int accept, List<State> states)
{
    private static final Logger LOG = LoggerFactory.getLogger(Automaton.class);

    public Automaton
    {
        requireNonNull(states, "states is null");
        states = List.copyOf(states);
        checkElementIndex(entry, states.size(), "entry");
        checkElementIndex(accept, states.size(), "accept");
    }

    public State state(int id)
    {
        checkElementIndex(id, states.size(), "state");
        return states.get(id);
    }

    public int size()
    {
        return states.size();
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();
        for (int id = 0; id < states.size(); id++) {
            builder.append(format("%s%s%s: %s%n",
                    id == entry ? ">" : "",
                    id,
                    id == accept ? "*" : "",
                    states.get(id)));
        }
        return builder.toString();
    }

    /**
     * Slot pair of one state. An empty slot means no transition.
     */
    public record State(Optional<Transition> first, Optional<Transition> second)
    {
        static final State DANGLING = new State(Optional.empty(), Optional.empty());

        public State
        {
            requireNonNull(first, "first is null");
            requireNonNull(second, "second is null");
        }

        static State of(Transition first)
        {
            return new State(Optional.of(first), Optional.empty());
        }

        static State of(Transition first, Transition second)
        {
            return new State(Optional.of(first), Optional.of(second));
        }

        /**
         * Whether neither slot carries a transition
         */
        public boolean isDangling()
        {
            return first.isEmpty() && second.isEmpty();
        }

        /**
         * Present transitions, first slot before second
         */
        public List<Transition> transitions()
        {
            List<Transition> result = new ArrayList<>(2);
            first.ifPresent(result::add);
            second.ifPresent(result::add);
            return result;
        }

        @Override
        public String toString()
        {
            return format("%s %s",
                    first.map(Transition::toString).orElse("_"),
                    second.map(Transition::toString).orElse("_"));
        }
    }

    public record Transition(Label label, int target)
    {
        public Transition
        {
            requireNonNull(label, "label is null");
        }

        static Transition epsilon(int target)
        {
            return new Transition(Epsilon.INSTANCE, target);
        }

        public boolean isEpsilon()
        {
            return label instanceof Epsilon;
        }

        @Override
        public String toString()
        {
            return format("-[%s]-> %s", label, target);
        }
    }

    public sealed interface Label
            permits Epsilon, Literal
    {
    }

    public record Epsilon()
            implements Label
    {
        public static final Epsilon INSTANCE = new Epsilon();

        @Override
        public String toString()
        {
            return "ε";
        }
    }

    public record Literal(int codePoint)
            implements Label
    {
        public Literal
        {
            checkArgument(Character.isValidCodePoint(codePoint), "Invalid code point: %s", codePoint);
        }

        public boolean matches(int value)
        {
            return codePoint == value;
        }

        @Override
        public String toString()
        {
            return new String(Character.toChars(codePoint));
        }
    }

    /**
     * Automaton under construction. Primitive builders append new fragments to the table,
     * combinators graft existing fragments into larger ones, and {@link #build(Fragment)}
     * fixes the entry and accept state once the whole pattern is assembled.
     */
    public static class Builder
    {
        private final List<State> states;
        private boolean built;

        public Builder()
        {
            this(0);
        }

        /**
         * @param expectedStates capacity hint for the transition table
         */
        public Builder(int expectedStates)
        {
            checkArgument(expectedStates >= 0, "expectedStates is negative");
            states = new ArrayList<>(expectedStates);
        }

        /**
         * Two unconnected states: accepts nothing.
         */
        public Fragment nothing()
        {
            checkNotBuilt();
            int entry = addState(State.DANGLING);
            int accept = addState(State.DANGLING);
            return new Fragment(entry, accept);
        }

        /**
         * One state that is both entry and accept: accepts only the empty string.
         */
        public Fragment empty()
        {
            checkNotBuilt();
            int state = addState(State.DANGLING);
            return new Fragment(state, state);
        }

        public Fragment literal(char value)
        {
            return literal((int) value);
        }

        /**
         * Two states joined by a transition on {@code codePoint}.
         */
        public Fragment literal(int codePoint)
        {
            checkNotBuilt();
            Literal label = new Literal(codePoint);

            int entry = states.size();
            int accept = entry + 1;
            addState(State.of(new Transition(label, accept)));
            addState(State.DANGLING);
            return new Fragment(entry, accept);
        }

        /**
         * Links the accept state of {@code left} to the entry of {@code right}. No states are added.
         */
        public Fragment concatenate(Fragment left, Fragment right)
        {
            checkNotBuilt();
            checkOperands(left, right);

            setState(left.accept(), State.of(Transition.epsilon(right.entry())));
            left.consume();
            right.consume();

            Fragment result = new Fragment(left.entry(), right.accept());
            LOG.trace("Concatenated {} and {} into {}", left, right, result);
            return result;
        }

        /**
         * Zero or more repetitions of {@code fragment}. Adds an entry state, a branch state and
         * an accept state. The branch re-enters the fragment through its first slot and exits to
         * the new accept state through its second slot.
         */
        public Fragment star(Fragment fragment)
        {
            checkNotBuilt();
            checkOperand(fragment, "star");

            int entry = states.size();
            int branch = entry + 1;
            int accept = entry + 2;
            addState(State.of(Transition.epsilon(branch)));
            addState(State.of(Transition.epsilon(fragment.entry()), Transition.epsilon(accept)));
            addState(State.DANGLING);
            setState(fragment.accept(), State.of(Transition.epsilon(branch)));
            fragment.consume();

            Fragment result = new Fragment(entry, accept);
            LOG.trace("Applied star to {} as {}", fragment, result);
            return result;
        }

        /**
         * Either {@code left} or {@code right}. Adds a branch state, whose first slot leads to
         * {@code left} and second slot to {@code right}, and a shared accept state.
         */
        public Fragment union(Fragment left, Fragment right)
        {
            checkNotBuilt();
            checkOperands(left, right);

            int branch = states.size();
            int accept = branch + 1;
            addState(State.of(Transition.epsilon(left.entry()), Transition.epsilon(right.entry())));
            addState(State.DANGLING);
            setState(left.accept(), State.of(Transition.epsilon(accept)));
            setState(right.accept(), State.of(Transition.epsilon(accept)));
            left.consume();
            right.consume();

            Fragment result = new Fragment(branch, accept);
            LOG.trace("United {} and {} into {}", left, right, result);
            return result;
        }

        /**
         * Fixes the entry and accept state of the automaton to those of {@code fragment}.
         * The builder cannot be used afterwards.
         */
        public Automaton build(Fragment fragment)
        {
            checkNotBuilt();
            requireNonNull(fragment, "fragment is null");
            checkElementIndex(fragment.entry(), states.size(), "entry");
            checkElementIndex(fragment.accept(), states.size(), "accept");

            built = true;
            Automaton automaton = new Automaton(fragment.entry(), fragment.accept(), states);
            LOG.debug("Built automaton with {} states, entry {}, accept {}", automaton.size(), automaton.entry(), automaton.accept());
            return automaton;
        }

        public int size()
        {
            return states.size();
        }

        public State state(int id)
        {
            checkElementIndex(id, states.size(), "state");
            return states.get(id);
        }

        private int addState(State state)
        {
            states.add(state);
            return states.size() - 1;
        }

        private void setState(int id, State state)
        {
            states.set(id, state);
        }

        private void checkOperands(Fragment left, Fragment right)
        {
            requireNonNull(left, "left is null");
            requireNonNull(right, "right is null");
            checkArgument(left != right, "Fragment %s cannot be used as both operands", left);
            checkOperand(left, "left");
            checkOperand(right, "right");
        }

        private void checkOperand(Fragment fragment, String name)
        {
            requireNonNull(fragment, name + " is null");
            checkArgument(!fragment.isConsumed(), "Fragment %s (%s) has already been consumed", fragment, name);
            checkElementIndex(fragment.entry(), states.size(), name + " entry");
            checkElementIndex(fragment.accept(), states.size(), name + " accept");

            State accept = states.get(fragment.accept());
            checkArgument(accept.isDangling(), "Accept state %s of fragment %s (%s) already has transitions: %s", fragment.accept(), fragment, name, accept);
        }

        private void checkNotBuilt()
        {
            checkState(!built, "Automaton has already been built");
        }
    }
}
